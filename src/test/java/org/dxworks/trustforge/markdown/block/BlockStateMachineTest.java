package org.dxworks.trustforge.markdown.block;

import org.dxworks.trustforge.markdown.SlugRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

public class BlockStateMachineTest {

    private static List<Block> scan(String markdown) {
        return BlockStateMachine.scan(markdown, new SlugRegistry()).blocks();
    }

    @Test
    void scan_ParagraphLinesAreJoined() {
        assertEquals(List.of(new Block.Paragraph("one two")), scan("one\ntwo\n"));
    }

    @Test
    void scan_HeadingWithoutIdGetsSlugLabel() {
        assertEquals(List.of(new Block.Heading(2, "Roles & Duties", "roles-duties")), scan("## Roles & Duties"));
    }

    @Test
    void scan_HeadingKeepsExplicitId() {
        assertEquals(List.of(new Block.Heading(1, "Scope", "custom")), scan("# Scope {#custom}"));
    }

    @Test
    void scan_ListsSwitchKind() {
        List<Block> blocks = scan("- a\n* b\n1. c\n2. d");

        assertEquals(List.of(
                new Block.BulletList(List.of("a", "b")),
                new Block.OrderedList(List.of("c", "d"))
        ), blocks);
    }

    @Test
    void scan_LazyContinuationJoinsLastItem() {
        assertEquals(List.of(new Block.BulletList(List.of("first item continued"))), scan("- first item\ncontinued"));
    }

    @Test
    void scan_CodeFenceKeepsLinesVerbatim() {
        List<Block> blocks = scan("```yaml\n# not a heading\n  - not a list\n```");

        assertEquals(List.of(new Block.CodeBlock("yaml", List.of("# not a heading", "  - not a list"))), blocks);
    }

    @Test
    void scan_UnterminatedFenceIsClosedAtEnd() {
        List<Block> blocks = scan("text\n```\ncode line");

        assertEquals(2, blocks.size());
        assertEquals(new Block.CodeBlock(null, List.of("code line")), blocks.get(1));
    }

    @Test
    void scan_BlockquoteEndsOnPlainLine() {
        List<Block> blocks = scan("> quoted\n>more\nafter");

        assertEquals(List.of(
                new Block.Blockquote(List.of("quoted", "more")),
                new Block.Paragraph("after")
        ), blocks);
    }

    @Test
    void scan_RuleAndTable() {
        List<Block> blocks = scan("---\n| a | b |\n|---|---|\n| 1 | 2 |\ntext");

        assertInstanceOf(Block.Rule.class, blocks.get(0));
        Block.Table table = assertInstanceOf(Block.Table.class, blocks.get(1));
        assertEquals(List.of("a", "b"), table.table().header());
        assertEquals(new Block.Paragraph("text"), blocks.get(2));
    }

    @Test
    void accept_TracksState() {
        BlockStateMachine machine = scannerFor();
        machine.accept("```");
        assertEquals(BlockState.CODE_BLOCK, machine.getState());
        machine.accept("```");
        assertEquals(BlockState.NONE, machine.getState());
        machine.accept("| a |");
        assertEquals(BlockState.TABLE_CAPTURE, machine.getState());
        machine.accept("");
        assertEquals(BlockState.NONE, machine.getState());
    }

    private static BlockStateMachine scannerFor() {
        return BlockStateMachine.newScanner(new SlugRegistry());
    }
}
