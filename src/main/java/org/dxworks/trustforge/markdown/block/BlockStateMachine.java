package org.dxworks.trustforge.markdown.block;

import org.dxworks.trustforge.markdown.MarkdownPatterns;
import org.dxworks.trustforge.markdown.SlugRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans a policy body line by line into a {@link Document}.
 * <p>
 * Supported: ATX headings, paragraphs, {@code - }/{@code * } and {@code 1. } lists (not nested),
 * fenced code, {@code >} quotes (not nested), pipe tables and {@code ---} rules. Anything the
 * scanner does not understand ends up as paragraph text; malformed input never fails the scan.
 * <p>
 * One instance per document. Labels for headings without a {@code {#id}} come from the
 * {@link SlugRegistry} passed in, so they stay unique together with ids assigned earlier in the
 * same render.
 */
public final class BlockStateMachine {

    private static final Pattern BLOCKQUOTE = Pattern.compile("^\\s*>\\s?(.*)$");
    private static final Pattern RULE = Pattern.compile("^\\s*-{3,}\\s*$");
    private static final Pattern HEADING = Pattern.compile("^(#{1,6})\\s+(.+)$");
    private static final Pattern ORDERED_ITEM = Pattern.compile("^\\s*\\d+\\.\\s+(.*)$");

    private final SlugRegistry slugs;
    private final List<Block> blocks = new ArrayList<>();

    private BlockState state = BlockState.NONE;
    // paragraph lines, list items, code lines, quote lines or table rows, depending on state
    private final List<String> buffer = new ArrayList<>();
    private String codeLanguage;

    private BlockStateMachine(SlugRegistry slugs) {
        this.slugs = slugs;
    }

    public static Document scan(String markdown, SlugRegistry slugs) {
        BlockStateMachine machine = newScanner(slugs);
        String[] lines = markdown.split("\\r?\\n", -1);
        // a trailing newline does not start another line
        int count = markdown.endsWith("\n") ? lines.length - 1 : lines.length;
        for (int i = 0; i < count; i++) {
            machine.accept(lines[i]);
        }
        machine.flush();
        return new Document(machine.blocks);
    }

    static BlockStateMachine newScanner(SlugRegistry slugs) {
        return new BlockStateMachine(slugs);
    }

    BlockState getState() {
        return state;
    }

    void accept(String raw) {
        if (state == BlockState.CODE_BLOCK) {
            if (MarkdownPatterns.FENCE_END.matcher(raw).matches()) {
                flush();
            } else {
                buffer.add(raw);
            }
            return;
        }

        Matcher fence = MarkdownPatterns.FENCE_START.matcher(raw.strip());
        if (fence.matches()) {
            enter(BlockState.CODE_BLOCK);
            codeLanguage = fence.group(1).isEmpty() ? null : fence.group(1);
            return;
        }

        Matcher quote = BLOCKQUOTE.matcher(raw);
        if (quote.matches()) {
            enter(BlockState.BLOCKQUOTE);
            buffer.add(quote.group(1).strip());
            return;
        }
        if (state == BlockState.BLOCKQUOTE) {
            flush();
        }

        String line = raw.strip();

        if (RULE.matcher(line).matches()) {
            flush();
            blocks.add(new Block.Rule());
            return;
        }

        if (line.isEmpty()) {
            flush();
            return;
        }

        Matcher heading = HEADING.matcher(line);
        if (heading.matches()) {
            flush();
            blocks.add(heading(heading.group(1).length(), heading.group(2)));
            return;
        }

        if (TableAssembler.isPipeRow(line)) {
            enter(BlockState.TABLE_CAPTURE);
            buffer.add(line);
            return;
        }
        if (state == BlockState.TABLE_CAPTURE) {
            flush();
        }

        if (line.startsWith("- ") || line.startsWith("* ")) {
            enter(BlockState.BULLET_LIST);
            buffer.add(line.substring(2).strip());
            return;
        }

        Matcher ordered = ORDERED_ITEM.matcher(line);
        if (ordered.matches()) {
            enter(BlockState.ORDERED_LIST);
            buffer.add(ordered.group(1).strip());
            return;
        }

        line = MarkdownPatterns.HEADING_ID.matcher(line).replaceFirst("");

        // lazy continuation of the last list item
        if (state == BlockState.BULLET_LIST || state == BlockState.ORDERED_LIST) {
            int last = buffer.size() - 1;
            buffer.set(last, buffer.get(last) + " " + line);
            return;
        }

        enter(BlockState.PARAGRAPH);
        buffer.add(line);
    }

    private Block.Heading heading(int level, String text) {
        Matcher id = MarkdownPatterns.HEADING_ID.matcher(text);
        if (id.find()) {
            String title = text.substring(0, id.start()).strip();
            return new Block.Heading(level, title, id.group(1));
        }
        String title = text.strip();
        return new Block.Heading(level, title, slugs.register(SlugRegistry.slugify(title)));
    }

    /**
     * Switches to {@code next}, closing whatever else is open. Staying in the same state keeps
     * the buffer.
     */
    private void enter(BlockState next) {
        if (state != next) {
            flush();
            state = next;
        }
    }

    void flush() {
        Block block = switch (state) {
            case NONE -> null;
            case PARAGRAPH -> new Block.Paragraph(String.join(" ", buffer));
            case BULLET_LIST -> new Block.BulletList(buffer);
            case ORDERED_LIST -> new Block.OrderedList(buffer);
            case CODE_BLOCK -> new Block.CodeBlock(codeLanguage, buffer);
            case BLOCKQUOTE -> new Block.Blockquote(buffer);
            case TABLE_CAPTURE -> new Block.Table(TableAssembler.assemble(buffer));
        };
        if (block != null) {
            blocks.add(block);
        }
        buffer.clear();
        codeLanguage = null;
        state = BlockState.NONE;
    }
}
