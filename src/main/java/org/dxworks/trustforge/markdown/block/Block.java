package org.dxworks.trustforge.markdown.block;

import java.util.List;

/**
 * Block-level element of a scanned policy body. Text fields hold raw Markdown; escaping and
 * inline formatting happen when a writer emits the block.
 */
public sealed interface Block {

    void accept(BlockVisitor visitor);

    record Paragraph(String text) implements Block {
        @Override
        public void accept(BlockVisitor visitor) {
            visitor.visit(this);
        }
    }

    /**
     * @param level 1-6 as written in the source
     * @param label unique per render
     */
    record Heading(int level, String text, String label) implements Block {
        @Override
        public void accept(BlockVisitor visitor) {
            visitor.visit(this);
        }
    }

    record BulletList(List<String> items) implements Block {
        public BulletList {
            items = List.copyOf(items);
        }

        @Override
        public void accept(BlockVisitor visitor) {
            visitor.visit(this);
        }
    }

    record OrderedList(List<String> items) implements Block {
        public OrderedList {
            items = List.copyOf(items);
        }

        @Override
        public void accept(BlockVisitor visitor) {
            visitor.visit(this);
        }
    }

    /**
     * @param language fence tag, null when the fence has none
     * @param lines verbatim content
     */
    record CodeBlock(String language, List<String> lines) implements Block {
        public CodeBlock {
            lines = List.copyOf(lines);
        }

        @Override
        public void accept(BlockVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Blockquote(List<String> lines) implements Block {
        public Blockquote {
            lines = List.copyOf(lines);
        }

        @Override
        public void accept(BlockVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Table(PipeTable table) implements Block {
        @Override
        public void accept(BlockVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Rule() implements Block {
        @Override
        public void accept(BlockVisitor visitor) {
            visitor.visit(this);
        }
    }
}
