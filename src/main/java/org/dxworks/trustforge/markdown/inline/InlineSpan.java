package org.dxworks.trustforge.markdown.inline;

/**
 * A run of inline content produced by {@link InlineLexer}. Spans are flat: a bold span holds
 * plain text, never another span.
 */
public sealed interface InlineSpan {

    <R> R accept(InlineVisitor<R> visitor);

    record Text(String text) implements InlineSpan {
        @Override
        public <R> R accept(InlineVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Bold(String text) implements InlineSpan {
        @Override
        public <R> R accept(InlineVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Italic(String text) implements InlineSpan {
        @Override
        public <R> R accept(InlineVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Code(String text) implements InlineSpan {
        @Override
        public <R> R accept(InlineVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Link(String text, String url) implements InlineSpan {
        @Override
        public <R> R accept(InlineVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Autolink(String url) implements InlineSpan {
        @Override
        public <R> R accept(InlineVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }
}
