package org.dxworks.trustforge.markdown.inline;

/**
 * One implementation per output format.
 */
public interface InlineVisitor<R> {
    R visit(InlineSpan.Text text);

    R visit(InlineSpan.Bold bold);

    R visit(InlineSpan.Italic italic);

    R visit(InlineSpan.Code code);

    R visit(InlineSpan.Link link);

    R visit(InlineSpan.Autolink autolink);
}
