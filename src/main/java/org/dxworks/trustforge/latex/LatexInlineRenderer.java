package org.dxworks.trustforge.latex;

import org.dxworks.trustforge.markdown.inline.InlineLexer;
import org.dxworks.trustforge.markdown.inline.InlineSpan;
import org.dxworks.trustforge.markdown.inline.InlineVisitor;

/**
 * Emits inline spans as LaTeX. Span content is escaped before it is wrapped in a macro; macro
 * output is never escaped again.
 */
public final class LatexInlineRenderer implements InlineVisitor<String> {

    private static final LatexInlineRenderer INSTANCE = new LatexInlineRenderer();

    private LatexInlineRenderer() {}

    public static String render(String markdownLine) {
        StringBuilder out = new StringBuilder();
        for (InlineSpan span : InlineLexer.tokenize(markdownLine)) {
            out.append(span.accept(INSTANCE));
        }
        return out.toString();
    }

    @Override
    public String visit(InlineSpan.Text text) {
        return LatexEscaper.escape(text.text());
    }

    @Override
    public String visit(InlineSpan.Bold bold) {
        return "\\textbf{" + LatexEscaper.escape(bold.text()) + "}";
    }

    @Override
    public String visit(InlineSpan.Italic italic) {
        return "\\emph{" + LatexEscaper.escape(italic.text()) + "}";
    }

    @Override
    public String visit(InlineSpan.Code code) {
        return "\\texttt{" + LatexEscaper.escape(code.text()) + "}";
    }

    @Override
    public String visit(InlineSpan.Link link) {
        return "\\href{" + LatexEscaper.escapeUrl(link.url()) + "}{" + LatexEscaper.escape(link.text()) + "}";
    }

    @Override
    public String visit(InlineSpan.Autolink autolink) {
        // also used inside section titles, where a bare hash or percent sign breaks the argument
        return "\\url{" + LatexEscaper.escapeUrl(autolink.url()) + "}";
    }
}
