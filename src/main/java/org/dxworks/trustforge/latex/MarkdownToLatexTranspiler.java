package org.dxworks.trustforge.latex;

import org.dxworks.trustforge.markdown.HeadingPreprocessor;
import org.dxworks.trustforge.markdown.SlugRegistry;
import org.dxworks.trustforge.markdown.block.BlockStateMachine;
import org.dxworks.trustforge.markdown.block.Document;

/**
 * Markdown policy body to LaTeX body fragment, without any external tool.
 * <p>
 * Each call uses its own {@link SlugRegistry} and scanner, so concurrent calls on different
 * documents do not interact.
 */
public final class MarkdownToLatexTranspiler {

    private MarkdownToLatexTranspiler() {}

    public static String transpile(String markdownBody) {
        SlugRegistry slugs = new SlugRegistry();
        String prepared = HeadingPreprocessor.stripDeclaredToc(markdownBody);
        prepared = HeadingPreprocessor.deduplicateHeadings(prepared, slugs);
        Document document = BlockStateMachine.scan(prepared, slugs);
        return LatexBodyWriter.write(document);
    }
}
