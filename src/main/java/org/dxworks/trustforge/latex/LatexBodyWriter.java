package org.dxworks.trustforge.latex;

import org.dxworks.trustforge.markdown.block.Block;
import org.dxworks.trustforge.markdown.block.BlockVisitor;
import org.dxworks.trustforge.markdown.block.ColumnAlignment;
import org.dxworks.trustforge.markdown.block.Document;
import org.dxworks.trustforge.markdown.block.PipeTable;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes a scanned {@link Document} as a LaTeX body fragment for the policy template.
 * Sectioning commands carry {@code \label}s so the template's table of contents and PDF
 * bookmarks pick them up.
 */
public final class LatexBodyWriter implements BlockVisitor {

    private final List<String> out = new ArrayList<>();

    private LatexBodyWriter() {}

    public static String write(Document document) {
        LatexBodyWriter writer = new LatexBodyWriter();
        document.accept(writer);
        return String.join("\n", writer.out).strip() + "\n";
    }

    @Override
    public void visit(Block.Paragraph paragraph) {
        out.add(LatexInlineRenderer.render(paragraph.text()));
        out.add("");
    }

    @Override
    public void visit(Block.Heading heading) {
        String title = LatexInlineRenderer.render(heading.text());
        String line = switch (heading.level()) {
            case 1 -> "\\section{" + title + "}\\label{sec:" + heading.label() + "}";
            case 2 -> "\\subsection{" + title + "}\\label{subsec:" + heading.label() + "}";
            // 4-6 have no numbered counterpart in the template and collapse onto level 3
            default -> "\\subsubsection{" + title + "}\\label{subsubsec:" + heading.label() + "}";
        };
        out.add(line);
        out.add("");
    }

    @Override
    public void visit(Block.BulletList list) {
        writeList("itemize", list.items());
    }

    @Override
    public void visit(Block.OrderedList list) {
        writeList("enumerate", list.items());
    }

    private void writeList(String environment, List<String> items) {
        out.add("\\begin{" + environment + "}");
        for (String item : items) {
            String tex = LatexInlineRenderer.render(item);
            // a leading bracket would be read as the optional item label
            out.add((tex.startsWith("[") ? "\\item{} " : "\\item ") + tex);
        }
        out.add("\\end{" + environment + "}");
        out.add("");
    }

    @Override
    public void visit(Block.CodeBlock codeBlock) {
        if (codeBlock.language() != null) {
            out.add("\\textit{" + LatexEscaper.escape(codeBlock.language()) + "}");
        }
        out.add("\\begin{verbatim}");
        out.addAll(codeBlock.lines());
        out.add("\\end{verbatim}");
        out.add("");
    }

    @Override
    public void visit(Block.Blockquote blockquote) {
        out.add("\\begin{quote}");
        for (String line : blockquote.lines()) {
            out.add(LatexInlineRenderer.render(line));
        }
        out.add("\\end{quote}");
        out.add("");
    }

    @Override
    public void visit(Block.Table table) {
        PipeTable pipeTable = table.table();
        if (pipeTable.columnCount() == 0) {
            return;
        }
        String columnSpec = pipeTable.alignments().stream()
                .map(LatexBodyWriter::columnSpec)
                .collect(Collectors.joining("|"));
        out.add("\\begin{tabular}{" + columnSpec + "}");
        out.add("\\hline");
        if (pipeTable.hasHeader()) {
            writeRow(pipeTable.header(), true);
        }
        for (List<String> row : pipeTable.rows()) {
            writeRow(row, false);
        }
        out.add("\\end{tabular}");
        out.add("");
    }

    private void writeRow(List<String> cells, boolean header) {
        List<String> rendered = new ArrayList<>();
        for (String cell : cells) {
            String tex = LatexInlineRenderer.render(cell);
            rendered.add(header && !tex.isEmpty() ? "\\textbf{" + tex + "}" : tex);
        }
        out.add(String.join(" & ", rendered) + " \\\\");
        out.add("\\hline");
    }

    private static String columnSpec(ColumnAlignment alignment) {
        return switch (alignment) {
            case LEFT -> "l";
            case CENTER -> "c";
            case RIGHT -> "r";
        };
    }

    @Override
    public void visit(Block.Rule rule) {
        out.add("\\noindent\\hrulefill");
        out.add("");
    }
}
