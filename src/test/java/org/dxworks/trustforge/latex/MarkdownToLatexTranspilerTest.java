package org.dxworks.trustforge.latex;

import org.junit.jupiter.api.Test;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MarkdownToLatexTranspilerTest {

    private static final Pattern LABEL = Pattern.compile("\\\\label\\{([^}]*)\\}");

    @Test
    void transpile_LabelsAreUnique() {
        String latex = MarkdownToLatexTranspiler.transpile("# Scope\n## Scope\n# Scope {#scope-2}\n### Scope\n");

        Set<String> labels = new HashSet<>();
        Matcher matcher = LABEL.matcher(latex);
        int count = 0;
        while (matcher.find()) {
            String label = matcher.group(1);
            String id = label.substring(label.indexOf(':') + 1);
            assertTrue(labels.add(id), "duplicate label " + id);
            count++;
        }
        assertEquals(4, count);
    }

    @Test
    void transpile_DeepHeadingsCollapseToSubsubsection() {
        assertEquals("\\subsubsection{Deep}\\label{subsubsec:deep}\n", MarkdownToLatexTranspiler.transpile("###### Deep"));
    }

    @Test
    void transpile_BulletList() {
        assertEquals("\\begin{itemize}\n\\item one\n\\item \\textbf{two}\n\\end{itemize}\n",
                MarkdownToLatexTranspiler.transpile("- one\n- **two**\n"));
    }

    @Test
    void transpile_TaskListItemKeepsItsBullet() {
        assertEquals("\\begin{itemize}\n\\item{} [ ] Enable MFA\n\\item done\n\\end{itemize}\n",
                MarkdownToLatexTranspiler.transpile("- [ ] Enable MFA\n- done\n"));
    }

    @Test
    void transpile_ShortDashAlignmentRow() {
        String latex = MarkdownToLatexTranspiler.transpile("| a | b | c |\n|-|:-:|--:|\n| 1 | 2 |\n");

        assertEquals("\\begin{tabular}{l|c|r}\n"
                + "\\hline\n"
                + "\\textbf{a} & \\textbf{b} & \\textbf{c} \\\\\n"
                + "\\hline\n"
                + "1 & 2 &  \\\\\n"
                + "\\hline\n"
                + "\\end{tabular}\n", latex);
    }

    @Test
    void transpile_AutolinkInHeadingIsEscaped() {
        String latex = MarkdownToLatexTranspiler.transpile("# Contact <https://x.org/a#b%c>");

        assertTrue(latex.startsWith("\\section{Contact \\url{https://x.org/a\\#b\\%c}}\\label{sec:"), latex);
    }

    @Test
    void transpile_DeclaredTocIsDropped() {
        String latex = MarkdownToLatexTranspiler.transpile("## Table of Contents\n- [A](#a)\n## A\n");

        assertFalse(latex.contains("Table of Contents"));
        assertEquals("\\subsection{A}\\label{subsec:a}\n", latex);
    }

    @Test
    void transpile_UnterminatedFenceIsClosed() {
        assertEquals("\\textit{python}\n\\begin{verbatim}\nprint(\"100%\")\n\\end{verbatim}\n",
                MarkdownToLatexTranspiler.transpile("```python\nprint(\"100%\")\n"));
    }

    @Test
    void transpile_EmptyBody() {
        assertEquals("\n", MarkdownToLatexTranspiler.transpile(""));
    }
}
