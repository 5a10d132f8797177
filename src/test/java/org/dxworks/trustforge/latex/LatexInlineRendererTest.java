package org.dxworks.trustforge.latex;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class LatexInlineRendererTest {

    @Test
    void render_BoldItalicCode() {
        assertEquals("\\textbf{must} be \\emph{reviewed} by \\texttt{sec\\_ops}",
                LatexInlineRenderer.render("**must** be *reviewed* by `sec_ops`"));
    }

    @Test
    void render_LinkEscapesUrlAndText() {
        assertEquals("\\href{https://x.org/?a=1\\&b=2}{R\\&D}",
                LatexInlineRenderer.render("[R&D](https://x.org/?a=1&b=2)"));
    }

    @Test
    void render_AutolinkKeepsRawUrl() {
        assertEquals("see \\url{https://x.org/a_b}", LatexInlineRenderer.render("see <https://x.org/a_b>"));
    }

    @Test
    void render_LinkTargetKeepsTilde() {
        assertEquals("\\href{https://x.org/~user\\#top}{home\\textasciitilde{}}",
                LatexInlineRenderer.render("[home~](https://x.org/~user#top)"));
    }

    @Test
    void render_AutolinkEscapesHashAndPercent() {
        assertEquals("\\url{https://x.org/a\\#b\\%c}", LatexInlineRenderer.render("<https://x.org/a#b%c>"));
    }

    @Test
    void render_CodeWinsOverLink() {
        assertEquals("\\texttt{[a](b)}", LatexInlineRenderer.render("`[a](b)`"));
    }
}
