package org.dxworks.trustforge.latex.template;

import org.dxworks.trustforge.latex.LatexEscaper;
import org.dxworks.trustforge.model.theme.ThemeTokens;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flattens theme tokens into the {@code __TF_*__} placeholders of the LaTeX template.
 */
public final class LatexThemeTokens {

    private static final int BOLD_WEIGHT_THRESHOLD = 600;

    private LatexThemeTokens() {}

    public static Map<String, String> toPlaceholders(ThemeTokens tokens) {
        Map<String, String> vars = new LinkedHashMap<>();
        vars.put("__TF_COLOR_PRIMARY__", rgb(tokens.color.primary));
        vars.put("__TF_COLOR_TEXT__", rgb(tokens.color.text));
        vars.put("__TF_COLOR_MUTED__", rgb(tokens.color.muted));
        vars.put("__TF_COLOR_BORDER__", rgb(tokens.color.border));
        vars.put("__TF_COLOR_BACKGROUND__", rgb(tokens.color.background));
        vars.put("__TF_COLOR_LINK__", rgb(tokens.pdf.linkColor));
        vars.put("__TF_COLOR_HEADING__", rgb(tokens.pdf.headingColor));
        vars.put("__TF_FONT_BODY__", tokens.typography.fontBody);
        vars.put("__TF_FONT_HEADING__", tokens.typography.fontHeading);
        vars.put("__TF_FONT_MONO__", tokens.typography.fontMono);
        vars.put("__TF_PAGE_MARGIN_MM__", Integer.toString(tokens.layout.pageMarginsMm));
        vars.put("__TF_HEADING_WEIGHT__", Integer.toString(tokens.html.headingWeight));
        vars.put("__TF_HEADING_SERIES__",
                tokens.html.headingWeight >= BOLD_WEIGHT_THRESHOLD ? "\\bfseries" : "\\mdseries");
        vars.put("__TF_LOGO_HEIGHT_MM__", Integer.toString(tokens.brand.logoHeightMm));
        vars.put("__TF_BRAND_NAME__", LatexEscaper.escape(tokens.brand.name));
        return vars;
    }

    private static String rgb(String hex) {
        return RgbColor.fromHex(hex).toLatex();
    }
}
