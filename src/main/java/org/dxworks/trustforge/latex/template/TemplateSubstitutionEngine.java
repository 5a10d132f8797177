package org.dxworks.trustforge.latex.template;

import org.dxworks.trustforge.error.TemplateException;
import org.dxworks.trustforge.latex.LatexEscaper;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills the LaTeX policy template. Placeholders are exact, case-sensitive {@code __NAME__} tokens.
 * <p>
 * Substitution order: theme tokens, optional blocks (subtitle, footer, logo), escaped metadata,
 * then the body. The body goes in last and verbatim, so text inside it is never mistaken for a
 * placeholder.
 */
public final class TemplateSubstitutionEngine {

    public static final String BODY_PLACEHOLDER = "__POLICY_BODY__";

    private static final Pattern PLACEHOLDER = Pattern.compile("__[A-Z][A-Z0-9_]*__");

    private TemplateSubstitutionEngine() {}

    /**
     * The template must contain the body placeholder exactly once.
     */
    public static void checkBodyPlaceholder(String template, String templateName) {
        int count = countOccurrences(template, BODY_PLACEHOLDER);
        if (count != 1) {
            throw new TemplateException(templateName,
                    "expected a single " + BODY_PLACEHOLDER + " placeholder, found " + count + ".");
        }
    }

    public static String render(String template, String templateName, TemplateContext context, String body) {
        checkBodyPlaceholder(template, templateName);
        String latex = template;

        for (Map.Entry<String, String> entry : LatexThemeTokens.toPlaceholders(context.tokens()).entrySet()) {
            latex = latex.replace(entry.getKey(), entry.getValue());
        }

        latex = latex.replace("__SUBTITLE_BLOCK__", subtitleBlock(context));
        latex = latex.replace("__FOOTER_BLOCK__", footerBlock(context));
        latex = latex.replace("__LOGO_BLOCK__", logoBlock(context));

        latex = latex.replace("__TITLE__", LatexEscaper.escape(context.title()))
                .replace("__VERSION__", LatexEscaper.escape(context.version()))
                .replace("__OWNER__", LatexEscaper.escape(context.owner()))
                .replace("__LAST_REVIEWED__", LatexEscaper.escape(context.lastReviewed()));

        Set<String> unresolved = unresolvedPlaceholders(latex);
        if (!unresolved.isEmpty()) {
            throw new TemplateException(templateName, "unresolved placeholders " + unresolved + ".");
        }

        return latex.replace(BODY_PLACEHOLDER, body);
    }

    private static String subtitleBlock(TemplateContext context) {
        if (context.subtitle() == null) {
            return "";
        }
        return "{\\vspace{2mm}\\color{TFText}\\Large\\sffamily\\itshape "
                + LatexEscaper.escape(context.subtitle()) + "}\\par\n";
    }

    private static String footerBlock(TemplateContext context) {
        if (context.footer() == null) {
            return "";
        }
        return "{\\color{TFText}\\small " + LatexEscaper.escape(context.footer()) + "}\\par";
    }

    private static String logoBlock(TemplateContext context) {
        if (!context.hasLogo()) {
            return "";
        }
        return "\\includegraphics[height=" + context.tokens().brand.logoHeightMm + "mm]{"
                + context.logoFile() + "}\\par\\vspace{6mm}\n";
    }

    private static Set<String> unresolvedPlaceholders(String latex) {
        Set<String> found = new TreeSet<>();
        Matcher matcher = PLACEHOLDER.matcher(latex);
        while (matcher.find()) {
            if (!BODY_PLACEHOLDER.equals(matcher.group())) {
                found.add(matcher.group());
            }
        }
        return found;
    }

    private static int countOccurrences(String text, String token) {
        int count = 0;
        int from = 0;
        while ((from = text.indexOf(token, from)) >= 0) {
            count++;
            from += token.length();
        }
        return count;
    }
}
