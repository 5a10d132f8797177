package org.dxworks.trustforge.theme;

import org.dxworks.trustforge.model.theme.ThemeTokens;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flattens theme tokens into {@code --tf-*} CSS custom properties for the HTML template.
 */
public final class CssVariables {

    private CssVariables() {}

    public static Map<String, String> fromTokens(ThemeTokens t) {
        Map<String, String> vars = new LinkedHashMap<>();
        vars.put("--tf-primary", t.color.primary);
        vars.put("--tf-text", t.color.text);
        vars.put("--tf-muted", t.color.muted);
        vars.put("--tf-border", t.color.border);
        vars.put("--tf-bg", t.color.background);
        vars.put("--tf-link", t.pdf.linkColor);
        vars.put("--tf-heading", t.pdf.headingColor);
        vars.put("--tf-font-body", t.typography.fontBody);
        vars.put("--tf-font-heading", t.typography.fontHeading);
        vars.put("--tf-font-logo", t.typography.fontLogo);
        vars.put("--tf-font-mono", t.typography.fontMono);
        vars.put("--tf-max-width", t.html.maxWidthPx + "px");
        vars.put("--tf-heading-weight", Integer.toString(t.html.headingWeight));
        putIfPresent(vars, "--tf-primary-light", t.color.primaryLight);
        putIfPresent(vars, "--tf-primary-dark", t.color.primaryDark);
        putIfPresent(vars, "--tf-secondary", t.color.secondary);
        putIfPresent(vars, "--tf-accent", t.color.accent);
        return vars;
    }

    /**
     * A {@code :root { ... }} rule declaring every variable.
     */
    public static String toRootRule(Map<String, String> vars) {
        StringBuilder css = new StringBuilder(":root {\n");
        vars.forEach((name, value) -> css.append("  ").append(name).append(": ").append(value).append(";\n"));
        return css.append("}").toString();
    }

    private static void putIfPresent(Map<String, String> vars, String name, String value) {
        if (value != null && !value.isBlank()) {
            vars.put(name, value);
        }
    }
}
