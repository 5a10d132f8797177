package org.dxworks.trustforge.latex.template;

import org.dxworks.trustforge.model.PolicyMeta;
import org.dxworks.trustforge.model.theme.ThemeTokens;

/**
 * Everything the LaTeX template needs besides the body.
 *
 * @param subtitle nullable
 * @param footer nullable
 * @param logoFile file name of the logo next to the .tex file, null when there is no logo
 */
public record TemplateContext(String title,
                              String version,
                              String owner,
                              String lastReviewed,
                              String subtitle,
                              String footer,
                              ThemeTokens tokens,
                              String logoFile) {

    /**
     * @param defaultFooter used when the policy does not set its own footer, may be null
     */
    public static TemplateContext of(PolicyMeta meta, ThemeTokens tokens, String logoFile, String defaultFooter) {
        String footer = isBlank(meta.footer) ? defaultFooter : meta.footer;
        return new TemplateContext(meta.title, meta.version, meta.owner, meta.lastReviewed,
                isBlank(meta.subtitle) ? null : meta.subtitle,
                isBlank(footer) ? null : footer,
                tokens, logoFile);
    }

    public boolean hasLogo() {
        return logoFile != null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
