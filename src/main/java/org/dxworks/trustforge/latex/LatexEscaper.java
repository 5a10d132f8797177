package org.dxworks.trustforge.latex;

/**
 * Escapes LaTeX special characters in running text and converts en/em dashes to their ASCII
 * ligature form. Works character by character, so replacements never escape each other.
 */
public final class LatexEscaper {

    private LatexEscaper() {}

    public static String escape(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\textbackslash{}");
                case '{' -> out.append("\\{");
                case '}' -> out.append("\\}");
                case '$' -> out.append("\\$");
                case '&' -> out.append("\\&");
                case '#' -> out.append("\\#");
                case '%' -> out.append("\\%");
                case '_' -> out.append("\\_");
                case '~' -> out.append("\\textasciitilde{}");
                case '^' -> out.append("\\textasciicircum{}");
                case '\u2013' -> out.append("--"); // en dash
                case '\u2014' -> out.append("---"); // em dash
                default -> out.append(c);
            }
        }
        return out.toString();
    }

    /**
     * Escapes a URL for the first argument of hyperref's href and url macros. Only the characters
     * that end or comment out the argument are escaped; hyperref turns them back into the literal
     * characters in the link target.
     */
    public static String escapeUrl(String url) {
        if (url == null || url.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder(url.length() + 8);
        for (int i = 0; i < url.length(); i++) {
            char c = url.charAt(i);
            switch (c) {
                case '#' -> out.append("\\#");
                case '%' -> out.append("\\%");
                case '&' -> out.append("\\&");
                default -> out.append(c);
            }
        }
        return out.toString();
    }
}
