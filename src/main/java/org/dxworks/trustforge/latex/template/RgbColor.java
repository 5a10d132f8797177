package org.dxworks.trustforge.latex.template;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A colour as fractional RGB components in 0..1, the form xcolor's {@code rgb} model expects.
 */
public record RgbColor(double red, double green, double blue) {

    private static final Pattern HEX6 = Pattern.compile("^#[0-9A-Fa-f]{6}$");

    public static boolean isHex6(String value) {
        return value != null && HEX6.matcher(value).matches();
    }

    public static RgbColor fromHex(String hex) {
        if (!isHex6(hex)) {
            throw new IllegalArgumentException("Expected a 6-digit hex colour like #AABBCC, got: " + hex);
        }
        int rgb = Integer.parseInt(hex.substring(1), 16);
        return new RgbColor(((rgb >> 16) & 0xFF) / 255.0, ((rgb >> 8) & 0xFF) / 255.0, (rgb & 0xFF) / 255.0);
    }

    /**
     * Three components with three decimals, e.g. {@code 0.102,0.451,0.910}.
     */
    public String toLatex() {
        return String.format(Locale.ROOT, "%.3f,%.3f,%.3f", red, green, blue);
    }
}
