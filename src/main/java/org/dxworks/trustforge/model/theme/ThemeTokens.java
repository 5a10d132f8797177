package org.dxworks.trustforge.model.theme;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Resolved design tokens of a theme file. Every field carries the neutral default, so a theme
 * only needs to list what it changes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ThemeTokens {
    public Brand brand = new Brand();
    public Colors color = new Colors();
    public Typography typography = new Typography();
    public Layout layout = new Layout();
    public Pdf pdf = new Pdf();
    public Html html = new Html();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Brand {
        public String name = "Trustforge";
        public String logoPath = "";
        public int logoHeightMm = 24; // cover logo
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Colors {
        public String primary = "#222222";
        public String text = "#222222";
        public String muted = "#555555";
        public String border = "#DDDDDD";
        public String background = "#FFFFFF";
        public String primaryLight; // nullable
        public String primaryDark; // nullable
        public String secondary; // nullable
        public String accent; // nullable
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Typography {
        public String fontBody = "Inter";
        public String fontHeading = "Inter";
        public String fontLogo = "Inter";
        public String fontMono = "Menlo";
        public double scale = 1.0;
        public double lineHeight = 1.5;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Layout {
        public int pageMarginsMm = 20;
        public boolean header = true;
        public boolean footer = true;
        public String watermark = "";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Pdf {
        public String linkColor = "#1A73E8";
        public String headingColor = "#000000";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Html {
        public int maxWidthPx = 800;
        public int headingWeight = 700;
    }

    public boolean hasLogo() {
        return brand.logoPath != null && !brand.logoPath.isBlank();
    }
}
