package org.dxworks.trustforge.theme;

import org.dxworks.trustforge.error.ThemeException;
import org.dxworks.trustforge.model.theme.ThemeTokens;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ThemeLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void loadBundled_NeutralTheme() {
        ThemeTokens tokens = ThemeLoader.loadBundled();

        assertEquals("Trustforge", tokens.brand.name);
        assertEquals("TeX Gyre Heros", tokens.typography.fontBody);
        assertEquals(800, tokens.html.maxWidthPx);
        assertFalse(tokens.hasLogo());
    }

    @Test
    void parse_PartialThemeKeepsDefaults() {
        ThemeTokens tokens = ThemeLoader.parse("color:\n  primary: \"#0A84FF\"\n  accent: \"#FF9500\"\npdf:\n", "partial.yaml");

        assertEquals("#0A84FF", tokens.color.primary);
        assertEquals("#FF9500", tokens.color.accent);
        assertNull(tokens.color.secondary);
        assertEquals("#222222", tokens.color.text);
        assertEquals("#1A73E8", tokens.pdf.linkColor);
        assertEquals(700, tokens.html.headingWeight);
    }

    @Test
    void parse_EmptyFileIsAllDefaults() {
        ThemeTokens tokens = ThemeLoader.parse("", "empty.yaml");

        assertEquals("Inter", tokens.typography.fontBody);
        assertEquals(20, tokens.layout.pageMarginsMm);
    }

    @Test
    void parse_RejectsShortHexColor() {
        ThemeException e = assertThrows(ThemeException.class,
                () -> ThemeLoader.parse("color:\n  primary: \"#FFF\"\n", "bad.yaml"));

        assertTrue(e.getMessage().contains("color.primary"));
        assertEquals("bad.yaml", e.getThemePath());
    }

    @Test
    void parse_RejectsInvalidOptionalColor() {
        assertThrows(ThemeException.class, () -> ThemeLoader.parse("color:\n  secondary: red\n", "bad.yaml"));
    }

    @Test
    void parse_RejectsHeadingWeightOutOfRange() {
        assertThrows(ThemeException.class, () -> ThemeLoader.parse("html:\n  heading_weight: 950\n", "bad.yaml"));
    }

    @Test
    void parse_RejectsBlankFont() {
        assertThrows(ThemeException.class, () -> ThemeLoader.parse("typography:\n  font_mono: \"  \"\n", "bad.yaml"));
    }

    @Test
    void parse_RejectsNonPositiveSizes() {
        assertThrows(ThemeException.class, () -> ThemeLoader.parse("typography:\n  scale: 0\n", "bad.yaml"));
        assertThrows(ThemeException.class, () -> ThemeLoader.parse("layout:\n  page_margins_mm: -5\n", "bad.yaml"));
        assertThrows(ThemeException.class, () -> ThemeLoader.parse("html:\n  max_width_px: 0\n", "bad.yaml"));
    }

    @Test
    void parse_RejectsWrongType() {
        assertThrows(ThemeException.class, () -> ThemeLoader.parse("html:\n  max_width_px: wide\n", "bad.yaml"));
    }

    @Test
    void load_FromFile() throws Exception {
        Path theme = tempDir.resolve("brand.yaml");
        Files.writeString(theme, "brand:\n  name: Acme\n  logo_path: assets/logo.png\n");

        ThemeTokens tokens = ThemeLoader.load(theme);

        assertEquals("Acme", tokens.brand.name);
        assertTrue(tokens.hasLogo());
    }

    @Test
    void load_MissingFile() {
        assertThrows(ThemeException.class, () -> ThemeLoader.load(tempDir.resolve("nope.yaml")));
    }

    @Test
    void resolveAndLoad_UnknownConfiguredPathFails() {
        assertThrows(ThemeException.class,
                () -> ThemeLoader.resolveAndLoad(tempDir.resolve("missing-theme.yaml").toString()));
    }

    @Test
    void resolveAndLoad_ExplicitAbsolutePath() throws Exception {
        Path theme = tempDir.resolve("dark.yaml");
        Files.writeString(theme, "color:\n  background: \"#000000\"\n");

        assertEquals("#000000", ThemeLoader.resolveAndLoad(theme.toString()).color.background);
    }
}
