package org.dxworks.trustforge.theme;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.trustforge.error.ThemeException;
import org.dxworks.trustforge.latex.template.RgbColor;
import org.dxworks.trustforge.model.theme.ThemeTokens;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Loads and validates YAML theme files.
 */
public final class ThemeLoader {

    static final String BUNDLED_THEME = "themes/neutral.yaml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);

    private ThemeLoader() {}

    /**
     * Resolves {@code configuredPath} with {@link ThemeResolver} and loads the result.
     */
    public static ThemeTokens resolveAndLoad(String configuredPath) {
        return ThemeResolver.resolve(configuredPath)
                .map(ThemeLoader::load)
                .orElseGet(ThemeLoader::loadBundled);
    }

    public static ThemeTokens load(Path themePath) {
        String raw;
        try {
            raw = Files.readString(themePath, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new ThemeException(themePath.toString(), "Theme file not found.", e);
        } catch (IOException e) {
            throw new ThemeException(themePath.toString(), "Unable to read theme file: " + e.getMessage(), e);
        }
        return parse(raw, themePath.toString());
    }

    public static ThemeTokens loadBundled() {
        try (InputStream in = ThemeLoader.class.getClassLoader().getResourceAsStream(BUNDLED_THEME)) {
            if (in == null) {
                throw new ThemeException("classpath:" + BUNDLED_THEME, "Bundled theme is missing.");
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), "classpath:" + BUNDLED_THEME);
        } catch (IOException e) {
            throw new ThemeException("classpath:" + BUNDLED_THEME, "Unable to read bundled theme: " + e.getMessage(), e);
        }
    }

    public static ThemeTokens parse(String yaml, String source) {
        ThemeTokens tokens;
        try {
            tokens = yaml.isBlank() ? new ThemeTokens() : YAML_MAPPER.readValue(yaml, ThemeTokens.class);
        } catch (JsonProcessingException e) {
            throw new ThemeException(source, "YAML parse error: " + e.getOriginalMessage(), e);
        }
        if (tokens == null) {
            tokens = new ThemeTokens();
        }
        fillMissingSections(tokens);
        validate(tokens, source);
        return tokens;
    }

    // "pdf:" with nothing under it maps to null
    private static void fillMissingSections(ThemeTokens tokens) {
        if (tokens.brand == null) tokens.brand = new ThemeTokens.Brand();
        if (tokens.color == null) tokens.color = new ThemeTokens.Colors();
        if (tokens.typography == null) tokens.typography = new ThemeTokens.Typography();
        if (tokens.layout == null) tokens.layout = new ThemeTokens.Layout();
        if (tokens.pdf == null) tokens.pdf = new ThemeTokens.Pdf();
        if (tokens.html == null) tokens.html = new ThemeTokens.Html();
        if (tokens.brand.logoPath == null) tokens.brand.logoPath = "";
        if (tokens.layout.watermark == null) tokens.layout.watermark = "";
    }

    static void validate(ThemeTokens tokens, String source) {
        ThemeTokens.Colors c = tokens.color;
        requireHex("color.primary", c.primary, source);
        requireHex("color.text", c.text, source);
        requireHex("color.muted", c.muted, source);
        requireHex("color.border", c.border, source);
        requireHex("color.background", c.background, source);
        optionalHex("color.primary_light", c.primaryLight, source);
        optionalHex("color.primary_dark", c.primaryDark, source);
        optionalHex("color.secondary", c.secondary, source);
        optionalHex("color.accent", c.accent, source);

        requireHex("pdf.link_color", tokens.pdf.linkColor, source);
        requireHex("pdf.heading_color", tokens.pdf.headingColor, source);

        ThemeTokens.Typography t = tokens.typography;
        requireText("typography.font_body", t.fontBody, source);
        requireText("typography.font_heading", t.fontHeading, source);
        requireText("typography.font_logo", t.fontLogo, source);
        requireText("typography.font_mono", t.fontMono, source);
        requirePositive("typography.scale", t.scale, source);
        requirePositive("typography.line_height", t.lineHeight, source);
        requirePositive("layout.page_margins_mm", tokens.layout.pageMarginsMm, source);
        requirePositive("brand.logo_height_mm", tokens.brand.logoHeightMm, source);
        requirePositive("html.max_width_px", tokens.html.maxWidthPx, source);

        int weight = tokens.html.headingWeight;
        if (weight < 100 || weight > 900) {
            throw new ThemeException(source, "'html.heading_weight' should be between 100 and 900 (got " + weight + ").");
        }
    }

    private static void requireHex(String field, String value, String source) {
        if (!RgbColor.isHex6(value)) {
            throw new ThemeException(source,
                    "Invalid color for '" + field + "': '" + value + "'. Expected 6-digit hex like #AABBCC.");
        }
    }

    private static void optionalHex(String field, String value, String source) {
        if (value != null && !RgbColor.isHex6(value)) {
            throw new ThemeException(source,
                    "Invalid color for optional '" + field + "': '" + value + "'. Expected 6-digit hex like #AABBCC.");
        }
    }

    private static void requireText(String field, String value, String source) {
        if (value == null || value.isBlank()) {
            throw new ThemeException(source, "'" + field + "' must be a non-empty string.");
        }
    }

    private static void requirePositive(String field, double value, String source) {
        if (!(value > 0)) {
            throw new ThemeException(source, "'" + field + "' must be a positive number (got " + value + ").");
        }
    }
}
