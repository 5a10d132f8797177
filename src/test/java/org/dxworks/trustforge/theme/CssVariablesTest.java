package org.dxworks.trustforge.theme;

import org.dxworks.trustforge.model.theme.ThemeTokens;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CssVariablesTest {

    @Test
    void fromTokens_CoreVariables() {
        Map<String, String> vars = CssVariables.fromTokens(new ThemeTokens());

        assertEquals("#222222", vars.get("--tf-primary"));
        assertEquals("#FFFFFF", vars.get("--tf-bg"));
        assertEquals("#1A73E8", vars.get("--tf-link"));
        assertEquals("800px", vars.get("--tf-max-width"));
        assertEquals("700", vars.get("--tf-heading-weight"));
        assertFalse(vars.containsKey("--tf-accent"));
    }

    @Test
    void fromTokens_OptionalColorsWhenSet() {
        ThemeTokens tokens = new ThemeTokens();
        tokens.color.accent = "#FF9500";
        tokens.color.primaryDark = "#000080";

        Map<String, String> vars = CssVariables.fromTokens(tokens);

        assertEquals("#FF9500", vars.get("--tf-accent"));
        assertEquals("#000080", vars.get("--tf-primary-dark"));
    }

    @Test
    void toRootRule_DeclaresEveryVariable() {
        String css = CssVariables.toRootRule(Map.of("--tf-primary", "#123456"));

        assertEquals(":root {\n  --tf-primary: #123456;\n}", css);
        assertTrue(CssVariables.toRootRule(CssVariables.fromTokens(new ThemeTokens())).contains("--tf-font-mono: Menlo;"));
    }
}
