package org.dxworks.trustforge.markdown;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SlugRegistryTest {

    @Test
    void slugify_LowercasesAndHyphenates() {
        assertEquals("data-retention-policy", SlugRegistry.slugify("  Data Retention -- Policy! "));
    }

    @Test
    void slugify_KeepsUnicodeLetters() {
        assertEquals("sécurité-données", SlugRegistry.slugify("Sécurité Données"));
    }

    @Test
    void slugify_EmptyFallsBackToSection() {
        assertEquals("section", SlugRegistry.slugify("!!!"));
    }

    @Test
    void register_NumbersDuplicatesFromTwo() {
        SlugRegistry registry = new SlugRegistry();

        assertEquals("scope", registry.register("scope"));
        assertEquals("scope-2", registry.register("scope"));
        assertEquals("scope-3", registry.register("scope"));
    }

    @Test
    void register_StepsAroundReservedIds() {
        SlugRegistry registry = new SlugRegistry();
        registry.reserve("scope-2");

        assertEquals("scope", registry.register("scope"));
        assertEquals("scope-3", registry.register("scope"));
        assertTrue(registry.isIssued("scope-2"));
    }

    @Test
    void register_StepsAroundGeneratedCollisions() {
        SlugRegistry registry = new SlugRegistry();

        assertEquals("a-2", registry.register("a-2"));
        assertEquals("a", registry.register("a"));
        assertEquals("a-3", registry.register("a"));
    }
}
