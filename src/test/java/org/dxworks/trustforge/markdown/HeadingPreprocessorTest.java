package org.dxworks.trustforge.markdown;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class HeadingPreprocessorTest {

    @Test
    void deduplicateHeadings_AssignsNumberedIds() {
        String markdown = "# Scope\ntext\n## Scope\n### Scope\n";

        String result = HeadingPreprocessor.deduplicateHeadings(markdown, new SlugRegistry());

        assertEquals("# Scope {#scope}\ntext\n## Scope {#scope-2}\n### Scope {#scope-3}\n", result);
    }

    @Test
    void deduplicateHeadings_IsIdempotent() {
        String once = HeadingPreprocessor.deduplicateHeadings("# A\n# A\n", new SlugRegistry());
        String twice = HeadingPreprocessor.deduplicateHeadings(once, new SlugRegistry());

        assertEquals(once, twice);
    }

    @Test
    void deduplicateHeadings_KeepsExplicitIdAndAvoidsIt() {
        String result = HeadingPreprocessor.deduplicateHeadings("# Intro {#scope}\n# Scope", new SlugRegistry());

        assertEquals("# Intro {#scope}\n# Scope {#scope-2}", result);
    }

    @Test
    void deduplicateHeadings_SkipsCodeFences() {
        String markdown = "```bash\n# comment\n```\n# Real\n";

        String result = HeadingPreprocessor.deduplicateHeadings(markdown, new SlugRegistry());

        assertEquals("```bash\n# comment\n```\n# Real {#real}\n", result);
    }

    @Test
    void stripDeclaredToc_RemovesSectionUpToNextHeading() {
        String markdown = "# Policy\n\n## Table of Contents\n- [A](#a)\n- [B](#b)\n\n## A\nbody\n";

        assertEquals("# Policy\n\n## A\nbody\n", HeadingPreprocessor.stripDeclaredToc(markdown));
    }

    @Test
    void stripDeclaredToc_IsCaseInsensitiveAndRunsToEnd() {
        assertEquals("intro", HeadingPreprocessor.stripDeclaredToc("intro\n### TABLE OF CONTENTS\n- x"));
    }

    @Test
    void stripDeclaredToc_LeavesDocumentsWithoutTocAlone() {
        String markdown = "# A\n\n```\n## Table of Contents\n```\n";

        assertEquals(markdown, HeadingPreprocessor.stripDeclaredToc(markdown));
    }
}
