package org.dxworks.trustforge.markdown;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-based clean-up of a policy body before it is scanned into blocks:
 * <ul>
 *   <li>drops a hand-written "Table of Contents" section (the LaTeX template builds its own),</li>
 *   <li>writes a unique {@code {#id}} onto every heading that has none.</li>
 * </ul>
 * Lines inside fenced code blocks are never touched.
 */
public final class HeadingPreprocessor {

    private static final Pattern TOC_HEADING =
            Pattern.compile("^\\s{0,3}#{1,6}\\s+table of contents\\s*$", Pattern.CASE_INSENSITIVE);

    private static final Pattern HEADING =
            Pattern.compile("^(\\s{0,3})(#{1,6})\\s+(.+?)\\s*(\\{#[\\p{L}\\p{N}_-]+\\})?\\s*$");

    private HeadingPreprocessor() {}

    public static String stripDeclaredToc(String markdown) {
        List<String> out = new ArrayList<>();
        boolean skipping = false;
        boolean inFence = false;

        for (String line : splitLines(markdown)) {
            if (skipping) {
                if (!inFence && MarkdownPatterns.HEADING_START.matcher(line).find()) {
                    skipping = false;
                    out.add(line);
                } else {
                    inFence = toggleFence(line, inFence);
                }
                continue;
            }
            if (!inFence && TOC_HEADING.matcher(line).matches()) {
                skipping = true;
                continue;
            }
            inFence = toggleFence(line, inFence);
            out.add(line);
        }
        return joinLines(out, markdown);
    }

    /**
     * Assigns {@code {#slug}}, {@code {#slug-2}}, ... to headings in document order. Headings that
     * already carry an id keep it and the id is reserved in {@code registry}.
     */
    public static String deduplicateHeadings(String markdown, SlugRegistry registry) {
        List<String> lines = splitLines(markdown);
        reserveExplicitIds(lines, registry);

        List<String> out = new ArrayList<>();
        boolean inFence = false;

        for (String line : lines) {
            if (inFence) {
                inFence = toggleFence(line, true);
                out.add(line);
                continue;
            }
            Matcher heading = HEADING.matcher(line);
            if (!heading.matches()) {
                inFence = toggleFence(line, false);
                out.add(line);
                continue;
            }
            if (heading.group(4) != null) {
                out.add(line);
                continue;
            }
            String title = heading.group(3);
            String id = registry.register(SlugRegistry.slugify(title));
            out.add(heading.group(1) + heading.group(2) + " " + title + " {#" + id + "}");
        }
        return joinLines(out, markdown);
    }

    // explicit ids anywhere in the document win over generated ones, even ones further down
    private static void reserveExplicitIds(List<String> lines, SlugRegistry registry) {
        boolean inFence = false;
        for (String line : lines) {
            if (!inFence) {
                Matcher heading = HEADING.matcher(line);
                if (heading.matches() && heading.group(4) != null) {
                    String explicitId = heading.group(4);
                    registry.reserve(explicitId.substring(2, explicitId.length() - 1));
                    continue;
                }
            }
            inFence = toggleFence(line, inFence);
        }
    }

    private static boolean toggleFence(String line, boolean inFence) {
        if (inFence) {
            return !MarkdownPatterns.FENCE_END.matcher(line).matches();
        }
        return MarkdownPatterns.FENCE_START.matcher(line.strip()).matches();
    }

    static List<String> splitLines(String text) {
        if (text.isEmpty()) {
            return List.of();
        }
        List<String> lines = new ArrayList<>(List.of(text.split("\\r?\\n", -1)));
        // a trailing newline does not start another line
        if (text.endsWith("\n")) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }

    private static String joinLines(List<String> lines, String original) {
        return String.join("\n", lines) + (original.endsWith("\n") ? "\n" : "");
    }
}
