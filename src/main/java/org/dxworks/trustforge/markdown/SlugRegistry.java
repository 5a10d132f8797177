package org.dxworks.trustforge.markdown;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Hands out unique heading labels for a single render. The first heading with a given slug keeps
 * it unqualified, the n-th duplicate gets {@code -n}.
 * <p>
 * Not thread-safe; create one per render and pass it along.
 */
public final class SlugRegistry {

    private static final Pattern NON_SLUG_CHARS = Pattern.compile("[^\\p{L}\\p{N}\\s_-]");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s_-]+");
    private static final String FALLBACK_SLUG = "section";

    private final Map<String, Integer> occurrences = new HashMap<>();
    private final Set<String> issued = new HashSet<>();

    /**
     * Lowercases, drops everything that is not a letter, digit, whitespace, underscore or hyphen,
     * collapses separator runs to one hyphen and trims hyphens at both ends.
     */
    public static String slugify(String text) {
        String slug = NON_SLUG_CHARS.matcher(text.toLowerCase(Locale.ROOT)).replaceAll("").strip();
        slug = SEPARATORS.matcher(slug).replaceAll("-");
        int start = 0;
        int end = slug.length();
        while (start < end && slug.charAt(start) == '-') start++;
        while (end > start && slug.charAt(end - 1) == '-') end--;
        slug = slug.substring(start, end);
        return slug.isEmpty() ? FALLBACK_SLUG : slug;
    }

    /**
     * Returns a label for {@code baseSlug} that no earlier call on this registry has returned.
     */
    public String register(String baseSlug) {
        int count = occurrences.merge(baseSlug, 1, Integer::sum);
        String candidate = count == 1 ? baseSlug : baseSlug + "-" + count;
        while (!issued.add(candidate)) {
            count = occurrences.merge(baseSlug, 1, Integer::sum);
            candidate = baseSlug + "-" + count;
        }
        return candidate;
    }

    /**
     * Records a manually assigned id so generated labels step around it.
     */
    public void reserve(String explicitId) {
        occurrences.merge(explicitId, 1, Integer::sum);
        issued.add(explicitId);
    }

    public boolean isIssued(String label) {
        return issued.contains(label);
    }
}
