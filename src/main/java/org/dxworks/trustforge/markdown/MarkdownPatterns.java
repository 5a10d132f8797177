package org.dxworks.trustforge.markdown;

import java.util.regex.Pattern;

/**
 * Line-level patterns shared by the heading preprocessor and the block scanner, so both agree on
 * what a heading, a fence or a heading id is.
 */
public final class MarkdownPatterns {

    /** Opening fence with an optional language tag; matched against the stripped line. */
    public static final Pattern FENCE_START = Pattern.compile("^```([A-Za-z0-9+_.-]*)\\s*$");

    /** Closing fence; matched against the raw line. */
    public static final Pattern FENCE_END = Pattern.compile("^```\\s*$");

    /** ATX heading with up to three spaces of indentation. */
    public static final Pattern HEADING_START = Pattern.compile("^\\s{0,3}#{1,6}\\s+");

    /** Trailing pandoc-style heading id, e.g. {@code {#scope}}. */
    public static final Pattern HEADING_ID = Pattern.compile("\\s*\\{#([\\p{L}\\p{N}_-]+)\\}\\s*$");

    private MarkdownPatterns() {}
}
