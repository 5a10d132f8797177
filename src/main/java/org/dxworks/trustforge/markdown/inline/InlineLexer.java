package org.dxworks.trustforge.markdown.inline;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits one line of Markdown into {@link InlineSpan}s.
 * <p>
 * The line is scanned left to right. At every position the rules are tried in precedence order
 * (code span, autolink, link, bold, italic) and the first one that matches consumes its text.
 * Code spans are opaque, so {@code `[a](b)`} stays literal code. Markers that do not close are kept
 * as plain text.
 */
public final class InlineLexer {

    private static final Pattern AUTOLINK = Pattern.compile("<(https?://[^>\\s]+)>");
    private static final Pattern LINK = Pattern.compile("\\[([^\\]]+)\\]\\(([^)]+)\\)");
    private static final Pattern BOLD = Pattern.compile("\\*\\*([^*]+)\\*\\*");
    private static final Pattern ITALIC = Pattern.compile("\\*([^*]+)\\*(?!\\*)");

    private InlineLexer() {}

    public static List<InlineSpan> tokenize(String line) {
        List<InlineSpan> spans = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        int length = line.length();
        int pos = 0;

        while (pos < length) {
            char c = line.charAt(pos);
            InlineSpan span = null;
            int next = pos;

            if (c == '`') {
                int close = line.indexOf('`', pos + 1);
                if (close > pos + 1) {
                    span = new InlineSpan.Code(line.substring(pos + 1, close));
                    next = close + 1;
                }
            } else if (c == '<') {
                Matcher m = lookingAt(AUTOLINK, line, pos);
                if (m != null) {
                    span = new InlineSpan.Autolink(m.group(1));
                    next = m.end();
                }
            } else if (c == '[') {
                Matcher m = lookingAt(LINK, line, pos);
                if (m != null) {
                    span = new InlineSpan.Link(m.group(1), m.group(2));
                    next = m.end();
                }
            } else if (c == '*') {
                Matcher bold = lookingAt(BOLD, line, pos);
                if (bold != null) {
                    span = new InlineSpan.Bold(bold.group(1));
                    next = bold.end();
                } else if (pos == 0 || line.charAt(pos - 1) != '*') {
                    Matcher italic = lookingAt(ITALIC, line, pos);
                    if (italic != null) {
                        span = new InlineSpan.Italic(italic.group(1));
                        next = italic.end();
                    }
                }
            }

            if (span == null) {
                text.append(c);
                pos++;
                continue;
            }
            if (text.length() > 0) {
                spans.add(new InlineSpan.Text(text.toString()));
                text.setLength(0);
            }
            spans.add(span);
            pos = next;
        }

        if (text.length() > 0) {
            spans.add(new InlineSpan.Text(text.toString()));
        }
        return spans;
    }

    private static Matcher lookingAt(Pattern pattern, String line, int from) {
        Matcher matcher = pattern.matcher(line);
        matcher.region(from, line.length());
        return matcher.lookingAt() ? matcher : null;
    }
}
