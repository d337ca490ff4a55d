package httpreq.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splitting helpers shared by the {@code include=}, {@code expect=} and {@code attach=} sub-grammars.
 */
final class Items {
    private Items() {
    }

    /**
     * Splits on {@code separator} only where the text after it starts a new item, and never inside quotes.
     * Blank items are dropped and the rest trimmed.
     */
    static List<String> split(final String in, final char separator, final Pattern itemStart) {
        final List<String> items = new ArrayList<>();
        var start = 0;
        var i = 0;
        while (i < in.length()) {
            final var c = in.charAt(i);
            if ((c == '"' || c == '\'') && in.indexOf(c, i + 1) > 0) {
                i = in.indexOf(c, i + 1) + 1;
                continue;
            }
            if (c == separator && itemStart.matcher(in.substring(i + 1).stripLeading()).lookingAt()) {
                items.add(in.substring(start, i));
                start = i + 1;
            }
            i++;
        }
        items.add(in.substring(start));

        final List<String> trimmed = new ArrayList<>();
        for (final var item : items) {
            if (!item.isBlank()) {
                trimmed.add(item.trim());
            }
        }
        return trimmed;
    }

    static String unquote(final String in) {
        final var s = in.trim();
        if (s.length() >= 2) {
            final var first = s.charAt(0);
            if ((first == '"' || first == '\'') && s.charAt(s.length() - 1) == first) {
                return s.substring(1, s.length() - 1);
            }
        }
        return s;
    }
}
