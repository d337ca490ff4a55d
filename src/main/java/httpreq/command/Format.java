package httpreq.command;

import io.vavr.control.Option;

import java.util.Arrays;
import java.util.Locale;

/**
 * Stdout rendering of a response body. {@code AUTO} is never written by the user; it is the default of
 * verbs that pretty-print JSON only on a terminal.
 */
public enum Format {
    AUTO,
    JSON,
    CSV,
    TEXT,
    RAW;

    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Option<Format> of(final String keyword) {
        return Option.ofOptional(Arrays.stream(values())
            .filter(format -> format != AUTO && format.keyword().equals(keyword))
            .findFirst());
    }
}
