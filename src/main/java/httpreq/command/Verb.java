package httpreq.command;

import io.vavr.control.Option;

import java.util.Arrays;
import java.util.Locale;

public enum Verb {
    READ,
    SAVE,
    SEND,
    UPLOAD,
    WATCH,
    INSPECT,
    AUTHENTICATE,
    SESSION;

    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Option<Verb> of(final String keyword) {
        return Option.ofOptional(Arrays.stream(values())
            .filter(verb -> verb.keyword().equals(keyword))
            .findFirst());
    }
}
