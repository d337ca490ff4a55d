package httpreq.command;

import io.vavr.control.Option;

import java.util.Arrays;
import java.util.Locale;

public enum SessionAction {
    SHOW,
    CLEAR,
    USE;

    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Option<SessionAction> of(final String keyword) {
        return Option.ofOptional(Arrays.stream(values())
            .filter(action -> action.keyword().equals(keyword))
            .findFirst());
    }
}
