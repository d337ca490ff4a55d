package httpreq.cli;

import io.vavr.control.Option;

/**
 * A grammar or validation error, located by character offset and offending token.
 */
public class ParseError extends Exception {
    private final int position;
    private final String token;
    private final String reason;
    private final String suggestion;

    public ParseError(final int position, final String token, final String reason) {
        this(position, token, reason, null);
    }

    public ParseError(final int position, final String token, final String reason, final String suggestion) {
        super(String.format("parse error at position %d (token: \"%s\"): %s", position, token, reason)
            + (suggestion == null ? "" : String.format(" (did you mean \"%s\"?)", suggestion)));
        this.position = position;
        this.token = token;
        this.reason = reason;
        this.suggestion = suggestion;
    }

    public int position() {
        return position;
    }

    public String token() {
        return token;
    }

    public String reason() {
        return reason;
    }

    public Option<String> suggestion() {
        return Option.of(suggestion);
    }
}
