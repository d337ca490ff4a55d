package httpreq.command;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * A single response assertion. {@code subject} is the header name or JSONPath expression where the kind
 * has one; {@code value} is the expected status, header value, substring, JSONPath value or regex.
 */
@Value
@Accessors(fluent = true)
public class ExpectCheck {
    Kind kind;
    String subject;
    String value;

    public enum Kind {
        STATUS("status"),
        HEADER("header"),
        CONTAINS("contains"),
        JSONPATH("jsonpath"),
        MATCHES("matches");

        private final String tag;

        Kind(final String tag) {
            this.tag = tag;
        }

        public String tag() {
            return tag;
        }
    }

    public static ExpectCheck status(final String code) {
        return new ExpectCheck(Kind.STATUS, null, code);
    }

    public static ExpectCheck header(final String name, final String value) {
        return new ExpectCheck(Kind.HEADER, name, value);
    }

    public static ExpectCheck contains(final String text) {
        return new ExpectCheck(Kind.CONTAINS, null, text);
    }

    public static ExpectCheck jsonPath(final String path, final String value) {
        return new ExpectCheck(Kind.JSONPATH, path, value);
    }

    public static ExpectCheck matches(final String regex) {
        return new ExpectCheck(Kind.MATCHES, null, regex);
    }

    public String describe() {
        switch (kind) {
            case HEADER:
                return kind.tag() + ":" + subject + "=" + value;
            case JSONPATH:
                return kind.tag() + ":" + subject + (value == null ? "" : "=" + value);
            default:
                return kind.tag() + ":" + value;
        }
    }
}
