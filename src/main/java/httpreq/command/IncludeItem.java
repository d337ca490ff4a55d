package httpreq.command;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * One {@code tag: ...} item of an {@code include=} clause. For {@link Type#BASIC} the name is the user
 * and the value the password.
 */
@Value
@Accessors(fluent = true)
public class IncludeItem {
    Type type;
    String name;
    String value;

    public enum Type {
        HEADER("header"),
        PARAM("param"),
        COOKIE("cookie"),
        BASIC("basic");

        private final String tag;

        Type(final String tag) {
            this.tag = tag;
        }

        public String tag() {
            return tag;
        }
    }

    public static IncludeItem header(final String name, final String value) {
        return new IncludeItem(Type.HEADER, name, value);
    }

    public static IncludeItem param(final String name, final String value) {
        return new IncludeItem(Type.PARAM, name, value);
    }

    public static IncludeItem cookie(final String name, final String value) {
        return new IncludeItem(Type.COOKIE, name, value);
    }

    public static IncludeItem basic(final String user, final String password) {
        return new IncludeItem(Type.BASIC, user, password);
    }
}
