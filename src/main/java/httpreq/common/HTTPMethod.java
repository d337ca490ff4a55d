package httpreq.common;

import java.util.Locale;

public enum HTTPMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE,
    HEAD,
    OPTIONS;

    /**
     * Case-insensitive lookup.
     *
     * @throws IllegalArgumentException if the value names no supported method
     */
    public static HTTPMethod of(final String value) {
        switch (value.toUpperCase(Locale.ROOT)) {
            case "GET":
                return GET;
            case "POST":
                return POST;
            case "PUT":
                return PUT;
            case "PATCH":
                return PATCH;
            case "DELETE":
                return DELETE;
            case "HEAD":
                return HEAD;
            case "OPTIONS":
                return OPTIONS;
            default:
                throw new IllegalArgumentException("Invalid http method specified: " + value);
        }
    }

    public boolean isWrite() {
        return this == POST || this == PUT || this == PATCH || this == DELETE;
    }
}
