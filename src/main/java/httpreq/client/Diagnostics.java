package httpreq.client;

import httpreq.common.HTTPMethod;
import lombok.AllArgsConstructor;

import java.io.PrintStream;
import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * The human-facing side channel (stderr). Every line written here is part of the command's observable
 * output; internal tracing goes to the logger instead.
 */
@AllArgsConstructor
public class Diagnostics {
    private final PrintStream err;

    public void note(final String line) {
        err.println(line);
    }

    public void note(final String format, final Object... args) {
        err.println(String.format(format, args));
    }

    public void redirect(final int status, final HTTPMethod method, final URI location) {
        note("→ %d %s %s", status, method, location);
    }

    public void advisory(final int status) {
        note("Advisory: %d redirect for write verb, not following", status);
    }

    public void meta(final int status, final URI url, final long size, final String contentType) {
        note("HTTP %d", status);
        note("URL: %s", url);
        note("Size: %d bytes", size);
        if (contentType != null && !contentType.isEmpty()) {
            note("Content-Type: %s", contentType);
        }
    }

    public void request(final HTTPMethod method, final URI uri, final Map<String, String> headers) {
        note("> %s %s", method, uri);
        headers.forEach((name, value) -> note("> %s: %s", name, value));
    }

    public void response(final int status, final Map<String, List<String>> headers) {
        note("< HTTP %d", status);
        headers.forEach((name, values) -> values.forEach(value -> note("< %s: %s", name, value)));
    }
}
