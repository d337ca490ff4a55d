package httpreq.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import httpreq.session.Session;
import io.vavr.control.Option;
import io.vavr.control.Try;

import java.util.LinkedHashMap;
import java.util.List;

/**
 * Builds the session an authenticate run leaves behind: the stored session (if any) updated with the
 * {@code name=value} of every {@code Set-Cookie} seen and, when the body is a JSON object with an
 * {@code access_token} string, a bearer authorization.
 */
final class SessionCapture {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SessionCapture() {
    }

    static Session capture(final Option<Session> existing, final String host, final List<String> setCookies, final byte[] body) {
        final var cookies = new LinkedHashMap<String, String>();
        String authorization = null;
        if (existing.isDefined()) {
            if (existing.get().getCookies() != null) {
                cookies.putAll(existing.get().getCookies());
            }
            authorization = existing.get().getAuthorization();
        }

        for (final var header : setCookies) {
            final var pair = header.split(";", 2)[0].trim();
            final var eq = pair.indexOf('=');
            if (eq > 0) {
                cookies.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
            }
        }

        final var token = Try.of(() -> MAPPER.readTree(body))
            .toOption()
            .filter(tree -> tree != null && tree.isObject() && tree.path("access_token").isTextual())
            .map(tree -> tree.get("access_token").asText())
            .filter(value -> !value.isEmpty());
        if (token.isDefined()) {
            authorization = "Bearer " + token.get();
        }

        return new Session(host, cookies, authorization);
    }
}
