package httpreq.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jayway.jsonpath.JsonPathException;
import com.jayway.jsonpath.PathNotFoundException;
import httpreq.command.ExpectCheck;
import io.vavr.control.Option;

import java.net.http.HttpHeaders;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Evaluates response assertions. Checks run in order and the first failure is reported.
 */
public final class Expectations {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Expectations() {
    }

    public static Option<String> firstFailure(final List<ExpectCheck> checks, final int status, final HttpHeaders headers, final byte[] body) {
        for (final var check : checks) {
            final var failure = failure(check, status, headers, body);
            if (failure.isDefined()) {
                return failure;
            }
        }
        return Option.none();
    }

    public static boolean holds(final ExpectCheck check, final int status, final HttpHeaders headers, final byte[] body) {
        return failure(check, status, headers, body).isEmpty();
    }

    static Option<String> failure(final ExpectCheck check, final int status, final HttpHeaders headers, final byte[] body) {
        switch (check.kind()) {
            case STATUS:
                final var actual = String.valueOf(status);
                return actual.equals(check.value())
                    ? Option.none()
                    : Option.of(String.format("expected status %s, got %s", check.value(), actual));
            case HEADER:
                final var header = headers.firstValue(check.subject()).orElse("");
                return header.equals(check.value())
                    ? Option.none()
                    : Option.of(String.format("expected header %s=%s, got %s", check.subject(), check.value(), header));
            case CONTAINS:
                return text(body).contains(check.value())
                    ? Option.none()
                    : Option.of(String.format("expected body to contain \"%s\"", check.value()));
            case JSONPATH:
                return jsonPath(check, body);
            case MATCHES:
                return Pattern.compile(check.value()).matcher(text(body)).find()
                    ? Option.none()
                    : Option.of(String.format("body does not match regex \"%s\"", check.value()));
            default:
                return Option.of("unknown check " + check.kind());
        }
    }

    private static Option<String> jsonPath(final ExpectCheck check, final byte[] body) {
        final Object found;
        try {
            found = JsonPaths.read(body, check.subject());
        } catch (final PathNotFoundException e) {
            return Option.of(String.format("expected jsonpath %s to exist", check.subject()));
        } catch (final JsonPathException | IllegalArgumentException e) {
            return Option.of(String.format("expected a JSON body for jsonpath %s: %s", check.subject(), e.getMessage()));
        }

        if (check.value() == null) {
            return Option.none();
        }
        final var actual = stringify(found);
        return actual.equals(check.value())
            ? Option.none()
            : Option.of(String.format("expected jsonpath %s=%s, got %s", check.subject(), check.value(), actual));
    }

    static String stringify(final Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String) {
            return (String) value;
        }
        if (value instanceof Map || value instanceof List) {
            try {
                return MAPPER.writeValueAsString(value);
            } catch (final JsonProcessingException e) {
                return String.valueOf(value);
            }
        }
        return String.valueOf(value);
    }

    private static String text(final byte[] body) {
        return new String(body, StandardCharsets.UTF_8);
    }
}
