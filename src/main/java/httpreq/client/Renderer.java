package httpreq.client;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import httpreq.command.Format;
import io.vavr.control.Option;
import io.vavr.control.Try;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Stdout rendering. {@code json} always pretty-prints JSON, {@code auto} only on a terminal, and anything
 * that is not JSON or asks for another format passes through untouched.
 */
public final class Renderer {
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private Renderer() {
    }

    public static byte[] render(final byte[] body, final Format format, final boolean tty) {
        switch (format) {
            case JSON:
                return pretty(body).getOrElse(body);
            case AUTO:
                return tty ? pretty(body).getOrElse(body) : body;
            default:
                return body;
        }
    }

    static Option<byte[]> pretty(final byte[] body) {
        if (body.length == 0) {
            return Option.none();
        }
        try {
            final var tree = MAPPER.readTree(body);
            if (tree == null || tree.isMissingNode()) {
                return Option.none();
            }
            return Option.of((MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(tree) + "\n").getBytes(StandardCharsets.UTF_8));
        } catch (final IOException e) {
            return Option.none();
        }
    }

    /**
     * The JSON value at {@code path}, as compact JSON.
     */
    static Try<byte[]> pick(final byte[] body, final String path) {
        return Try.of(() -> (MAPPER.writeValueAsString(JsonPaths.read(body, path)) + "\n").getBytes(StandardCharsets.UTF_8));
    }

    static byte[] timestamped(final byte[] body, final Instant at) {
        final var text = new String(body, StandardCharsets.UTF_8);
        final var lines = Arrays.stream(text.split("\n", -1))
            .filter(line -> !line.isEmpty())
            .map(line -> "[" + at + "] " + line)
            .collect(Collectors.joining("\n"));
        return (lines + "\n").getBytes(StandardCharsets.UTF_8);
    }
}
