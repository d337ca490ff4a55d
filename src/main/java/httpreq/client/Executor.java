package httpreq.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import httpreq.Configuration;
import httpreq.Const;
import httpreq.command.Verb;
import httpreq.common.HTTPMethod;
import httpreq.planner.BodyPlan;
import httpreq.planner.ExecutionPlan;
import httpreq.session.SessionError;
import httpreq.session.SessionStore;
import io.vavr.control.Try;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Runs an {@link ExecutionPlan}: builds the request, applies the stored session, sends it through the
 * redirect state machine (retrying transport failures), decodes the response, then checks expectations and
 * writes the output.
 * <p>
 * Diagnostics go to {@code stderr}; only the rendered body goes to {@code stdout} or the destination file.
 */
@Slf4j
@Builder
public class Executor {
    private static final Set<String> RESTRICTED_HEADERS = Set.of("host", "connection", "content-length", "expect", "upgrade");
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Configuration configuration;
    private final SessionStore sessions;
    private final InputStream stdin;
    private final PrintStream stdout;
    private final PrintStream stderr;
    private final boolean tty;
    @Builder.Default
    private final Sleeper sleeper = Sleeper.SYSTEM;

    public Try<Exchange> execute(final ExecutionPlan plan) {
        return Try.of(() -> run(plan));
    }

    Exchange run(final ExecutionPlan plan) throws ExecutionError {
        final var diagnostics = new Diagnostics(stderr);

        final URI uri;
        try {
            uri = Urls.assemble(plan.url(), plan.queryParams());
        } catch (final URISyntaxException e) {
            throw ExecutionError.invalid("invalid URL '" + plan.url() + "': " + e.getReason(), e);
        }

        final var payload = Payloads.assemble(plan.body(), stdin, diagnostics);
        final var headers = headers(plan, payload, uri, diagnostics);
        final var cookies = new CookieManager(null, CookiePolicy.ACCEPT_ALL);
        final var client = HttpClients.create(plan, configuration, cookies, diagnostics);
        final var request = Request.builder()
            .method(plan.method())
            .uri(uri)
            .headers(headers)
            .body(payload.bytes())
            .build();

        if (plan.verbose()) {
            diagnostics.request(plan.method(), uri, headers);
        }

        var exchange = exchange(plan, client, request, diagnostics);
        if (plan.every() != null) {
            while (plan.until() == null || !Expectations.holds(plan.until(), exchange.status(), exchange.headers(), exchange.body())) {
                final var poll = Renderer.render(exchange.body(), plan.output().format(), tty);
                write(tty ? Renderer.timestamped(poll, Instant.now()) : poll);
                pause(plan.every());
                exchange = exchange(plan, client, request, diagnostics);
            }
        }

        if (plan.verb() == Verb.AUTHENTICATE) {
            saveSession(plan, exchange, cookies, diagnostics);
        }

        check(plan, exchange);
        output(plan, exchange);
        return exchange;
    }

    private Map<String, String> headers(
        final ExecutionPlan plan,
        final Payload payload,
        final URI uri,
        final Diagnostics diagnostics) {
        final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (final var header : plan.headers().entrySet()) {
            if (RESTRICTED_HEADERS.contains(header.getKey().toLowerCase(Locale.ROOT))) {
                diagnostics.note("Note: header %s is managed by the client, ignoring it", header.getKey());
                continue;
            }
            headers.put(header.getKey(), header.getValue());
        }

        if (!payload.isEmpty() && payload.contentType() != null) {
            if (plan.body().type() == BodyPlan.Type.MULTIPART) {
                if (headers.containsKey(Const.Headers.CONTENT_TYPE)) {
                    diagnostics.note("Note: Content-Type overridden for multipart");
                }
                headers.put(Const.Headers.CONTENT_TYPE, payload.contentType());
            } else {
                headers.putIfAbsent(Const.Headers.CONTENT_TYPE, payload.contentType());
            }
        }

        if (!plan.cookies().isEmpty()) {
            final var cookie = plan.cookies().entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining("; "));
            headers.merge(Const.Headers.COOKIE, cookie, (existing, added) -> existing + "; " + added);
        }

        if (!headers.containsKey(Const.Headers.AUTHORIZATION) && !headers.containsKey(Const.Headers.COOKIE)) {
            applySession(plan, headers, diagnostics);
        }

        headers.putIfAbsent(Const.Headers.USER_AGENT, configuration.userAgent());
        headers.putIfAbsent(Const.Headers.ACCEPT_ENCODING, Const.Headers.DEFAULT_ACCEPT_ENCODING);

        if (plan.resume() && plan.output().destination() != null) {
            final var destination = Paths.get(plan.output().destination());
            if (Files.isRegularFile(destination)) {
                try {
                    final var size = Files.size(destination);
                    if (size > 0) {
                        headers.put(Const.Headers.RANGE, "bytes=" + size + "-");
                        diagnostics.note("Resuming %s from byte %d", destination, size);
                    }
                } catch (final IOException e) {
                    log.debug("Cannot stat {} for resume, downloading from scratch: {}", destination, e.getMessage());
                }
            }
        }

        log.debug("Request headers for {}: {}", uri, headers.keySet());
        return headers;
    }

    private void applySession(final ExecutionPlan plan, final Map<String, String> headers, final Diagnostics diagnostics) {
        if (sessions == null) {
            return;
        }
        try {
            final var host = SessionStore.extractHost(plan.url());
            final var stored = sessions.load(host);
            if (stored.isEmpty()) {
                return;
            }
            final var session = stored.get();
            if (session.getAuthorization() != null && !session.getAuthorization().isEmpty()) {
                headers.put(Const.Headers.AUTHORIZATION, session.getAuthorization());
            }
            if (session.getCookies() != null && !session.getCookies().isEmpty()) {
                headers.put(Const.Headers.COOKIE, session.getCookies().entrySet().stream()
                    .map(entry -> entry.getKey() + "=" + entry.getValue())
                    .collect(Collectors.joining("; ")));
            }
            diagnostics.note("Using session for %s", host);
        } catch (final SessionError e) {
            diagnostics.note("Warning: session not applied: %s", e.getMessage());
        }
    }

    private Exchange exchange(
        final ExecutionPlan plan,
        final HttpClient client,
        final Request request,
        final Diagnostics diagnostics) throws ExecutionError {
        final var follower = RedirectFollower.builder()
            .client(client)
            .policy(RedirectPolicy.of(plan))
            .maxRedirects(configuration.maxRedirects())
            .diagnostics(diagnostics)
            .captureCookies(plan.verb() == Verb.AUTHENTICATE)
            .build();
        final var timeout = plan.timeout() != null ? plan.timeout() : configuration.timeout();

        return new Retrier(plan.retry(), sleeper, diagnostics).run(() -> {
            final var deadline = Deadline.after(timeout);
            final var result = follower.follow(request, deadline);
            final var response = result.response();
            if (plan.verbose()) {
                diagnostics.response(response.statusCode(), response.headers().map());
            }

            final var announced = result.request().method() == HTTPMethod.HEAD
                ? OptionalLong.empty()
                : response.headers().firstValueAsLong(Const.Headers.CONTENT_LENGTH);
            final var raw = BodyReader.read(response.body(), plan.sizeLimit(), announced, deadline);

            final var encoding = response.headers().firstValue(Const.Headers.CONTENT_ENCODING).orElse(null);
            final Decompressor.Decoded decoded;
            try {
                decoded = Decompressor.decode(raw, encoding);
            } catch (final IOException e) {
                throw ExecutionError.network("failed to decompress response (" + encoding + "): " + Payloads.describe(e), e);
            }
            if (decoded.decompressed()) {
                diagnostics.note("Decompressed response");
            }

            final var exchange = new Exchange(
                response.statusCode(),
                response.uri(),
                response.headers(),
                decoded.bytes(),
                decoded.decompressed(),
                result.trace(),
                result.setCookies());
            diagnostics.meta(exchange.status(), exchange.uri(), exchange.body().length, exchange.contentType());
            return exchange;
        });
    }

    private void saveSession(
        final ExecutionPlan plan,
        final Exchange exchange,
        final CookieManager cookies,
        final Diagnostics diagnostics) {
        if (sessions == null) {
            return;
        }
        try {
            final var host = SessionStore.extractHost(plan.url());
            final List<String> setCookies = new ArrayList<>(exchange.setCookies());
            final var target = URI.create(plan.url());
            cookies.getCookieStore().get(URI.create(target.getScheme() + "://" + target.getRawAuthority() + "/"))
                .forEach(cookie -> setCookies.add(cookie.getName() + "=" + cookie.getValue()));

            final var session = SessionCapture.capture(sessions.load(host), host, setCookies, exchange.body());
            sessions.save(session);
            diagnostics.note("Session saved for %s", host);
        } catch (final SessionError e) {
            diagnostics.note("Warning: session not saved: %s", e.getMessage());
        }
    }

    private static void check(final ExecutionPlan plan, final Exchange exchange) throws ExecutionError {
        if (!plan.expect().isEmpty()) {
            final var failure = Expectations.firstFailure(plan.expect(), exchange.status(), exchange.headers(), exchange.body());
            if (failure.isDefined()) {
                throw ExecutionError.expectation(failure.get());
            }
        } else if (!exchange.isSuccess()) {
            throw ExecutionError.network(String.format("HTTP %d", exchange.status()));
        }
    }

    private void output(final ExecutionPlan plan, final Exchange exchange) throws ExecutionError {
        final var output = plan.output();
        if (output.destination() != null) {
            save(Paths.get(output.destination()), exchange.body(), plan.resume() && exchange.status() == 206);
            return;
        }

        if (output.pick() != null) {
            final var picked = Renderer.pick(exchange.body(), output.pick());
            if (picked.isFailure()) {
                throw ExecutionError.network("cannot pick " + output.pick() + ": " + picked.getCause().getMessage(), picked.getCause());
            }
            write(picked.get());
            return;
        }

        if (plan.verb() == Verb.INSPECT) {
            write(Renderer.render(inspection(exchange), output.format(), tty));
            return;
        }

        write(Renderer.render(exchange.body(), output.format(), tty));
    }

    private static byte[] inspection(final Exchange exchange) throws ExecutionError {
        final var node = MAPPER.createObjectNode();
        node.put("status", exchange.status());
        node.put("url", exchange.uri().toString());
        final var headers = node.putObject("headers");
        new TreeMap<>(exchange.headers().map()).forEach((name, values) -> {
            final var array = headers.putArray(name);
            values.forEach(array::add);
        });
        try {
            return (MAPPER.writeValueAsString(node) + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw ExecutionError.network("cannot render response metadata: " + e.getMessage(), e);
        }
    }

    private static void save(final Path destination, final byte[] body, final boolean append) throws ExecutionError {
        try {
            final var parent = destination.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (append) {
                Files.write(destination, body, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } else {
                Files.write(destination, body);
            }
            log.debug("Wrote {} bytes to {} (append: {})", body.length, destination, append);
        } catch (final IOException e) {
            throw ExecutionError.network("failed to write " + destination + ": " + Payloads.describe(e), e);
        }
    }

    private void write(final byte[] bytes) {
        stdout.write(bytes, 0, bytes.length);
        stdout.flush();
    }

    private void pause(final Duration interval) throws ExecutionError {
        try {
            sleeper.sleep(interval);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ExecutionError.network("interrupted while watching", e);
        }
    }
}
