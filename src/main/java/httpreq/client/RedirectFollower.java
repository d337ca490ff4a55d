package httpreq.client;

import httpreq.Const;
import httpreq.common.HTTPMethod;
import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Sends a request and walks its redirect chain according to a {@link RedirectPolicy}.
 * <p>
 * Each followed hop is reported as {@code → <status> <method> <url>}. When capturing cookies, the
 * {@code Set-Cookie} headers of every hop are collected, intermediate ones included.
 */
@Slf4j
@Builder
final class RedirectFollower {
    enum State {
        SENDING,
        REDIRECT_RECEIVED,
        DONE,
        ERROR
    }

    private final HttpClient client;
    private final RedirectPolicy policy;
    private final int maxRedirects;
    private final Diagnostics diagnostics;
    private final boolean captureCookies;

    @Value
    @Accessors(fluent = true)
    static class Result {
        HttpResponse<InputStream> response;
        Request request;
        List<String> trace;
        List<String> setCookies;
    }

    Result follow(final Request first, final Deadline deadline) throws ExecutionError {
        final List<String> trace = new ArrayList<>();
        final List<String> setCookies = new ArrayList<>();
        var state = State.SENDING;
        var request = first;
        var hops = 0;
        HttpResponse<InputStream> response = null;
        ExecutionError error = null;

        while (true) {
            switch (state) {
                case SENDING:
                    response = send(request, deadline);
                    if (captureCookies) {
                        setCookies.addAll(response.headers().allValues(Const.Headers.SET_COOKIE));
                    }
                    state = isRedirect(response.statusCode()) ? State.REDIRECT_RECEIVED : State.DONE;
                    break;

                case REDIRECT_RECEIVED:
                    final var status = response.statusCode();
                    final var location = response.headers().firstValue(Const.Headers.LOCATION);
                    if (location.isEmpty()) {
                        state = State.DONE;
                        break;
                    }

                    if (policy == RedirectPolicy.NONE) {
                        if (request.method().isWrite() && status <= 303) {
                            diagnostics.advisory(status);
                        }
                        state = State.DONE;
                        break;
                    }
                    if (policy == RedirectPolicy.SMART && status != 307 && status != 308) {
                        error = ExecutionError.network(String.format("not following %d redirect for write verb, use 307/308", status));
                        state = State.ERROR;
                        break;
                    }
                    if (hops >= maxRedirects) {
                        error = ExecutionError.network(String.format("stopped after %d redirects", maxRedirects));
                        state = State.ERROR;
                        break;
                    }

                    final Request next;
                    try {
                        next = next(request, status, location.get());
                    } catch (final URISyntaxException e) {
                        error = ExecutionError.network("invalid redirect location '" + location.get() + "': " + e.getMessage(), e);
                        state = State.ERROR;
                        break;
                    }
                    hops++;
                    diagnostics.redirect(status, next.method(), next.uri());
                    trace.add(String.format("→ %d %s %s", status, next.method(), next.uri()));
                    discard(response);
                    request = next;
                    state = State.SENDING;
                    break;

                case DONE:
                    return new Result(response, request, trace, setCookies);

                case ERROR:
                default:
                    discard(response);
                    throw error;
            }
        }
    }

    private static Request next(final Request request, final int status, final String location) throws URISyntaxException {
        final var uri = Urls.resolve(request.uri(), location);
        final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.putAll(request.headers());
        if (!Urls.sameOrigin(request.uri(), uri)) {
            headers.remove(Const.Headers.AUTHORIZATION);
            headers.remove(Const.Headers.COOKIE);
        }

        if (status == 307 || status == 308) {
            return request.toBuilder().uri(uri).headers(headers).build();
        }
        headers.remove(Const.Headers.CONTENT_TYPE);
        final var method = request.method() == HTTPMethod.HEAD ? HTTPMethod.HEAD : HTTPMethod.GET;
        return request.toBuilder().method(method).uri(uri).headers(headers).body(null).build();
    }

    private HttpResponse<InputStream> send(final Request request, final Deadline deadline) throws ExecutionError {
        final var timeout = deadline.remaining();
        log.debug("Sending {} {} (timeout {})", request.method(), request.uri(), timeout);
        try {
            return client.send(request.toHttpRequest(timeout), HttpResponse.BodyHandlers.ofInputStream());
        } catch (final HttpTimeoutException e) {
            throw deadline.expired(e);
        } catch (final SSLException e) {
            throw ExecutionError.network("TLS failure: " + e.getMessage(), e);
        } catch (final IOException e) {
            throw ExecutionError.transport("request failed: " + Payloads.describe(e), e);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ExecutionError.network("request interrupted", e);
        } catch (final IllegalArgumentException e) {
            throw ExecutionError.invalid("invalid request: " + e.getMessage(), e);
        }
    }

    private static boolean isRedirect(final int status) {
        return status == 301 || status == 302 || status == 303 || status == 307 || status == 308;
    }

    static void discard(final HttpResponse<InputStream> response) {
        if (response == null) {
            return;
        }
        try {
            response.body().close();
        } catch (final IOException e) {
            log.debug("Could not close response body of {}: {}", response.uri(), e.getMessage());
        }
    }
}
