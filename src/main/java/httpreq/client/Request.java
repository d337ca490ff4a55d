package httpreq.client;

import httpreq.common.HTTPMethod;
import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Map;

/**
 * One hop of an exchange. Redirects derive the next hop with {@code toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
@Accessors(fluent = true)
class Request {
    HTTPMethod method;
    URI uri;
    Map<String, String> headers;
    byte[] body;

    HttpRequest toHttpRequest(final Duration timeout) {
        final var builder = HttpRequest.newBuilder(uri)
            .timeout(timeout)
            .method(method.name(), body == null ? HttpRequest.BodyPublishers.noBody() : HttpRequest.BodyPublishers.ofByteArray(body));
        headers.forEach(builder::header);
        return builder.build();
    }
}
