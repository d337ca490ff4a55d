package httpreq.client;

import io.vavr.Tuple2;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

final class Urls {
    private Urls() {
    }

    /**
     * Appends {@code params} after any query the URL already has, keeping their order and duplicates.
     */
    static URI assemble(final String url, final List<Tuple2<String, String>> params) throws URISyntaxException {
        final var base = new URI(url);
        final var scheme = base.getScheme() == null ? "" : base.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new URISyntaxException(url, "only http and https URLs are supported");
        }
        if (base.getRawAuthority() == null || base.getHost() == null) {
            throw new URISyntaxException(url, "missing host");
        }
        if (params.isEmpty()) {
            return base;
        }

        final var extra = params.stream()
            .map(param -> encode(param._1) + "=" + encode(param._2))
            .collect(Collectors.joining("&"));
        final var query = base.getRawQuery() == null || base.getRawQuery().isEmpty() ? extra : base.getRawQuery() + "&" + extra;

        final var sb = new StringBuilder()
            .append(base.getScheme()).append("://").append(base.getRawAuthority())
            .append(base.getRawPath() == null ? "" : base.getRawPath())
            .append('?').append(query);
        if (base.getRawFragment() != null) {
            sb.append('#').append(base.getRawFragment());
        }
        return new URI(sb.toString());
    }

    static URI resolve(final URI base, final String location) throws URISyntaxException {
        return base.resolve(new URI(location.trim()));
    }

    static boolean sameOrigin(final URI a, final URI b) {
        return a.getScheme().equalsIgnoreCase(b.getScheme()) && a.getRawAuthority().equalsIgnoreCase(b.getRawAuthority());
    }

    private static String encode(final String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
