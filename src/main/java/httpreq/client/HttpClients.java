package httpreq.client;

import httpreq.Configuration;
import httpreq.planner.ExecutionPlan;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509ExtendedTrustManager;
import java.net.CookieManager;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.Socket;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.util.Locale;

/**
 * Builds the JDK client for one plan. Redirects are never followed by the client itself.
 */
@Slf4j
final class HttpClients {
    private HttpClients() {
    }

    static HttpClient create(
        final ExecutionPlan plan,
        final Configuration configuration,
        final CookieManager cookies,
        final Diagnostics diagnostics) throws ExecutionError {
        final var builder = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .followRedirects(HttpClient.Redirect.NEVER)
            .connectTimeout(plan.timeout() != null ? plan.timeout() : configuration.timeout())
            .cookieHandler(cookies);

        if (plan.proxy() != null) {
            builder.proxy(ProxySelector.of(proxyAddress(plan.proxy())));
        }

        if (plan.insecure()) {
            diagnostics.note("Warning: TLS verification disabled");
            builder.sslContext(trustAll());
        }

        return builder.build();
    }

    static InetSocketAddress proxyAddress(final String proxy) throws ExecutionError {
        final URI uri;
        try {
            uri = new URI(proxy);
        } catch (final URISyntaxException e) {
            throw ExecutionError.invalid("invalid proxy URL '" + proxy + "': " + e.getMessage(), e);
        }
        final var scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw ExecutionError.invalid("invalid proxy URL '" + proxy + "': only http and https proxies are supported", null);
        }
        if (uri.getHost() == null) {
            throw ExecutionError.invalid("invalid proxy URL '" + proxy + "': missing host", null);
        }
        final var port = uri.getPort() != -1 ? uri.getPort() : scheme.equals("https") ? 443 : 80;
        log.debug("Using proxy {}:{}", uri.getHost(), port);
        return InetSocketAddress.createUnresolved(uri.getHost(), port);
    }

    private static SSLContext trustAll() throws ExecutionError {
        try {
            final var context = SSLContext.getInstance("TLS");
            context.init(null, new TrustManager[]{new TrustAll()}, new SecureRandom());
            return context;
        } catch (final GeneralSecurityException e) {
            throw ExecutionError.invalid("could not set up insecure TLS: " + e.getMessage(), e);
        }
    }

    /**
     * Accepts every certificate chain. Being an extended trust manager, it also stands in for hostname
     * verification.
     */
    private static final class TrustAll extends X509ExtendedTrustManager {
        @Override
        public void checkClientTrusted(final X509Certificate[] chain, final String authType, final Socket socket) {
        }

        @Override
        public void checkServerTrusted(final X509Certificate[] chain, final String authType, final Socket socket) {
        }

        @Override
        public void checkClientTrusted(final X509Certificate[] chain, final String authType, final SSLEngine engine) {
        }

        @Override
        public void checkServerTrusted(final X509Certificate[] chain, final String authType, final SSLEngine engine) {
        }

        @Override
        public void checkClientTrusted(final X509Certificate[] chain, final String authType) {
        }

        @Override
        public void checkServerTrusted(final X509Certificate[] chain, final String authType) {
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
