package httpreq.client;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import lombok.Value;
import lombok.experimental.Accessors;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * A loopback HTTP server on an ephemeral port that records every request it receives.
 */
final class TestServer implements AutoCloseable {
    @FunctionalInterface
    interface Handler {
        void handle(HttpExchange exchange, Received request) throws IOException;
    }

    @Value
    @Accessors(fluent = true)
    static class Received {
        String method;
        String path;
        String query;
        Headers headers;
        byte[] body;

        String text() {
            return new String(body, StandardCharsets.UTF_8);
        }
    }

    private final HttpServer server;
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final List<Received> received = new CopyOnWriteArrayList<>();

    TestServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.setExecutor(executor);
        server.start();
    }

    TestServer on(final String path, final Handler handler) {
        server.createContext(path, exchange -> {
            try {
                final var request = new Received(
                    exchange.getRequestMethod(),
                    exchange.getRequestURI().getPath(),
                    exchange.getRequestURI().getRawQuery(),
                    exchange.getRequestHeaders(),
                    exchange.getRequestBody().readAllBytes());
                received.add(request);
                handler.handle(exchange, request);
            } finally {
                exchange.close();
            }
        });
        return this;
    }

    String url(final String path) {
        return "http://127.0.0.1:" + server.getAddress().getPort() + path;
    }

    String host() {
        return "127.0.0.1:" + server.getAddress().getPort();
    }

    List<Received> received() {
        return received;
    }

    static void respond(final HttpExchange exchange, final int status, final String body) throws IOException {
        respond(exchange, status, body.getBytes(StandardCharsets.UTF_8));
    }

    static void respond(final HttpExchange exchange, final int status, final byte[] body) throws IOException {
        if (body.length == 0 || "HEAD".equals(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(status, -1);
            return;
        }
        exchange.sendResponseHeaders(status, body.length);
        exchange.getResponseBody().write(body);
    }

    static void redirect(final HttpExchange exchange, final int status, final String location) throws IOException {
        exchange.getResponseHeaders().set("Location", location);
        exchange.sendResponseHeaders(status, -1);
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }
}
