package httpreq.client;

import lombok.Value;
import lombok.experimental.Accessors;
import org.brotli.dec.BrotliInputStream;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.zip.GZIPInputStream;
import java.util.zip.InflaterInputStream;

/**
 * Undoes {@code Content-Encoding}. Encodings are listed in the order they were applied, so they are removed
 * last to first. An unknown encoding stops the unwrapping and the bytes reached so far are returned.
 */
public final class Decompressor {
    private Decompressor() {
    }

    @Value
    @Accessors(fluent = true)
    public static class Decoded {
        byte[] bytes;
        boolean decompressed;
    }

    public static Decoded decode(final byte[] body, final String contentEncoding) throws IOException {
        if (contentEncoding == null || contentEncoding.isBlank() || body.length == 0) {
            return new Decoded(body, false);
        }

        final var encodings = contentEncoding.split(",");
        var bytes = body;
        var decompressed = false;
        for (int i = encodings.length - 1; i >= 0; i--) {
            final var encoding = encodings[i].trim().toLowerCase(Locale.ROOT);
            switch (encoding) {
                case "gzip":
                case "x-gzip":
                    bytes = readAll(new GZIPInputStream(new ByteArrayInputStream(bytes)));
                    decompressed = true;
                    break;
                case "br":
                    bytes = readAll(new BrotliInputStream(new ByteArrayInputStream(bytes)));
                    decompressed = true;
                    break;
                case "deflate":
                    bytes = readAll(new InflaterInputStream(new ByteArrayInputStream(bytes)));
                    decompressed = true;
                    break;
                case "identity":
                case "":
                    break;
                default:
                    return new Decoded(bytes, decompressed);
            }
        }
        return new Decoded(bytes, decompressed);
    }

    private static byte[] readAll(final InputStream in) throws IOException {
        try (in) {
            return in.readAllBytes();
        }
    }
}
