package httpreq.client;

import httpreq.Const;
import httpreq.command.AttachPart;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import java.util.UUID;

/**
 * {@code multipart/form-data} encoding. Parts with a file name are written as file fields, defaulting to
 * {@code application/octet-stream}; the others as plain fields.
 */
final class MultipartBody {
    private static final String CRLF = "\r\n";

    private MultipartBody() {
    }

    static Payload build(final List<AttachPart> parts, final String boundary) throws IOException {
        final var actualBoundary = boundary == null ? "req-" + UUID.randomUUID().toString().replace("-", "") : boundary;
        final var out = new ByteArrayOutputStream();

        for (final var part : parts) {
            write(out, "--" + actualBoundary + CRLF);
            var disposition = "Content-Disposition: form-data; name=\"" + escape(part.name()) + "\"";
            if (part.filename() != null) {
                disposition += "; filename=\"" + escape(part.filename()) + "\"";
            }
            write(out, disposition + CRLF);

            final var contentType = part.contentType() != null
                ? part.contentType()
                : part.filename() != null ? Const.Headers.APPLICATION_OCTET_STREAM : null;
            if (contentType != null) {
                write(out, Const.Headers.CONTENT_TYPE + ": " + contentType + CRLF);
            }
            write(out, CRLF);

            if (part.isFile()) {
                out.write(Files.readAllBytes(Paths.get(part.file())));
            } else {
                write(out, part.value());
            }
            write(out, CRLF);
        }
        write(out, "--" + actualBoundary + "--" + CRLF);

        return new Payload(out.toByteArray(), Const.Headers.MULTIPART_FORM_DATA + "; boundary=" + actualBoundary);
    }

    private static void write(final ByteArrayOutputStream out, final String s) {
        out.writeBytes(s.getBytes(StandardCharsets.UTF_8));
    }

    private static String escape(final String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
