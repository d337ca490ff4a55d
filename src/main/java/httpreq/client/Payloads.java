package httpreq.client;

import httpreq.Const;
import httpreq.planner.BodyPlan;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * Reads and encodes the planned body up front, so every attempt and redirect hop can resend it.
 */
final class Payloads {
    private Payloads() {
    }

    static Payload assemble(final BodyPlan body, final InputStream stdin, final Diagnostics diagnostics) throws ExecutionError {
        if (body == null) {
            return Payload.NONE;
        }

        if (body.type() == BodyPlan.Type.MULTIPART) {
            try {
                return MultipartBody.build(body.parts(), body.boundary());
            } catch (final IOException e) {
                throw ExecutionError.invalid("failed to build multipart body: " + describe(e), e);
            }
        }

        final byte[] bytes;
        try {
            if (body.isStdin()) {
                bytes = stdin.readAllBytes();
            } else if (body.isFile()) {
                bytes = Files.readAllBytes(Paths.get(body.filePath()));
            } else {
                bytes = body.content() == null ? new byte[0] : body.content().getBytes(StandardCharsets.UTF_8);
            }
        } catch (final IOException e) {
            final var source = body.isStdin() ? "stdin" : "file " + body.filePath();
            throw ExecutionError.invalid("failed to read " + source + ": " + describe(e), e);
        }

        switch (body.type()) {
            case JSON:
                if (body.inferred()) {
                    diagnostics.note("Inferred Content-Type: " + Const.Headers.APPLICATION_JSON);
                }
                return new Payload(bytes, Const.Headers.APPLICATION_JSON);
            case FORM:
                return new Payload(bytes, Const.Headers.APPLICATION_X_WWW_FORM_URLENCODED);
            default:
                return new Payload(bytes, null);
        }
    }

    static String describe(final IOException e) {
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
