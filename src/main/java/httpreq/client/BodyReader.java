package httpreq.client;

import io.vavr.control.Try;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Reads a response body, enforcing the size limit on the bytes as received and the attempt's deadline on the
 * whole read. On expiry the stream is closed, which cancels the exchange.
 */
@Slf4j
final class BodyReader {
    private static final int BUFFER_SIZE = 8192;

    private BodyReader() {
    }

    static byte[] read(final InputStream in, final Long limit, final OptionalLong contentLength, final Deadline deadline) throws ExecutionError {
        final CompletableFuture<Try<byte[]>> reading = CompletableFuture.supplyAsync(() -> Try.of(() -> drain(in, limit, contentLength)));
        final Try<byte[]> result;
        try {
            result = reading.get(deadline.remaining().toNanos(), TimeUnit.NANOSECONDS);
        } catch (final TimeoutException e) {
            cancel(in, reading);
            throw deadline.expired(e);
        } catch (final InterruptedException e) {
            cancel(in, reading);
            Thread.currentThread().interrupt();
            throw ExecutionError.network("interrupted while reading response", e);
        } catch (final ExecutionException e) {
            throw ExecutionError.transport("failed to read response: " + e.getCause().getMessage(), e.getCause());
        } catch (final ExecutionError e) {
            cancel(in, reading);
            throw e;
        }

        if (result.isFailure()) {
            if (result.getCause() instanceof ExecutionError) {
                throw (ExecutionError) result.getCause();
            }
            throw ExecutionError.transport("failed to read response: " + result.getCause().getMessage(), result.getCause());
        }
        return result.get();
    }

    private static byte[] drain(final InputStream in, final Long limit, final OptionalLong contentLength) throws ExecutionError {
        try (in) {
            if (limit != null && contentLength.isPresent() && contentLength.getAsLong() > limit) {
                throw exceeded(limit);
            }

            final var out = new ByteArrayOutputStream();
            final var buffer = new byte[BUFFER_SIZE];
            long total = 0;
            int read;
            while ((read = in.read(buffer)) != -1) {
                total += read;
                if (limit != null && total > limit) {
                    throw exceeded(limit);
                }
                out.write(buffer, 0, read);
            }
            return out.toByteArray();
        } catch (final IOException e) {
            throw ExecutionError.transport("failed to read response: " + Payloads.describe(e), e);
        }
    }

    private static void cancel(final InputStream in, final CompletableFuture<?> reading) {
        reading.cancel(true);
        try {
            in.close();
        } catch (final IOException e) {
            log.debug("Could not close stalled response body: {}", e.getMessage());
        }
    }

    private static ExecutionError exceeded(final long limit) {
        return ExecutionError.network(String.format("response exceeds size limit of %d bytes", limit));
    }
}
