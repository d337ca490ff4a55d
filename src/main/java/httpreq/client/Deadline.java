package httpreq.client;

import httpreq.common.Quantities;

import java.time.Duration;
import java.time.Instant;

/**
 * One time budget shared by every hop of an attempt.
 */
final class Deadline {
    private final Duration budget;
    private final Instant end;

    private Deadline(final Duration budget) {
        this.budget = budget;
        end = Instant.now().plus(budget);
    }

    static Deadline after(final Duration budget) {
        return new Deadline(budget);
    }

    Duration remaining() throws ExecutionError {
        final var remaining = Duration.between(Instant.now(), end);
        if (remaining.isZero() || remaining.isNegative()) {
            throw expired(null);
        }
        return remaining;
    }

    ExecutionError expired(final Throwable cause) {
        return ExecutionError.transport("request timed out after " + Quantities.format(budget), cause);
    }
}
