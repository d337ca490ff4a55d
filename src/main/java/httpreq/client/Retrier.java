package httpreq.client;

import httpreq.common.Quantities;
import httpreq.planner.RetryPlan;
import lombok.AllArgsConstructor;

/**
 * Repeats a whole attempt, redirects included, after retryable failures.
 */
@AllArgsConstructor
final class Retrier {
    @FunctionalInterface
    interface Attempt<T> {
        T run() throws ExecutionError;
    }

    private final RetryPlan retry;
    private final Sleeper sleeper;
    private final Diagnostics diagnostics;

    <T> T run(final Attempt<T> attempt) throws ExecutionError {
        final var retries = retry == null ? 0 : retry.count();
        for (int made = 0; ; made++) {
            try {
                return attempt.run();
            } catch (final ExecutionError e) {
                if (!e.retryable() || made >= retries) {
                    throw e;
                }
                final var delay = retry.delay(made + 1);
                diagnostics.note("Retrying (%d/%d) after %s: %s", made + 1, retries, Quantities.format(delay), e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (final InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw ExecutionError.network("interrupted while waiting to retry", interrupted);
                }
            }
        }
    }
}
