package httpreq.planner;

import lombok.Value;
import lombok.experimental.Accessors;

import java.time.Duration;

/**
 * Additional attempts after a transport failure, with exponential delays bounded by the backoff range.
 */
@Value
@Accessors(fluent = true)
public class RetryPlan {
    int count;
    Duration backoffMin;
    Duration backoffMax;

    /**
     * Delay before retry number {@code attempt} (1-based): {@code min * 2^(attempt - 1)}, capped at max.
     */
    public Duration delay(final int attempt) {
        var delay = backoffMin;
        for (int i = 1; i < attempt && delay.compareTo(backoffMax) < 0; i++) {
            delay = delay.multipliedBy(2);
        }
        return delay.compareTo(backoffMax) > 0 ? backoffMax : delay;
    }
}
