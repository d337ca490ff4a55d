package httpreq.client;

import httpreq.planner.ExecutionPlan;

/**
 * How 3xx responses are handled.
 * <ul>
 *   <li>{@code STANDARD}: follow; 301, 302 and 303 switch to GET (HEAD stays HEAD) and drop the body,
 *   307 and 308 keep method and body.</li>
 *   <li>{@code SMART}: follow only 307 and 308; any other redirect is an error.</li>
 *   <li>{@code NONE}: never follow; a write method receiving 301, 302 or 303 gets an advisory note.</li>
 * </ul>
 */
enum RedirectPolicy {
    STANDARD,
    SMART,
    NONE;

    static RedirectPolicy of(final ExecutionPlan plan) {
        if (plan.smartFollow() && plan.method().isWrite()) {
            return SMART;
        }
        switch (plan.verb()) {
            case READ:
            case SAVE:
            case AUTHENTICATE:
                return STANDARD;
            default:
                return NONE;
        }
    }
}
