package httpreq.planner;

public class PlanError extends Exception {
    public PlanError(final String message) {
        super(message);
    }

    public PlanError(final String message, final Throwable cause) {
        super(message, cause);
    }
}
