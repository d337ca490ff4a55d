package httpreq.client;

import httpreq.common.ExitCode;

/**
 * A failed execution, classified by the exit code it maps to. Only transport failures are retryable.
 */
public class ExecutionError extends Exception {
    private final ExitCode exitCode;
    private final boolean retryable;

    public ExecutionError(final ExitCode exitCode, final String message, final boolean retryable, final Throwable cause) {
        super(message, cause);
        this.exitCode = exitCode;
        this.retryable = retryable;
    }

    public static ExecutionError transport(final String message, final Throwable cause) {
        return new ExecutionError(ExitCode.NETWORK, message, true, cause);
    }

    public static ExecutionError network(final String message) {
        return new ExecutionError(ExitCode.NETWORK, message, false, null);
    }

    public static ExecutionError network(final String message, final Throwable cause) {
        return new ExecutionError(ExitCode.NETWORK, message, false, cause);
    }

    public static ExecutionError expectation(final String message) {
        return new ExecutionError(ExitCode.EXPECTATION_FAILED, message, false, null);
    }

    public static ExecutionError invalid(final String message, final Throwable cause) {
        return new ExecutionError(ExitCode.INVALID, message, false, cause);
    }

    public ExitCode exitCode() {
        return exitCode;
    }

    public boolean retryable() {
        return retryable;
    }
}
