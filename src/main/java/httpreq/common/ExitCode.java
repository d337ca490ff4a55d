package httpreq.common;

public enum ExitCode {
    SUCCESS(0),
    EXPECTATION_FAILED(3),
    NETWORK(4),
    INVALID(5);

    private final int code;

    ExitCode(final int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
