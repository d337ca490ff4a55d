package httpreq.session;

public class SessionError extends Exception {
    public SessionError(final String message) {
        super(message);
    }

    public SessionError(final String message, final Throwable cause) {
        super(message, cause);
    }
}
