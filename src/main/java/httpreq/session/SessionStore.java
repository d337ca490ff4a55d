package httpreq.session;

import io.vavr.control.Option;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Per-host session persistence.
 */
public interface SessionStore {
    /**
     * The stored session, or none. Fails rather than returning none when the stored data may not be trusted,
     * for instance because other users can read it.
     */
    Option<Session> load(String host) throws SessionError;

    void save(Session session) throws SessionError;

    /**
     * Removes the session of a host. Removing an absent session is not an error.
     */
    void delete(String host) throws SessionError;

    /**
     * The key sessions are stored under: the URL's {@code host[:port]}, without any user info.
     */
    static String extractHost(final String url) throws SessionError {
        try {
            final var authority = new URI(url).getRawAuthority();
            if (authority == null || authority.isEmpty()) {
                throw new SessionError("invalid URL: no host in " + url);
            }
            final var at = authority.lastIndexOf('@');
            return at < 0 ? authority : authority.substring(at + 1);
        } catch (final URISyntaxException e) {
            throw new SessionError("invalid URL: " + e.getMessage(), e);
        }
    }
}
