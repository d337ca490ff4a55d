package httpreq.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import httpreq.Const;
import httpreq.command.Clause;
import httpreq.command.Command;
import httpreq.command.Format;
import lombok.AllArgsConstructor;

import java.io.PrintStream;

/**
 * {@code session show|clear|use <host>}. {@code show} hides secrets unless {@code as=json} asks for the raw
 * stored session.
 */
@AllArgsConstructor
public class SessionCommand {
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final SessionStore store;
    private final PrintStream out;

    public void run(final Command command) throws SessionError {
        final var host = SessionStore.extractHost(command.target());
        switch (command.sessionAction()) {
            case SHOW:
                show(host, wantsJson(command));
                break;
            case CLEAR:
                store.delete(host);
                out.printf("Session cleared for %s%n", host);
                break;
            case USE:
                if (store.load(host).isEmpty()) {
                    throw new SessionError("no session found for " + host);
                }
                out.printf("export %s=%s%n", Const.SESSION_HOST_ENV, host);
                break;
            default:
                throw new SessionError("unknown session action: " + command.sessionAction());
        }
    }

    private void show(final String host, final boolean json) throws SessionError {
        final var stored = store.load(host);
        if (stored.isEmpty()) {
            out.printf("No session found for %s%n", host);
            return;
        }

        final var session = stored.get();
        if (json) {
            try {
                out.println(MAPPER.writeValueAsString(session));
            } catch (final JsonProcessingException e) {
                throw new SessionError("failed to format session: " + e.getMessage(), e);
            }
            return;
        }

        final var redacted = session.redacted();
        out.printf("Session for %s:%n", redacted.getHost());
        if (!redacted.getCookies().isEmpty()) {
            out.println("Cookies:");
            redacted.getCookies().forEach((name, value) -> out.printf("  %s: %s%n", name, value));
        }
        if (redacted.getAuthorization() != null) {
            out.printf("Authorization: %s%n", redacted.getAuthorization());
        }
    }

    private static boolean wantsJson(final Command command) {
        return command.clauses().stream()
            .anyMatch(clause -> clause instanceof Clause.As && ((Clause.As) clause).format() == Format.JSON);
    }
}
