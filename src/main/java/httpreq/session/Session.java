package httpreq.session;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cookies and bearer authorization remembered for one host.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class Session {
    static final String REDACTED = "***";

    private String host;
    private Map<String, String> cookies = new LinkedHashMap<>();
    private String authorization;

    /**
     * A copy safe to print: cookie values become {@value #REDACTED} and a bearer token {@code Bearer ***}.
     */
    public Session redacted() {
        final Map<String, String> hidden = new LinkedHashMap<>();
        if (cookies != null) {
            cookies.keySet().forEach(name -> hidden.put(name, REDACTED));
        }
        return new Session(host, hidden, authorization == null || authorization.isEmpty() ? null : "Bearer " + REDACTED);
    }
}
