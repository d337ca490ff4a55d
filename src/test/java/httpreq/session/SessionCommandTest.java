package httpreq.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import httpreq.cli.Parser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionCommandTest {
    @TempDir
    Path tmp;

    private FileSessionStore store;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    @BeforeEach
    void setUp() throws SessionError {
        store = new FileSessionStore(tmp);
        final Map<String, String> cookies = new LinkedHashMap<>();
        cookies.put("sid", "s3cr3t");
        store.save(new Session("api.example.com", cookies, "Bearer tok123"));
    }

    private String run(final String line) throws SessionError {
        new SessionCommand(store, new PrintStream(out, true, StandardCharsets.UTF_8)).run(Parser.parse(line).get());
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void showRedactsSecrets() throws SessionError {
        final var shown = run("session show api.example.com");

        assertThat(shown).isEqualTo("Session for api.example.com:\nCookies:\n  sid: ***\nAuthorization: Bearer ***\n");
        assertThat(shown).doesNotContain("s3cr3t").doesNotContain("tok123");
    }

    @Test
    void showAsJsonPrintsStoredSession() throws Exception {
        final var json = new ObjectMapper().readTree(run("session show https://api.example.com/v1 as=json"));

        assertThat(json.get("host").asText()).isEqualTo("api.example.com");
        assertThat(json.get("cookies").get("sid").asText()).isEqualTo("s3cr3t");
        assertThat(json.get("authorization").asText()).isEqualTo("Bearer tok123");
    }

    @Test
    void showReportsMissingSession() throws SessionError {
        assertThat(run("session show other.example.com")).isEqualTo("No session found for other.example.com\n");
    }

    @Test
    void clearDeletesSessionFile() throws SessionError {
        assertThat(run("session clear api.example.com")).isEqualTo("Session cleared for api.example.com\n");
        assertThat(Files.exists(store.path("api.example.com"))).isFalse();
    }

    @Test
    void useExportsHost() throws SessionError {
        assertThat(run("session use api.example.com")).isEqualTo("export REQ_SESSION_HOST=api.example.com\n");
    }

    @Test
    void useFailsWithoutSession() {
        assertThatThrownBy(() -> run("session use other.example.com"))
            .isInstanceOf(SessionError.class)
            .hasMessage("no session found for other.example.com");
    }

    @Test
    void redactedKeepsCookieNamesOnly() {
        final Map<String, String> cookies = new LinkedHashMap<>();
        cookies.put("a", "1");
        cookies.put("b", "2");

        final var redacted = new Session("h", cookies, null).redacted();

        assertThat(redacted.getCookies()).containsExactly(Map.entry("a", "***"), Map.entry("b", "***"));
        assertThat(redacted.getAuthorization()).isNull();
        assertThat(cookies).containsEntry("a", "1");
    }
}
