package httpreq.client;

import httpreq.command.ExpectCheck;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.net.http.HttpHeaders;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class ExpectationsTest {
    private static final HttpHeaders HEADERS = HttpHeaders.of(
        Map.of("Content-Type", List.of("application/json"), "X-Count", List.of("3")),
        (name, value) -> true);
    private static final byte[] BODY = "{\"id\":7,\"name\":\"Ada\",\"tags\":[\"a\",\"b\"],\"meta\":{\"ok\":true}}"
        .getBytes(StandardCharsets.UTF_8);

    @ParameterizedTest
    @MethodSource("passingProvider")
    void checkHolds(final ExpectCheck check) {
        assertThat(Expectations.failure(check, 200, HEADERS, BODY).isEmpty()).isTrue();
        assertThat(Expectations.holds(check, 200, HEADERS, BODY)).isTrue();
    }

    static Stream<Arguments> passingProvider() {
        return Stream.of(
            Arguments.of(ExpectCheck.status("200")),
            Arguments.of(ExpectCheck.header("content-type", "application/json")),
            Arguments.of(ExpectCheck.contains("\"Ada\"")),
            Arguments.of(ExpectCheck.jsonPath("$.id", null)),
            Arguments.of(ExpectCheck.jsonPath("$.id", "7")),
            Arguments.of(ExpectCheck.jsonPath("$.name", "Ada")),
            Arguments.of(ExpectCheck.jsonPath("$.meta.ok", "true")),
            Arguments.of(ExpectCheck.jsonPath("$.tags", "[\"a\",\"b\"]")),
            Arguments.of(ExpectCheck.matches("\"id\":\\d+"))
        );
    }

    @ParameterizedTest
    @MethodSource("failingProvider")
    void checkReportsFailure(final ExpectCheck check, final byte[] body, final String message) {
        assertThat(Expectations.failure(check, 404, HEADERS, body).get()).isEqualTo(message);
    }

    static Stream<Arguments> failingProvider() {
        return Stream.of(
            Arguments.of(ExpectCheck.status("200"), BODY, "expected status 200, got 404"),
            Arguments.of(ExpectCheck.header("X-Count", "4"), BODY, "expected header X-Count=4, got 3"),
            Arguments.of(ExpectCheck.header("X-Missing", "1"), BODY, "expected header X-Missing=1, got "),
            Arguments.of(ExpectCheck.contains("Grace"), BODY, "expected body to contain \"Grace\""),
            Arguments.of(ExpectCheck.matches("^<html>"), BODY, "body does not match regex \"^<html>\""),
            Arguments.of(ExpectCheck.jsonPath("$.missing", null), BODY, "expected jsonpath $.missing to exist"),
            Arguments.of(ExpectCheck.jsonPath("$.id", "8"), BODY, "expected jsonpath $.id=8, got 7")
        );
    }

    @Test
    void jsonPathNeedsJsonBody() {
        final var failure = Expectations.failure(ExpectCheck.jsonPath("$.id", null), 200, HEADERS, "<html/>".getBytes(StandardCharsets.UTF_8));

        assertThat(failure.get()).startsWith("expected a JSON body for jsonpath $.id");
    }

    @Test
    void firstFailureStopsAtFirstFailingCheck() {
        final var checks = List.of(ExpectCheck.status("404"), ExpectCheck.contains("Grace"), ExpectCheck.status("500"));

        assertThat(Expectations.firstFailure(checks, 404, HEADERS, BODY).get()).isEqualTo("expected body to contain \"Grace\"");
        assertThat(Expectations.firstFailure(checks.subList(0, 1), 404, HEADERS, BODY).isEmpty()).isTrue();
    }
}
