package httpreq.planner;

import httpreq.cli.Parser;
import httpreq.command.ExpectCheck;
import httpreq.command.Format;
import httpreq.command.Verb;
import httpreq.common.HTTPMethod;
import io.vavr.Tuple;
import io.vavr.control.Try;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class PlannerTest {
    @TempDir
    Path tmp;

    private static Try<ExecutionPlan> plan(final String in) {
        return Parser.parse(in).flatMap(Planner::plan);
    }

    @ParameterizedTest
    @MethodSource("defaultsProvider")
    void planAppliesVerbDefaults(final String in, final HTTPMethod method, final Format format) {
        final var plan = plan(in).get();

        assertThat(plan.method()).isEqualTo(method);
        assertThat(plan.output().format()).isEqualTo(format);
    }

    static Stream<Arguments> defaultsProvider() {
        return Stream.of(
            Arguments.of("read https://x.com", HTTPMethod.GET, Format.AUTO),
            Arguments.of("save https://x.com/a.zip", HTTPMethod.GET, Format.RAW),
            Arguments.of("send https://x.com", HTTPMethod.GET, Format.AUTO),
            Arguments.of("send https://x.com with=hi", HTTPMethod.POST, Format.AUTO),
            Arguments.of("send https://x.com with=hi using=PUT", HTTPMethod.PUT, Format.AUTO),
            Arguments.of("send https://x.com using=PATCH with=hi", HTTPMethod.PATCH, Format.AUTO),
            Arguments.of("upload https://x.com with=hi", HTTPMethod.POST, Format.AUTO),
            Arguments.of("watch https://x.com", HTTPMethod.GET, Format.AUTO),
            Arguments.of("inspect https://x.com", HTTPMethod.HEAD, Format.JSON),
            Arguments.of("authenticate https://x.com", HTTPMethod.POST, Format.AUTO),
            Arguments.of("read https://x.com as=csv", HTTPMethod.GET, Format.CSV)
        );
    }

    @ParameterizedTest
    @MethodSource("errorProvider")
    void planRejectsInvalidCommand(final String in, final String cause) {
        final var plan = plan(in);

        assertThat(plan.isFailure()).isTrue();
        assertThat(plan.getCause()).isInstanceOf(PlanError.class);
        assertThat(plan.getCause().getMessage()).isEqualTo(cause);
    }

    static Stream<Arguments> errorProvider() {
        return Stream.of(
            Arguments.of("read https://x.com using=POST", "verb 'read' is incompatible with method 'POST'"),
            Arguments.of("send https://x.com using=GET", "verb 'send' is incompatible with method 'GET'"),
            Arguments.of("watch https://x.com using=DELETE", "verb 'watch' is incompatible with method 'DELETE'"),
            Arguments.of("upload https://x.com", "upload requires attach= or with="),
            Arguments.of("read https://x.com every=1s", "every= is only valid for watch"),
            Arguments.of("read https://x.com until=status:200", "until= is only valid for watch"),
            Arguments.of("watch https://x.com until=status:200", "until= needs every= to poll"),
            Arguments.of("read https://x.com resume", "resume is only valid for save"),
            Arguments.of("session show x.com", "session commands manage stored sessions and send no request")
        );
    }

    @Test
    void planMergesIncludeItems() {
        final var plan = plan("read https://x.com include='header: X-A: 1; param: q=a; cookie: sid=1' "
            + "include='header: x-a: 2; param: q=b; cookie: sid=2; param: page=3'").get();

        assertThat(plan.headers()).containsEntry("X-A", "2").hasSize(1);
        assertThat(plan.queryParams()).containsExactly(Tuple.of("q", "a"), Tuple.of("q", "b"), Tuple.of("page", "3"));
        assertThat(plan.cookies()).containsEntry("sid", "2").hasSize(1);
    }

    @Test
    void planEncodesBasicAuth() {
        final var plan = plan("read https://x.com include='header: Authorization: Bearer x; basic: user:pass'").get();

        assertThat(plan.headers()).containsEntry("Authorization", "Basic dXNlcjpwYXNz");
    }

    @Test
    void planInfersBodyType() {
        final var json = plan("send https://x.com with={\"a\":1}").get().body();
        assertThat(json.type()).isEqualTo(BodyPlan.Type.JSON);
        assertThat(json.inferred()).isTrue();
        assertThat(json.content()).isEqualTo("{\"a\":1}");

        final var file = plan("send https://x.com with=@data.bin").get().body();
        assertThat(file.isFile()).isTrue();
        assertThat(file.filePath()).isEqualTo("data.bin");

        final var stdin = plan("send https://x.com with=@-").get().body();
        assertThat(stdin.isStdin()).isTrue();
        assertThat(stdin.isFile()).isFalse();
    }

    @Test
    void planBuildsMultipartBody() {
        final var body = plan("upload https://x.com attach=part: name=doc, file=@dir/report.pdf "
            + "attach=part: name=note, value=hi; boundary: b0undary").get().body();

        assertThat(body.type()).isEqualTo(BodyPlan.Type.MULTIPART);
        assertThat(body.boundary()).isEqualTo("b0undary");
        assertThat(body.parts()).hasSize(2);
        assertThat(body.parts().get(0).filename()).isEqualTo("report.pdf");
        assertThat(body.parts().get(1).filename()).isNull();
    }

    @Test
    void planResolvesRetryDefaults() {
        assertThat(plan("read https://x.com").get().retry()).isNull();

        final var retry = plan("read https://x.com retry=2").get().retry();
        assertThat(retry.count()).isEqualTo(2);
        assertThat(retry.backoffMin()).isEqualTo(Duration.ofMillis(200));
        assertThat(retry.backoffMax()).isEqualTo(Duration.ofSeconds(5));

        final var backoff = plan("read https://x.com backoff=1s..3s").get().retry();
        assertThat(backoff.count()).isEqualTo(3);
        assertThat(backoff.delay(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(backoff.delay(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(backoff.delay(3)).isEqualTo(Duration.ofSeconds(3));
        assertThat(backoff.delay(10)).isEqualTo(Duration.ofSeconds(3));
    }

    @Test
    void planRoutesUnderBySyntax() {
        final var timeout = plan("read https://x.com under=5s").get();
        assertThat(timeout.timeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(timeout.sizeLimit()).isNull();

        final var size = plan("read https://x.com under=2KB").get();
        assertThat(size.sizeLimit()).isEqualTo(2048L);
        assertThat(size.timeout()).isNull();
    }

    @Test
    void planCarriesWatchAndFlags() {
        final var plan = plan("watch https://x.com every=1s until=status:200 expect=contains:ok verbose insecure via=http://p:3128").get();

        assertThat(plan.verb()).isEqualTo(Verb.WATCH);
        assertThat(plan.every()).isEqualTo(Duration.ofSeconds(1));
        assertThat(plan.until()).isEqualTo(ExpectCheck.status("200"));
        assertThat(plan.expect()).containsExactly(ExpectCheck.contains("ok"));
        assertThat(plan.verbose()).isTrue();
        assertThat(plan.insecure()).isTrue();
        assertThat(plan.proxy()).isEqualTo("http://p:3128");
    }

    @ParameterizedTest
    @MethodSource("filenameProvider")
    void filenameFromUrlUsesLastSegment(final String url, final String expected) {
        assertThat(Planner.filenameFromUrl(url)).isEqualTo(expected);
    }

    static Stream<Arguments> filenameProvider() {
        return Stream.of(
            Arguments.of("https://x.com/files/report.pdf", "report.pdf"),
            Arguments.of("https://x.com/files/my%20report.pdf?version=2", "my report.pdf"),
            Arguments.of("https://x.com/", "download"),
            Arguments.of("https://x.com", "download"),
            Arguments.of("https://x.com/files/latest", "download"),
            Arguments.of("https://x.com/a%2F..%2Fetc.conf", "etc.conf")
        );
    }

    @Test
    void planInfersSaveDestination() throws Exception {
        final var dir = Files.createDirectory(tmp.resolve("downloads"));

        assertThat(plan("save https://x.com/a/b.tar.gz").get().output().destination()).isEqualTo("b.tar.gz");
        assertThat(plan("save https://x.com/b.tar.gz to=" + dir).get().output().destination())
            .isEqualTo(dir.resolve("b.tar.gz").toString());
        assertThat(plan("save https://x.com/b.tar.gz to=" + dir.resolve("c.tgz")).get().output().destination())
            .isEqualTo(dir.resolve("c.tgz").toString());
    }

    @Test
    void planKeepsPickAndDestinationForRead() {
        final var output = plan("read https://x.com pick=$.items[*].id to=ids.json").get().output();

        assertThat(output.pick()).isEqualTo("$.items[*].id");
        assertThat(output.destination()).isEqualTo("ids.json");
        assertThat(output.format()).isEqualTo(Format.AUTO);
    }

    @Test
    void planIsSideEffectFree() {
        final var plan = plan("read https://x.com include=param: a=1").get();

        assertThat(plan.queryParams()).isEqualTo(List.of(Tuple.of("a", "1")));
        assertThat(plan.body()).isNull();
        assertThat(plan.expect()).isEmpty();
    }
}
