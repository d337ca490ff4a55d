package httpreq.planner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import httpreq.cli.Parser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PlanJsonTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static JsonNode explain(final String in, final boolean pretty) throws Exception {
        final var plan = Parser.parse(in).flatMap(Planner::plan).get();
        return MAPPER.readTree(PlanJson.render(plan, pretty));
    }

    @Test
    void renderDescribesResolvedPlan() throws Exception {
        final var json = explain(
            "send https://x.com/u with={\"a\":1} include='header: X-Trace: 1; param: q=a; param: q=b; cookie: sid=s' "
                + "expect=status:201, jsonpath:$.id retry=2 timeout=1m30s under=1KB follow=smart",
            false);

        assertThat(json.get("verb").asText()).isEqualTo("send");
        assertThat(json.get("method").asText()).isEqualTo("POST");
        assertThat(json.get("url").asText()).isEqualTo("https://x.com/u");
        assertThat(json.at("/headers/X-Trace").asText()).isEqualTo("1");
        assertThat(json.at("/query_params/1/value").asText()).isEqualTo("b");
        assertThat(json.at("/cookies/sid").asText()).isEqualTo("s");
        assertThat(json.at("/body/type").asText()).isEqualTo("json");
        assertThat(json.at("/body/content").asText()).isEqualTo("{\"a\":1}");
        assertThat(json.at("/output/format").asText()).isEqualTo("auto");
        assertThat(json.at("/retry/count").asInt()).isEqualTo(2);
        assertThat(json.at("/retry/backoff/min").asText()).isEqualTo("200ms");
        assertThat(json.at("/retry/backoff/max").asText()).isEqualTo("5s");
        assertThat(json.get("timeout").asText()).isEqualTo("1m30s");
        assertThat(json.get("size_limit").asLong()).isEqualTo(1024L);
        assertThat(json.get("follow").asText()).isEqualTo("smart");
        assertThat(json.get("expect")).hasSize(2);
        assertThat(json.at("/expect/0").asText()).isEqualTo("status:201");
        assertThat(json.at("/expect/1").asText()).isEqualTo("jsonpath:$.id");
    }

    @Test
    void renderOmitsUnsetFields() throws Exception {
        final var json = explain("read https://x.com", true);

        assertThat(json.has("headers")).isFalse();
        assertThat(json.has("body")).isFalse();
        assertThat(json.has("retry")).isFalse();
        assertThat(json.has("timeout")).isFalse();
        assertThat(json.has("insecure")).isFalse();
        assertThat(json.at("/output/format").asText()).isEqualTo("auto");
    }

    @Test
    void renderIsCompactUnlessPretty() {
        final var plan = Parser.parse("read https://x.com").flatMap(Planner::plan).get();

        assertThat(PlanJson.render(plan, false)).doesNotContain("\n");
        assertThat(PlanJson.render(plan, true)).contains("\n");
    }
}
