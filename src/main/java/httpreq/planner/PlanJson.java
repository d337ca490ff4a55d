package httpreq.planner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import httpreq.common.Quantities;

import java.util.Locale;

/**
 * The JSON view of a plan printed by {@code explain} and {@code --dry-run}. Unset fields are omitted.
 */
public final class PlanJson {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private PlanJson() {
    }

    public static String render(final ExecutionPlan plan, final boolean pretty) {
        try {
            final var node = toJson(plan);
            return pretty ? MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node) : MAPPER.writeValueAsString(node);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("plan could not be serialized", e);
        }
    }

    static ObjectNode toJson(final ExecutionPlan plan) {
        final var node = MAPPER.createObjectNode();
        node.put("verb", plan.verb().keyword());
        node.put("method", plan.method().name());
        node.put("url", plan.url());

        if (!plan.headers().isEmpty()) {
            final var headers = node.putObject("headers");
            plan.headers().forEach(headers::put);
        }
        if (!plan.queryParams().isEmpty()) {
            final var params = node.putArray("query_params");
            plan.queryParams().forEach(param -> params.addObject().put("name", param._1).put("value", param._2));
        }
        if (!plan.cookies().isEmpty()) {
            final var cookies = node.putObject("cookies");
            plan.cookies().forEach(cookies::put);
        }

        if (plan.body() != null) {
            final var body = node.putObject("body");
            final var bodyPlan = plan.body();
            body.put("type", bodyPlan.type().name().toLowerCase(Locale.ROOT));
            if (bodyPlan.content() != null) {
                body.put("content", bodyPlan.content());
            }
            if (bodyPlan.filePath() != null) {
                body.put("file_path", bodyPlan.filePath());
            }
            if (bodyPlan.boundary() != null) {
                body.put("boundary", bodyPlan.boundary());
            }
            if (bodyPlan.parts() != null) {
                final var parts = body.putArray("attach_parts");
                for (final var part : bodyPlan.parts()) {
                    final var partNode = parts.addObject().put("name", part.name());
                    if (part.file() != null) {
                        partNode.put("file", part.file());
                    }
                    if (part.value() != null) {
                        partNode.put("value", part.value());
                    }
                    if (part.filename() != null) {
                        partNode.put("filename", part.filename());
                    }
                    if (part.contentType() != null) {
                        partNode.put("type", part.contentType());
                    }
                }
            }
        }

        final var output = node.putObject("output");
        output.put("format", plan.output().format().keyword());
        if (plan.output().destination() != null) {
            output.put("destination", plan.output().destination());
        }
        if (plan.output().pick() != null) {
            output.put("pick", plan.output().pick());
        }

        if (plan.retry() != null) {
            final var retry = node.putObject("retry");
            retry.put("count", plan.retry().count());
            retry.putObject("backoff")
                .put("min", Quantities.format(plan.retry().backoffMin()))
                .put("max", Quantities.format(plan.retry().backoffMax()));
        }
        if (plan.timeout() != null) {
            node.put("timeout", Quantities.format(plan.timeout()));
        }
        if (plan.sizeLimit() != null) {
            node.put("size_limit", plan.sizeLimit());
        }
        if (plan.proxy() != null) {
            node.put("proxy", plan.proxy());
        }
        if (plan.insecure()) {
            node.put("insecure", true);
        }
        if (plan.verbose()) {
            node.put("verbose", true);
        }
        if (plan.resume()) {
            node.put("resume", true);
        }
        if (plan.smartFollow()) {
            node.put("follow", "smart");
        }
        if (!plan.expect().isEmpty()) {
            final var expect = node.putArray("expect");
            plan.expect().forEach(check -> expect.add(check.describe()));
        }
        if (plan.every() != null) {
            node.put("every", Quantities.format(plan.every()));
        }
        if (plan.until() != null) {
            node.put("until", plan.until().describe());
        }
        return node;
    }
}
