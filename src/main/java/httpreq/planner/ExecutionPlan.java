package httpreq.planner;

import httpreq.command.ExpectCheck;
import httpreq.command.Verb;
import httpreq.common.HTTPMethod;
import io.vavr.Tuple2;
import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * A fully resolved request: defaults applied, clauses folded in, validated. Nullable fields mean "not set":
 * {@code body}, {@code retry}, {@code timeout}, {@code sizeLimit}, {@code proxy}, {@code every}, {@code until}.
 * Header names compare case-insensitively; query parameters keep their order, duplicates included.
 */
@Value
@Builder(toBuilder = true)
@Accessors(fluent = true)
public class ExecutionPlan {
    Verb verb;
    HTTPMethod method;
    String url;
    Map<String, String> headers;
    List<Tuple2<String, String>> queryParams;
    Map<String, String> cookies;
    BodyPlan body;
    OutputPlan output;
    RetryPlan retry;
    Duration timeout;
    Long sizeLimit;
    String proxy;
    boolean insecure;
    boolean verbose;
    boolean resume;
    boolean smartFollow;
    List<ExpectCheck> expect;
    Duration every;
    ExpectCheck until;
}
