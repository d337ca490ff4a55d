package httpreq.planner;

import httpreq.command.Format;
import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;

@Value
@Builder(toBuilder = true)
@Accessors(fluent = true)
public class OutputPlan {
    Format format;
    String destination;
    String pick;
}
