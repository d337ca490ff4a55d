package httpreq.command;

import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;

import java.util.List;

/**
 * A parsed sentence: a verb, its target URL and the clauses in source order. Session commands carry a
 * {@link SessionAction} instead of request clauses; for every other verb the action is {@code null}.
 */
@Value
@Builder(toBuilder = true)
@Accessors(fluent = true)
public class Command {
    Verb verb;
    String target;
    List<Clause> clauses;
    SessionAction sessionAction;

    public boolean isSession() {
        return verb == Verb.SESSION;
    }
}
