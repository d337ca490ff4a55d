package httpreq.planner;

import httpreq.command.AttachPart;
import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;

import java.util.List;

/**
 * What to send as the request body. Inline content is in {@code content}; file and stdin bodies are read by
 * the executor, with {@code filePath} set to {@value #STDIN} for stdin.
 */
@Value
@Builder(toBuilder = true)
@Accessors(fluent = true)
public class BodyPlan {
    public static final String STDIN = "-";

    Type type;
    String content;
    String filePath;
    boolean inferred;
    List<AttachPart> parts;
    String boundary;

    public enum Type {
        JSON,
        FORM,
        RAW,
        MULTIPART
    }

    public boolean isStdin() {
        return STDIN.equals(filePath);
    }

    public boolean isFile() {
        return filePath != null && !isStdin();
    }
}
