package httpreq.command;

import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * A multipart part. Exactly one of {@code file} and {@code value} is set.
 */
@Value
@Builder(toBuilder = true)
@Accessors(fluent = true)
public class AttachPart {
    String name;
    String file;
    String value;
    String filename;
    String contentType;

    public boolean isFile() {
        return file != null;
    }
}
