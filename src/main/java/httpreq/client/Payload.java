package httpreq.client;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Request body bytes with the content type they imply; both are null for a request without a body.
 */
@Value
@Accessors(fluent = true)
public class Payload {
    static final Payload NONE = new Payload(null, null);

    byte[] bytes;
    String contentType;

    public boolean isEmpty() {
        return bytes == null;
    }
}
