package httpreq.client;

import httpreq.Const;
import lombok.Value;
import lombok.experimental.Accessors;

import java.net.URI;
import java.net.http.HttpHeaders;
import java.util.List;

/**
 * The final response of an execution, body already read and decoded.
 */
@Value
@Accessors(fluent = true)
public class Exchange {
    int status;
    URI uri;
    HttpHeaders headers;
    byte[] body;
    boolean decompressed;
    List<String> trace;
    List<String> setCookies;

    public String contentType() {
        return headers.firstValue(Const.Headers.CONTENT_TYPE).orElse("");
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
