package httpreq;

import java.time.Duration;

public interface Const {
    String REQ = "req";
    String VERSION = "1.0.0";
    String USER_AGENT = REQ + "/" + VERSION;
    String CONFIG_DIR_ENV = "REQ_CONFIG_DIR";
    String SESSION_HOST_ENV = "REQ_SESSION_HOST";
    String PROPERTIES_FILE = "req.properties";
    String DRY_RUN = "--dry-run";
    int MAX_REDIRECTS = 5;
    Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    Duration DEFAULT_BACKOFF_MIN = Duration.ofMillis(200);
    Duration DEFAULT_BACKOFF_MAX = Duration.ofSeconds(5);
    int DEFAULT_RETRIES_WITH_BACKOFF = 3;
    String DEFAULT_FILENAME = "download";

    interface Headers {
        String ACCEPT_ENCODING = "Accept-Encoding";
        String AUTHORIZATION = "Authorization";
        String CONTENT_ENCODING = "Content-Encoding";
        String CONTENT_LENGTH = "Content-Length";
        String CONTENT_TYPE = "Content-Type";
        String COOKIE = "Cookie";
        String LOCATION = "Location";
        String RANGE = "Range";
        String SET_COOKIE = "Set-Cookie";
        String USER_AGENT = "User-Agent";
        String DEFAULT_ACCEPT_ENCODING = "gzip, br";
        String APPLICATION_JSON = "application/json";
        String APPLICATION_X_WWW_FORM_URLENCODED = "application/x-www-form-urlencoded";
        String MULTIPART_FORM_DATA = "multipart/form-data";
        String APPLICATION_OCTET_STREAM = "application/octet-stream";
    }
}
