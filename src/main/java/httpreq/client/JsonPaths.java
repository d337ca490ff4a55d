package httpreq.client;

import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.spi.json.JacksonJsonProvider;
import com.jayway.jsonpath.spi.mapper.JacksonMappingProvider;

import java.nio.charset.StandardCharsets;

/**
 * JSONPath over response bodies, backed by Jackson.
 */
final class JsonPaths {
    private static final Configuration CONFIGURATION = Configuration.builder()
        .jsonProvider(new JacksonJsonProvider())
        .mappingProvider(new JacksonMappingProvider())
        .build();

    private JsonPaths() {
    }

    /**
     * @throws com.jayway.jsonpath.PathNotFoundException when the path selects nothing
     * @throws com.jayway.jsonpath.InvalidJsonException when the body is not JSON
     */
    static Object read(final byte[] body, final String path) {
        return JsonPath.using(CONFIGURATION).parse(new String(body, StandardCharsets.UTF_8)).read(path);
    }
}
