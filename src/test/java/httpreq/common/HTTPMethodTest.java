package httpreq.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HTTPMethodTest {
    @Test
    void ofIgnoresCase() {
        assertThat(HTTPMethod.of("put")).isEqualTo(HTTPMethod.PUT);
        assertThat(HTTPMethod.of("Options")).isEqualTo(HTTPMethod.OPTIONS);
    }

    @Test
    void ofRejectsUnknownMethod() {
        assertThatThrownBy(() -> HTTPMethod.of("FETCH"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Invalid http method specified: FETCH");
    }

    @Test
    void writeMethodsCarryBodies() {
        assertThat(HTTPMethod.POST.isWrite()).isTrue();
        assertThat(HTTPMethod.DELETE.isWrite()).isTrue();
        assertThat(HTTPMethod.GET.isWrite()).isFalse();
        assertThat(HTTPMethod.HEAD.isWrite()).isFalse();
    }
}
