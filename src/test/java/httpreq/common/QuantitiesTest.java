package httpreq.common;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.Duration;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuantitiesTest {
    @ParameterizedTest
    @MethodSource("durationProvider")
    void durationParsesLiteral(final String in, final Duration expected) {
        assertThat(Quantities.duration(in)).isEqualTo(expected);
    }

    static Stream<Arguments> durationProvider() {
        return Stream.of(
            Arguments.of("0", Duration.ZERO),
            Arguments.of("500ms", Duration.ofMillis(500)),
            Arguments.of("5s", Duration.ofSeconds(5)),
            Arguments.of("1m30s", Duration.ofSeconds(90)),
            Arguments.of("1.5h", Duration.ofMinutes(90)),
            Arguments.of("250us", Duration.ofNanos(250_000)),
            Arguments.of("10ns", Duration.ofNanos(10))
        );
    }

    @ParameterizedTest
    @MethodSource("invalidDurationProvider")
    void durationRejectsMalformedLiteral(final String in) {
        assertThatThrownBy(() -> Quantities.duration(in))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("invalid duration: " + in);
    }

    static Stream<Arguments> invalidDurationProvider() {
        return Stream.of(
            Arguments.of("5"),
            Arguments.of("s"),
            Arguments.of("5 seconds"),
            Arguments.of("-1s"),
            Arguments.of("")
        );
    }

    @ParameterizedTest
    @MethodSource("sizeProvider")
    void sizeUsesBinaryMultiples(final String in, final long expected) {
        assertThat(Quantities.isSize(in)).isTrue();
        assertThat(Quantities.size(in)).isEqualTo(expected);
    }

    static Stream<Arguments> sizeProvider() {
        return Stream.of(
            Arguments.of("512B", 512L),
            Arguments.of("1KB", 1024L),
            Arguments.of("1kb", 1024L),
            Arguments.of("1.5MB", 1_572_864L),
            Arguments.of("2GB", 2L * 1024 * 1024 * 1024),
            Arguments.of("1TB", 1L << 40)
        );
    }

    @ParameterizedTest
    @MethodSource("outOfRangeProvider")
    void quantitiesRejectValuesBeyondLongRange(final String in, final String message) {
        assertThatThrownBy(() -> {
            if (Quantities.isSize(in)) {
                Quantities.size(in);
            } else {
                Quantities.duration(in);
            }
        }).isInstanceOf(IllegalArgumentException.class).hasMessage(message);
    }

    static Stream<Arguments> outOfRangeProvider() {
        return Stream.of(
            Arguments.of("99999999999TB", "size out of range: 99999999999TB"),
            Arguments.of("8388608TB", "size out of range: 8388608TB"),
            Arguments.of("2562048h", "duration out of range: 2562048h"),
            Arguments.of("99999999999999999999ns", "duration out of range: 99999999999999999999ns")
        );
    }

    @Test
    void quantitiesTruncateFractionalRemainder() {
        assertThat(Quantities.size("1.5B")).isEqualTo(1L);
        assertThat(Quantities.duration("1.5ns")).isEqualTo(Duration.ofNanos(1));
        assertThat(Quantities.size("8388607TB")).isEqualTo(8388607L << 40);
    }

    @Test
    void sizeRejectsDuration() {
        assertThat(Quantities.isSize("30s")).isFalse();
        assertThatThrownBy(() -> Quantities.size("30s")).hasMessage("invalid size: 30s");
    }

    @ParameterizedTest
    @MethodSource("formatProvider")
    void formatWritesShortestLiteral(final Duration in, final String expected) {
        assertThat(Quantities.format(in)).isEqualTo(expected);
    }

    static Stream<Arguments> formatProvider() {
        return Stream.of(
            Arguments.of(Duration.ZERO, "0s"),
            Arguments.of(Duration.ofMillis(200), "200ms"),
            Arguments.of(Duration.ofSeconds(5), "5s"),
            Arguments.of(Duration.ofSeconds(90), "1m30s"),
            Arguments.of(Duration.ofMillis(1500), "1.5s"),
            Arguments.of(Duration.ofHours(2), "2h")
        );
    }
}
