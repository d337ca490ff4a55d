package httpreq.cli;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class SuggestionsTest {
    @ParameterizedTest
    @MethodSource("closestProvider")
    void closestPicksNearestWord(final String input, final List<String> vocabulary, final String expected) {
        assertThat(Suggestions.closest(input, vocabulary).getOrNull()).isEqualTo(expected);
    }

    static Stream<Arguments> closestProvider() {
        return Stream.of(
            Arguments.of("reed", Grammar.verbNames(), "read"),
            Arguments.of("sve", Grammar.verbNames(), "save"),
            Arguments.of("ass", Grammar.clauseKeys(), "as"),
            Arguments.of("incldue", Grammar.clauseKeys(), "include"),
            Arguments.of("xyzzy", Grammar.clauseKeys(), null),
            Arguments.of("a", List.of("b"), null),
            Arguments.of("bat", List.of("cat", "hat"), "cat")
        );
    }

    @ParameterizedTest
    @MethodSource("distanceProvider")
    void distanceCountsEdits(final String a, final String b, final int expected) {
        assertThat(Suggestions.distance(a, b)).isEqualTo(expected);
    }

    static Stream<Arguments> distanceProvider() {
        return Stream.of(
            Arguments.of("", "", 0),
            Arguments.of("", "abc", 3),
            Arguments.of("kitten", "sitting", 3),
            Arguments.of("status", "stauts", 2),
            Arguments.of("read", "read", 0)
        );
    }
}
