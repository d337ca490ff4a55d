package httpreq.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class GrammarTest {
    @ParameterizedTest
    @MethodSource("verbExampleProvider")
    void verbExampleParses(final String example) {
        final var command = Parser.parse(example);

        assertThat(command.isSuccess()).as(example + " -> " + command).isTrue();
    }

    static Stream<Arguments> verbExampleProvider() {
        return Grammar.VERBS.stream().map(entry -> Arguments.of(entry.example()));
    }

    @ParameterizedTest
    @MethodSource("clauseExampleProvider")
    void clauseExampleParses(final String example) {
        final var command = Parser.parse("read https://api.example.com " + example);

        assertThat(command.isSuccess()).as(example + " -> " + command).isTrue();
        assertThat(command.get().clauses()).hasSize(1);
    }

    static Stream<Arguments> clauseExampleProvider() {
        return Stream.concat(Grammar.CLAUSES.stream(), Grammar.FLAGS.stream()).map(entry -> Arguments.of(entry.example()));
    }

    @Test
    void helpListsWholeVocabulary() {
        final var help = Grammar.help();

        Grammar.verbNames().forEach(verb -> assertThat(help).contains(verb));
        Grammar.clauseKeys().forEach(key -> assertThat(help).contains(key + "="));
        Grammar.flagNames().forEach(flag -> assertThat(help).contains(flag));
        assertThat(help).contains("--dry-run");
    }

    @Test
    void onlyIncludeAndAttachRepeat() {
        assertThat(Grammar.CLAUSES.stream().filter(Grammar.Entry::repeatable).map(Grammar.Entry::name))
            .containsExactly("include", "attach");
    }
}
