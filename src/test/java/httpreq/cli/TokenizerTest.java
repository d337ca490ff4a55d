package httpreq.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class TokenizerTest {
    @Test
    void tokenizeSplitsVerbTargetAndClauses() {
        final var tokens = Tokenizer.tokenize("read https://x.com/users as=json");

        assertThat(tokens).hasSize(3);
        assertThat(tokens.get(0).kind()).isEqualTo(Token.Kind.WORD);
        assertThat(tokens.get(0).text()).isEqualTo("read");
        assertThat(tokens.get(1).kind()).isEqualTo(Token.Kind.URL);
        assertThat(tokens.get(1).position()).isEqualTo(5);
        assertThat(tokens.get(2).kind()).isEqualTo(Token.Kind.CLAUSE);
        assertThat(tokens.get(2).key()).isEqualTo("as");
        assertThat(tokens.get(2).value()).isEqualTo("json");
        assertThat(tokens.get(2).position()).isEqualTo(25);
    }

    @Test
    void tokenizeNeverFailsOnEmptyInput() {
        assertThat(Tokenizer.tokenize("")).isEmpty();
        assertThat(Tokenizer.tokenize("   ")).isEmpty();
        assertThat(Tokenizer.tokenize(null)).isEmpty();
    }

    @ParameterizedTest
    @MethodSource("clauseValueProvider")
    void tokenizeReadsClauseValue(final String in, final String value, final boolean quoted, final String type, final String content) {
        final var tokens = Tokenizer.tokenize(in);
        final var clause = tokens.get(2);

        assertThat(clause.kind()).isEqualTo(Token.Kind.CLAUSE);
        assertThat(clause.value()).isEqualTo(value);
        assertThat(clause.quoted()).isEqualTo(quoted);
        assertThat(clause.unterminated()).isFalse();
        assertThat(clause.type()).isEqualTo(type);
        assertThat(clause.content()).isEqualTo(content);
    }

    static Stream<Arguments> clauseValueProvider() {
        return Stream.of(
            Arguments.of(
                "send https://x.com with='{\"name\": \"Ada Lovelace\"}'",
                "{\"name\": \"Ada Lovelace\"}", true, null, null),
            Arguments.of(
                "send https://x.com with={\"name\": \"Ada\"}",
                "{\"name\": \"Ada\"}", false, null, null),
            Arguments.of(
                "send https://x.com with=json:'{\"a\": 1}'",
                "json:{\"a\": 1}", false, "json", "{\"a\": 1}"),
            Arguments.of(
                "read https://x.com include=header: Authorization: Bearer a b; param: q=1 as=json",
                "header: Authorization: Bearer a b; param: q=1", false, "header", " Authorization: Bearer a b; param: q=1"),
            Arguments.of(
                "read https://x.com expect=contains:it's fine",
                "contains:it's fine", false, "contains", "it's fine"),
            Arguments.of(
                "read https://x.com via=http://proxy:8080",
                "http://proxy:8080", false, null, null),
            Arguments.of(
                "read https://x.com with='say \\'hi\\''",
                "say 'hi'", true, null, null)
        );
    }

    @Test
    void tokenizeStopsValueAtFlagsAndClauseKeys() {
        final var tokens = Tokenizer.tokenize("save https://x.com/a.zip to=my file.zip resume verbose retry=2");

        assertThat(tokens).extracting(Token::text).containsExactly("save", "https://x.com/a.zip", "to", "resume", "verbose", "retry");
        assertThat(tokens.get(2).value()).isEqualTo("my file.zip");
        assertThat(tokens.get(3).kind()).isEqualTo(Token.Kind.WORD);
        assertThat(tokens.get(5).value()).isEqualTo("2");
    }

    @Test
    void tokenizeKeepsWhitespaceBeforeUnknownKeys() {
        final var tokens = Tokenizer.tokenize("read https://x.com include=param: q=a b=c");

        assertThat(tokens).hasSize(3);
        assertThat(tokens.get(2).value()).isEqualTo("param: q=a b=c");
    }

    @Test
    void tokenizeMarksUnterminatedQuote() {
        final var tokens = Tokenizer.tokenize("read https://x.com as='json");

        assertThat(tokens.get(2).unterminated()).isTrue();
    }

    @Test
    void tokenizeStripsQuotesAfterTypePrefix() {
        final var tokens = Tokenizer.tokenize("read https://x.com expect=contains:\"a b\" as=json");

        assertThat(tokens).hasSize(4);
        assertThat(tokens.get(2).value()).isEqualTo("contains:a b");
        assertThat(tokens.get(3).value()).isEqualTo("json");
    }

    @Test
    void tokenizeRetainsMidValueQuotes() {
        final var tokens = Tokenizer.tokenize("send https://x.com with=note=\"a b\" as=json");

        assertThat(tokens).hasSize(4);
        assertThat(tokens.get(2).value()).isEqualTo("note=\"a b\"");
    }
}
