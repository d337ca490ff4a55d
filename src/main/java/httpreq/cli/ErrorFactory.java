package httpreq.cli;

public interface ErrorFactory {
    String EXPECTED_VERB = "expected a verb";
    String UNKNOWN_VERB = "unknown verb";
    String MISSING_TARGET = "missing target URL";
    String EXPECTED_TARGET = "expected a target URL starting with http:// or https://";
    String UNKNOWN_CLAUSE = "unknown clause";
    String UNEXPECTED_WORD = "unexpected word";
    String DUPLICATE_CLAUSE = "duplicate clause '%s' (only include= and attach= may repeat)";
    String EMPTY_VALUE = "clause '%s' requires a value";
    String UNTERMINATED_QUOTE = "unterminated quote in value of '%s'";

    static ParseError expectedVerb(final int position) {
        return new ParseError(position, "", EXPECTED_VERB);
    }

    static ParseError unknownVerb(final Token token, final String suggestion) {
        return new ParseError(token.position(), token.text(), UNKNOWN_VERB, suggestion);
    }

    static ParseError missingTarget(final int position) {
        return new ParseError(position, "", MISSING_TARGET);
    }

    static ParseError expectedTarget(final Token token) {
        return new ParseError(token.position(), token.text(), EXPECTED_TARGET);
    }

    static ParseError unknownClause(final Token token, final String suggestion) {
        return new ParseError(token.position(), token.text(), UNKNOWN_CLAUSE, suggestion);
    }

    static ParseError unexpectedWord(final Token token, final String suggestion) {
        return new ParseError(token.position(), token.text(), UNEXPECTED_WORD, suggestion);
    }

    static ParseError duplicateClause(final Token token) {
        return new ParseError(token.position(), token.text(), String.format(DUPLICATE_CLAUSE, token.text()));
    }

    static ParseError emptyValue(final Token token) {
        return new ParseError(token.position(), token.text(), String.format(EMPTY_VALUE, token.text()));
    }

    static ParseError unterminatedQuote(final Token token) {
        return new ParseError(token.position(), token.text(), String.format(UNTERMINATED_QUOTE, token.text()));
    }

    static ParseError invalid(final Token token, final String reason) {
        return new ParseError(token.position(), token.text(), reason);
    }

    static ParseError invalid(final Token token, final String reason, final String suggestion) {
        return new ParseError(token.position(), token.text(), reason, suggestion);
    }
}
