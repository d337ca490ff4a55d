package httpreq.cli;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * A lexical unit of a command line. {@code position} is the character offset of the token in the input.
 * <p>
 * Clause tokens keep the value both raw and, when the value reads as {@code <type>:<content>}, split into
 * its type and content. A value that started with a quote is {@code quoted}; quoted and JSON-shaped values
 * are never split.
 */
@Value
@Accessors(fluent = true)
public class Token {
    Kind kind;
    int position;
    String text;
    String value;
    boolean quoted;
    boolean unterminated;
    String type;
    String content;

    public enum Kind {
        WORD,
        URL,
        CLAUSE
    }

    static Token word(final int position, final String text) {
        return new Token(isUrl(text) ? Kind.URL : Kind.WORD, position, text, null, false, false, null, null);
    }

    static Token clause(
        final int position,
        final String key,
        final String value,
        final boolean quoted,
        final boolean unterminated,
        final String type,
        final String content) {
        return new Token(Kind.CLAUSE, position, key, value, quoted, unterminated, type, content);
    }

    public String key() {
        return kind == Kind.CLAUSE ? text : null;
    }

    public boolean isTyped() {
        return type != null;
    }

    public boolean isUrlValue() {
        return kind == Kind.CLAUSE && !quoted && isUrl(value);
    }

    static boolean isUrl(final String s) {
        return s.startsWith("http://") || s.startsWith("https://");
    }
}
