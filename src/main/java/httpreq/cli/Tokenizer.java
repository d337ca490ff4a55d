package httpreq.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a command line into words, URLs and {@code key=value} clauses. Never fails: malformed input such
 * as an unterminated quote is marked on the token and reported by the {@link Parser}.
 * <p>
 * Clause values may contain whitespace. A value ends at whitespace only when what follows is the end of
 * input, another {@code key=} for a known clause key, or a bare flag. Quotes open literal spans; a quote at
 * the start of a value (or right after a {@code type:} prefix) is removed along with its partner, and inside
 * such a span a backslash escapes the quote or another backslash. Quotes later in a value are kept.
 */
public final class Tokenizer {
    private static final Pattern TYPED = Pattern.compile("^([A-Za-z][\\w-]*):(.*)$", Pattern.DOTALL);
    private static final Pattern TYPE_PREFIX = Pattern.compile("^[A-Za-z][\\w-]*:$");
    private static final Pattern CLAUSE_START = Pattern.compile("^([A-Za-z]+)=");
    private static final Pattern FLAG_START = Pattern.compile("^([A-Za-z]+)(\\s.*)?$", Pattern.DOTALL);

    private final String in;
    private int i;

    private Tokenizer(final String in) {
        this.in = in;
    }

    public static List<Token> tokenize(final String in) {
        return new Tokenizer(in == null ? "" : in).tokens();
    }

    private List<Token> tokens() {
        final List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (i >= in.length()) {
                return tokens;
            }
            tokens.add(in.startsWith("http://", i) || in.startsWith("https://", i) ? url() : wordOrClause());
        }
    }

    private Token url() {
        final var start = i;
        while (i < in.length() && !Character.isWhitespace(in.charAt(i))) {
            i++;
        }
        return Token.word(start, in.substring(start, i));
    }

    private Token wordOrClause() {
        final var start = i;
        final var sb = new StringBuilder();
        while (i < in.length() && !Character.isWhitespace(in.charAt(i))) {
            final var c = in.charAt(i);
            if (c == '=') {
                i++;
                return clause(start, sb.toString());
            }
            if (isQuote(c) && in.indexOf(c, i + 1) > 0) {
                final var close = in.indexOf(c, i + 1);
                sb.append(in, i + 1, close);
                i = close + 1;
                continue;
            }
            sb.append(c);
            i++;
        }
        return Token.word(start, sb.toString());
    }

    private Token clause(final int start, final String key) {
        final var sb = new StringBuilder();
        final var quoted = i < in.length() && isQuote(in.charAt(i));
        var unterminated = false;

        while (i < in.length()) {
            final var c = in.charAt(i);
            if (isQuote(c)) {
                if (sb.length() == 0 || TYPE_PREFIX.matcher(sb).matches()) {
                    unterminated = !strippedSpan(sb, c);
                } else {
                    retainedSpan(sb, c);
                }
                continue;
            }
            if (Character.isWhitespace(c) && atBoundary()) {
                break;
            }
            sb.append(c);
            i++;
        }

        final var value = sb.toString();
        String type = null;
        String content = null;
        final var matcher = TYPED.matcher(value);
        if (!quoted && !isJsonShaped(value) && !Token.isUrl(value) && matcher.matches()) {
            type = matcher.group(1);
            content = matcher.group(2);
        }
        return Token.clause(start, key, value, quoted, unterminated, type, content);
    }

    /**
     * Consumes a quoted span, dropping its quotes. Returns false when the input ends before the closing quote.
     */
    private boolean strippedSpan(final StringBuilder sb, final char quote) {
        i++;
        while (i < in.length()) {
            final var c = in.charAt(i);
            if (c == '\\' && i + 1 < in.length() && (in.charAt(i + 1) == quote || in.charAt(i + 1) == '\\')) {
                sb.append(in.charAt(i + 1));
                i += 2;
            } else if (c == quote) {
                i++;
                return true;
            } else {
                sb.append(c);
                i++;
            }
        }
        return false;
    }

    private void retainedSpan(final StringBuilder sb, final char quote) {
        var close = i + 1;
        while (close < in.length() && in.charAt(close) != quote) {
            close += in.charAt(close) == '\\' && close + 1 < in.length() ? 2 : 1;
        }
        if (close >= in.length()) {
            // lone quote, e.g. an apostrophe
            sb.append(quote);
            i++;
            return;
        }
        sb.append(in, i, close + 1);
        i = close + 1;
    }

    private boolean atBoundary() {
        final var rest = in.substring(i).stripLeading();
        if (rest.isEmpty()) {
            return true;
        }
        final var clause = CLAUSE_START.matcher(rest);
        if (clause.find() && Grammar.isClauseKey(clause.group(1))) {
            return true;
        }
        final var flag = FLAG_START.matcher(rest);
        return flag.matches() && Grammar.isFlag(flag.group(1));
    }

    private void skipWhitespace() {
        while (i < in.length() && Character.isWhitespace(in.charAt(i))) {
            i++;
        }
    }

    private static boolean isQuote(final char c) {
        return c == '"' || c == '\'';
    }

    static boolean isJsonShaped(final String value) {
        final var trimmed = value.trim();
        return trimmed.startsWith("{") || trimmed.startsWith("[");
    }
}
