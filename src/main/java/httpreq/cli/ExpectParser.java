package httpreq.cli;

import com.jayway.jsonpath.InvalidPathException;
import com.jayway.jsonpath.JsonPath;
import httpreq.command.ExpectCheck;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * {@code expect=status:200, header:Name=Value, contains:"text", jsonpath:$.a=1, matches:regex}. The same
 * check grammar is used, one check at a time, by {@code until=}.
 */
final class ExpectParser {
    private static final Pattern CHECK_START = Pattern.compile("(status|header|contains|jsonpath|matches)\\s*:");
    private static final Pattern CHECK = Pattern.compile("^([A-Za-z]+)\\s*:(.*)$", Pattern.DOTALL);
    private static final Pattern STATUS = Pattern.compile("^\\d{3}$");

    private ExpectParser() {
    }

    static List<ExpectCheck> parse(final Token token) throws ParseError {
        final List<ExpectCheck> checks = new ArrayList<>();
        for (final var raw : Items.split(token.value(), ',', CHECK_START)) {
            checks.add(check(token, raw));
        }
        if (checks.isEmpty()) {
            throw ErrorFactory.emptyValue(token);
        }
        return checks;
    }

    static ExpectCheck check(final Token token, final String raw) throws ParseError {
        final var matcher = CHECK.matcher(raw.trim());
        if (!matcher.matches()) {
            throw ErrorFactory.invalid(token, "check '" + raw + "' must look like '<kind>:<value>'");
        }
        final var kind = matcher.group(1);
        final var rest = matcher.group(2).trim();

        switch (kind) {
            case "status":
                if (!STATUS.matcher(rest).matches()) {
                    throw ErrorFactory.invalid(token, "status check needs a three-digit code, got '" + rest + "'");
                }
                return ExpectCheck.status(rest);
            case "header":
                final var eq = rest.indexOf('=');
                if (eq <= 0) {
                    throw ErrorFactory.invalid(token, "header check '" + rest + "' must look like 'Name=Value'");
                }
                return ExpectCheck.header(rest.substring(0, eq).trim(), Items.unquote(rest.substring(eq + 1)));
            case "contains":
                final var text = Items.unquote(rest);
                if (text.isEmpty()) {
                    throw ErrorFactory.invalid(token, "contains check needs some text");
                }
                return ExpectCheck.contains(text);
            case "jsonpath":
                return jsonPath(token, rest);
            case "matches":
                final var regex = Items.unquote(rest);
                try {
                    Pattern.compile(regex);
                } catch (final PatternSyntaxException e) {
                    throw ErrorFactory.invalid(token, "invalid regex '" + regex + "': " + e.getDescription());
                }
                return ExpectCheck.matches(regex);
            default:
                final var kinds = Arrays.stream(ExpectCheck.Kind.values()).map(ExpectCheck.Kind::tag).collect(Collectors.toList());
                throw ErrorFactory.invalid(token, "unknown check '" + kind + "'", Suggestions.closest(kind, kinds).getOrNull());
        }
    }

    private static ExpectCheck jsonPath(final Token token, final String rest) throws ParseError {
        final var eq = topLevelEquals(rest);
        final var path = (eq < 0 ? rest : rest.substring(0, eq)).trim();
        final var value = eq < 0 ? null : Items.unquote(rest.substring(eq + 1));
        compilePath(token, path);
        return ExpectCheck.jsonPath(path, value);
    }

    static void compilePath(final Token token, final String path) throws ParseError {
        try {
            JsonPath.compile(path);
        } catch (final InvalidPathException | IllegalArgumentException e) {
            throw ErrorFactory.invalid(token, "invalid JSONPath '" + path + "': " + e.getMessage());
        }
    }

    /**
     * Index of the first '=' outside brackets, parentheses and quotes, or -1.
     */
    private static int topLevelEquals(final String in) {
        var depth = 0;
        char quote = 0;
        for (int i = 0; i < in.length(); i++) {
            final var c = in.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '[' || c == '(') {
                depth++;
            } else if (c == ']' || c == ')') {
                depth--;
            } else if (c == '=' && depth == 0) {
                return i;
            }
        }
        return -1;
    }
}
