package httpreq.cli;

import httpreq.command.IncludeItem;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * {@code include=header: Name: Value; param: k=v; cookie: k=v; basic: user:pass}
 */
final class IncludeParser {
    private static final Pattern ITEM_START = Pattern.compile("(header|param|cookie|basic)\\s*:", Pattern.CASE_INSENSITIVE);
    private static final Pattern ITEM = Pattern.compile("^([A-Za-z]+)\\s*:(.*)$", Pattern.DOTALL);

    private IncludeParser() {
    }

    static List<IncludeItem> parse(final Token token) throws ParseError {
        final List<IncludeItem> items = new ArrayList<>();
        for (final var raw : Items.split(token.value(), ';', ITEM_START)) {
            items.add(item(token, raw));
        }
        if (items.isEmpty()) {
            throw ErrorFactory.emptyValue(token);
        }
        return items;
    }

    private static IncludeItem item(final Token token, final String raw) throws ParseError {
        final var matcher = ITEM.matcher(raw);
        if (!matcher.matches()) {
            throw ErrorFactory.invalid(token, "include item '" + raw + "' must look like '<type>: <value>'");
        }
        final var tag = matcher.group(1).toLowerCase(Locale.ROOT);
        final var rest = matcher.group(2).trim();

        switch (tag) {
            case "header":
                return header(token, rest);
            case "param":
                return IncludeItem.param(name(token, rest, "param"), Items.unquote(rest.substring(rest.indexOf('=') + 1)));
            case "cookie":
                return IncludeItem.cookie(name(token, rest, "cookie"), Items.unquote(rest.substring(rest.indexOf('=') + 1)));
            case "basic":
                return basic(token, rest);
            default:
                final var tags = Arrays.stream(IncludeItem.Type.values()).map(IncludeItem.Type::tag).collect(Collectors.toList());
                throw ErrorFactory.invalid(token, "unknown include type '" + tag + "'", Suggestions.closest(tag, tags).getOrNull());
        }
    }

    private static IncludeItem header(final Token token, final String rest) throws ParseError {
        final var colon = rest.indexOf(':');
        if (colon <= 0 || rest.substring(0, colon).isBlank()) {
            throw ErrorFactory.invalid(token, "header '" + rest + "' must look like 'Name: Value'");
        }
        return IncludeItem.header(rest.substring(0, colon).trim(), Items.unquote(rest.substring(colon + 1)));
    }

    private static String name(final Token token, final String rest, final String tag) throws ParseError {
        final var eq = rest.indexOf('=');
        if (eq <= 0 || rest.substring(0, eq).isBlank()) {
            throw ErrorFactory.invalid(token, tag + " '" + rest + "' must look like 'name=value'");
        }
        return rest.substring(0, eq).trim();
    }

    private static IncludeItem basic(final Token token, final String rest) throws ParseError {
        final var credentials = Items.unquote(rest);
        final var colon = credentials.indexOf(':');
        if (colon < 0 || colon != credentials.lastIndexOf(':')) {
            throw ErrorFactory.invalid(token, "basic auth must look like 'user:password' with exactly one colon");
        }
        return IncludeItem.basic(credentials.substring(0, colon), credentials.substring(colon + 1));
    }
}
