package httpreq.cli;

import httpreq.command.AttachPart;
import io.vavr.Tuple;
import io.vavr.Tuple2;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * {@code attach=part: name=avatar, file=@me.png, type=image/png; part: name=meta, value=xyz; boundary: b}
 */
final class AttachParser {
    private static final Pattern ITEM_START = Pattern.compile("(part|boundary)\\s*:", Pattern.CASE_INSENSITIVE);
    private static final Pattern FIELD_START = Pattern.compile("[A-Za-z]+\\s*=");
    private static final Pattern ITEM = Pattern.compile("^([A-Za-z]+)\\s*:(.*)$", Pattern.DOTALL);

    private AttachParser() {
    }

    static Tuple2<List<AttachPart>, String> parse(final Token token) throws ParseError {
        final List<AttachPart> parts = new ArrayList<>();
        String boundary = null;
        for (final var raw : Items.split(token.value(), ';', ITEM_START)) {
            final var matcher = ITEM.matcher(raw);
            if (!matcher.matches()) {
                throw ErrorFactory.invalid(token, "attach item '" + raw + "' must start with 'part:' or 'boundary:'");
            }
            switch (matcher.group(1).toLowerCase(Locale.ROOT)) {
                case "part":
                    parts.add(part(token, matcher.group(2)));
                    break;
                case "boundary":
                    boundary = Items.unquote(matcher.group(2));
                    if (boundary.isEmpty()) {
                        throw ErrorFactory.invalid(token, "boundary must not be empty");
                    }
                    break;
                default:
                    throw ErrorFactory.invalid(token, "unknown attach item '" + matcher.group(1) + "'", "part");
            }
        }
        if (parts.isEmpty()) {
            throw ErrorFactory.invalid(token, "attach needs at least one 'part:'");
        }
        return Tuple.of(parts, boundary);
    }

    private static AttachPart part(final Token token, final String fields) throws ParseError {
        final var builder = AttachPart.builder();
        var hasName = false;
        var hasFile = false;
        var hasValue = false;

        for (final var field : Items.split(fields, ',', FIELD_START)) {
            final var eq = field.indexOf('=');
            if (eq <= 0) {
                throw ErrorFactory.invalid(token, "part field '" + field + "' must look like 'key=value'");
            }
            final var key = field.substring(0, eq).trim().toLowerCase(Locale.ROOT);
            final var value = Items.unquote(field.substring(eq + 1));
            switch (key) {
                case "name":
                    builder.name(value);
                    hasName = !value.isEmpty();
                    break;
                case "file":
                    builder.file(value.startsWith("@") ? value.substring(1) : value);
                    hasFile = true;
                    break;
                case "value":
                    builder.value(value);
                    hasValue = true;
                    break;
                case "filename":
                    builder.filename(value);
                    break;
                case "type":
                    builder.contentType(value);
                    break;
                default:
                    throw ErrorFactory.invalid(
                        token,
                        "unknown part field '" + key + "'",
                        Suggestions.closest(key, List.of("name", "file", "value", "filename", "type")).getOrNull());
            }
        }

        if (!hasName) {
            throw ErrorFactory.invalid(token, "part needs a name=");
        }
        if (hasFile == hasValue) {
            throw ErrorFactory.invalid(token, "part needs exactly one of file= or value=");
        }
        return builder.build();
    }
}
