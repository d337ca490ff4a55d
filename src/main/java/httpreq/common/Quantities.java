package httpreq.common;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Duration and byte-size literals as written in clause values.
 * <p>
 * Durations are one or more {@code <number><unit>} pairs ({@code 500ms}, {@code 1m30s}, {@code 1.5h})
 * with units {@code ns}, {@code us}, {@code ms}, {@code s}, {@code m}, {@code h}.
 * Sizes are {@code <number><B|KB|MB|GB|TB>} in multiples of 1024.
 */
public final class Quantities {
    private static final Pattern DURATION = Pattern.compile("^((\\d+(\\.\\d+)?)(ns|us|µs|ms|s|m|h))+$");
    private static final Pattern DURATION_PART = Pattern.compile("(\\d+(?:\\.\\d+)?)(ns|us|µs|ms|s|m|h)");
    private static final Pattern SIZE = Pattern.compile("^(\\d+(?:\\.\\d+)?)\\s*(B|KB|MB|GB|TB)$", Pattern.CASE_INSENSITIVE);

    private Quantities() {
    }

    public static boolean isSize(final String in) {
        return SIZE.matcher(in.trim()).matches();
    }

    public static Duration duration(final String in) {
        final var value = in.trim();
        if ("0".equals(value)) {
            return Duration.ZERO;
        }
        if (!DURATION.matcher(value).matches()) {
            throw new IllegalArgumentException("invalid duration: " + in);
        }

        var nanos = BigDecimal.ZERO;
        final var matcher = DURATION_PART.matcher(value);
        while (matcher.find()) {
            nanos = nanos.add(new BigDecimal(matcher.group(1)).multiply(BigDecimal.valueOf(nanosPerUnit(matcher.group(2)))));
        }
        return Duration.ofNanos(exact(nanos, "duration", in));
    }

    public static long size(final String in) {
        final var matcher = SIZE.matcher(in.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("invalid size: " + in);
        }
        final var multiplier = bytesPerUnit(matcher.group(2).toUpperCase(Locale.ROOT));
        return exact(new BigDecimal(matcher.group(1)).multiply(BigDecimal.valueOf(multiplier)), "size", in);
    }

    private static long exact(final BigDecimal value, final String what, final String in) {
        try {
            return value.setScale(0, RoundingMode.DOWN).longValueExact();
        } catch (final ArithmeticException e) {
            throw new IllegalArgumentException(what + " out of range: " + in, e);
        }
    }

    public static String format(final Duration duration) {
        if (duration.isZero()) {
            return "0s";
        }
        if (duration.toMillis() < 1000) {
            return duration.toMillis() + "ms";
        }
        final var sb = new StringBuilder();
        if (duration.toHours() > 0) {
            sb.append(duration.toHours()).append('h');
        }
        if (duration.toMinutesPart() > 0) {
            sb.append(duration.toMinutesPart()).append('m');
        }
        if (duration.toSecondsPart() > 0 || duration.toMillisPart() > 0) {
            sb.append(duration.toSecondsPart());
            if (duration.toMillisPart() > 0) {
                sb.append('.').append(String.format("%03d", duration.toMillisPart()).replaceAll("0+$", ""));
            }
            sb.append('s');
        }
        return sb.toString();
    }

    private static long nanosPerUnit(final String unit) {
        switch (unit) {
            case "ns":
                return 1L;
            case "us":
            case "µs":
                return 1_000L;
            case "ms":
                return 1_000_000L;
            case "s":
                return 1_000_000_000L;
            case "m":
                return 60_000_000_000L;
            case "h":
                return 3_600_000_000_000L;
            default:
                throw new IllegalArgumentException("invalid duration unit: " + unit);
        }
    }

    private static long bytesPerUnit(final String unit) {
        switch (unit) {
            case "B":
                return 1L;
            case "KB":
                return 1L << 10;
            case "MB":
                return 1L << 20;
            case "GB":
                return 1L << 30;
            case "TB":
                return 1L << 40;
            default:
                throw new IllegalArgumentException("invalid size unit: " + unit);
        }
    }
}
