package httpreq.cli;

import io.vavr.control.Option;

import java.util.Collection;

/**
 * "Did you mean" lookups by edit distance.
 */
public final class Suggestions {
    private static final int MAX_DISTANCE = 2;

    private Suggestions() {
    }

    /**
     * The closest word of the vocabulary within two edits, earlier words winning ties. Nothing is suggested
     * when the distance is as large as the input itself.
     */
    public static Option<String> closest(final String input, final Collection<String> vocabulary) {
        String best = null;
        var bestDistance = Integer.MAX_VALUE;
        for (final var candidate : vocabulary) {
            final var distance = distance(input, candidate);
            if (distance < bestDistance) {
                best = candidate;
                bestDistance = distance;
            }
        }
        return bestDistance <= MAX_DISTANCE && bestDistance < input.length() ? Option.of(best) : Option.none();
    }

    static int distance(final String a, final String b) {
        var previous = new int[b.length() + 1];
        var current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                final var cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            final var swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
