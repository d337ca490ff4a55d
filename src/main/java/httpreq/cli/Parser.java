package httpreq.cli;

import httpreq.command.Clause;
import httpreq.command.Command;
import httpreq.command.Format;
import httpreq.command.SessionAction;
import httpreq.command.Verb;
import httpreq.common.HTTPMethod;
import httpreq.common.Quantities;
import io.vavr.control.Try;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns a command line into a {@link Command}: {@code verb target [clause | flag]*}, or
 * {@code session <show|clear|use> <host> [as=json]}.
 */
@Slf4j
public final class Parser {
    private static final Pattern BACKOFF = Pattern.compile("^(.+?)\\.\\.(.+)$");
    private static final Pattern INTEGER = Pattern.compile("^\\d+$");

    private Parser() {
    }

    public static Try<Command> parse(final String in) {
        return Try.of(() -> command(Tokenizer.tokenize(in)));
    }

    public static Command command(final List<Token> tokens) throws ParseError {
        if (tokens.isEmpty()) {
            throw ErrorFactory.expectedVerb(0);
        }

        final var first = tokens.get(0);
        if (first.kind() != Token.Kind.WORD) {
            throw ErrorFactory.unknownVerb(first, null);
        }
        final var verb = Verb.of(first.text())
            .getOrElseThrow(() -> ErrorFactory.unknownVerb(first, Suggestions.closest(first.text(), Grammar.verbNames()).getOrNull()));

        if (verb == Verb.SESSION) {
            return session(tokens);
        }

        if (tokens.size() < 2) {
            throw ErrorFactory.missingTarget(first.position() + first.text().length());
        }
        final var target = tokens.get(1);
        if (target.kind() != Token.Kind.URL) {
            throw ErrorFactory.expectedTarget(target);
        }

        final var clauses = clauses(tokens.subList(2, tokens.size()));
        log.debug("Parsed {} {} with {} clause(s)", verb.keyword(), target.text(), clauses.size());
        return Command.builder()
            .verb(verb)
            .target(target.text())
            .clauses(clauses)
            .build();
    }

    private static Command session(final List<Token> tokens) throws ParseError {
        final var verbToken = tokens.get(0);
        if (tokens.size() < 2) {
            throw ErrorFactory.invalid(verbToken, "session needs one of show, clear or use");
        }
        final var actionToken = tokens.get(1);
        final var actions = List.of("show", "clear", "use");
        final var action = SessionAction.of(actionToken.text())
            .getOrElseThrow(() -> ErrorFactory.invalid(
                actionToken,
                "unknown session action",
                Suggestions.closest(actionToken.text(), actions).getOrNull()));

        if (tokens.size() < 3) {
            throw ErrorFactory.missingTarget(actionToken.position() + actionToken.text().length());
        }
        final var hostToken = tokens.get(2);
        if (hostToken.kind() == Token.Kind.CLAUSE || hostToken.text().isBlank()) {
            throw ErrorFactory.invalid(hostToken, "session needs a host or URL");
        }
        final var target = hostToken.kind() == Token.Kind.URL ? hostToken.text() : "https://" + hostToken.text();

        final var clauses = clauses(tokens.subList(3, tokens.size()));
        for (final var clause : clauses) {
            if (!(clause instanceof Clause.As)) {
                throw ErrorFactory.invalid(hostToken, "clause '" + clause.key() + "' is not valid for session commands");
            }
        }
        return Command.builder()
            .verb(Verb.SESSION)
            .target(target)
            .clauses(clauses)
            .sessionAction(action)
            .build();
    }

    private static List<Clause> clauses(final List<Token> tokens) throws ParseError {
        final List<Clause> clauses = new ArrayList<>();
        final Set<String> seen = new HashSet<>();
        for (final var token : tokens) {
            final Clause clause;
            switch (token.kind()) {
                case URL:
                    throw ErrorFactory.invalid(token, "only one target URL is allowed");
                case WORD:
                    clause = flag(token);
                    break;
                default:
                    clause = clause(token);
                    break;
            }
            if (!Grammar.isRepeatable(clause.key()) && !seen.add(clause.key())) {
                throw ErrorFactory.duplicateClause(token);
            }
            clauses.add(clause);
        }
        return clauses;
    }

    private static Clause flag(final Token token) throws ParseError {
        switch (token.text()) {
            case "insecure":
                return new Clause.Insecure(true);
            case "verbose":
                return new Clause.Verbose();
            case "resume":
                return new Clause.Resume();
            default:
                final List<String> vocabulary = new ArrayList<>(Grammar.flagNames());
                vocabulary.addAll(Grammar.clauseKeys());
                throw ErrorFactory.unexpectedWord(token, Suggestions.closest(token.text(), vocabulary).getOrNull());
        }
    }

    private static Clause clause(final Token token) throws ParseError {
        if (!Grammar.isClauseKey(token.key())) {
            throw ErrorFactory.unknownClause(token, Suggestions.closest(token.key(), Grammar.clauseKeys()).getOrNull());
        }
        if (token.unterminated()) {
            throw ErrorFactory.unterminatedQuote(token);
        }
        if (token.value().isBlank()) {
            throw ErrorFactory.emptyValue(token);
        }

        final var value = token.value().trim();
        switch (token.key()) {
            case "using":
                return using(token, value);
            case "with":
                return with(token);
            case "include":
                return new Clause.Include(IncludeParser.parse(token));
            case "attach":
                final var attach = AttachParser.parse(token);
                return new Clause.Attach(attach._1, attach._2);
            case "expect":
                return new Clause.Expect(ExpectParser.parse(token));
            case "as":
                return new Clause.As(Format.of(value)
                    .getOrElseThrow(() -> ErrorFactory.invalid(
                        token,
                        "unknown output format '" + value + "', expected one of json, csv, text, raw",
                        Suggestions.closest(value, List.of("json", "csv", "text", "raw")).getOrNull())));
            case "to":
                return new Clause.To(value);
            case "retry":
                if (!INTEGER.matcher(value).matches()) {
                    throw ErrorFactory.invalid(token, "retry needs a non-negative number, got '" + value + "'");
                }
                try {
                    return new Clause.Retry(Integer.parseInt(value));
                } catch (final NumberFormatException e) {
                    throw ErrorFactory.invalid(token, "retry count out of range");
                }
            case "backoff":
                return backoff(token, value);
            case "timeout":
                return new Clause.Timeout(positiveDuration(token, value));
            case "under":
                if (Quantities.isSize(value)) {
                    return Clause.Under.size(size(token, value));
                }
                return Clause.Under.timeout(positiveDuration(token, value));
            case "via":
            case "proxy":
                if (!token.isUrlValue()) {
                    throw ErrorFactory.invalid(token, token.key() + " needs an http:// or https:// URL, got '" + value + "'");
                }
                return new Clause.Via(token.key(), value);
            case "follow":
                if (!"smart".equals(value)) {
                    throw ErrorFactory.invalid(token, "unknown follow policy '" + value + "', expected smart",
                        Suggestions.closest(value, List.of("smart")).getOrNull());
                }
                return new Clause.Follow(Clause.Follow.Policy.SMART);
            case "insecure":
                switch (value.toLowerCase(Locale.ROOT)) {
                    case "true":
                        return new Clause.Insecure(true);
                    case "false":
                        return new Clause.Insecure(false);
                    default:
                        throw ErrorFactory.invalid(token, "insecure must be true or false, got '" + value + "'");
                }
            case "pick":
                ExpectParser.compilePath(token, value);
                return new Clause.Pick(value);
            case "every":
                return new Clause.Every(positiveDuration(token, value));
            case "until":
                return new Clause.Until(ExpectParser.check(token, value));
            default:
                throw ErrorFactory.unknownClause(token, null);
        }
    }

    private static Clause using(final Token token, final String value) throws ParseError {
        try {
            return new Clause.Using(HTTPMethod.of(value));
        } catch (final IllegalArgumentException e) {
            throw ErrorFactory.invalid(token, "unknown HTTP method '" + value + "'");
        }
    }

    private static Clause with(final Token token) {
        final var value = token.value();
        if (token.isTyped()) {
            switch (token.type().toLowerCase(Locale.ROOT)) {
                case "json":
                    return new Clause.With(Clause.With.Source.INLINE, Clause.With.BodyType.JSON, token.content(), false);
                case "form":
                    return new Clause.With(Clause.With.Source.INLINE, Clause.With.BodyType.FORM, token.content(), false);
                case "raw":
                    return new Clause.With(Clause.With.Source.INLINE, Clause.With.BodyType.RAW, token.content(), false);
                default:
                    // not a body type, e.g. "note: hello"
                    break;
            }
        }
        if (!token.quoted() && "@-".equals(value)) {
            return new Clause.With(Clause.With.Source.STDIN, Clause.With.BodyType.RAW, null, false);
        }
        if (!token.quoted() && value.startsWith("@")) {
            return new Clause.With(Clause.With.Source.FILE, Clause.With.BodyType.RAW, value.substring(1), false);
        }
        if (Tokenizer.isJsonShaped(value)) {
            return new Clause.With(Clause.With.Source.INLINE, Clause.With.BodyType.JSON, value, true);
        }
        return new Clause.With(Clause.With.Source.INLINE, Clause.With.BodyType.RAW, value, false);
    }

    private static Clause backoff(final Token token, final String value) throws ParseError {
        final var matcher = BACKOFF.matcher(value);
        if (!matcher.matches()) {
            throw ErrorFactory.invalid(token, "backoff must look like '<min>..<max>', got '" + value + "'");
        }
        final var min = duration(token, matcher.group(1));
        final var max = duration(token, matcher.group(2));
        if (min.compareTo(max) > 0) {
            throw ErrorFactory.invalid(token, "backoff minimum must not exceed its maximum");
        }
        return new Clause.Backoff(min, max);
    }

    private static Duration positiveDuration(final Token token, final String value) throws ParseError {
        final var duration = duration(token, value);
        if (duration.isZero() || duration.isNegative()) {
            throw ErrorFactory.invalid(token, token.key() + " must be greater than zero");
        }
        return duration;
    }

    private static Duration duration(final Token token, final String value) throws ParseError {
        try {
            return Quantities.duration(value);
        } catch (final IllegalArgumentException e) {
            throw ErrorFactory.invalid(token, e.getMessage() + " (use e.g. 500ms, 5s, 1m30s)");
        }
    }

    private static long size(final Token token, final String value) throws ParseError {
        try {
            return Quantities.size(value);
        } catch (final IllegalArgumentException e) {
            throw ErrorFactory.invalid(token, e.getMessage());
        }
    }
}
