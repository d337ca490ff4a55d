package httpreq.cli;

import httpreq.Const;
import lombok.Value;
import lombok.experimental.Accessors;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The vocabulary of the command language. The tokenizer, the parser, suggestions and help text all read
 * from these tables.
 */
public final class Grammar {
    private static final String NAME_DESCRIPTION_TEMPLATE = "   %-16s%s%n";
    private static final String EXAMPLE_TEMPLATE = "   %-16s  e.g. %s%n";

    public static final List<Entry> VERBS = List.of(
        new Entry("read", "GET a resource and print it to stdout.", false, "read https://api.example.com/users as=json"),
        new Entry("save", "GET a resource and write it to a file.", false, "save https://example.com/file.zip to=file.zip"),
        new Entry("send", "Send a body; POST when with= is present.", false, "send https://api.example.com/users with='{\"name\":\"Ada\"}'"),
        new Entry("upload", "POST multipart parts or a body; requires attach= or with=.", false,
            "upload https://api.example.com/files attach='part: name=file, file=@avatar.png'"),
        new Entry("watch", "GET once, or poll with every= until a condition holds.", false,
            "watch https://api.example.com/jobs/1 every=2s until=jsonpath:$.state=done"),
        new Entry("inspect", "HEAD a resource and print its status and headers as JSON.", false, "inspect https://example.com"),
        new Entry("authenticate", "Log in and store the resulting session for the host.", false,
            "authenticate https://api.example.com/login using=POST with='{\"user\":\"ada\"}'"),
        new Entry("session", "Show, clear or use the stored session of a host.", false, "session show api.example.com"));

    public static final List<Entry> CLAUSES = List.of(
        new Entry("using", "HTTP method override.", false, "using=PUT"),
        new Entry("include", "Add headers, params, cookies and basic auth.", true,
            "include='header: Authorization: Bearer token; param: q=search query; basic: user:pass'"),
        new Entry("with", "Request body, inline, @file or @- for stdin.", false, "with=json:'{\"name\":\"Ada\"}'"),
        new Entry("attach", "Multipart parts for upload or send.", true, "attach='part: name=avatar, file=@me.png; part: name=meta, value=xyz'"),
        new Entry("expect", "Assertions on the response.", false, "expect=status:200, header:Content-Type=application/json, contains:\"ok\""),
        new Entry("as", "Output format for stdout: json, csv, text or raw.", false, "as=json"),
        new Entry("to", "Destination path.", false, "to=out.json"),
        new Entry("retry", "Retry attempts for transient errors.", false, "retry=3"),
        new Entry("backoff", "Delay range between retries.", false, "backoff=200ms..5s"),
        new Entry("timeout", "Timeout for the whole exchange.", false, "timeout=10s"),
        new Entry("under", "Timeout or response size limit.", false, "under=30s"),
        new Entry("via", "Proxy URL.", false, "via=http://proxy:8080"),
        new Entry("proxy", "Alias of via=.", false, "proxy=http://proxy:8080"),
        new Entry("follow", "Redirect policy for write verbs.", false, "follow=smart"),
        new Entry("insecure", "Disable TLS verification for this request.", false, "insecure=true"),
        new Entry("pick", "Print only the value at a JSONPath.", false, "pick=$.items[0].id"),
        new Entry("every", "Polling interval for watch.", false, "every=5s"),
        new Entry("until", "Stop watching once this check holds.", false, "until=status:200"));

    public static final List<Entry> FLAGS = List.of(
        new Entry("insecure", "Same as insecure=true.", false, "insecure"),
        new Entry("verbose", "Print the outgoing request to stderr.", false, "verbose"),
        new Entry("resume", "Continue a partial download of save.", false, "resume"));

    private static final Set<String> CLAUSE_KEYS = CLAUSES.stream().map(Entry::name).collect(Collectors.toUnmodifiableSet());
    private static final Set<String> FLAG_NAMES = FLAGS.stream().map(Entry::name).collect(Collectors.toUnmodifiableSet());

    private Grammar() {
    }

    @Value
    @Accessors(fluent = true)
    public static class Entry {
        String name;
        String description;
        boolean repeatable;
        String example;
    }

    public static boolean isClauseKey(final String key) {
        return CLAUSE_KEYS.contains(key);
    }

    public static boolean isFlag(final String word) {
        return FLAG_NAMES.contains(word);
    }

    public static boolean isRepeatable(final String key) {
        return CLAUSES.stream().anyMatch(e -> e.name().equals(key) && e.repeatable());
    }

    public static List<String> verbNames() {
        return VERBS.stream().map(Entry::name).collect(Collectors.toList());
    }

    public static List<String> clauseKeys() {
        return CLAUSES.stream().map(Entry::name).collect(Collectors.toList());
    }

    public static List<String> flagNames() {
        return FLAGS.stream().map(Entry::name).collect(Collectors.toList());
    }

    public static String help() {
        final var sb = new StringBuilder();
        sb.append(String.format("%s: an HTTP client you talk to in sentences.%n", Const.REQ));
        sb.append(String.format("%nUsage:%n   %s <verb> <url> [clauses...] [flags...]%n", Const.REQ));
        sb.append(String.format("   %s explain \"<verb> <url> [clauses...]\"%n", Const.REQ));
        sb.append(String.format("   %s session <show|clear|use> <host>%n", Const.REQ));

        sb.append(String.format("%nThe verbs are:%n"));
        for (final var verb : VERBS) {
            sb.append(String.format(NAME_DESCRIPTION_TEMPLATE, verb.name(), verb.description()));
        }

        sb.append(String.format("%nThe clauses are:%n"));
        for (final var clause : CLAUSES) {
            sb.append(String.format(
                NAME_DESCRIPTION_TEMPLATE,
                clause.name() + "=",
                clause.description() + (clause.repeatable() ? " (repeatable)" : "")));
            sb.append(String.format(EXAMPLE_TEMPLATE, "", clause.example()));
        }

        sb.append(String.format("%nThe flags are:%n"));
        for (final var flag : FLAGS) {
            sb.append(String.format(NAME_DESCRIPTION_TEMPLATE, flag.name(), flag.description()));
        }
        sb.append(String.format("   %-16sPrints the plan instead of sending the request.%n", Const.DRY_RUN));
        sb.append(String.format("   %-16sPrints this output.%n", "help"));

        sb.append(String.format("%nExamples:%n"));
        for (final var verb : VERBS) {
            sb.append(String.format("   %s %s%n", Const.REQ, verb.example()));
        }
        return sb.toString();
    }
}
