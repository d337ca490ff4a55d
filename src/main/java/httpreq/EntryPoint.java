package httpreq;

import httpreq.cli.Grammar;
import httpreq.cli.ParseError;
import httpreq.cli.Parser;
import httpreq.client.ExecutionError;
import httpreq.client.Executor;
import httpreq.command.Command;
import httpreq.common.ExitCode;
import httpreq.planner.PlanJson;
import httpreq.planner.Planner;
import httpreq.session.FileSessionStore;
import httpreq.session.SessionCommand;
import io.vavr.control.Try;
import lombok.extern.slf4j.Slf4j;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
public class EntryPoint {

    public static void main(final String[] args) {
        final var stdout = utf8(new FileOutputStream(FileDescriptor.out));
        final var stderr = utf8(new FileOutputStream(FileDescriptor.err));
        final var code = run(args, System.getenv(), System.in, stdout, stderr, System.console() != null);
        stdout.flush();
        stderr.flush();
        System.exit(code);
    }

    /**
     * A console stream that encodes UTF-8 regardless of the platform charset.
     */
    static PrintStream utf8(final OutputStream out) {
        return new PrintStream(out, true, StandardCharsets.UTF_8);
    }

    /**
     * Runs one invocation and returns its exit code.
     */
    public static int run(
        final String[] args,
        final Map<String, String> env,
        final InputStream stdin,
        final PrintStream stdout,
        final PrintStream stderr,
        final boolean tty) {
        final List<String> words = new ArrayList<>();
        var dryRun = false;
        for (final var arg : args) {
            switch (arg) {
                case Const.DRY_RUN:
                case "-dry-run":
                    dryRun = true;
                    break;
                case "--help":
                case "-help":
                case "-h":
                    stdout.print(Grammar.help());
                    return ExitCode.SUCCESS.code();
                case "--version":
                case "-version":
                case "-v":
                    stdout.printf("%s version %s%n", Const.REQ, Const.VERSION);
                    return ExitCode.SUCCESS.code();
                default:
                    words.add(arg);
            }
        }

        if (words.isEmpty() || words.get(0).equals("help")) {
            stdout.print(Grammar.help());
            return ExitCode.SUCCESS.code();
        }

        final Configuration configuration;
        try {
            configuration = Configuration.load(env);
        } catch (final IllegalArgumentException e) {
            return fail(stderr, e);
        }
        log.debug("Configuration directory: {}", configuration.configDir());

        if (words.get(0).equals("explain")) {
            if (words.size() < 2) {
                stderr.printf("Usage: %s explain \"<command>\"%n", Const.REQ);
                return ExitCode.INVALID.code();
            }
            return explain(String.join(" ", words.subList(1, words.size())), stdout, stderr, tty);
        }

        final var line = String.join(" ", words);
        final var parsed = Parser.parse(line);
        if (parsed.isFailure()) {
            return fail(stderr, parsed.getCause());
        }
        final Command command = parsed.get();

        if (command.isSession()) {
            return Try.run(() -> new SessionCommand(new FileSessionStore(configuration.configDir()), stdout).run(command))
                .fold(failure -> fail(stderr, failure), nothing -> ExitCode.SUCCESS.code());
        }

        if (dryRun) {
            return explain(line, stdout, stderr, tty);
        }

        return Planner.plan(command)
            .flatMap(plan -> Executor.builder()
                .configuration(configuration)
                .sessions(new FileSessionStore(configuration.configDir()))
                .stdin(stdin)
                .stdout(stdout)
                .stderr(stderr)
                .tty(tty)
                .build()
                .execute(plan))
            .fold(failure -> fail(stderr, failure), exchange -> ExitCode.SUCCESS.code());
    }

    private static int explain(final String line, final PrintStream stdout, final PrintStream stderr, final boolean tty) {
        return Parser.parse(line)
            .flatMap(Planner::plan)
            .fold(failure -> fail(stderr, failure), plan -> {
                stdout.println(PlanJson.render(plan, tty));
                return ExitCode.SUCCESS.code();
            });
    }

    static int fail(final PrintStream stderr, final Throwable failure) {
        stderr.println("Error: " + failure.getMessage());
        if (failure instanceof ParseError) {
            ((ParseError) failure).suggestion().forEach(suggestion -> stderr.printf("Hint: Try using '%s' instead%n", suggestion));
        }
        if (failure instanceof ExecutionError) {
            return ((ExecutionError) failure).exitCode().code();
        }
        log.debug("Invalid invocation", failure);
        return ExitCode.INVALID.code();
    }
}
