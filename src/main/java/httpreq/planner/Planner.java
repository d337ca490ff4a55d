package httpreq.planner;

import httpreq.Const;
import httpreq.command.AttachPart;
import httpreq.command.Clause;
import httpreq.command.Command;
import httpreq.command.ExpectCheck;
import httpreq.command.Format;
import httpreq.command.IncludeItem;
import httpreq.command.Verb;
import httpreq.common.HTTPMethod;
import io.vavr.Tuple;
import io.vavr.Tuple2;
import io.vavr.control.Try;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Resolves a {@link Command} into an {@link ExecutionPlan}: verb defaults first, then every clause folded
 * in source order, then validation and destination inference.
 */
@Slf4j
public final class Planner {
    static final String INCOMPATIBLE_METHOD = "verb '%s' is incompatible with method '%s'";

    private Planner() {
    }

    public static Try<ExecutionPlan> plan(final Command command) {
        return Try.of(() -> resolve(command));
    }

    public static ExecutionPlan resolve(final Command command) throws PlanError {
        if (command.isSession()) {
            throw new PlanError("session commands manage stored sessions and send no request");
        }

        final var fold = new Fold(command.verb());
        for (final var clause : command.clauses()) {
            clause.accept(fold);
        }
        final var plan = fold.build(command.target());
        log.debug("Planned {} {} {}", plan.verb().keyword(), plan.method(), plan.url());
        return plan;
    }

    static HTTPMethod defaultMethod(final Verb verb) {
        switch (verb) {
            case UPLOAD:
            case AUTHENTICATE:
                return HTTPMethod.POST;
            case INSPECT:
                return HTTPMethod.HEAD;
            default:
                return HTTPMethod.GET;
        }
    }

    static Format defaultFormat(final Verb verb) {
        switch (verb) {
            case SAVE:
                return Format.RAW;
            case INSPECT:
                return Format.JSON;
            default:
                return Format.AUTO;
        }
    }

    /**
     * Methods a verb accepts through {@code using=}; an empty set accepts any.
     */
    static Set<HTTPMethod> allowedMethods(final Verb verb) {
        switch (verb) {
            case READ:
                return Set.of(HTTPMethod.GET, HTTPMethod.HEAD, HTTPMethod.OPTIONS);
            case SAVE:
                return Set.of(HTTPMethod.GET, HTTPMethod.POST);
            case SEND:
                return Set.of(HTTPMethod.POST, HTTPMethod.PUT, HTTPMethod.PATCH);
            case UPLOAD:
                return Set.of(HTTPMethod.POST, HTTPMethod.PUT);
            case WATCH:
                return Set.of(HTTPMethod.GET);
            case INSPECT:
                return Set.of(HTTPMethod.HEAD, HTTPMethod.GET, HTTPMethod.OPTIONS);
            default:
                return Set.of();
        }
    }

    /**
     * The file name a download of {@code url} is saved under: the last path segment, percent-decoded and
     * stripped of separators, or {@value Const#DEFAULT_FILENAME} when that is empty or has no extension.
     */
    static String filenameFromUrl(final String url) {
        final String path;
        try {
            path = new URI(url).getRawPath();
        } catch (final URISyntaxException e) {
            return Const.DEFAULT_FILENAME;
        }
        if (path == null || path.isEmpty() || "/".equals(path)) {
            return Const.DEFAULT_FILENAME;
        }

        final var segments = path.split("/");
        final var last = segments.length == 0 ? "" : segments[segments.length - 1];
        var name = URLDecoder.decode(last.replace("+", "%2B"), StandardCharsets.UTF_8);
        name = name.substring(Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\')) + 1);
        if (name.isEmpty() || !name.contains(".") || ".".equals(name) || "..".equals(name)) {
            return Const.DEFAULT_FILENAME;
        }
        return name;
    }

    private static final class Fold implements Clause.Visitor<Void, PlanError> {
        private final Verb verb;
        private HTTPMethod explicitMethod;
        private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private final List<Tuple2<String, String>> queryParams = new ArrayList<>();
        private final Map<String, String> cookies = new LinkedHashMap<>();
        private BodyPlan body;
        private final List<AttachPart> parts = new ArrayList<>();
        private String boundary;
        private Format format;
        private String destination;
        private String pick;
        private Integer retryCount;
        private Duration backoffMin;
        private Duration backoffMax;
        private Duration timeout;
        private Long sizeLimit;
        private String proxy;
        private boolean insecure;
        private boolean verbose;
        private boolean resume;
        private boolean smartFollow;
        private List<ExpectCheck> expect = List.of();
        private Duration every;
        private ExpectCheck until;

        Fold(final Verb verb) {
            this.verb = verb;
            format = defaultFormat(verb);
        }

        public Void visit(final Clause.Using clause) throws PlanError {
            final var allowed = allowedMethods(verb);
            if (!allowed.isEmpty() && !allowed.contains(clause.method())) {
                throw new PlanError(String.format(INCOMPATIBLE_METHOD, verb.keyword(), clause.method()));
            }
            explicitMethod = clause.method();
            return null;
        }

        public Void visit(final Clause.With clause) {
            final var builder = BodyPlan.builder()
                .type(bodyType(clause.type()))
                .inferred(clause.inferred());
            switch (clause.source()) {
                case FILE:
                    builder.filePath(clause.content());
                    break;
                case STDIN:
                    builder.filePath(BodyPlan.STDIN);
                    break;
                default:
                    builder.content(clause.content());
                    break;
            }
            body = builder.build();
            return null;
        }

        public Void visit(final Clause.Include clause) {
            for (final var item : clause.items()) {
                switch (item.type()) {
                    case HEADER:
                        headers.put(item.name(), item.value());
                        break;
                    case PARAM:
                        queryParams.add(Tuple.of(item.name(), item.value()));
                        break;
                    case COOKIE:
                        cookies.put(item.name(), item.value());
                        break;
                    case BASIC:
                        headers.put(Const.Headers.AUTHORIZATION, basic(item));
                        break;
                    default:
                        throw new IllegalStateException("Unhandled include type: " + item.type());
                }
            }
            return null;
        }

        public Void visit(final Clause.Attach clause) {
            parts.addAll(clause.parts());
            if (clause.boundary() != null) {
                boundary = clause.boundary();
            }
            return null;
        }

        public Void visit(final Clause.Expect clause) {
            expect = clause.checks();
            return null;
        }

        public Void visit(final Clause.As clause) {
            format = clause.format();
            return null;
        }

        public Void visit(final Clause.To clause) {
            destination = clause.destination();
            return null;
        }

        public Void visit(final Clause.Retry clause) {
            retryCount = clause.count();
            return null;
        }

        public Void visit(final Clause.Backoff clause) {
            backoffMin = clause.min();
            backoffMax = clause.max();
            return null;
        }

        public Void visit(final Clause.Timeout clause) {
            timeout = clause.duration();
            return null;
        }

        public Void visit(final Clause.Under clause) {
            if (clause.isSize()) {
                sizeLimit = clause.size();
            } else {
                timeout = clause.timeout();
            }
            return null;
        }

        public Void visit(final Clause.Via clause) {
            proxy = clause.url();
            return null;
        }

        public Void visit(final Clause.Follow clause) {
            smartFollow = clause.policy() == Clause.Follow.Policy.SMART;
            return null;
        }

        public Void visit(final Clause.Insecure clause) {
            insecure = clause.enabled();
            return null;
        }

        public Void visit(final Clause.Pick clause) {
            pick = clause.path();
            return null;
        }

        public Void visit(final Clause.Every clause) throws PlanError {
            if (verb != Verb.WATCH) {
                throw new PlanError("every= is only valid for watch");
            }
            every = clause.interval();
            return null;
        }

        public Void visit(final Clause.Until clause) throws PlanError {
            if (verb != Verb.WATCH) {
                throw new PlanError("until= is only valid for watch");
            }
            until = clause.check();
            return null;
        }

        public Void visit(final Clause.Verbose clause) {
            verbose = true;
            return null;
        }

        public Void visit(final Clause.Resume clause) throws PlanError {
            if (verb != Verb.SAVE) {
                throw new PlanError("resume is only valid for save");
            }
            resume = true;
            return null;
        }

        ExecutionPlan build(final String url) throws PlanError {
            if (!parts.isEmpty()) {
                body = BodyPlan.builder()
                    .type(BodyPlan.Type.MULTIPART)
                    .parts(parts.stream().map(Fold::withFilename).collect(Collectors.toUnmodifiableList()))
                    .boundary(boundary)
                    .build();
            }
            if (verb == Verb.UPLOAD && body == null) {
                throw new PlanError("upload requires attach= or with=");
            }
            if (until != null && every == null) {
                throw new PlanError("until= needs every= to poll");
            }
            if (resume && destination == null) {
                throw new PlanError("resume needs to= naming the partial file");
            }

            final var defaultMethod = defaultMethod(verb);
            final HTTPMethod method;
            if (explicitMethod != null) {
                method = explicitMethod;
            } else if (body != null && defaultMethod == HTTPMethod.GET) {
                method = HTTPMethod.POST;
            } else {
                method = defaultMethod;
            }

            RetryPlan retry = null;
            if (retryCount != null || backoffMin != null) {
                retry = new RetryPlan(
                    retryCount != null ? retryCount : Const.DEFAULT_RETRIES_WITH_BACKOFF,
                    backoffMin != null ? backoffMin : Const.DEFAULT_BACKOFF_MIN,
                    backoffMax != null ? backoffMax : Const.DEFAULT_BACKOFF_MAX);
            }

            return ExecutionPlan.builder()
                .verb(verb)
                .method(method)
                .url(url)
                .headers(Collections.unmodifiableMap(headers))
                .queryParams(List.copyOf(queryParams))
                .cookies(Collections.unmodifiableMap(cookies))
                .body(body)
                .output(OutputPlan.builder()
                    .format(format)
                    .destination(verb == Verb.SAVE ? saveDestination(url) : destination)
                    .pick(pick)
                    .build())
                .retry(retry)
                .timeout(timeout)
                .sizeLimit(sizeLimit)
                .proxy(proxy)
                .insecure(insecure)
                .verbose(verbose)
                .resume(resume)
                .smartFollow(smartFollow)
                .expect(expect)
                .every(every)
                .until(until)
                .build();
        }

        private String saveDestination(final String url) {
            if (destination == null) {
                return filenameFromUrl(url);
            }
            final Path path = Paths.get(destination);
            if (Files.isDirectory(path)) {
                return path.resolve(filenameFromUrl(url)).toString();
            }
            return destination;
        }

        private static AttachPart withFilename(final AttachPart part) {
            if (part.isFile() && part.filename() == null) {
                final var name = Paths.get(part.file()).getFileName();
                return part.toBuilder().filename(name == null ? part.file() : name.toString()).build();
            }
            return part;
        }

        private static BodyPlan.Type bodyType(final Clause.With.BodyType type) {
            switch (type) {
                case JSON:
                    return BodyPlan.Type.JSON;
                case FORM:
                    return BodyPlan.Type.FORM;
                default:
                    return BodyPlan.Type.RAW;
            }
        }

        private static String basic(final IncludeItem item) {
            final var credentials = item.name() + ":" + item.value();
            return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
        }
    }
}
