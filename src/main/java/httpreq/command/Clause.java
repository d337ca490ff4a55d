package httpreq.command;

import httpreq.common.HTTPMethod;
import lombok.Value;
import lombok.experimental.Accessors;

import java.time.Duration;
import java.util.List;

/**
 * A {@code key=value} modifier or bare flag of a command. The set of variants is closed: every consumer
 * matches through {@link Visitor}, so adding a variant fails compilation at each consumer until it is handled.
 */
public interface Clause {
    String key();

    <R, E extends Exception> R accept(Visitor<R, E> visitor) throws E;

    interface Visitor<R, E extends Exception> {
        R visit(Using clause) throws E;

        R visit(With clause) throws E;

        R visit(Include clause) throws E;

        R visit(Attach clause) throws E;

        R visit(Expect clause) throws E;

        R visit(As clause) throws E;

        R visit(To clause) throws E;

        R visit(Retry clause) throws E;

        R visit(Backoff clause) throws E;

        R visit(Timeout clause) throws E;

        R visit(Under clause) throws E;

        R visit(Via clause) throws E;

        R visit(Follow clause) throws E;

        R visit(Insecure clause) throws E;

        R visit(Pick clause) throws E;

        R visit(Every clause) throws E;

        R visit(Until clause) throws E;

        R visit(Verbose clause) throws E;

        R visit(Resume clause) throws E;
    }

    @Value
    @Accessors(fluent = true)
    class Using implements Clause {
        HTTPMethod method;

        public String key() {
            return "using";
        }

        public <R, E extends Exception> R accept(final Visitor<R, E> visitor) throws E {
            return visitor.visit(this);
        }
    }

    /**
     * A request body. {@code content} is the inline text, or the file path when the source is a file.
     * {@code inferred} marks a json type guessed from the content's shape rather than written as a prefix.
     */
    @Value
    @Accessors(fluent = true)
    class With implements Clause {
        Source source;
        BodyType type;
        String content;
        boolean inferred;

        public enum Source {
            INLINE,
            FILE,
            STDIN
        }

        public enum BodyType {
            JSON,
            FORM,
            RAW
        }

        public String key() {
            return "with";
        }

        public <R, E extends Exception> R accept(final Visitor<R, E> visitor) throws E {
            return visitor.visit(this);
        }
    }

    @Value
    @Accessors(fluent = true)
    class Include implements Clause {
        List<IncludeItem> items;

        public String key() {
            return "include";
        }

        public <R, E extends Exception> R accept(final Visitor<R, E> visitor) throws E {
            return visitor.visit(this);
        }
    }

    @Value
    @Accessors(fluent = true)
    class Attach implements Clause {
        List<AttachPart> parts;
        String boundary;

        public String key() {
            return "attach";
        }

        public <R, E extends Exception> R accept(final Visitor<R, E> visitor) throws E {
            return visitor.visit(this);
        }
    }

    @Value
    @Accessors(fluent = true)
    class Expect implements Clause {
        List<ExpectCheck> checks;

        public String key() {
            return "expect";
        }

        public <R, E extends Exception> R accept(final Visitor<R, E> visitor) throws E {
            return visitor.visit(this);
        }
    }

    @Value
    @Accessors(fluent = true)
    class As implements Clause {
        Format format;

        public String key() {
            return "as";
        }

        public <R, E extends Exception> R accept(final Visitor<R, E> visitor) throws E {
            return visitor.visit(this);
        }
    }

    @Value
    @Accessors(fluent = true)
    class To implements Clause {
        String destination;

        public String key() {
            return "to";
        }

        public <R, E extends Exception> R accept(final Visitor<R, E> visitor) throws E {
            return visitor.visit(this);
        }
    }

    @Value
    @Accessors(fluent = true)
    class Retry implements Clause {
        int count;

        public String key() {
            return "retry";
        }

        public <R, E extends Exception> R accept(final Visitor<R, E> visitor) throws E {
            return visitor.visit(this);
        }
    }

    @Value
    @Accessors(fluent = true)
    class Backoff implements Clause {
        Duration min;
        Duration max;

        public String key() {
            return "backoff";
        }

        public <R, E extends Exception> R accept(final Visitor<R, E> visitor) throws E {
            return visitor.visit(this);
        }
    }

    @Value
    @Accessors(fluent = true)
    class Timeout implements Clause {
        Duration duration;

        public String key() {
            return "timeout";
        }

        public <R, E extends Exception> R accept(final Visitor<R, E> visitor) throws E {
            return visitor.visit(this);
        }
    }

    /**
     * Either a timeout or a response size limit, whichever the value parsed as.
     */
    @Value
    @Accessors(fluent = true)
    class Under implements Clause {
        Duration timeout;
        Long size;

        public static Under timeout(final Duration timeout) {
            return new Under(timeout, null);
        }

        public static Under size(final long size) {
            return new Under(null, size);
        }

        public boolean isSize() {
            return size != null;
        }

        public String key() {
            return "under";
        }

        public <R, E extends Exception> R accept(final Visitor<R, E> visitor) throws E {
            return visitor.visit(this);
        }
    }

    /**
     * A proxy URL, written as {@code via=} or its alias {@code proxy=}.
     */
    @Value
    @Accessors(fluent = true)
    class Via implements Clause {
        String key;
        String url;

        public <R, E extends Exception> R accept(final Visitor<R, E> visitor) throws E {
            return visitor.visit(this);
        }
    }

    @Value
    @Accessors(fluent = true)
    class Follow implements Clause {
        Policy policy;

        public enum Policy {
            SMART
        }

        public String key() {
            return "follow";
        }

        public <R, E extends Exception> R accept(final Visitor<R, E> visitor) throws E {
            return visitor.visit(this);
        }
    }

    @Value
    @Accessors(fluent = true)
    class Insecure implements Clause {
        boolean enabled;

        public String key() {
            return "insecure";
        }

        public <R, E extends Exception> R accept(final Visitor<R, E> visitor) throws E {
            return visitor.visit(this);
        }
    }

    @Value
    @Accessors(fluent = true)
    class Pick implements Clause {
        String path;

        public String key() {
            return "pick";
        }

        public <R, E extends Exception> R accept(final Visitor<R, E> visitor) throws E {
            return visitor.visit(this);
        }
    }

    @Value
    @Accessors(fluent = true)
    class Every implements Clause {
        Duration interval;

        public String key() {
            return "every";
        }

        public <R, E extends Exception> R accept(final Visitor<R, E> visitor) throws E {
            return visitor.visit(this);
        }
    }

    @Value
    @Accessors(fluent = true)
    class Until implements Clause {
        ExpectCheck check;

        public String key() {
            return "until";
        }

        public <R, E extends Exception> R accept(final Visitor<R, E> visitor) throws E {
            return visitor.visit(this);
        }
    }

    @Value
    @Accessors(fluent = true)
    class Verbose implements Clause {
        public String key() {
            return "verbose";
        }

        public <R, E extends Exception> R accept(final Visitor<R, E> visitor) throws E {
            return visitor.visit(this);
        }
    }

    @Value
    @Accessors(fluent = true)
    class Resume implements Clause {
        public String key() {
            return "resume";
        }

        public <R, E extends Exception> R accept(final Visitor<R, E> visitor) throws E {
            return visitor.visit(this);
        }
    }
}
