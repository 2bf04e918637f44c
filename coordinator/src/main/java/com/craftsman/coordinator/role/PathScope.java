package com.craftsman.coordinator.role;

import com.fasterxml.jackson.annotation.JsonValue;

import java.nio.file.FileSystems;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Restricts a granted operation to paths matching a set of globs.
 *
 * Globs use {@link java.nio.file.FileSystem#getPathMatcher} syntax, so
 * {@code **.md} matches markdown files at any depth and {@code **plan**}
 * matches any path containing "plan". Paths are normalized before matching,
 * which keeps {@code plans/../src/Main.java} out of a {@code plans/**} scope.
 *
 * <p>A scope may also carry protected paths: globs that are refused even when
 * the allow globs (or an unrestricted scope) would accept them, unless one of
 * the exception globs matches too. {@code deny **.env, except **.env.example}
 * blocks {@code config/.env} but not {@code config/.env.example}.
 */
public final class PathScope {

    public static final PathScope UNRESTRICTED = new PathScope(Globs.NONE, Globs.NONE, Globs.NONE, null);

    private final Globs     allow;
    private final Globs     deny;
    private final Globs     except;
    // a path must also satisfy this scope, when set
    private final PathScope also;

    private PathScope(Globs allow, Globs deny, Globs except, PathScope also) {
        this.allow  = allow;
        this.deny   = deny;
        this.except = except;
        this.also   = also;
    }

    public static PathScope of(List<String> globs) {
        if (globs == null || globs.isEmpty()) {
            return UNRESTRICTED;
        }
        return new PathScope(Globs.of(globs), Globs.NONE, Globs.NONE, null);
    }

    /**
     * Copy of this scope that also refuses paths matching {@code denied},
     * unless they match one of {@code exceptions}. Adds to any protected
     * paths the scope already has.
     */
    public PathScope denying(List<String> denied, List<String> exceptions) {
        if (denied == null || denied.isEmpty()) {
            return this;
        }
        return new PathScope(allow, deny.plus(denied), except.plus(exceptions), also);
    }

    public boolean isUnrestricted() {
        return allow.isEmpty() && deny.isEmpty() && also == null;
    }

    /**
     * Scope accepting only paths both scopes accept. Used when a delegating
     * context hands a path-scoped grant to a role whose own grant is wider.
     */
    public PathScope intersect(PathScope other) {
        if (other == null || other.isUnrestricted() || other.equals(this)) {
            return this;
        }
        if (isUnrestricted()) {
            return other;
        }
        return new PathScope(allow, deny, except, also == null ? other : also.intersect(other));
    }

    /** Allow globs, including those of every scope this one was intersected with. */
    @JsonValue
    public List<String> globs() {
        if (also == null) {
            return allow.patterns();
        }
        List<String> all = new ArrayList<>(allow.patterns());
        all.addAll(also.globs());
        return all;
    }

    public List<String> deniedGlobs() {
        if (also == null) {
            return deny.patterns();
        }
        List<String> all = new ArrayList<>(deny.patterns());
        all.addAll(also.deniedGlobs());
        return all;
    }

    /**
     * Unrestricted scopes accept anything, including a missing path. A
     * missing path passes a scope that only protects paths, and fails one
     * with allow globs.
     */
    public boolean allows(String path) {
        if (isUnrestricted()) {
            return true;
        }
        if (also != null && !also.allows(path)) {
            return false;
        }
        if (path == null || path.isBlank()) {
            return allow.isEmpty();
        }
        Path p;
        try {
            p = Path.of(path).normalize();
        } catch (InvalidPathException e) {
            return false;
        }
        if (deny.matches(p) && !except.matches(p)) {
            return false;
        }
        return allow.isEmpty() || allow.matches(p);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PathScope other
                && allow.equals(other.allow)
                && deny.equals(other.deny)
                && except.equals(other.except)
                && Objects.equals(also, other.also);
    }

    @Override
    public int hashCode() { return Objects.hash(allow, deny, except, also); }

    @Override
    public String toString() {
        if (isUnrestricted()) {
            return "*";
        }
        StringBuilder sb = new StringBuilder(allow.isEmpty() ? "*" : String.join(",", allow.patterns()));
        if (!deny.isEmpty()) {
            sb.append(" !").append(String.join(",", deny.patterns()));
        }
        if (!except.isEmpty()) {
            sb.append(" +").append(String.join(",", except.patterns()));
        }
        if (also != null) {
            sb.append(" & ").append(also);
        }
        return sb.toString();
    }

    /** Glob patterns with their compiled matchers; equality is by pattern. */
    private record Globs(List<String> patterns, List<PathMatcher> matchers) {

        static final Globs NONE = new Globs(List.of(), List.of());

        static Globs of(List<String> patterns) {
            List<String> copy = List.copyOf(patterns);
            return new Globs(copy, copy.stream()
                    .map(g -> FileSystems.getDefault().getPathMatcher("glob:" + g))
                    .toList());
        }

        Globs plus(List<String> more) {
            if (more == null || more.isEmpty()) {
                return this;
            }
            List<String> all = new ArrayList<>(patterns);
            all.addAll(more);
            return of(all);
        }

        boolean isEmpty() { return patterns.isEmpty(); }

        boolean matches(Path path) {
            for (PathMatcher m : matchers) {
                if (m.matches(path)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Globs other && patterns.equals(other.patterns);
        }

        @Override
        public int hashCode() { return patterns.hashCode(); }
    }
}
