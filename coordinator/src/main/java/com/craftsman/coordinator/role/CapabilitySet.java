package com.craftsman.coordinator.role;

import com.craftsman.coordinator.tool.OperationKind;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable set of operation kinds a role (or a delegated context) may invoke,
 * each optionally narrowed to a {@link PathScope}.
 *
 * Every "modifying" method returns a new instance.
 */
public final class CapabilitySet {

    private static final Comparator<OperationKind> BY_NAME = Comparator.comparing(OperationKind::name);

    private static final CapabilitySet EMPTY = new CapabilitySet(Map.of());

    private final Map<OperationKind, PathScope> grants;

    private CapabilitySet(Map<OperationKind, PathScope> grants) {
        TreeMap<OperationKind, PathScope> sorted = new TreeMap<>(BY_NAME);
        sorted.putAll(grants);
        this.grants = Collections.unmodifiableMap(sorted);
    }

    public static CapabilitySet empty() { return EMPTY; }

    public static CapabilitySet of(OperationKind... kinds) {
        Map<OperationKind, PathScope> m = new LinkedHashMap<>();
        for (OperationKind k : kinds) {
            m.put(k, PathScope.UNRESTRICTED);
        }
        return new CapabilitySet(m);
    }

    public static CapabilitySet of(Map<OperationKind, PathScope> grants) {
        return new CapabilitySet(grants);
    }

    /** Copy of this set with {@code kind} granted under {@code scope}. */
    public CapabilitySet with(OperationKind kind, PathScope scope) {
        Map<OperationKind, PathScope> m = new LinkedHashMap<>(grants);
        m.put(kind, scope == null ? PathScope.UNRESTRICTED : scope);
        return new CapabilitySet(m);
    }

    public boolean contains(OperationKind kind) {
        return grants.containsKey(kind);
    }

    public boolean containsAll(Collection<OperationKind> kinds) {
        return grants.keySet().containsAll(kinds);
    }

    /** Kinds from {@code requested} that this set does not hold, sorted by name. */
    public Set<OperationKind> missing(Collection<OperationKind> requested) {
        Set<OperationKind> out = new TreeSet<>(BY_NAME);
        for (OperationKind k : requested) {
            if (!grants.containsKey(k)) {
                out.add(k);
            }
        }
        return out;
    }

    /** Intersection with {@code kinds}; path scopes are kept from this set. */
    public CapabilitySet restrictTo(Collection<OperationKind> kinds) {
        Map<OperationKind, PathScope> m = new LinkedHashMap<>();
        for (OperationKind k : kinds) {
            PathScope scope = grants.get(k);
            if (scope != null) {
                m.put(k, scope);
            }
        }
        return new CapabilitySet(m);
    }

    /**
     * Kinds held by both sets. Where both scope a kind, the result only
     * accepts paths both scopes accept.
     */
    public CapabilitySet intersect(CapabilitySet other) {
        Map<OperationKind, PathScope> m = new LinkedHashMap<>();
        grants.forEach((k, scope) -> {
            PathScope theirs = other.grants.get(k);
            if (theirs != null) {
                m.put(k, scope.intersect(theirs));
            }
        });
        return new CapabilitySet(m);
    }

    /**
     * True if {@code kind} is granted and, for path-scoped grants, the
     * path falls inside the scope.
     */
    public boolean permits(OperationKind kind, String path) {
        PathScope scope = grants.get(kind);
        return scope != null && scope.allows(path);
    }

    public PathScope scopeOf(OperationKind kind) {
        return grants.get(kind);
    }

    public Set<OperationKind> kinds() {
        return grants.keySet();
    }

    public boolean isEmpty() { return grants.isEmpty(); }

    @JsonValue
    public Map<String, PathScope> asMap() {
        Map<String, PathScope> m = new LinkedHashMap<>();
        grants.forEach((k, v) -> m.put(k.name(), v));
        return m;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CapabilitySet other && grants.equals(other.grants);
    }

    @Override
    public int hashCode() { return grants.hashCode(); }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        grants.forEach((k, v) -> {
            if (sb.length() > 1) sb.append(", ");
            sb.append(k.name());
            if (!v.isUnrestricted()) sb.append('[').append(v).append(']');
        });
        return sb.append('}').toString();
    }
}
