package com.craftsman.coordinator.tool;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * An operation a role may be permitted to invoke through the gateway.
 *
 * Not an enum: the role table may name kinds the core has
 * never heard of, and neither the router nor the gateway needs to change
 * for them. The constants below are the kinds the canonical roles use.
 */
public record OperationKind(String name) {

    public static final OperationKind READ_FILE     = new OperationKind("READ_FILE");
    public static final OperationKind WRITE_FILE    = new OperationKind("WRITE_FILE");
    public static final OperationKind SEARCH        = new OperationKind("SEARCH");
    public static final OperationKind EXECUTE_SHELL = new OperationKind("EXECUTE_SHELL");
    public static final OperationKind CREATE_PLAN   = new OperationKind("CREATE_PLAN");

    public OperationKind {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Operation kind name must not be blank");
        }
    }

    /** Parse a kind from configuration; names are case-insensitive, "read-file" is READ_FILE. */
    @JsonCreator
    public static OperationKind of(String name) {
        Objects.requireNonNull(name, "name");
        return new OperationKind(name.strip().replace('-', '_').toUpperCase(Locale.ROOT));
    }

    @JsonValue
    @Override
    public String name() { return name; }

    @Override
    public String toString() { return name; }
}
