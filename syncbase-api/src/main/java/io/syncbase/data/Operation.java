/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.data;

/**
 * The kind of row-level change described by a {@link ChangeEvent}.
 */
public enum Operation {
    /**
     * A new row was created.
     */
    INSERT("c"),
    /**
     * An existing row was modified.
     */
    UPDATE("u"),
    /**
     * An existing row was removed.
     */
    DELETE("d");

    private final String code;

    Operation(String code) {
        this.code = code;
    }

    /**
     * Look up the operation for the given short code.
     *
     * @param code the code; may be null
     * @return the operation, or null if no operation has that code
     */
    public static Operation forCode(String code) {
        for (Operation op : Operation.values()) {
            if (op.code().equalsIgnoreCase(code)) {
                return op;
            }
        }
        return null;
    }

    /**
     * Parse the operation from either its name (e.g. {@code "INSERT"}) or its short code (e.g. {@code "c"}),
     * ignoring case and surrounding whitespace.
     *
     * @param value the textual operation; may be null
     * @return the operation, or null if the value does not name one
     */
    public static Operation parse(String value) {
        if (value == null) {
            return null;
        }
        final String trimmed = value.trim();
        for (Operation op : Operation.values()) {
            if (op.name().equalsIgnoreCase(trimmed)) {
                return op;
            }
        }
        return forCode(trimmed);
    }

    public String code() {
        return code;
    }
}
