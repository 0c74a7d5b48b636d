package com.kookykangaroo.markdown;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of nodes in a Markdown tree.
 *
 * The lower-case value is what gets persisted as the {@code type} property.
 */
public enum NodeType {

    ROOT("root"),
    HEADING("heading"),
    PARAGRAPH("paragraph");

    private final String value;

    NodeType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Resolves a persisted type value. Unknown values are empty rather than an error,
     * since the store may hold nodes written by other tools.
     */
    public static Optional<NodeType> fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equals(value))
                .findFirst();
    }
}
