package com.indexsync.model;

import java.util.Optional;

/**
 * Change operation carried by an envelope's {@code op} field.
 */
public enum OperationType {

    CREATE("c"),
    UPDATE("u"),
    DELETE("d");

    private final String code;

    OperationType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /** Lower-case name used as a metrics tag and log value. */
    public String tag() {
        return name().toLowerCase();
    }

    public static Optional<OperationType> fromCode(String code) {
        for (OperationType type : values()) {
            if (type.code.equals(code)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
