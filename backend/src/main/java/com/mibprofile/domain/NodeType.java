package com.mibprofile.domain;

import java.util.Locale;

/**
 * Node kind of a compiled MIB symbol. Only leaf kinds are routed into a profile.
 */
public enum NodeType {
    SCALAR,
    COLUMN,
    NOTIFICATION,
    TRAP,
    OTHER;

    /**
     * Maps the compiler's node type string (case-insensitive) to a NodeType. Unknown or blank values map to OTHER
     * (e.g. "table", "row").
     */
    public static NodeType fromCompilerValue(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        return switch (value.strip().toLowerCase(Locale.ROOT)) {
            case "scalar" -> SCALAR;
            case "column" -> COLUMN;
            case "notification", "notificationtype" -> NOTIFICATION;
            case "trap", "traptype" -> TRAP;
            default -> OTHER;
        };
    }

    public boolean isMetric() {
        return this == SCALAR || this == COLUMN;
    }

    public boolean isTrap() {
        return this == NOTIFICATION || this == TRAP;
    }
}
