package com.company.trainingruns.domain.enums;

import java.util.Locale;

public enum ObjectiveDirection {
    MAXIMIZE("maximize"),
    MINIMIZE("minimize");

    private final String value;

    ObjectiveDirection(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Suffix the tracker appends to an objective name in its metric keys.
     */
    public String aliasSuffix() {
        return "_" + value;
    }

    public static ObjectiveDirection fromString(String direction) {
        if (direction == null) {
            return null;
        }
        return ObjectiveDirection.valueOf(direction.trim().toUpperCase(Locale.ROOT));
    }
}
