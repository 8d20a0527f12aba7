package com.example.console.abac.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Decision {
    ALLOW,
    DENY;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }

    /** Anything but {@code allow} reads as a denial. */
    @JsonCreator
    public static Decision fromWire(String value) {
        return "allow".equalsIgnoreCase(value) ? ALLOW : DENY;
    }
}
