package com.example.console.abac.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Mode of a tenant's policy set. {@code SHADOW} evaluates and logs decisions
 * without enforcing them.
 */
public enum PolicyMode {
    DISABLED,
    ENFORCE,
    SHADOW;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }

    /**
     * Unknown or missing values read as {@code DISABLED}, which is never a valid
     * activation mode.
     */
    @JsonCreator
    public static PolicyMode fromWire(String value) {
        if (value != null) {
            for (PolicyMode mode : values()) {
                if (mode.name().equalsIgnoreCase(value.trim())) {
                    return mode;
                }
            }
        }
        return DISABLED;
    }

    public boolean isActivationMode() {
        return this != DISABLED;
    }
}
