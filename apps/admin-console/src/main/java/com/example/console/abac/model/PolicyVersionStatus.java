package com.example.console.abac.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PolicyVersionStatus {
    DRAFT,
    PUBLISHED,
    SHADOW,
    SUPERSEDED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }

    public boolean isActive() {
        return this == PUBLISHED || this == SHADOW;
    }

    public static PolicyVersionStatus activeIn(PolicyMode mode) {
        return mode == PolicyMode.SHADOW ? SHADOW : PUBLISHED;
    }
}
