package com.example.console.rbac.hierarchy;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

/**
 * Outcome of validating a proposed parent for a role.
 */
public record ParentCheck(@Nullable Violation violation, @Nullable String reason) {

    public enum Violation {
        SELF_REFERENCE,
        UNKNOWN_PARENT,
        CYCLE,
        BROKEN_CHAIN,
        DEPTH_EXCEEDED
    }

    private static final ParentCheck OK = new ParentCheck(null, null);

    @NonNull
    public static ParentCheck ok() {
        return OK;
    }

    @NonNull
    public static ParentCheck rejected(@NonNull Violation violation, @NonNull String reason) {
        return new ParentCheck(violation, reason);
    }

    public boolean isValid() {
        return violation == null;
    }
}
