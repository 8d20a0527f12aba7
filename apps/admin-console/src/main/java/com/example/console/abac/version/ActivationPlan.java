package com.example.console.abac.version;

import com.example.console.abac.model.PolicyMode;
import com.example.console.abac.model.PolicyVersion;
import org.springframework.lang.Nullable;

/**
 * What a publish or rollback will do to a tenant's history.
 *
 * @param target   version being made active
 * @param mode     mode it will be active in
 * @param previous version active before the call, if any
 * @param kind     how the history changes
 */
public record ActivationPlan(
        PolicyVersion target,
        PolicyMode mode,
        @Nullable PolicyVersion previous,
        Kind kind
) {
    public enum Kind {
        /** Target already active in the requested mode. */
        NO_OP,
        /** Target already active; only the mode changes. */
        MODE_SWITCH,
        /** Target becomes active; the previous active version, if any, is superseded. */
        ACTIVATE
    }

    public boolean changesState() {
        return kind != Kind.NO_OP;
    }
}
