package com.example.console.common.exception;

import com.example.console.common.AdminOperation;
import org.springframework.lang.NonNull;

/**
 * The state the operator acted on changed underneath them, or the gateway did not
 * apply a change it acknowledged.
 */
public class ConflictException extends ConsoleException {

    public static final String ACTIVE_VERSION_CHANGED = "ACTIVE_VERSION_CHANGED";
    public static final String REVOCATION_NOT_APPLIED = "REVOCATION_NOT_APPLIED";

    public ConflictException(@NonNull AdminOperation operation, @NonNull String code, @NonNull String message) {
        super(ErrorCategory.CONFLICT, operation, code, message);
    }
}
