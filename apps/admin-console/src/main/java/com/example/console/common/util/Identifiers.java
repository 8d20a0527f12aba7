package com.example.console.common.util;

import com.example.console.common.AdminOperation;
import com.example.console.common.exception.InvalidInputException;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

/**
 * Guards for tenant, service, role, permission and version ids taken from request paths.
 */
public final class Identifiers {

    private Identifiers() {}

    @NonNull
    public static String require(@NonNull AdminOperation operation, @NonNull String field, @Nullable String value) {
        String trimmed = StringSanitizer.trimToNull(value);
        if (trimmed == null) {
            throw InvalidInputException.missingField(operation, field);
        }
        if (!StringSanitizer.isValidSafeId(trimmed)) {
            throw InvalidInputException.invalidValue(operation, field, field + " has an invalid format");
        }
        return trimmed;
    }

    @Nullable
    public static String optional(@NonNull AdminOperation operation, @NonNull String field, @Nullable String value) {
        return StringSanitizer.trimToNull(value) == null ? null : require(operation, field, value);
    }
}
