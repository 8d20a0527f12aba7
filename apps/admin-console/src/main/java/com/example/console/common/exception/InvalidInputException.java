package com.example.console.common.exception;

import com.example.console.common.AdminOperation;
import org.springframework.lang.NonNull;

import java.util.Map;

public class InvalidInputException extends ConsoleException {

    public static final String MISSING_FIELD = "MISSING_FIELD";
    public static final String DUPLICATE_CODE = "DUPLICATE_CODE";
    public static final String INVALID_DOCUMENT = "INVALID_DOCUMENT";
    public static final String INVALID_VALUE = "INVALID_VALUE";

    private final String field;

    private InvalidInputException(AdminOperation operation, String code, String field, String message) {
        super(ErrorCategory.INVALID_INPUT, operation, code, message);
        this.field = field;
    }

    @NonNull
    public static InvalidInputException missingField(@NonNull AdminOperation operation, @NonNull String field) {
        return new InvalidInputException(operation, MISSING_FIELD, field, field + " is required");
    }

    @NonNull
    public static InvalidInputException duplicateCode(@NonNull AdminOperation operation, @NonNull String code) {
        return new InvalidInputException(operation, DUPLICATE_CODE, "code",
                "Permission code '" + code + "' already exists in this service");
    }

    @NonNull
    public static InvalidInputException invalidDocument(@NonNull AdminOperation operation, @NonNull String message) {
        return new InvalidInputException(operation, INVALID_DOCUMENT, "policy", message);
    }

    @NonNull
    public static InvalidInputException invalidValue(@NonNull AdminOperation operation, @NonNull String field,
                                                     @NonNull String message) {
        return new InvalidInputException(operation, INVALID_VALUE, field, message);
    }

    @NonNull
    public String getField() {
        return field;
    }

    @Override
    public Map<String, Object> getDetails() {
        return Map.of("field", field);
    }
}
