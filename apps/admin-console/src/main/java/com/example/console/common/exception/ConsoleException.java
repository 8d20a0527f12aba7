package com.example.console.common.exception;

import com.example.console.common.AdminOperation;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * Base of every failure the console reports to an operator.
 */
public abstract class ConsoleException extends RuntimeException {

    private final ErrorCategory category;
    private final AdminOperation operation;
    private final String code;

    protected ConsoleException(@NonNull ErrorCategory category, @NonNull AdminOperation operation,
                               @NonNull String code, @NonNull String message) {
        super(message);
        this.category = category;
        this.operation = operation;
        this.code = code;
    }

    protected ConsoleException(@NonNull ErrorCategory category, @NonNull AdminOperation operation,
                               @NonNull String code, @NonNull String message, @Nullable Throwable cause) {
        super(message, cause);
        this.category = category;
        this.operation = operation;
        this.code = code;
    }

    @NonNull
    public ErrorCategory getCategory() {
        return category;
    }

    @NonNull
    public AdminOperation getOperation() {
        return operation;
    }

    @NonNull
    public String getCode() {
        return code;
    }

    /**
     * Extra context rendered under {@code details} in the error body.
     */
    @Nullable
    public Map<String, Object> getDetails() {
        return null;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "category=" + category +
                ", operation=" + operation +
                ", code='" + code + '\'' +
                ", message='" + getMessage() + '\'' +
                '}';
    }
}
