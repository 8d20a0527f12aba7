package com.example.console.common.util;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.regex.Pattern;

public final class StringSanitizer {

    private static final Pattern SAFE_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9_@.:-]{1,128}$");
    private static final int DEFAULT_LOG_MAX_LENGTH = 64;
    private static final int DEFAULT_HEADER_MAX_LENGTH = 128;

    private StringSanitizer() {}

    @NonNull
    public static String forLog(@Nullable String value) {
        return forLog(value, DEFAULT_LOG_MAX_LENGTH);
    }

    @NonNull
    public static String forLog(@Nullable String value, int maxLength) {
        if (value == null) {
            return "null";
        }
        String sanitized = value
                .replace("\n", "")
                .replace("\r", "")
                .replace("\t", "");
        return sanitized.substring(0, Math.min(sanitized.length(), maxLength));
    }

    @Nullable
    public static String headerValue(@Nullable String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.length() > DEFAULT_HEADER_MAX_LENGTH) {
            return trimmed.substring(0, DEFAULT_HEADER_MAX_LENGTH);
        }
        return trimmed;
    }

    /**
     * Null or blank becomes null, anything else is trimmed.
     */
    @Nullable
    public static String trimToNull(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    public static boolean isValidSafeId(@Nullable String id) {
        return id != null && SAFE_ID_PATTERN.matcher(id).matches();
    }
}
