package com.example.console.common.exception;

import com.example.console.common.AdminOperation;
import org.springframework.lang.NonNull;

import java.util.Map;

public class NotEditableException extends ConsoleException {

    private final String versionId;
    private final String status;

    public NotEditableException(@NonNull AdminOperation operation, @NonNull String versionId, @NonNull String status) {
        super(ErrorCategory.NOT_EDITABLE, operation, "VERSION_NOT_EDITABLE",
                "Policy version " + versionId + " is " + status + "; only drafts can be edited");
        this.versionId = versionId;
        this.status = status;
    }

    @Override
    public Map<String, Object> getDetails() {
        return Map.of("version_id", versionId, "status", status);
    }
}
