package com.example.console.common.exception;

import com.example.console.common.AdminOperation;
import org.springframework.lang.NonNull;

import java.util.Map;

public class ResourceNotFoundException extends ConsoleException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(@NonNull AdminOperation operation, @NonNull String resourceType,
                                     @NonNull String resourceId, @NonNull String scope) {
        super(ErrorCategory.NOT_FOUND, operation, resourceType.toUpperCase() + "_NOT_FOUND",
                resourceType + " " + resourceId + " not found in " + scope);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    @NonNull
    public String getResourceType() {
        return resourceType;
    }

    @NonNull
    public String getResourceId() {
        return resourceId;
    }

    @Override
    public Map<String, Object> getDetails() {
        return Map.of("resource_type", resourceType, "resource_id", resourceId);
    }
}
