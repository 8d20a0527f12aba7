package com.example.console.observability.metrics;

import com.example.console.common.AdminOperation;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Console-specific metrics. Tag values come from closed enums or are sanitized
 * to keep cardinality bounded.
 */
@Component
public class ConsoleMetrics {

    private static final String OUTCOME_SUCCESS = "success";
    private static final String OUTCOME_FAILURE = "failure";
    private static final String TAG_UNKNOWN = "unknown";
    private static final int MAX_TAG_LENGTH = 32;

    private final MeterRegistry registry;

    private final Counter revocationMismatch;

    public ConsoleMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.revocationMismatch = Counter.builder("rbac.revocation.mismatch")
                .description("Unbind calls the gateway acknowledged without removing the edge")
                .register(registry);
    }

    public void recordGatewayCall(@NonNull AdminOperation operation, boolean success, @NonNull Duration duration) {
        Timer.builder("identity_gateway.request")
                .description("Identity gateway call duration")
                .tag("operation", operation.label())
                .tag("outcome", success ? OUTCOME_SUCCESS : OUTCOME_FAILURE)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(duration.toNanos(), TimeUnit.NANOSECONDS);
    }

    public void recordPolicyActivation(@NonNull AdminOperation operation, @Nullable String mode, boolean changed) {
        registry.counter("abac.policy.activation",
                Tags.of("operation", operation.label(),
                        "mode", sanitizeTag(mode),
                        "result", changed ? "applied" : "unchanged"))
                .increment();
    }

    public void recordSimulation(@Nullable String decision) {
        registry.counter("abac.simulation", Tags.of("decision", sanitizeTag(decision))).increment();
    }

    public void recordHierarchyAnomalies(int orphaned, int cyclic, int crossService) {
        if (orphaned > 0) {
            registry.counter("rbac.hierarchy.anomalies", Tags.of("kind", "orphaned")).increment(orphaned);
        }
        if (cyclic > 0) {
            registry.counter("rbac.hierarchy.anomalies", Tags.of("kind", "cyclic")).increment(cyclic);
        }
        if (crossService > 0) {
            registry.counter("rbac.hierarchy.anomalies", Tags.of("kind", "cross_service")).increment(crossService);
        }
    }

    public void recordPolicyAnomalies(int count) {
        if (count > 0) {
            registry.counter("abac.policy.anomalies").increment(count);
        }
    }

    public void recordRevocationMismatch() {
        revocationMismatch.increment();
    }

    @NonNull
    private String sanitizeTag(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return TAG_UNKNOWN;
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_-]", "_");
        if (sanitized.length() > MAX_TAG_LENGTH) {
            sanitized = sanitized.substring(0, MAX_TAG_LENGTH);
        }
        return sanitized.isBlank() ? TAG_UNKNOWN : sanitized;
    }
}
