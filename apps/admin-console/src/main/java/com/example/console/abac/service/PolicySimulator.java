package com.example.console.abac.service;

import com.example.console.abac.client.AbacApiClient;
import com.example.console.abac.model.PolicyDocument;
import com.example.console.abac.model.SimulationInput;
import com.example.console.abac.model.SimulationResult;
import com.example.console.common.AdminOperation;
import com.example.console.common.exception.InvalidInputException;
import com.example.console.common.util.Identifiers;
import com.example.console.common.util.StringSanitizer;
import com.example.console.observability.metrics.ConsoleMetrics;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * What-if evaluation of a hypothetical request. The gateway evaluates; this side
 * only checks the request and, when one is supplied, the candidate policy.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PolicySimulator {

    private final AbacApiClient abacApiClient;
    private final PolicyDocumentParser documentParser;
    private final ConsoleMetrics metrics;

    /**
     * @param policy     candidate document; when null and {@code policyJson} is null too,
     *                   the tenant's active version is used
     * @param policyJson candidate document as raw JSON text
     */
    @NonNull
    public Mono<SimulationResult> simulate(@NonNull String tenantId, @Nullable JsonNode policy,
                                           @Nullable String policyJson, @Nullable SimulationInput input) {
        AdminOperation operation = AdminOperation.SIMULATE;
        return Mono.defer(() -> {
            String tenant = Identifiers.require(operation, "tenant_id", tenantId);
            if (input == null) {
                throw InvalidInputException.missingField(operation, "simulation");
            }
            String action = StringSanitizer.trimToNull(input.action());
            if (action == null) {
                throw InvalidInputException.missingField(operation, "action");
            }
            String resourceType = StringSanitizer.trimToNull(input.resourceType());
            if (resourceType == null) {
                throw InvalidInputException.missingField(operation, "resource_type");
            }
            PolicyDocument candidate = hasCandidate(policy, policyJson)
                    ? documentParser.resolve(operation, policy, policyJson)
                    : null;

            SimulationInput normalized = new SimulationInput(action, resourceType, input.subject(),
                    input.resource(), input.request(), input.env());

            return abacApiClient.simulate(operation, tenant, candidate, normalized)
                    .doOnNext(result -> {
                        metrics.recordSimulation(result.decision() == null ? null : result.decision().wireValue());
                        log.info("Simulated {} on {} for tenant {} against {}: {} (allow={}, deny={})",
                                StringSanitizer.forLog(action), StringSanitizer.forLog(resourceType),
                                StringSanitizer.forLog(tenant), candidate == null ? "active version" : "candidate",
                                result.decision(), result.matchedAllowRuleIds(), result.matchedDenyRuleIds());
                    });
        });
    }

    private static boolean hasCandidate(@Nullable JsonNode policy, @Nullable String policyJson) {
        return (policy != null && !policy.isNull() && !policy.isMissingNode()) || policyJson != null;
    }
}
