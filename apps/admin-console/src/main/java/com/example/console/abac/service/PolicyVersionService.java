package com.example.console.abac.service;

import com.example.console.abac.client.AbacApiClient;
import com.example.console.abac.model.ActivationResult;
import com.example.console.abac.model.ActivePolicy;
import com.example.console.abac.model.PolicyDocument;
import com.example.console.abac.model.PolicyListing;
import com.example.console.abac.model.PolicyMode;
import com.example.console.abac.model.PolicyVersion;
import com.example.console.abac.model.PolicyVersionView;
import com.example.console.abac.version.ActivationPlan;
import com.example.console.abac.version.PolicyVersionHistory;
import com.example.console.common.AdminOperation;
import com.example.console.common.exception.ResourceNotFoundException;
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

import java.util.Objects;
import java.util.Optional;

/**
 * Draft, publish and rollback of a tenant's ABAC policy versions.
 *
 * <p>Each operation fetches the tenant's history, validates locally, calls the
 * gateway once and returns the re-fetched state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PolicyVersionService {

    private final AbacApiClient abacApiClient;
    private final PolicyDocumentParser documentParser;
    private final ConsoleMetrics metrics;

    @NonNull
    public Mono<PolicyListing> listVersions(@NonNull String tenantId) {
        AdminOperation operation = AdminOperation.LIST_POLICIES;
        return Mono.defer(() -> loadHistory(operation, Identifiers.require(operation, "tenant_id", tenantId))
                .map(PolicyVersionHistory::toListing));
    }

    @NonNull
    public Mono<PolicyVersionView> getVersion(@NonNull String tenantId, @NonNull String versionId) {
        AdminOperation operation = AdminOperation.GET_POLICY_VERSION;
        return Mono.defer(() -> {
            String tenant = Identifiers.require(operation, "tenant_id", tenantId);
            String version = Identifiers.require(operation, "version_id", versionId);
            return readVersion(operation, tenant, version);
        });
    }

    /**
     * Empty when the tenant has no active version.
     */
    @NonNull
    public Mono<ActivePolicy> getActive(@NonNull String tenantId) {
        AdminOperation operation = AdminOperation.GET_ACTIVE;
        return Mono.defer(() -> loadHistory(operation, Identifiers.require(operation, "tenant_id", tenantId))
                .flatMap(history -> Mono.justOrEmpty(history.active())));
    }

    @NonNull
    public Mono<PolicyVersion> createDraft(@NonNull String tenantId, @Nullable JsonNode policy,
                                           @Nullable String policyJson, @Nullable String changeNote) {
        AdminOperation operation = AdminOperation.CREATE_DRAFT;
        return Mono.defer(() -> {
            String tenant = Identifiers.require(operation, "tenant_id", tenantId);
            PolicyDocument document = documentParser.resolve(operation, policy, policyJson);

            return loadHistory(operation, tenant).flatMap(before ->
                    abacApiClient.createDraft(operation, tenant, document, StringSanitizer.trimToNull(changeNote))
                            .flatMap(created -> {
                                if (created.versionNo() <= before.maxVersionNo()) {
                                    log.error("Gateway assigned version_no {} to draft {} for tenant {}; "
                                                    + "highest existing was {}", created.versionNo(), created.id(),
                                            StringSanitizer.forLog(tenant), before.maxVersionNo());
                                }
                                log.info("Created draft {} (version {}) for tenant {} with {} rules",
                                        created.id(), created.versionNo(), StringSanitizer.forLog(tenant),
                                        document.rules().size());
                                return loadHistory(operation, tenant)
                                        .map(after -> after.require(operation, created.id()));
                            }));
        });
    }

    @NonNull
    public Mono<PolicyVersionView> updateDraft(@NonNull String tenantId, @NonNull String versionId,
                                               @Nullable JsonNode policy, @Nullable String policyJson,
                                               @Nullable String changeNote) {
        AdminOperation operation = AdminOperation.UPDATE_DRAFT;
        return Mono.defer(() -> {
            String tenant = Identifiers.require(operation, "tenant_id", tenantId);
            String version = Identifiers.require(operation, "version_id", versionId);
            PolicyDocument document = documentParser.resolve(operation, policy, policyJson);

            return loadHistory(operation, tenant)
                    .map(history -> history.requireDraft(operation, version))
                    .flatMap(draft -> abacApiClient.updateDraft(operation, tenant, version, document,
                            StringSanitizer.trimToNull(changeNote)))
                    .then(Mono.defer(() -> readVersion(operation, tenant, version)))
                    .doOnNext(view -> log.info("Updated draft {} for tenant {}",
                            version, StringSanitizer.forLog(tenant)));
        });
    }

    @NonNull
    public Mono<ActivationResult> publish(@NonNull String tenantId, @NonNull String versionId,
                                          @Nullable PolicyMode mode, @Nullable String expectedActiveVersionId) {
        return activate(AdminOperation.PUBLISH, tenantId, versionId, mode, expectedActiveVersionId);
    }

    /**
     * Same transition as {@link #publish}, aimed at an older version.
     */
    @NonNull
    public Mono<ActivationResult> rollback(@NonNull String tenantId, @NonNull String versionId,
                                           @Nullable PolicyMode mode, @Nullable String expectedActiveVersionId) {
        return activate(AdminOperation.ROLLBACK, tenantId, versionId, mode, expectedActiveVersionId);
    }

    private Mono<ActivationResult> activate(AdminOperation operation, String tenantId, String versionId,
                                            @Nullable PolicyMode requestedMode,
                                            @Nullable String expectedActiveVersionId) {
        return Mono.defer(() -> {
            String tenant = Identifiers.require(operation, "tenant_id", tenantId);
            String version = Identifiers.require(operation, "version_id", versionId);
            String expected = Identifiers.optional(operation, "expected_active_version_id", expectedActiveVersionId);
            PolicyMode mode = requestedMode == null ? PolicyMode.ENFORCE : requestedMode;

            return loadHistory(operation, tenant).flatMap(history -> {
                ActivationPlan plan = history.planActivation(operation, version, mode, expected);
                if (!plan.changesState()) {
                    log.info("{}: version {} already active in {} mode for tenant {}",
                            operation, version, mode.wireValue(), StringSanitizer.forLog(tenant));
                    metrics.recordPolicyActivation(operation, mode.wireValue(), false);
                    return Mono.just(new ActivationResult(history.toListing(), plan.kind(), previousId(plan)));
                }

                Mono<Void> call = operation == AdminOperation.ROLLBACK
                        ? abacApiClient.rollback(operation, tenant, version, mode)
                        : abacApiClient.publish(operation, tenant, version, mode);
                PolicyVersionHistory expectedState = history.apply(plan);

                return call.then(Mono.defer(() -> loadHistory(operation, tenant)))
                        .map(after -> {
                            checkApplied(operation, tenant, expectedState, after);
                            metrics.recordPolicyActivation(operation, mode.wireValue(), true);
                            log.info("{}: tenant {} active version {} -> {} ({})", operation,
                                    StringSanitizer.forLog(tenant), previousId(plan), version, mode.wireValue());
                            return new ActivationResult(after.toListing(), plan.kind(), previousId(plan));
                        });
            });
        });
    }

    private void checkApplied(AdminOperation operation, String tenantId, PolicyVersionHistory expected,
                              PolicyVersionHistory actual) {
        Optional<ActivePolicy> want = expected.active();
        Optional<ActivePolicy> got = actual.active();
        boolean matches = want.isPresent() && got.isPresent()
                && Objects.equals(want.get().version().id(), got.get().version().id())
                && want.get().mode() == got.get().mode();
        if (!matches) {
            log.warn("{}: gateway state for tenant {} differs from the requested activation: expected {}, got {}",
                    operation, StringSanitizer.forLog(tenantId), describe(want), describe(got));
        }
    }

    private static String describe(Optional<ActivePolicy> active) {
        return active.map(a -> a.version().id() + "/" + a.mode().wireValue()).orElse("none");
    }

    @Nullable
    private static String previousId(ActivationPlan plan) {
        return plan.previous() == null ? null : plan.previous().id();
    }

    private Mono<PolicyVersionView> readVersion(AdminOperation operation, String tenantId, String versionId) {
        return loadHistory(operation, tenantId).flatMap(history -> {
            PolicyVersion version = history.require(operation, versionId);
            return abacApiClient.getVersion(operation, tenantId, versionId)
                    .map(detail -> new PolicyVersionView(version,
                            detail.policy() == null ? PolicyDocument.empty() : detail.policy()))
                    .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException(
                            operation, "PolicyVersion", versionId, "tenant " + tenantId)));
        });
    }

    private Mono<PolicyVersionHistory> loadHistory(AdminOperation operation, String tenantId) {
        return abacApiClient.listPolicies(operation, tenantId)
                .map(payload -> PolicyVersionHistory.fromGateway(tenantId, payload))
                .doOnNext(history -> {
                    if (!history.anomalies().isEmpty()) {
                        log.warn("Policy history anomalies for tenant {}: {}",
                                StringSanitizer.forLog(tenantId), history.anomalies());
                        metrics.recordPolicyAnomalies(history.anomalies().size());
                    }
                });
    }
}
