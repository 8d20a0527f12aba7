package com.example.console.abac.client;

import com.example.console.abac.model.PolicyDocument;
import com.example.console.abac.model.PolicyMode;
import com.example.console.abac.model.SimulationInput;
import com.example.console.abac.model.SimulationResult;
import com.example.console.common.AdminOperation;
import com.example.console.gateway.GatewayEnvelope;
import com.example.console.gateway.IdentityGatewayClient;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.RequiredArgsConstructor;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Tenant ABAC policy endpoints of the identity gateway.
 */
@Component
@RequiredArgsConstructor
public class AbacApiClient {

    private static final String POLICIES = "/api/v1/tenants/{tenantId}/abac/policies";
    private static final String VERSION = POLICIES + "/{versionId}";

    private static final ParameterizedTypeReference<GatewayEnvelope<PolicyListPayload>> LIST =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<GatewayEnvelope<PolicyVersionSummary>> DETAIL =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<GatewayEnvelope<DraftCreated>> CREATED =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<GatewayEnvelope<SimulationResult>> SIMULATION =
            new ParameterizedTypeReference<>() {};

    private final IdentityGatewayClient gateway;

    @NonNull
    public Mono<PolicyListPayload> listPolicies(@NonNull AdminOperation operation, @NonNull String tenantId) {
        return gateway.get(operation, LIST, POLICIES, tenantId)
                .defaultIfEmpty(new PolicyListPayload(null, null));
    }

    @NonNull
    public Mono<PolicyVersionSummary> getVersion(@NonNull AdminOperation operation, @NonNull String tenantId,
                                                 @NonNull String versionId) {
        return gateway.get(operation, DETAIL, VERSION, tenantId, versionId);
    }

    @NonNull
    public Mono<DraftCreated> createDraft(@NonNull AdminOperation operation, @NonNull String tenantId,
                                          @NonNull PolicyDocument policy, @Nullable String changeNote) {
        return gateway.send(operation, HttpMethod.POST, new DraftPayload(policy, changeNote), CREATED,
                POLICIES, tenantId);
    }

    @NonNull
    public Mono<Void> updateDraft(@NonNull AdminOperation operation, @NonNull String tenantId,
                                  @NonNull String versionId, @NonNull PolicyDocument policy,
                                  @Nullable String changeNote) {
        return gateway.execute(operation, HttpMethod.PUT, new DraftPayload(policy, changeNote),
                VERSION, tenantId, versionId);
    }

    @NonNull
    public Mono<Void> publish(@NonNull AdminOperation operation, @NonNull String tenantId,
                              @NonNull String versionId, @NonNull PolicyMode mode) {
        return gateway.execute(operation, HttpMethod.POST, new ActivationPayload(versionId, mode),
                VERSION + "/publish", tenantId, versionId);
    }

    @NonNull
    public Mono<Void> rollback(@NonNull AdminOperation operation, @NonNull String tenantId,
                               @NonNull String versionId, @NonNull PolicyMode mode) {
        return gateway.execute(operation, HttpMethod.POST, new ActivationPayload(versionId, mode),
                VERSION + "/rollback", tenantId, versionId);
    }

    /**
     * Evaluates {@code input} against {@code policy}, or against the tenant's
     * published version when {@code policy} is null.
     */
    @NonNull
    public Mono<SimulationResult> simulate(@NonNull AdminOperation operation, @NonNull String tenantId,
                                           @Nullable PolicyDocument policy, @NonNull SimulationInput input) {
        return gateway.send(operation, HttpMethod.POST, new SimulationPayload(policy, input), SIMULATION,
                "/api/v1/tenants/{tenantId}/abac/simulate", tenantId);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record DraftPayload(PolicyDocument policy, @JsonProperty("change_note") String changeNote) {
    }

    public record ActivationPayload(@JsonProperty("version_id") String versionId, PolicyMode mode) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SimulationPayload(PolicyDocument policy, SimulationInput simulation) {
    }
}
