package com.example.console.abac.controller;

import com.example.console.abac.dto.ActivationRequest;
import com.example.console.abac.dto.ActivePolicyResponse;
import com.example.console.abac.dto.DraftRequest;
import com.example.console.abac.dto.SimulateRequest;
import com.example.console.abac.model.ActivationResult;
import com.example.console.abac.model.PolicyListing;
import com.example.console.abac.model.PolicyVersion;
import com.example.console.abac.model.PolicyVersionView;
import com.example.console.abac.model.SimulationResult;
import com.example.console.abac.service.PolicySimulator;
import com.example.console.abac.service.PolicyVersionService;
import com.example.console.common.util.StringSanitizer;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/v1/tenants/{tenantId}/abac")
@RequiredArgsConstructor
public class AbacPolicyController {

    private final PolicyVersionService policyVersionService;
    private final PolicySimulator policySimulator;

    @GetMapping("/policies")
    public Mono<PolicyListing> listPolicies(@PathVariable String tenantId) {
        log.debug("GET /abac/policies - tenant: {}", StringSanitizer.forLog(tenantId));
        return policyVersionService.listVersions(tenantId);
    }

    @PostMapping("/policies")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<PolicyVersion> createDraft(@PathVariable String tenantId, @Valid @RequestBody DraftRequest request) {
        log.debug("POST /abac/policies - tenant: {}", StringSanitizer.forLog(tenantId));
        return policyVersionService.createDraft(tenantId, request.policy(), request.policyJson(), request.changeNote());
    }

    @GetMapping("/policies/{versionId}")
    public Mono<PolicyVersionView> getVersion(@PathVariable String tenantId, @PathVariable String versionId) {
        return policyVersionService.getVersion(tenantId, versionId);
    }

    @PutMapping("/policies/{versionId}")
    public Mono<PolicyVersionView> updateDraft(@PathVariable String tenantId, @PathVariable String versionId,
                                               @Valid @RequestBody DraftRequest request) {
        log.debug("PUT /abac/policies/{} - tenant: {}",
                StringSanitizer.forLog(versionId), StringSanitizer.forLog(tenantId));
        return policyVersionService.updateDraft(tenantId, versionId, request.policy(), request.policyJson(),
                request.changeNote());
    }

    @PostMapping("/policies/{versionId}/publish")
    public Mono<ActivationResult> publish(@PathVariable String tenantId, @PathVariable String versionId,
                                          @RequestBody(required = false) ActivationRequest request) {
        ActivationRequest body = request == null ? new ActivationRequest(null, null) : request;
        log.debug("POST /abac/policies/{}/publish - tenant: {}, mode: {}",
                StringSanitizer.forLog(versionId), StringSanitizer.forLog(tenantId), body.mode());
        return policyVersionService.publish(tenantId, versionId, body.mode(), body.expectedActiveVersionId());
    }

    @PostMapping("/policies/{versionId}/rollback")
    public Mono<ActivationResult> rollback(@PathVariable String tenantId, @PathVariable String versionId,
                                           @RequestBody(required = false) ActivationRequest request) {
        ActivationRequest body = request == null ? new ActivationRequest(null, null) : request;
        log.debug("POST /abac/policies/{}/rollback - tenant: {}, mode: {}",
                StringSanitizer.forLog(versionId), StringSanitizer.forLog(tenantId), body.mode());
        return policyVersionService.rollback(tenantId, versionId, body.mode(), body.expectedActiveVersionId());
    }

    @GetMapping("/active")
    public Mono<ActivePolicyResponse> getActive(@PathVariable String tenantId) {
        return policyVersionService.getActive(tenantId)
                .map(active -> new ActivePolicyResponse(tenantId, active.version(), active.mode()))
                .defaultIfEmpty(new ActivePolicyResponse(tenantId, null, null));
    }

    @PostMapping("/simulate")
    public Mono<SimulationResult> simulate(@PathVariable String tenantId, @RequestBody SimulateRequest request) {
        log.debug("POST /abac/simulate - tenant: {}", StringSanitizer.forLog(tenantId));
        return policySimulator.simulate(tenantId, request.policy(), request.policyJson(), request.simulation());
    }
}
