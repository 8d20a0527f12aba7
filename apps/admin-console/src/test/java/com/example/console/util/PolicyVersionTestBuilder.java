package com.example.console.util;

import com.example.console.abac.client.PolicyListPayload;
import com.example.console.abac.client.PolicyVersionSummary;
import com.example.console.abac.model.PolicyDocument;
import com.example.console.abac.model.PolicyMode;
import com.example.console.abac.model.PolicySet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Test builder for gateway policy listings.
 *
 * <pre>{@code
 * PolicyListPayload payload = PolicyVersionTestBuilder.aListing()
 *         .withActive("v1", PolicyMode.SHADOW)
 *         .withVersions(version("v1", 1, "published"), version("v2", 2, "draft"))
 *         .build();
 * }</pre>
 */
public class PolicyVersionTestBuilder {

    public static final String TENANT_ID = "tenant-acme";
    public static final String POLICY_SET_ID = "set-1";

    private String activeVersionId;
    private PolicyMode mode = PolicyMode.DISABLED;
    private boolean withoutSet;
    private final List<PolicyVersionSummary> versions = new ArrayList<>();

    private PolicyVersionTestBuilder() {
    }

    public static PolicyVersionTestBuilder aListing() {
        return new PolicyVersionTestBuilder();
    }

    public static PolicyVersionSummary version(String id, int versionNo, String status) {
        return new PolicyVersionSummary(id, POLICY_SET_ID, versionNo, status, "note " + versionNo, "admin-1",
                String.format("2026-01-%02dT10:00:00Z", Math.min(versionNo, 28)), null, null);
    }

    public static PolicyVersionSummary versionWithPolicy(String id, int versionNo, String status,
                                                         PolicyDocument policy) {
        return new PolicyVersionSummary(id, POLICY_SET_ID, versionNo, status, null, null,
                "2026-01-01T10:00:00Z", null, policy);
    }

    public PolicyVersionTestBuilder withActive(String versionId, PolicyMode mode) {
        this.activeVersionId = versionId;
        this.mode = mode;
        return this;
    }

    public PolicyVersionTestBuilder withoutPolicySet() {
        this.withoutSet = true;
        return this;
    }

    public PolicyVersionTestBuilder withVersions(PolicyVersionSummary... summaries) {
        this.versions.addAll(Arrays.asList(summaries));
        return this;
    }

    public PolicyListPayload build() {
        if (withoutSet) {
            return new PolicyListPayload(null, versions);
        }
        Integer activeNo = versions.stream()
                .filter(v -> v.id().equals(activeVersionId))
                .map(PolicyVersionSummary::versionNo)
                .findFirst()
                .orElse(null);
        return new PolicyListPayload(new PolicySet(POLICY_SET_ID, TENANT_ID, mode, activeVersionId, activeNo),
                versions);
    }
}
