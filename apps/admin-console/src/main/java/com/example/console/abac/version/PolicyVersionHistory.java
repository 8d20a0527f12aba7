package com.example.console.abac.version;

import com.example.console.abac.client.PolicyListPayload;
import com.example.console.abac.client.PolicyVersionSummary;
import com.example.console.abac.model.ActivePolicy;
import com.example.console.abac.model.PolicyListing;
import com.example.console.abac.model.PolicyMode;
import com.example.console.abac.model.PolicySet;
import com.example.console.abac.model.PolicyVersion;
import com.example.console.abac.model.PolicyVersionStatus;
import com.example.console.common.AdminOperation;
import com.example.console.common.exception.ConflictException;
import com.example.console.common.exception.InvalidInputException;
import com.example.console.common.exception.NotEditableException;
import com.example.console.common.exception.ResourceNotFoundException;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Snapshot of one tenant's policy versions and the state machine over them.
 *
 * <p>Statuses are derived: the gateway stores {@code draft}, {@code published}
 * or {@code archived} per version and keeps mode and active pointer on the policy
 * set. A version is {@code PUBLISHED} or {@code SHADOW} only when the set points
 * at it. Publish and rollback share {@link #planActivation}; they differ only in
 * which gateway endpoint applies the plan.
 *
 * <p>Inconsistent gateway state is never repaired here. It is listed in
 * {@link #anomalies()} so operators can see it.
 */
public final class PolicyVersionHistory {

    private static final Comparator<PolicyVersion> NEWEST_FIRST =
            Comparator.comparingInt(PolicyVersion::versionNo).reversed();

    private final String tenantId;
    private final PolicySet policySet;
    private final List<PolicyVersion> versions;
    private final List<String> anomalies;

    private PolicyVersionHistory(String tenantId, @Nullable PolicySet policySet, List<PolicyVersion> versions,
                                 List<String> anomalies) {
        this.tenantId = tenantId;
        this.policySet = policySet;
        this.versions = versions;
        this.anomalies = anomalies;
    }

    @NonNull
    public static PolicyVersionHistory fromGateway(@NonNull String tenantId, @NonNull PolicyListPayload payload) {
        PolicySet set = payload.policySet();
        String pointer = set == null ? null : set.publishedVersionId();
        List<String> anomalies = new ArrayList<>();
        List<PolicyVersion> derived = new ArrayList<>();

        for (PolicyVersionSummary row : payload.versions()) {
            boolean isPointer = row.id() != null && row.id().equals(pointer);
            String stored = row.status() == null ? "" : row.status().trim().toLowerCase();
            PolicyVersionStatus status;
            switch (stored) {
                case "draft" -> {
                    status = PolicyVersionStatus.DRAFT;
                    if (isPointer) {
                        anomalies.add("Policy set points at draft version " + row.versionNo());
                    }
                }
                case "published", "shadow", "enforce" -> {
                    if (isPointer) {
                        status = PolicyVersionStatus.activeIn(set.mode());
                    } else {
                        status = PolicyVersionStatus.SUPERSEDED;
                        anomalies.add("Version " + row.versionNo()
                                + " is stored as published but is not the active version");
                    }
                }
                case "archived", "superseded" -> {
                    status = PolicyVersionStatus.SUPERSEDED;
                    if (isPointer) {
                        anomalies.add("Policy set points at archived version " + row.versionNo());
                    }
                }
                default -> {
                    status = PolicyVersionStatus.SUPERSEDED;
                    anomalies.add("Version " + row.versionNo() + " has unknown status '" + stored + "'");
                }
            }
            derived.add(new PolicyVersion(row.id(), tenantId, row.policySetId(), row.versionNo(), status,
                    row.changeNote(), row.createdBy(), row.createdAt(), row.publishedAt()));
        }
        return of(tenantId, set, derived, anomalies);
    }

    @NonNull
    public static PolicyVersionHistory of(@NonNull String tenantId, @Nullable PolicySet policySet,
                                          @NonNull List<PolicyVersion> versions) {
        return of(tenantId, policySet, versions, List.of());
    }

    private static PolicyVersionHistory of(String tenantId, @Nullable PolicySet policySet,
                                           List<PolicyVersion> versions, List<String> derivationAnomalies) {
        List<PolicyVersion> sorted = new ArrayList<>(versions);
        sorted.sort(NEWEST_FIRST);

        List<String> anomalies = new ArrayList<>(derivationAnomalies);
        anomalies.addAll(checkNumbering(sorted));

        long activeCount = sorted.stream().filter(v -> v.status().isActive()).count();
        if (activeCount > 1) {
            anomalies.add(activeCount + " versions are active at once");
        }
        if (policySet != null && policySet.publishedVersionId() != null
                && sorted.stream().noneMatch(v -> policySet.publishedVersionId().equals(v.id()))) {
            anomalies.add("Policy set points at unknown version " + policySet.publishedVersionId());
        }
        return new PolicyVersionHistory(tenantId, policySet, List.copyOf(sorted), List.copyOf(anomalies));
    }

    /**
     * Version numbers must be unique and must grow with creation time.
     */
    private static List<String> checkNumbering(List<PolicyVersion> newestFirst) {
        List<String> anomalies = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        for (PolicyVersion version : newestFirst) {
            if (!seen.add(version.versionNo())) {
                anomalies.add("version_no " + version.versionNo() + " is used more than once");
            }
        }
        for (int i = 0; i + 1 < newestFirst.size(); i++) {
            PolicyVersion newer = newestFirst.get(i);
            PolicyVersion older = newestFirst.get(i + 1);
            OffsetDateTime newerCreated = parseTimestamp(newer.createdAt());
            OffsetDateTime olderCreated = parseTimestamp(older.createdAt());
            if (newerCreated != null && olderCreated != null && newerCreated.isBefore(olderCreated)) {
                anomalies.add("version_no " + newer.versionNo() + " was created before version_no "
                        + older.versionNo());
            }
        }
        return anomalies;
    }

    @Nullable
    private static OffsetDateTime parseTimestamp(@Nullable String value) {
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    @NonNull
    public String tenantId() {
        return tenantId;
    }

    @NonNull
    public Optional<PolicySet> policySet() {
        return Optional.ofNullable(policySet);
    }

    /**
     * Newest first.
     */
    @NonNull
    public List<PolicyVersion> versions() {
        return versions;
    }

    @NonNull
    public List<String> anomalies() {
        return anomalies;
    }

    @NonNull
    public Optional<PolicyVersion> find(@Nullable String versionId) {
        return versions.stream().filter(v -> v.id() != null && v.id().equals(versionId)).findFirst();
    }

    /**
     * The version the policy set points at, if it is in an active status.
     */
    @NonNull
    public Optional<ActivePolicy> active() {
        if (policySet == null || policySet.publishedVersionId() == null) {
            return Optional.empty();
        }
        return find(policySet.publishedVersionId())
                .filter(v -> v.status().isActive())
                .map(v -> new ActivePolicy(v, policySet.mode()));
    }

    public int maxVersionNo() {
        return versions.stream().mapToInt(PolicyVersion::versionNo).max().orElse(0);
    }

    @NonNull
    public PolicyVersion require(@NonNull AdminOperation operation, @NonNull String versionId) {
        return find(versionId).orElseThrow(() -> new ResourceNotFoundException(
                operation, "PolicyVersion", versionId, "tenant " + tenantId));
    }

    @NonNull
    public PolicyVersion requireDraft(@NonNull AdminOperation operation, @NonNull String versionId) {
        PolicyVersion version = require(operation, versionId);
        if (version.status() != PolicyVersionStatus.DRAFT) {
            throw new NotEditableException(operation, versionId, version.status().wireValue());
        }
        return version;
    }

    /**
     * Decides what activating {@code versionId} in {@code mode} does.
     *
     * @param expectedActiveVersionId when non-null, the active version the operator
     *                                last saw; a different current one is a conflict
     */
    @NonNull
    public ActivationPlan planActivation(@NonNull AdminOperation operation, @NonNull String versionId,
                                         @NonNull PolicyMode mode, @Nullable String expectedActiveVersionId) {
        if (!mode.isActivationMode()) {
            throw InvalidInputException.invalidValue(operation, "mode", "mode must be 'enforce' or 'shadow'");
        }
        PolicyVersion target = require(operation, versionId);
        Optional<ActivePolicy> current = active();
        String currentId = current.map(a -> a.version().id()).orElse(null);

        if (expectedActiveVersionId != null && !Objects.equals(expectedActiveVersionId, currentId)) {
            throw new ConflictException(operation, ConflictException.ACTIVE_VERSION_CHANGED,
                    "Active version is " + (currentId == null ? "none" : currentId)
                            + ", not " + expectedActiveVersionId + "; reload and retry");
        }

        if (current.isPresent() && target.id().equals(currentId)) {
            ActivationPlan.Kind kind = current.get().mode() == mode
                    ? ActivationPlan.Kind.NO_OP
                    : ActivationPlan.Kind.MODE_SWITCH;
            return new ActivationPlan(target, mode, current.get().version(), kind);
        }
        return new ActivationPlan(target, mode, current.map(ActivePolicy::version).orElse(null),
                ActivationPlan.Kind.ACTIVATE);
    }

    /**
     * The history as it should look once the gateway has applied {@code plan}.
     * Documents are untouched; only statuses and the set pointer move.
     */
    @NonNull
    public PolicyVersionHistory apply(@NonNull ActivationPlan plan) {
        if (!plan.changesState()) {
            return this;
        }
        PolicyVersion target = plan.target();
        List<PolicyVersion> next = versions.stream()
                .map(v -> {
                    if (target.id().equals(v.id())) {
                        return v.withStatus(PolicyVersionStatus.activeIn(plan.mode()));
                    }
                    return v.status().isActive() ? v.withStatus(PolicyVersionStatus.SUPERSEDED) : v;
                })
                .toList();
        PolicySet nextSet = policySet == null
                ? new PolicySet(target.policySetId(), tenantId, plan.mode(), target.id(), target.versionNo())
                : policySet.activate(target.id(), target.versionNo(), plan.mode());
        return of(tenantId, nextSet, next);
    }

    @NonNull
    public PolicyListing toListing() {
        return new PolicyListing(tenantId, policySet, versions,
                active().map(a -> a.version().id()).orElse(null), anomalies);
    }
}
