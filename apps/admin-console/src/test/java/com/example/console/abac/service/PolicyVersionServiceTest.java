package com.example.console.abac.service;

import com.example.console.abac.client.AbacApiClient;
import com.example.console.abac.client.DraftCreated;
import com.example.console.abac.client.PolicyListPayload;
import com.example.console.abac.model.PolicyDocument;
import com.example.console.abac.model.PolicyMode;
import com.example.console.abac.model.PolicyVersion;
import com.example.console.abac.model.PolicyVersionStatus;
import com.example.console.abac.version.ActivationPlan;
import com.example.console.common.AdminOperation;
import com.example.console.common.exception.ConsoleException;
import com.example.console.common.exception.ErrorCategory;
import com.example.console.common.exception.InvalidInputException;
import com.example.console.common.exception.NotEditableException;
import com.example.console.observability.metrics.ConsoleMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;


import static com.example.console.util.PolicyVersionTestBuilder.POLICY_SET_ID;
import static com.example.console.util.PolicyVersionTestBuilder.TENANT_ID;
import static com.example.console.util.PolicyVersionTestBuilder.aListing;
import static com.example.console.util.PolicyVersionTestBuilder.version;
import static com.example.console.util.PolicyVersionTestBuilder.versionWithPolicy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("PolicyVersionService")
class PolicyVersionServiceTest {

    private static final String RULES = "{\"rules\": [{\"id\": \"r1\", \"effect\": \"allow\", \"actions\": [\"doc:read\"]}]}";

    @Mock
    private AbacApiClient abacApiClient;

    private PolicyVersionService service;

    @BeforeEach
    void setUp() {
        service = new PolicyVersionService(abacApiClient, new PolicyDocumentParser(new ObjectMapper()),
                new ConsoleMetrics(new SimpleMeterRegistry()));
    }

    private void givenListings(AdminOperation operation, PolicyListPayload first, PolicyListPayload... rest) {
        Mono<PolicyListPayload>[] next = toMonos(rest);
        when(abacApiClient.listPolicies(operation, TENANT_ID)).thenReturn(Mono.just(first), next);
    }

    @SuppressWarnings("unchecked")
    private static Mono<PolicyListPayload>[] toMonos(PolicyListPayload... payloads) {
        Mono<PolicyListPayload>[] monos = new Mono[payloads.length];
        for (int i = 0; i < payloads.length; i++) {
            monos[i] = Mono.just(payloads[i]);
        }
        return monos;
    }

    @Nested
    @DisplayName("publish")
    class Publish {

        @Test
        @DisplayName("should activate a draft in enforce mode by default without editing its document")
        void shouldPublishDraft() {
            givenListings(AdminOperation.PUBLISH,
                    aListing().withActive("v1", PolicyMode.ENFORCE)
                            .withVersions(version("v1", 1, "published"), version("v2", 2, "draft")).build(),
                    aListing().withActive("v2", PolicyMode.ENFORCE)
                            .withVersions(version("v1", 1, "archived"), version("v2", 2, "published")).build());
            when(abacApiClient.publish(AdminOperation.PUBLISH, TENANT_ID, "v2", PolicyMode.ENFORCE))
                    .thenReturn(Mono.empty());

            StepVerifier.create(service.publish(TENANT_ID, "v2", null, null))
                    .assertNext(result -> {
                        assertThat(result.kind()).isEqualTo(ActivationPlan.Kind.ACTIVATE);
                        assertThat(result.previousVersionId()).isEqualTo("v1");
                        assertThat(result.listing().activeVersionId()).isEqualTo("v2");
                        assertThat(result.listing().versions())
                                .filteredOn(v -> v.status() == PolicyVersionStatus.SUPERSEDED)
                                .extracting(PolicyVersion::id)
                                .containsExactly("v1");
                    })
                    .verifyComplete();

            verify(abacApiClient, never()).updateDraft(any(), anyString(), anyString(), any(), any());
        }

        @Test
        @DisplayName("should not call the gateway when the version is already active in that mode")
        void shouldSkipNoOp() {
            givenListings(AdminOperation.PUBLISH, aListing().withActive("v1", PolicyMode.SHADOW)
                    .withVersions(version("v1", 1, "published")).build());

            StepVerifier.create(service.publish(TENANT_ID, "v1", PolicyMode.SHADOW, null))
                    .assertNext(result -> assertThat(result.kind()).isEqualTo(ActivationPlan.Kind.NO_OP))
                    .verifyComplete();

            verify(abacApiClient, never()).publish(any(), anyString(), anyString(), any());
        }

        @Test
        @DisplayName("should switch a shadow version to enforce")
        void shouldSwitchMode() {
            givenListings(AdminOperation.PUBLISH,
                    aListing().withActive("v1", PolicyMode.SHADOW).withVersions(version("v1", 1, "published")).build(),
                    aListing().withActive("v1", PolicyMode.ENFORCE).withVersions(version("v1", 1, "published")).build());
            when(abacApiClient.publish(AdminOperation.PUBLISH, TENANT_ID, "v1", PolicyMode.ENFORCE))
                    .thenReturn(Mono.empty());

            StepVerifier.create(service.publish(TENANT_ID, "v1", PolicyMode.ENFORCE, "v1"))
                    .assertNext(result -> {
                        assertThat(result.kind()).isEqualTo(ActivationPlan.Kind.MODE_SWITCH);
                        assertThat(result.listing().versions().get(0).status()).isEqualTo(PolicyVersionStatus.PUBLISHED);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should reject a stale expected active version before calling the gateway")
        void shouldRejectStaleExpectation() {
            givenListings(AdminOperation.PUBLISH, aListing().withActive("v2", PolicyMode.ENFORCE)
                    .withVersions(version("v1", 1, "archived"), version("v2", 2, "published"),
                            version("v3", 3, "draft")).build());

            StepVerifier.create(service.publish(TENANT_ID, "v3", PolicyMode.ENFORCE, "v1"))
                    .expectErrorSatisfies(error -> assertThat(((ConsoleException) error)
                            .getCategory()).isEqualTo(ErrorCategory.CONFLICT))
                    .verify();

            verify(abacApiClient, never()).publish(any(), anyString(), anyString(), any());
        }
    }

    @Nested
    @DisplayName("rollback")
    class Rollback {

        @Test
        @DisplayName("should reactivate an older version through the rollback endpoint")
        void shouldRollback() {
            givenListings(AdminOperation.ROLLBACK,
                    aListing().withActive("v2", PolicyMode.ENFORCE)
                            .withVersions(version("v1", 1, "archived"), version("v2", 2, "published")).build(),
                    aListing().withActive("v1", PolicyMode.SHADOW)
                            .withVersions(version("v1", 1, "published"), version("v2", 2, "archived")).build());
            when(abacApiClient.rollback(AdminOperation.ROLLBACK, TENANT_ID, "v1", PolicyMode.SHADOW))
                    .thenReturn(Mono.empty());

            StepVerifier.create(service.rollback(TENANT_ID, "v1", PolicyMode.SHADOW, null))
                    .assertNext(result -> {
                        assertThat(result.previousVersionId()).isEqualTo("v2");
                        assertThat(result.listing().activeVersionId()).isEqualTo("v1");
                    })
                    .verifyComplete();

            verify(abacApiClient, never()).publish(any(), anyString(), anyString(), any());
        }
    }

    @Nested
    @DisplayName("updateDraft")
    class UpdateDraft {

        @Test
        @DisplayName("should refuse to edit a published version")
        void shouldRejectPublishedVersion() {
            givenListings(AdminOperation.UPDATE_DRAFT, aListing().withActive("v1", PolicyMode.ENFORCE)
                    .withVersions(version("v1", 1, "published")).build());

            StepVerifier.create(service.updateDraft(TENANT_ID, "v1", null, RULES, "tweak"))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(NotEditableException.class);
                        assertThat(((NotEditableException) error).getCategory()).isEqualTo(ErrorCategory.NOT_EDITABLE);
                    })
                    .verify();

            verify(abacApiClient, never()).updateDraft(any(), anyString(), anyString(), any(), any());
        }

        @Test
        @DisplayName("should save a draft and return it with its document")
        void shouldUpdateDraft() {
            givenListings(AdminOperation.UPDATE_DRAFT, aListing().withVersions(version("v1", 1, "draft")).build());
            when(abacApiClient.updateDraft(eq(AdminOperation.UPDATE_DRAFT), eq(TENANT_ID), eq("v1"),
                    any(PolicyDocument.class), eq("tweak")))
                    .thenReturn(Mono.empty());
            PolicyDocument saved = PolicyDocument.empty();
            when(abacApiClient.getVersion(AdminOperation.UPDATE_DRAFT, TENANT_ID, "v1"))
                    .thenReturn(Mono.just(versionWithPolicy("v1", 1, "draft", saved)));

            StepVerifier.create(service.updateDraft(TENANT_ID, "v1", null, RULES, " tweak "))
                    .assertNext(view -> {
                        assertThat(view.version().status()).isEqualTo(PolicyVersionStatus.DRAFT);
                        assertThat(view.policy()).isEqualTo(saved);
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("createDraft")
    class CreateDraft {

        @Test
        @DisplayName("should create the next version as a draft")
        void shouldCreateDraft() {
            givenListings(AdminOperation.CREATE_DRAFT,
                    aListing().withVersions(version("v1", 1, "draft")).build(),
                    aListing().withVersions(version("v1", 1, "draft"), version("v2", 2, "draft")).build());
            when(abacApiClient.createDraft(eq(AdminOperation.CREATE_DRAFT), eq(TENANT_ID), any(PolicyDocument.class),
                    eq("first cut")))
                    .thenReturn(Mono.just(new DraftCreated("v2", POLICY_SET_ID, 2, "draft")));

            StepVerifier.create(service.createDraft(TENANT_ID, null, RULES, "first cut"))
                    .assertNext(created -> {
                        assertThat(created.id()).isEqualTo("v2");
                        assertThat(created.versionNo()).isEqualTo(2);
                        assertThat(created.status()).isEqualTo(PolicyVersionStatus.DRAFT);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should reject an invalid document without calling the gateway")
        void shouldRejectInvalidDocument() {
            StepVerifier.create(service.createDraft(TENANT_ID, null, "{\"rules\": \"all\"}", null))
                    .expectError(InvalidInputException.class)
                    .verify();

            verifyNoInteractions(abacApiClient);
        }
    }

    @Nested
    @DisplayName("getActive")
    class GetActive {

        @Test
        @DisplayName("should complete empty when nothing is active")
        void shouldBeEmptyWithoutActiveVersion() {
            givenListings(AdminOperation.GET_ACTIVE, aListing().withVersions(version("v1", 1, "draft")).build());

            StepVerifier.create(service.getActive(TENANT_ID)).verifyComplete();
        }

        @Test
        @DisplayName("should return the active version and mode")
        void shouldReturnActive() {
            givenListings(AdminOperation.GET_ACTIVE, aListing().withActive("v1", PolicyMode.SHADOW)
                    .withVersions(version("v1", 1, "published")).build());

            StepVerifier.create(service.getActive(TENANT_ID))
                    .assertNext(active -> {
                        assertThat(active.version().id()).isEqualTo("v1");
                        assertThat(active.mode()).isEqualTo(PolicyMode.SHADOW);
                    })
                    .verifyComplete();
        }
    }
}
