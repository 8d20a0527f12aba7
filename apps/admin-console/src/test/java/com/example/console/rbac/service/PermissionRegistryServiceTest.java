package com.example.console.rbac.service;

import com.example.console.common.AdminOperation;
import com.example.console.common.exception.ErrorCategory;
import com.example.console.common.exception.GatewayException;
import com.example.console.common.exception.InvalidInputException;
import com.example.console.common.exception.ResourceNotFoundException;
import com.example.console.rbac.client.RbacApiClient;
import com.example.console.rbac.client.RbacApiClient.CreatePermissionPayload;
import com.example.console.rbac.model.Permission;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static com.example.console.util.RoleTestBuilder.SERVICE_ID;
import static com.example.console.util.RoleTestBuilder.permission;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("PermissionRegistryService")
class PermissionRegistryServiceTest {

    @Mock
    private RbacApiClient rbacApiClient;

    private PermissionRegistryService service;

    @BeforeEach
    void setUp() {
        service = new PermissionRegistryService(rbacApiClient);
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("should register a well-formed new code")
        void shouldRegisterPermission() {
            Permission created = permission("p-1", "report:export");
            when(rbacApiClient.listPermissions(AdminOperation.CREATE_PERMISSION, SERVICE_ID))
                    .thenReturn(Mono.just(List.of(permission("p-0", "report:read"))));
            when(rbacApiClient.createPermission(eq(AdminOperation.CREATE_PERMISSION), any(CreatePermissionPayload.class)))
                    .thenReturn(Mono.just(created));

            StepVerifier.create(service.create(SERVICE_ID, "report:export", "Export reports", " "))
                    .expectNext(created)
                    .verifyComplete();

            ArgumentCaptor<CreatePermissionPayload> captor = ArgumentCaptor.forClass(CreatePermissionPayload.class);
            verify(rbacApiClient).createPermission(any(), captor.capture());
            assertThat(captor.getValue().code()).isEqualTo("report:export");
            assertThat(captor.getValue().serviceId()).isEqualTo(SERVICE_ID);
            assertThat(captor.getValue().description()).isNull();
        }

        @Test
        @DisplayName("should reject a code already in the catalog")
        void shouldRejectDuplicateCode() {
            when(rbacApiClient.listPermissions(AdminOperation.CREATE_PERMISSION, SERVICE_ID))
                    .thenReturn(Mono.just(List.of(permission("p-0", "report:read"))));

            StepVerifier.create(service.create(SERVICE_ID, "report:read", "Read", null))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(InvalidInputException.class);
                        assertThat(((InvalidInputException) error).getCode())
                                .isEqualTo(InvalidInputException.DUPLICATE_CODE);
                    })
                    .verify();

            verify(rbacApiClient, never()).createPermission(any(), any());
        }

        @Test
        @DisplayName("should map a gateway conflict to a duplicate code")
        void shouldMapGatewayConflict() {
            when(rbacApiClient.listPermissions(AdminOperation.CREATE_PERMISSION, SERVICE_ID))
                    .thenReturn(Mono.just(List.of()));
            when(rbacApiClient.createPermission(eq(AdminOperation.CREATE_PERMISSION), any(CreatePermissionPayload.class)))
                    .thenReturn(Mono.error(GatewayException.fromResponse(AdminOperation.CREATE_PERMISSION,
                            HttpStatus.CONFLICT, "permission code exists", null)));

            StepVerifier.create(service.create(SERVICE_ID, "report:read", "Read", null))
                    .expectErrorSatisfies(error -> {
                        assertThat(((InvalidInputException) error).getCategory()).isEqualTo(ErrorCategory.INVALID_INPUT);
                        assertThat(((InvalidInputException) error).getCode())
                                .isEqualTo(InvalidInputException.DUPLICATE_CODE);
                    })
                    .verify();
        }

        @ParameterizedTest
        @ValueSource(strings = {"report", "Report:Read", "report:", ":read", "report read", "1report:read"})
        @DisplayName("should reject malformed codes before calling the gateway")
        void shouldRejectMalformedCode(String code) {
            StepVerifier.create(service.create(SERVICE_ID, code, "Name", null))
                    .expectErrorSatisfies(error -> assertThat(((InvalidInputException) error).getField())
                            .isEqualTo("code"))
                    .verify();

            verifyNoInteractions(rbacApiClient);
        }

        @Test
        @DisplayName("should require a name")
        void shouldRequireName() {
            StepVerifier.create(service.create(SERVICE_ID, "report:read", null, null))
                    .expectErrorSatisfies(error -> assertThat(((InvalidInputException) error).getField())
                            .isEqualTo("name"))
                    .verify();

            verifyNoInteractions(rbacApiClient);
        }
    }

    @Nested
    @DisplayName("delete")
    class Delete {

        @Test
        @DisplayName("should delete a permission of the service")
        void shouldDelete() {
            when(rbacApiClient.listPermissions(AdminOperation.DELETE_PERMISSION, SERVICE_ID))
                    .thenReturn(Mono.just(List.of(permission("p-1", "report:read"))));
            when(rbacApiClient.deletePermission(AdminOperation.DELETE_PERMISSION, "p-1")).thenReturn(Mono.empty());

            StepVerifier.create(service.delete(SERVICE_ID, "p-1")).verifyComplete();

            verify(rbacApiClient).deletePermission(AdminOperation.DELETE_PERMISSION, "p-1");
        }

        @Test
        @DisplayName("should return not found for a permission of another service")
        void shouldRejectForeignPermission() {
            when(rbacApiClient.listPermissions(AdminOperation.DELETE_PERMISSION, SERVICE_ID))
                    .thenReturn(Mono.just(List.of(permission("p-1", "report:read"))));

            StepVerifier.create(service.delete(SERVICE_ID, "p-other"))
                    .expectError(ResourceNotFoundException.class)
                    .verify();

            verify(rbacApiClient, never()).deletePermission(any(), anyString());
        }
    }
}
