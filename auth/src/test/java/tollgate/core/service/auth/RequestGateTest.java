package tollgate.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import tollgate.core.config.AuthSettings;
import tollgate.core.model.auth.AuthErrorKind;
import tollgate.core.model.auth.GateDecision;
import tollgate.core.model.auth.GateState;
import tollgate.core.model.auth.Identity;
import tollgate.core.model.auth.TokenValidationResult;
import tollgate.core.port.out.AuthMetrics;

@DisplayName("RequestGate")
@ExtendWith(MockitoExtension.class)
class RequestGateTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    @Mock
    private CompositeCredentialValidator validator;

    @Mock
    private AuthMetrics metrics;

    private RequestGate gate(AuthSettings settings) {
        return new RequestGate(validator, settings, metrics);
    }

    private RequestGate enforcingGate() {
        return gate(AuthSettings.builder().build());
    }

    @Nested
    @DisplayName("admit()")
    class Admit {

        @ParameterizedTest
        @NullSource
        @ValueSource(strings = {"", "Bearer", "Bearer ", "Basic dXNlcjpwYXNz", "Bearer a b"})
        @DisplayName("should reject a missing or malformed header without calling a validator")
        void shouldRejectMissingCredential(String header) {
            final var decision = enforcingGate().admit(header).await().atMost(TIMEOUT);

            final var rejected = assertInstanceOf(GateDecision.Rejected.class, decision);
            assertEquals(AuthErrorKind.MISSING_CREDENTIAL, rejected.reason());
            assertEquals(GateState.REJECTED, decision.finalState());
            verify(validator, never()).validate(anyString());
            verify(metrics).recordRejected(AuthErrorKind.MISSING_CREDENTIAL);
        }

        @Test
        @DisplayName("should attach the identity of a valid token")
        void shouldAuthenticate() {
            final var identity = Identity.staticKey("svc-a", false);
            when(validator.validate("sk-123"))
                    .thenReturn(Uni.createFrom().item(TokenValidationResult.valid(identity)));

            final var decision = enforcingGate().admit("Bearer sk-123").await().atMost(TIMEOUT);

            assertEquals(identity, assertInstanceOf(GateDecision.Authenticated.class, decision).identity());
            assertEquals(GateState.AUTHENTICATED, decision.finalState());
        }

        @Test
        @DisplayName("should expose only a generic reason for invalid tokens")
        void shouldRejectGenerically() {
            when(validator.validate("jwt")).thenReturn(Uni.createFrom()
                    .item(TokenValidationResult.invalid(AuthErrorKind.UNAUTHENTICATED, "all failed")));

            final var decision = enforcingGate().admit("bearer jwt").await().atMost(TIMEOUT);

            assertEquals(
                    AuthErrorKind.UNAUTHENTICATED,
                    assertInstanceOf(GateDecision.Rejected.class, decision).reason());
            verify(metrics).recordRejected(AuthErrorKind.UNAUTHENTICATED);
        }

        @Test
        @DisplayName("should admit everything when authentication is disabled for development")
        void shouldBypassWhenDisabled() {
            final var gate = gate(AuthSettings.builder().disabledForDevelopment(true).build());

            final var decision = gate.admit(null).await().atMost(TIMEOUT);

            assertInstanceOf(GateDecision.Bypassed.class, decision);
            verify(validator, never()).validate(anyString());
        }

        @Test
        @DisplayName("should admit everything when authentication is switched off")
        void shouldBypassWhenNotEnabled() {
            final var gate = gate(AuthSettings.builder().enabled(false).build());

            assertInstanceOf(GateDecision.Bypassed.class, gate.admit("Bearer x").await().atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("extractBearer()")
    class ExtractBearer {

        @Test
        @DisplayName("should accept any case of the scheme and surrounding whitespace")
        void shouldExtractToken() {
            assertEquals(Optional.of("abc"), RequestGate.extractBearer("Bearer abc"));
            assertEquals(Optional.of("abc"), RequestGate.extractBearer("BEARER abc"));
            assertEquals(Optional.of("abc"), RequestGate.extractBearer("  bearer   abc  "));
        }

        @Test
        @DisplayName("should reject other schemes and empty tokens")
        void shouldRejectInvalidHeaders() {
            assertTrue(RequestGate.extractBearer(null).isEmpty());
            assertTrue(RequestGate.extractBearer("Token abc").isEmpty());
            assertTrue(RequestGate.extractBearer("Bearer    ").isEmpty());
            assertTrue(RequestGate.extractBearer("Bearerabc").isEmpty());
            assertTrue(RequestGate.extractBearer("Bearer abc def").isEmpty());
        }
    }
}
