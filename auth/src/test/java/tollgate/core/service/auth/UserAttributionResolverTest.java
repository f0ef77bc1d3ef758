package tollgate.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import tollgate.core.model.auth.AuthErrorKind;
import tollgate.core.model.auth.AuthException;
import tollgate.core.model.auth.Identity;
import tollgate.core.port.out.SecurityEvents;

@DisplayName("UserAttributionResolver")
@ExtendWith(MockitoExtension.class)
class UserAttributionResolverTest {

    @Mock
    private SecurityEvents securityEvents;

    private UserAttributionResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new UserAttributionResolver(securityEvents);
    }

    private static Identity alice() {
        return Identity.provider(
                "alice",
                Optional.of("alice@example.com"),
                "https://idp.example",
                Instant.now().plusSeconds(600),
                false);
    }

    @Nested
    @DisplayName("static key callers")
    class StaticKeyCallers {

        @Test
        @DisplayName("should act on behalf of the claimed user and record the service account")
        void shouldDelegate() {
            final var attribution = resolver.resolve(
                    Identity.staticKey("svc-a", false),
                    Map.of("x-user-id", "bob", "x-user-email", "bob%40example.com")::get);

            assertEquals("bob", attribution.userId());
            assertEquals(Optional.of("bob@example.com"), attribution.userEmail());
            assertEquals(Optional.of("svc-a"), attribution.serviceAccount());
            assertTrue(attribution.isDelegated());
        }

        @Test
        @DisplayName("should attribute to the service itself without user headers")
        void shouldAttributeToService() {
            final var attribution = resolver.resolve(Identity.staticKey("svc-a", false), name -> null);

            assertEquals("svc-a", attribution.userId());
            assertFalse(attribution.isDelegated());
        }
    }

    @Nested
    @DisplayName("provider callers")
    class ProviderCallers {

        @Test
        @DisplayName("should use the token identity")
        void shouldUseTokenIdentity() {
            final var attribution = resolver.resolve(alice(), Map.of("x-user-name", "Alice%20Smith")::get);

            assertEquals("alice", attribution.userId());
            assertEquals(Optional.of("alice@example.com"), attribution.userEmail());
            assertEquals(Optional.of("Alice Smith"), attribution.userName());
            assertFalse(attribution.isDelegated());
        }

        @Test
        @DisplayName("should accept headers that repeat the token identity")
        void shouldAcceptMatchingClaims() {
            final var attribution = resolver.resolve(
                    alice(), Map.of("x-user-id", "alice", "x-user-email", "alice@example.com")::get);

            assertEquals("alice", attribution.userId());
            verifyNoInteractions(securityEvents);
        }

        @Test
        @DisplayName("should deny claiming another user id")
        void shouldDenyOtherUserId() {
            final var failure = assertThrows(
                    AuthException.class, () -> resolver.resolve(alice(), Map.of("x-user-id", "bob")::get));

            assertEquals(AuthErrorKind.IMPERSONATION_DENIED, failure.kind());
            verify(securityEvents).impersonationDenied("alice", "bob");
        }

        @Test
        @DisplayName("should deny claiming another email")
        void shouldDenyOtherEmail() {
            final var failure = assertThrows(
                    AuthException.class,
                    () -> resolver.resolve(alice(), Map.of("x-user-email", "bob@example.com")::get));

            assertEquals(AuthErrorKind.IMPERSONATION_DENIED, failure.kind());
        }
    }

    @Test
    @DisplayName("should take claimed values as given when authentication is bypassed")
    void shouldPassThroughWithoutIdentity() {
        final var attribution = resolver.resolve(null, Map.of("x-user-id", "carol+dev")::get);

        assertEquals("carol+dev", attribution.userId());
        assertEquals(Optional.of("unknown"), attribution.userEmail());
    }

    @Test
    @DisplayName("should keep malformed percent-encoding as is")
    void shouldKeepInvalidEncoding() {
        final var attribution = resolver.resolve(null, Map.of("x-user-id", "bad%zz")::get);

        assertEquals("bad%zz", attribution.userId());
    }
}
