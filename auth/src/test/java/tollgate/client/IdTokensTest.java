package tollgate.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tollgate.core.model.auth.AuthErrorKind;
import tollgate.core.model.auth.AuthException;

@DisplayName("IdTokens")
class IdTokensTest {

    @Test
    @DisplayName("reads exp from a signed token without verifying it")
    void readsExpiry() {
        final var exp = Instant.parse("2026-03-01T13:00:00Z");

        assertEquals(Optional.of(exp), IdTokens.expiry(FakeIdentityProvider.idToken("alice", exp)));
    }

    @Test
    @DisplayName("alg=none is a security violation")
    void unsignedRejected() {
        final var e = assertThrows(AuthException.class,
                () -> IdTokens.expiry(FakeIdentityProvider.unsignedIdToken(Instant.EPOCH)));

        assertEquals(AuthErrorKind.SECURITY_VIOLATION, e.kind());
    }

    @Test
    @DisplayName("opaque tokens have no readable expiry")
    void opaqueToken() {
        assertEquals(Optional.empty(), IdTokens.expiry("opaque-token"));
        assertEquals(Optional.empty(), IdTokens.expiry("not.a.jwt"));
    }
}
