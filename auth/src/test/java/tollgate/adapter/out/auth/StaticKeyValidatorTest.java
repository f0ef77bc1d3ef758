package tollgate.adapter.out.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import tollgate.core.config.AuthSettings;
import tollgate.core.model.auth.AuthErrorKind;
import tollgate.core.model.auth.Identity;
import tollgate.core.model.auth.TokenValidationResult;

@DisplayName("StaticKeyValidator")
class StaticKeyValidatorTest {

    private static StaticKeyValidator validator(boolean constantTime) {
        return new StaticKeyValidator(AuthSettings.builder()
                .staticKey("svc-a", "sk-123")
                .staticKey("svc-b", "sk-456")
                .admin("svc-b")
                .constantTimeKeyCompare(constantTime)
                .build());
    }

    private static TokenValidationResult validate(StaticKeyValidator validator, String token) {
        return validator.validate(token).await().atMost(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("should be unavailable without configured keys")
    void shouldBeUnavailableWithoutKeys() {
        final var validator = new StaticKeyValidator(AuthSettings.builder().build());

        assertFalse(validator.isAvailable());
        assertEquals("static-key", validator.name());
        assertEquals(200, validator.priority());
    }

    @Nested
    @DisplayName("hash lookup")
    class HashLookup {

        private final StaticKeyValidator validator = validator(false);

        @Test
        @DisplayName("should map a known key to its service name")
        void shouldAcceptKnownKey() {
            final var identity = assertInstanceOf(
                            TokenValidationResult.Valid.class, validate(validator, "sk-123"))
                    .identity();

            assertEquals("svc-a", identity.subject());
            assertEquals(Identity.STATIC_KEY_ISSUER, identity.issuer());
            assertEquals(Identity.Kind.STATIC_KEY, identity.kind());
            assertNull(identity.expiresAt());
            assertFalse(identity.admin());
        }

        @Test
        @DisplayName("should flag admin services")
        void shouldFlagAdmin() {
            final var result = validate(validator, "sk-456");

            assertTrue(assertInstanceOf(TokenValidationResult.Valid.class, result).identity().admin());
        }

        @ParameterizedTest
        @ValueSource(strings = {"sk-999", "SK-123", "sk-12", "sk-1234"})
        @DisplayName("should reject unknown keys")
        void shouldRejectUnknownKey(String token) {
            final var result = assertInstanceOf(TokenValidationResult.Invalid.class, validate(validator, token));

            assertEquals(AuthErrorKind.INVALID_CREDENTIAL, result.kind());
        }

        @Test
        @DisplayName("should report MISSING_CREDENTIAL for a blank token")
        void shouldRejectBlank() {
            final var result = assertInstanceOf(TokenValidationResult.Invalid.class, validate(validator, ""));

            assertEquals(AuthErrorKind.MISSING_CREDENTIAL, result.kind());
        }
    }

    @Nested
    @DisplayName("constant-time comparison")
    class ConstantTime {

        private final StaticKeyValidator validator = validator(true);

        @Test
        @DisplayName("should accept known keys")
        void shouldAcceptKnownKeys() {
            assertEquals(
                    "svc-a",
                    assertInstanceOf(TokenValidationResult.Valid.class, validate(validator, "sk-123"))
                            .identity()
                            .subject());
            assertEquals(
                    "svc-b",
                    assertInstanceOf(TokenValidationResult.Valid.class, validate(validator, "sk-456"))
                            .identity()
                            .subject());
        }

        @Test
        @DisplayName("should reject unknown keys")
        void shouldRejectUnknownKey() {
            final var result = assertInstanceOf(TokenValidationResult.Invalid.class, validate(validator, "sk-000"));

            assertEquals(AuthErrorKind.INVALID_CREDENTIAL, result.kind());
        }
    }
}
