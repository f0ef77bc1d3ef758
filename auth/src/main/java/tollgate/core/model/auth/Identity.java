package tollgate.core.model.auth;

import java.time.Instant;
import java.util.Optional;

/**
 * The authenticated caller behind a request.
 *
 * @param subject   subject claim, or the key name for static keys
 * @param email     email claim if the token carried one
 * @param issuer    token issuer, {@link #STATIC_KEY_ISSUER} for static keys
 * @param expiresAt expiry of the source token, null when the credential never expires
 * @param kind      how the caller authenticated
 * @param admin     whether the subject or email is in the admin list
 */
public record Identity(
        String subject, Optional<String> email, String issuer, Instant expiresAt, Kind kind, boolean admin) {

    public static final String STATIC_KEY_ISSUER = "static_key";

    public Identity {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Subject cannot be null or blank");
        }
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalArgumentException("Issuer cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Kind cannot be null");
        }
        if (email == null) {
            email = Optional.empty();
        }
    }

    public static Identity staticKey(String name, boolean admin) {
        return new Identity(name, Optional.empty(), STATIC_KEY_ISSUER, null, Kind.STATIC_KEY, admin);
    }

    public static Identity provider(
            String subject, Optional<String> email, String issuer, Instant expiresAt, boolean admin) {
        if (expiresAt == null) {
            throw new IllegalArgumentException("Provider identities require an expiry");
        }
        return new Identity(subject, email, issuer, expiresAt, Kind.PROVIDER, admin);
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public enum Kind {
        STATIC_KEY,
        PROVIDER
    }
}
