package tollgate.spi;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.auth.TokenValidationResult;

/**
 * Service Provider Interface for bearer credential validation.
 *
 * <p>Validators are tried by the composite validator in priority order (highest first). The first
 * {@link TokenValidationResult.Valid} wins; rejections from every validator collapse into one generic
 * unauthenticated outcome.
 *
 * <h2>Built-in Validators</h2>
 * <ul>
 *   <li><b>static-key</b>: preconfigured service keys (priority: 200)</li>
 *   <li><b>provider</b>: JWTs signed by a trusted identity provider (priority: 100)</li>
 * </ul>
 *
 * <p>Implementations must not block the calling thread and must not throw for an ordinary
 * rejection; they return {@link TokenValidationResult.Invalid} instead.
 */
public interface CredentialValidator {

    /**
     * Unique name identifying this validator, used in logs and metrics.
     */
    String name();

    /**
     * Priority for validator ordering (higher = tried first).
     */
    default int priority() {
        return 0;
    }

    /**
     * Whether this validator has anything to validate against.
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Validate a bearer token.
     *
     * @param token the raw token, without the "Bearer " prefix
     * @return the validation result
     */
    Uni<TokenValidationResult> validate(String token);
}
