package tollgate.core.port.out;

import tollgate.core.model.auth.AuthErrorKind;

/**
 * Port for authentication metrics.
 */
public interface AuthMetrics {

    void recordAuthenticated(String validator);

    void recordRejected(AuthErrorKind reason);

    void recordValidatorFailure(String validator, AuthErrorKind kind);

    void recordSignatureVerification(String issuer);

    void recordKeyFetch(String issuer, boolean success);

    void recordTokenCacheHit();
}
