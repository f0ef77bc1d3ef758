package tollgate.core.port.out;

import java.util.Map;

import tollgate.core.model.auth.AuthErrorKind;

/**
 * Port for security-relevant events that operators alert on.
 */
public interface SecurityEvents {

    /**
     * Every validator rejected a credential.
     *
     * @param failures validator name to failure kind
     */
    void authenticationFailed(Map<String, AuthErrorKind> failures);

    /**
     * Discovery or key fetch for a trusted issuer failed.
     */
    void providerUnavailable(String issuer, String reason);

    /**
     * An authenticated user claimed to act as someone else.
     */
    void impersonationDenied(String subject, String claimedUser);
}
