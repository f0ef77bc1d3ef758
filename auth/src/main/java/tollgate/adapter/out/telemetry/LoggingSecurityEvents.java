package tollgate.adapter.out.telemetry;

import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import tollgate.core.model.auth.AuthErrorKind;
import tollgate.core.port.out.SecurityEvents;

/**
 * Writes security events to the {@code tollgate.security} log category.
 *
 * <p>Authentication failures are routine and go to DEBUG; unavailable providers are ERROR so they
 * can be alerted on.
 */
@ApplicationScoped
public class LoggingSecurityEvents implements SecurityEvents {

    private static final Logger LOG = Logger.getLogger("tollgate.security");

    @Override
    public void authenticationFailed(Map<String, AuthErrorKind> failures) {
        LOG.debugf("AUTH_FAILURE: validators=%s", failures);
    }

    @Override
    public void providerUnavailable(String issuer, String reason) {
        LOG.errorf("PROVIDER_UNAVAILABLE: issuer=%s reason=%s", issuer, reason);
    }

    @Override
    public void impersonationDenied(String subject, String claimedUser) {
        LOG.warnf("IMPERSONATION_DENIED: subject=%s claimed=%s", subject, claimedUser);
    }
}
