package tollgate.core.service.auth;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tollgate.core.model.auth.AuthErrorKind;
import tollgate.core.model.auth.TokenValidationResult;
import tollgate.core.port.out.AuthMetrics;
import tollgate.core.port.out.SecurityEvents;
import tollgate.spi.CredentialValidator;

/**
 * Runs the available {@link CredentialValidator}s in priority order and returns the first success.
 *
 * <p>When every validator rejects the token the caller gets a single
 * {@link AuthErrorKind#UNAUTHENTICATED} result. The per-validator reasons go to the log, metrics and
 * security events only.
 */
@ApplicationScoped
public class CompositeCredentialValidator {

    private static final Logger LOG = Logger.getLogger(CompositeCredentialValidator.class);

    private final List<CredentialValidator> validators;
    private final AuthMetrics metrics;
    private final SecurityEvents securityEvents;

    @Inject
    public CompositeCredentialValidator(
            Instance<CredentialValidator> validatorInstances, AuthMetrics metrics, SecurityEvents securityEvents) {
        this(validatorInstances.stream().toList(), metrics, securityEvents);
    }

    public CompositeCredentialValidator(
            List<CredentialValidator> candidates, AuthMetrics metrics, SecurityEvents securityEvents) {
        this.validators = candidates.stream()
                .sorted((a, b) -> Integer.compare(b.priority(), a.priority()))
                .filter(CredentialValidator::isAvailable)
                .toList();
        this.metrics = metrics;
        this.securityEvents = securityEvents;

        if (validators.isEmpty()) {
            LOG.warn("No credential validators are available; every authenticated request will be rejected");
        } else {
            LOG.infov(
                    "Credential validators in order: {0}",
                    validators.stream().map(CredentialValidator::name).toList());
        }
    }

    public List<String> validatorNames() {
        return validators.stream().map(CredentialValidator::name).toList();
    }

    /**
     * Validate a bearer token.
     *
     * @param token the token without the "Bearer " prefix
     * @return {@link TokenValidationResult.Valid} from the first accepting validator, otherwise an
     *     {@link AuthErrorKind#UNAUTHENTICATED} rejection
     */
    public Uni<TokenValidationResult> validate(String token) {
        return validateFrom(token, 0, new LinkedHashMap<>());
    }

    private Uni<TokenValidationResult> validateFrom(String token, int index, Map<String, AuthErrorKind> failures) {
        if (index >= validators.size()) {
            return Uni.createFrom().item(reject(failures));
        }

        final var validator = validators.get(index);
        return validator
                .validate(token)
                .onFailure()
                .recoverWithItem(failure -> {
                    LOG.errorv(failure, "Validator {0} failed unexpectedly", validator.name());
                    return TokenValidationResult.invalid(AuthErrorKind.UNAUTHENTICATED, failure.getMessage());
                })
                .flatMap(result -> {
                    if (result instanceof TokenValidationResult.Valid) {
                        metrics.recordAuthenticated(validator.name());
                        return Uni.createFrom().item(result);
                    }
                    final var invalid = (TokenValidationResult.Invalid) result;
                    LOG.debugv("Validator {0} rejected token: {1} ({2})",
                            validator.name(), invalid.kind(), invalid.detail());
                    metrics.recordValidatorFailure(validator.name(), invalid.kind());
                    failures.put(validator.name(), invalid.kind());
                    return validateFrom(token, index + 1, failures);
                });
    }

    private TokenValidationResult reject(Map<String, AuthErrorKind> failures) {
        LOG.infov("Authentication failed with all validators: {0}", failures);
        securityEvents.authenticationFailed(Map.copyOf(failures));
        return TokenValidationResult.invalid(
                AuthErrorKind.UNAUTHENTICATED, "authentication failed with all validators");
    }
}
