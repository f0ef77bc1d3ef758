package tollgate.core.service.auth;

import java.util.Locale;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tollgate.core.config.AuthSettings;
import tollgate.core.model.auth.AuthErrorKind;
import tollgate.core.model.auth.GateDecision;
import tollgate.core.model.auth.GateState;
import tollgate.core.model.auth.Identity;
import tollgate.core.model.auth.TokenValidationResult;
import tollgate.core.port.in.AuthenticateRequest;
import tollgate.core.port.out.AuthMetrics;

/**
 * Transport-independent authentication of one request.
 *
 * <p>Bindings hand over the raw {@code Authorization} header and turn the {@link GateDecision} into
 * their own response. A missing or malformed header is rejected without calling any validator.
 */
@ApplicationScoped
public class RequestGate implements AuthenticateRequest {

    private static final Logger LOG = Logger.getLogger(RequestGate.class);
    private static final String BEARER_PREFIX = "bearer ";

    private final CompositeCredentialValidator validator;
    private final AuthSettings settings;
    private final AuthMetrics metrics;

    @Inject
    public RequestGate(CompositeCredentialValidator validator, AuthSettings settings, AuthMetrics metrics) {
        this.validator = validator;
        this.settings = settings;
        this.metrics = metrics;
    }

    @Override
    public boolean isEnforcing() {
        return settings.authenticationRequired();
    }

    @Override
    public Uni<GateDecision> admit(String authorizationHeader) {
        if (!isEnforcing()) {
            return Uni.createFrom().item(new GateDecision.Bypassed());
        }

        final var attempt = new Attempt();
        attempt.advance(GateState.EXTRACTING_CREDENTIAL);
        final var token = extractBearer(authorizationHeader);
        if (token.isEmpty()) {
            attempt.advance(GateState.REJECTED);
            metrics.recordRejected(AuthErrorKind.MISSING_CREDENTIAL);
            LOG.debug("Rejected request without a bearer credential");
            return Uni.createFrom().item(new GateDecision.Rejected(AuthErrorKind.MISSING_CREDENTIAL));
        }

        attempt.advance(GateState.VALIDATING);
        return validator.validate(token.get()).map(result -> {
            if (result instanceof TokenValidationResult.Valid valid) {
                attempt.advance(GateState.AUTHENTICATED);
                audit(valid.identity());
                return new GateDecision.Authenticated(valid.identity());
            }
            attempt.advance(GateState.REJECTED);
            metrics.recordRejected(AuthErrorKind.UNAUTHENTICATED);
            return new GateDecision.Rejected(AuthErrorKind.UNAUTHENTICATED);
        });
    }

    /**
     * Extracts the token from an {@code Authorization: Bearer <token>} header.
     *
     * @return the token, or empty when the header is absent or not a single bearer token
     */
    public static Optional<String> extractBearer(String header) {
        if (header == null) {
            return Optional.empty();
        }
        final var trimmed = header.trim();
        if (trimmed.length() <= BEARER_PREFIX.length()
                || !trimmed.substring(0, BEARER_PREFIX.length()).toLowerCase(Locale.ROOT).equals(BEARER_PREFIX)) {
            return Optional.empty();
        }
        final var token = trimmed.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty() || token.chars().anyMatch(Character::isWhitespace)) {
            return Optional.empty();
        }
        return Optional.of(token);
    }

    private static void audit(Identity identity) {
        LOG.infov(
                "authenticated: subject={0} email={1} issuer={2} admin={3}",
                identity.subject(),
                identity.email().orElse("-"),
                identity.issuer(),
                identity.admin());
    }

    /**
     * Tracks one request through the gate states.
     */
    private static final class Attempt {
        private GateState state = GateState.UNAUTHENTICATED;

        void advance(GateState next) {
            if (!allowed(state, next)) {
                throw new IllegalStateException("Illegal gate transition " + state + " -> " + next);
            }
            LOG.tracev("Gate {0} -> {1}", state, next);
            state = next;
        }

        private static boolean allowed(GateState from, GateState to) {
            return switch (from) {
                case UNAUTHENTICATED -> to == GateState.EXTRACTING_CREDENTIAL;
                case EXTRACTING_CREDENTIAL -> to == GateState.VALIDATING || to == GateState.REJECTED;
                case VALIDATING -> to == GateState.AUTHENTICATED || to == GateState.REJECTED;
                default -> false;
            };
        }
    }
}
