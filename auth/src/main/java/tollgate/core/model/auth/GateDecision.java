package tollgate.core.model.auth;

/**
 * Final decision of the request gate for one request.
 */
public sealed interface GateDecision {

    /**
     * The request carries a valid credential.
     */
    record Authenticated(Identity identity) implements GateDecision {
        public Authenticated {
            if (identity == null) {
                throw new IllegalArgumentException("Identity cannot be null");
            }
        }
    }

    /**
     * The request is refused. {@code reason} is either {@link AuthErrorKind#MISSING_CREDENTIAL} or
     * {@link AuthErrorKind#UNAUTHENTICATED}.
     */
    record Rejected(AuthErrorKind reason) implements GateDecision {
        public Rejected {
            if (reason != AuthErrorKind.MISSING_CREDENTIAL && reason != AuthErrorKind.UNAUTHENTICATED) {
                throw new IllegalArgumentException("Rejections expose only generic reasons, got " + reason);
            }
        }
    }

    /**
     * Authentication is switched off for development; the request proceeds without an identity.
     */
    record Bypassed() implements GateDecision {}

    default GateState finalState() {
        return this instanceof Rejected ? GateState.REJECTED : GateState.AUTHENTICATED;
    }
}
