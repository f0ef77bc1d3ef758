package tollgate.core.model.auth;

/**
 * States a request passes through in the request gate.
 */
public enum GateState {
    UNAUTHENTICATED,
    EXTRACTING_CREDENTIAL,
    VALIDATING,
    AUTHENTICATED,
    REJECTED;

    public boolean isTerminal() {
        return this == AUTHENTICATED || this == REJECTED;
    }
}
