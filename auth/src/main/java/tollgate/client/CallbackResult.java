package tollgate.client;

/**
 * What arrived at the loopback callback for one login attempt.
 */
public sealed interface CallbackResult {

    /**
     * State matched and the provider issued a code.
     */
    record Authorized(String code) implements CallbackResult {
        @Override
        public String toString() {
            return "Authorized[code=***]";
        }
    }

    /**
     * The returned state was absent or not the one issued for this attempt. The code was not read.
     */
    record StateMismatch() implements CallbackResult {}

    /**
     * State matched but the provider reported an error or sent no code.
     */
    record Denied(String error, String description) implements CallbackResult {}
}
