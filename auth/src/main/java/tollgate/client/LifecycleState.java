package tollgate.client;

public enum LifecycleState {
    NO_CREDENTIALS,
    AWAITING_INTERACTIVE_LOGIN,
    HAS_VALID_TOKEN,
    REFRESHING
}
