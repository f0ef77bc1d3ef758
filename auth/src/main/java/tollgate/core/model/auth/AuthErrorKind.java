package tollgate.core.model.auth;

import java.util.Locale;

/**
 * Classification of authentication failures.
 *
 * <p>The specific kind is kept for logs and metrics. Callers of the request gate only ever see
 * {@link #MISSING_CREDENTIAL} or {@link #UNAUTHENTICATED}.
 */
public enum AuthErrorKind {
    MISSING_CREDENTIAL,
    INVALID_CREDENTIAL,
    MALFORMED_TOKEN,
    PROVIDER_UNKNOWN,
    PROVIDER_UNAVAILABLE,
    INVALID_SIGNATURE,
    EXPIRED_TOKEN,
    NOT_YET_VALID,
    AUDIENCE_MISMATCH,
    ISSUER_MISMATCH,
    SECURITY_VIOLATION,
    REFRESH_FAILED,
    LOGIN_REQUIRED,
    LOGIN_FAILED,
    IMPERSONATION_DENIED,
    UNAUTHENTICATED;

    /**
     * Lower-case tag used as a metric dimension and in log lines.
     */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
