package tollgate.core.model.auth;

/**
 * Authentication failure carrying its {@link AuthErrorKind}.
 */
public class AuthException extends RuntimeException {

    private final AuthErrorKind kind;

    public AuthException(AuthErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AuthException(AuthErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public AuthErrorKind kind() {
        return kind;
    }
}
