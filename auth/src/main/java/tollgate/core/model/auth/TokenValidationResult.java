package tollgate.core.model.auth;

/**
 * Outcome of validating one bearer token with one validator.
 */
public sealed interface TokenValidationResult {

    /**
     * Token accepted.
     */
    record Valid(Identity identity) implements TokenValidationResult {
        public Valid {
            if (identity == null) {
                throw new IllegalArgumentException("Identity cannot be null");
            }
        }
    }

    /**
     * Token rejected. {@code detail} is for logs only and never reaches the caller.
     */
    record Invalid(AuthErrorKind kind, String detail) implements TokenValidationResult {
        public Invalid {
            if (kind == null) {
                throw new IllegalArgumentException("Kind cannot be null");
            }
            if (detail == null) {
                detail = kind.tag();
            }
        }
    }

    static TokenValidationResult valid(Identity identity) {
        return new Valid(identity);
    }

    static TokenValidationResult invalid(AuthErrorKind kind, String detail) {
        return new Invalid(kind, detail);
    }
}
