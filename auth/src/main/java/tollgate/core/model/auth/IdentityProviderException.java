package tollgate.core.model.auth;

/**
 * A call to an identity provider failed: transport error, unexpected status or unusable body.
 */
public class IdentityProviderException extends RuntimeException {

    private final int statusCode;

    public IdentityProviderException(String message) {
        this(message, 0);
    }

    public IdentityProviderException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public IdentityProviderException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    /**
     * HTTP status returned by the provider, or 0 when no response was received.
     */
    public int statusCode() {
        return statusCode;
    }
}
