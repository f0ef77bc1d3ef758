package tollgate.client;

/**
 * Source of a bearer token for outbound calls. Implementations return a token that is valid for at
 * least their refresh buffer, refreshing first when needed.
 */
@FunctionalInterface
public interface TokenSupplier {

    String getToken();
}
