package tollgate.core.model.auth;

import java.net.URI;

/**
 * The parts of an OpenID Connect discovery document this service uses.
 */
public record ProviderMetadata(URI issuer, URI jwksUri, URI authorizationEndpoint, URI tokenEndpoint) {

    public ProviderMetadata {
        if (issuer == null) {
            throw new IllegalArgumentException("issuer is required");
        }
        if (jwksUri == null) {
            throw new IllegalArgumentException("jwks_uri is required");
        }
        if (authorizationEndpoint == null) {
            throw new IllegalArgumentException("authorization_endpoint is required");
        }
        if (tokenEndpoint == null) {
            throw new IllegalArgumentException("token_endpoint is required");
        }
    }
}
