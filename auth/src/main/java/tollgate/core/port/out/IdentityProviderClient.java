package tollgate.core.port.out;

import java.net.URI;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.jose4j.jwk.JsonWebKeySet;

import tollgate.core.model.auth.ClientRegistration;
import tollgate.core.model.auth.ProviderMetadata;
import tollgate.core.model.auth.TokenResponse;

/**
 * Port for talking to an OpenID Connect identity provider.
 *
 * <p>Implementations must not follow redirects and must bound every request with a timeout.
 * Failures are reported as {@link tollgate.core.model.auth.IdentityProviderException}.
 */
public interface IdentityProviderClient {

    /**
     * Fetch {@code <issuer>/.well-known/openid-configuration}.
     */
    Uni<ProviderMetadata> discover(String issuer);

    /**
     * Fetch the provider's public key set.
     */
    Uni<JsonWebKeySet> fetchKeys(URI jwksUri);

    /**
     * Exchange an authorization code together with its PKCE verifier.
     */
    Uni<TokenResponse> exchangeCode(
            URI tokenEndpoint, ClientRegistration client, String code, String codeVerifier, URI redirectUri);

    /**
     * Redeem a refresh token. The scope is re-sent because some providers only issue a fresh ID token
     * when {@code openid} is requested again.
     */
    Uni<TokenResponse> refresh(
            URI tokenEndpoint, ClientRegistration client, String refreshToken, Optional<String> scope);

    /**
     * Obtain a token for the client itself with the client_credentials grant.
     */
    Uni<TokenResponse> clientCredentials(
            URI tokenEndpoint, ClientRegistration client, Optional<String> audience, Optional<String> scope);
}
