package tollgate.core.model.auth;

import java.util.Optional;

/**
 * OAuth2 client identity used at a provider's token endpoint.
 *
 * <p>A registration without a secret is a public client; the secret is sent only when configured.
 */
public record ClientRegistration(String clientId, Optional<String> clientSecret) {

    public ClientRegistration {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("Client ID is required");
        }
        if (clientSecret == null) {
            clientSecret = Optional.empty();
        }
        clientSecret = clientSecret.filter(s -> !s.isBlank());
    }

    public static ClientRegistration publicClient(String clientId) {
        return new ClientRegistration(clientId, Optional.empty());
    }

    public boolean isConfidential() {
        return clientSecret.isPresent();
    }

    @Override
    public String toString() {
        return "ClientRegistration[clientId=" + clientId + ", confidential=" + isConfidential() + "]";
    }
}
