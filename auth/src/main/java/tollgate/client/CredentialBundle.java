package tollgate.client;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Tokens held for one local user profile, in the persisted file format:
 * <pre>{@code
 * {"issuer": ..., "client_id": ..., "token": {"access_token": ..., "id_token": ...,
 *   "refresh_token": ..., "expires_at": <epoch seconds>}}
 * }</pre>
 *
 * <p>The client secret is never part of the bundle.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CredentialBundle(
        @JsonProperty("issuer") String issuer,
        @JsonProperty("client_id") String clientId,
        @JsonProperty("token") Tokens token) {

    public CredentialBundle {
        if (issuer == null || clientId == null || token == null) {
            throw new IllegalArgumentException("issuer, client_id and token are required");
        }
    }

    public Instant expiry() {
        return Instant.ofEpochSecond(token.expiresAt());
    }

    public boolean matches(ClientSettings settings) {
        return issuer.equals(settings.issuer()) && clientId.equals(settings.clientId());
    }

    @Override
    public String toString() {
        return "CredentialBundle[issuer=" + issuer + ", clientId=" + clientId + ", expiresAt=" + expiry() + "]";
    }

    /**
     * @param refreshToken null when the provider issued none
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Tokens(
            @JsonProperty("access_token") String accessToken,
            @JsonProperty("id_token") String idToken,
            @JsonProperty("refresh_token") String refreshToken,
            @JsonProperty("expires_at") long expiresAt) {

        public Tokens {
            if (accessToken == null || accessToken.isBlank()) {
                throw new IllegalArgumentException("access_token is required");
            }
            if (idToken == null || idToken.isBlank()) {
                throw new IllegalArgumentException("id_token is required");
            }
        }

        @Override
        public String toString() {
            return "Tokens[expiresAt=" + expiresAt + ", refreshable=" + (refreshToken != null) + "]";
        }
    }
}
