package tollgate.core.model.auth;

import java.util.Optional;

/**
 * Tokens returned by a provider's token endpoint.
 *
 * @param accessToken  the access token (always present on success)
 * @param idToken      the ID token, present when the openid scope was granted
 * @param refreshToken the refresh token, present if offline_access was granted or the token rotated
 * @param tokenType    token type, typically "Bearer"
 * @param expiresIn    seconds until the access token expires
 * @param scope        granted scopes, space-separated
 */
public record TokenResponse(
        String accessToken,
        Optional<String> idToken,
        Optional<String> refreshToken,
        String tokenType,
        long expiresIn,
        Optional<String> scope) {

    private static final long DEFAULT_EXPIRES_IN_SECONDS = 3600L;

    public TokenResponse {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("Access token is required");
        }
        if (tokenType == null || tokenType.isBlank()) {
            tokenType = "Bearer";
        }
        if (expiresIn <= 0) {
            expiresIn = DEFAULT_EXPIRES_IN_SECONDS;
        }
        if (idToken == null) {
            idToken = Optional.empty();
        }
        if (refreshToken == null) {
            refreshToken = Optional.empty();
        }
        if (scope == null) {
            scope = Optional.empty();
        }
    }

    @Override
    public String toString() {
        return "TokenResponse[tokenType=" + tokenType + ", expiresIn=" + expiresIn + ", idToken="
                + idToken.isPresent() + ", refreshToken=" + refreshToken.isPresent() + "]";
    }
}
