package tollgate.client;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

import tollgate.core.model.auth.ClientRegistration;

/**
 * Immutable settings for the client-side token lifecycle.
 *
 * <p>Read from MicroProfile Config with {@link #fromConfig()}, which also picks up environment
 * variables such as {@code TOLLGATE_CLIENT_ISSUER}:
 * <pre>
 * tollgate.client.issuer=https://idp.example
 * tollgate.client.client-id=cli
 * tollgate.client.token-file=/home/me/.tollgate/tokens.json
 * </pre>
 */
public record ClientSettings(
        String issuer,
        String clientId,
        Optional<String> clientSecret,
        Optional<String> audience,
        String scope,
        URI redirectUri,
        Path tokenFile,
        Duration refreshBuffer,
        Duration loginTimeout,
        Duration httpTimeout) {

    public static final String DEFAULT_SCOPE = "openid email profile offline_access";
    public static final URI DEFAULT_REDIRECT_URI = URI.create("http://localhost:48080/callback");
    public static final Duration DEFAULT_REFRESH_BUFFER = Duration.ofSeconds(300);
    public static final Duration DEFAULT_LOGIN_TIMEOUT = Duration.ofSeconds(300);
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(10);

    private static final String PREFIX = "tollgate.client.";

    public ClientSettings {
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalArgumentException("issuer is required");
        }
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("client id is required");
        }
        clientSecret = clientSecret == null ? Optional.empty() : clientSecret.filter(s -> !s.isBlank());
        audience = audience == null ? Optional.empty() : audience.filter(s -> !s.isBlank());
        if (scope == null || scope.isBlank()) {
            scope = DEFAULT_SCOPE;
        }
        if (redirectUri == null) {
            redirectUri = DEFAULT_REDIRECT_URI;
        }
        if (!"http".equals(redirectUri.getScheme()) || !isLoopback(redirectUri.getHost())) {
            throw new IllegalArgumentException("redirect URI must be an http loopback address: " + redirectUri);
        }
        if (tokenFile == null) {
            tokenFile = defaultTokenFile();
        }
        if (refreshBuffer == null) {
            refreshBuffer = DEFAULT_REFRESH_BUFFER;
        }
        if (loginTimeout == null) {
            loginTimeout = DEFAULT_LOGIN_TIMEOUT;
        }
        if (httpTimeout == null) {
            httpTimeout = DEFAULT_HTTP_TIMEOUT;
        }
    }

    public ClientRegistration registration() {
        return new ClientRegistration(clientId, clientSecret);
    }

    public static Path defaultTokenFile() {
        return Path.of(System.getProperty("user.home"), ".tollgate", "tokens.json");
    }

    public static ClientSettings fromConfig() {
        return fromConfig(ConfigProvider.getConfig());
    }

    public static ClientSettings fromConfig(Config config) {
        return new ClientSettings(
                config.getValue(PREFIX + "issuer", String.class),
                config.getValue(PREFIX + "client-id", String.class),
                config.getOptionalValue(PREFIX + "client-secret", String.class),
                config.getOptionalValue(PREFIX + "audience", String.class),
                config.getOptionalValue(PREFIX + "scope", String.class).orElse(DEFAULT_SCOPE),
                config.getOptionalValue(PREFIX + "redirect-uri", String.class)
                        .map(URI::create)
                        .orElse(DEFAULT_REDIRECT_URI),
                config.getOptionalValue(PREFIX + "token-file", String.class)
                        .map(Path::of)
                        .orElseGet(ClientSettings::defaultTokenFile),
                config.getOptionalValue(PREFIX + "refresh-buffer", Duration.class).orElse(DEFAULT_REFRESH_BUFFER),
                config.getOptionalValue(PREFIX + "login-timeout", Duration.class).orElse(DEFAULT_LOGIN_TIMEOUT),
                config.getOptionalValue(PREFIX + "http-timeout", Duration.class).orElse(DEFAULT_HTTP_TIMEOUT));
    }

    public static Builder builder(String issuer, String clientId) {
        return new Builder(issuer, clientId);
    }

    private static boolean isLoopback(String host) {
        return "localhost".equals(host) || "127.0.0.1".equals(host) || "[::1]".equals(host);
    }

    @Override
    public String toString() {
        return "ClientSettings[issuer=" + issuer + ", clientId=" + clientId + ", confidential="
                + clientSecret.isPresent() + ", audience=" + audience.orElse("-") + ", redirectUri=" + redirectUri
                + ", tokenFile=" + tokenFile + "]";
    }

    public static final class Builder {
        private final String issuer;
        private final String clientId;
        private String clientSecret;
        private String audience;
        private String scope = DEFAULT_SCOPE;
        private URI redirectUri = DEFAULT_REDIRECT_URI;
        private Path tokenFile;
        private Duration refreshBuffer = DEFAULT_REFRESH_BUFFER;
        private Duration loginTimeout = DEFAULT_LOGIN_TIMEOUT;
        private Duration httpTimeout = DEFAULT_HTTP_TIMEOUT;

        private Builder(String issuer, String clientId) {
            this.issuer = issuer;
            this.clientId = clientId;
        }

        public Builder clientSecret(String value) {
            this.clientSecret = value;
            return this;
        }

        public Builder audience(String value) {
            this.audience = value;
            return this;
        }

        public Builder scope(String value) {
            this.scope = value;
            return this;
        }

        public Builder redirectUri(URI value) {
            this.redirectUri = value;
            return this;
        }

        public Builder tokenFile(Path value) {
            this.tokenFile = value;
            return this;
        }

        public Builder refreshBuffer(Duration value) {
            this.refreshBuffer = value;
            return this;
        }

        public Builder loginTimeout(Duration value) {
            this.loginTimeout = value;
            return this;
        }

        public Builder httpTimeout(Duration value) {
            this.httpTimeout = value;
            return this;
        }

        public ClientSettings build() {
            return new ClientSettings(
                    issuer,
                    clientId,
                    Optional.ofNullable(clientSecret),
                    Optional.ofNullable(audience),
                    scope,
                    redirectUri,
                    tokenFile,
                    refreshBuffer,
                    loginTimeout,
                    httpTimeout);
        }
    }
}
