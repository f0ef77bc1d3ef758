package tollgate.adapter.out.http;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.WebClientOptions;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.lang.JoseException;

import tollgate.core.config.AuthSettings;
import tollgate.core.model.auth.ClientRegistration;
import tollgate.core.model.auth.IdentityProviderException;
import tollgate.core.model.auth.ProviderMetadata;
import tollgate.core.model.auth.TokenResponse;
import tollgate.core.port.out.IdentityProviderClient;

/**
 * {@link IdentityProviderClient} over the Vert.x web client.
 *
 * <p>Redirects are never followed and every request carries the configured timeout. Token
 * requests are form-encoded; a client secret is added to the form only for confidential clients.
 */
@ApplicationScoped
public class VertxIdentityProviderClient implements IdentityProviderClient {

    private static final Logger LOG = Logger.getLogger(VertxIdentityProviderClient.class);
    static final String DISCOVERY_PATH = "/.well-known/openid-configuration";
    private static final String FORM_CONTENT_TYPE = "application/x-www-form-urlencoded";

    private final WebClient webClient;
    private final long timeoutMillis;

    @Inject
    public VertxIdentityProviderClient(Vertx vertx, AuthSettings settings) {
        this(vertx, settings.fetchTimeout());
    }

    public VertxIdentityProviderClient(Vertx vertx, Duration timeout) {
        this.timeoutMillis = timeout.toMillis();
        this.webClient = WebClient.create(
                vertx,
                new WebClientOptions()
                        .setFollowRedirects(false)
                        .setConnectTimeout((int) Math.min(Integer.MAX_VALUE, timeoutMillis))
                        .setUserAgent("tollgate"));
    }

    @Override
    public Uni<ProviderMetadata> discover(String issuer) {
        final var url = stripTrailingSlash(issuer) + DISCOVERY_PATH;
        LOG.debugv("Fetching discovery document {0}", url);

        return webClient
                .getAbs(url)
                .timeout(timeoutMillis)
                .putHeader("Accept", "application/json")
                .send()
                .map(response -> parseMetadata(requireOk(response, url).bodyAsJsonObject()))
                .onFailure(failure -> !(failure instanceof IdentityProviderException))
                .transform(failure -> new IdentityProviderException("Discovery failed for " + issuer, failure));
    }

    @Override
    public Uni<JsonWebKeySet> fetchKeys(URI jwksUri) {
        LOG.debugv("Fetching key set {0}", jwksUri);

        return webClient
                .getAbs(jwksUri.toString())
                .timeout(timeoutMillis)
                .putHeader("Accept", "application/json")
                .send()
                .map(response -> {
                    final var body = requireOk(response, jwksUri.toString()).bodyAsString();
                    try {
                        return new JsonWebKeySet(body);
                    } catch (JoseException e) {
                        throw new IdentityProviderException("Unparseable key set from " + jwksUri, e);
                    }
                })
                .onFailure(failure -> !(failure instanceof IdentityProviderException))
                .transform(failure -> new IdentityProviderException("Key set fetch failed for " + jwksUri, failure));
    }

    @Override
    public Uni<TokenResponse> exchangeCode(
            URI tokenEndpoint, ClientRegistration client, String code, String codeVerifier, URI redirectUri) {
        final var form = new LinkedHashMap<String, String>();
        form.put("grant_type", "authorization_code");
        form.put("code", code);
        form.put("code_verifier", codeVerifier);
        form.put("redirect_uri", redirectUri.toString());
        return postForm(tokenEndpoint, client, form);
    }

    @Override
    public Uni<TokenResponse> refresh(
            URI tokenEndpoint, ClientRegistration client, String refreshToken, Optional<String> scope) {
        final var form = new LinkedHashMap<String, String>();
        form.put("grant_type", "refresh_token");
        form.put("refresh_token", refreshToken);
        scope.ifPresent(value -> form.put("scope", value));
        return postForm(tokenEndpoint, client, form);
    }

    @Override
    public Uni<TokenResponse> clientCredentials(
            URI tokenEndpoint, ClientRegistration client, Optional<String> audience, Optional<String> scope) {
        final var form = new LinkedHashMap<String, String>();
        form.put("grant_type", "client_credentials");
        audience.ifPresent(value -> form.put("audience", value));
        scope.ifPresent(value -> form.put("scope", value));
        return postForm(tokenEndpoint, client, form);
    }

    private Uni<TokenResponse> postForm(URI tokenEndpoint, ClientRegistration client, Map<String, String> form) {
        final var grantType = form.get("grant_type");
        form.put("client_id", client.clientId());
        client.clientSecret().ifPresent(secret -> form.put("client_secret", secret));
        LOG.debugv("Requesting {0} token from {1}", grantType, tokenEndpoint);

        return webClient
                .postAbs(tokenEndpoint.toString())
                .timeout(timeoutMillis)
                .putHeader("Content-Type", FORM_CONTENT_TYPE)
                .putHeader("Accept", "application/json")
                .sendBuffer(Buffer.buffer(encodeForm(form)))
                .map(response -> parseTokenResponse(requireOk(response, tokenEndpoint.toString()).bodyAsJsonObject()))
                .onFailure(failure -> !(failure instanceof IdentityProviderException))
                .transform(failure ->
                        new IdentityProviderException(grantType + " request to " + tokenEndpoint + " failed", failure));
    }

    private static HttpResponse<Buffer> requireOk(HttpResponse<Buffer> response, String url) {
        if (response.statusCode() != 200) {
            LOG.warnv("Identity provider returned {0} for {1}: {2}", response.statusCode(), url, errorCode(response));
            throw new IdentityProviderException(
                    "Identity provider returned status " + response.statusCode() + " for " + url,
                    response.statusCode());
        }
        return response;
    }

    private static String errorCode(HttpResponse<Buffer> response) {
        try {
            final var json = response.bodyAsJsonObject();
            return json == null ? "-" : json.getString("error", "-");
        } catch (RuntimeException e) {
            return "-";
        }
    }

    static ProviderMetadata parseMetadata(JsonObject json) {
        if (json == null) {
            throw new IdentityProviderException("Empty discovery document");
        }
        return new ProviderMetadata(
                requiredUri(json, "issuer"),
                requiredUri(json, "jwks_uri"),
                requiredUri(json, "authorization_endpoint"),
                requiredUri(json, "token_endpoint"));
    }

    static TokenResponse parseTokenResponse(JsonObject json) {
        if (json == null) {
            throw new IdentityProviderException("Empty token response");
        }
        final var accessToken = json.getString("access_token");
        if (accessToken == null || accessToken.isBlank()) {
            throw new IdentityProviderException("Token response missing access_token");
        }
        return new TokenResponse(
                accessToken,
                Optional.ofNullable(json.getString("id_token")),
                Optional.ofNullable(json.getString("refresh_token")),
                json.getString("token_type", "Bearer"),
                json.getLong("expires_in", 0L),
                Optional.ofNullable(json.getString("scope")));
    }

    private static URI requiredUri(JsonObject json, String field) {
        final var value = json.getString(field);
        if (value == null || value.isBlank()) {
            throw new IdentityProviderException("Discovery document missing " + field);
        }
        try {
            return URI.create(value);
        } catch (IllegalArgumentException e) {
            throw new IdentityProviderException("Discovery document has invalid " + field, e);
        }
    }

    private static String encodeForm(Map<String, String> form) {
        return form.entrySet().stream()
                .map(e -> urlEncode(e.getKey()) + "=" + urlEncode(e.getValue()))
                .collect(Collectors.joining("&"));
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String issuer) {
        return issuer.endsWith("/") ? issuer.substring(0, issuer.length() - 1) : issuer;
    }
}
