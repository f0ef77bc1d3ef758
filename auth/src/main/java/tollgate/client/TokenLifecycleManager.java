package tollgate.client;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import org.jboss.logging.Logger;

import tollgate.adapter.out.http.VertxIdentityProviderClient;
import tollgate.core.model.auth.AuthErrorKind;
import tollgate.core.model.auth.AuthException;
import tollgate.core.model.auth.ProviderMetadata;
import tollgate.core.model.auth.TokenResponse;
import tollgate.core.port.out.IdentityProviderClient;

/**
 * Keeps a user's provider tokens usable for an outbound client.
 *
 * <p>Lifecycle: {@code NO_CREDENTIALS -> AWAITING_INTERACTIVE_LOGIN -> HAS_VALID_TOKEN <-> REFRESHING},
 * back to {@code NO_CREDENTIALS} on any unrecoverable failure. Every public operation runs under one
 * lock, so concurrent {@link #getToken()} callers on an expiring token wait for a single refresh and
 * then all see its result.
 *
 * <p>{@link #getToken()} returns the ID token. The refresh token only ever leaves this class in the
 * refresh request to the provider's token endpoint.
 */
public class TokenLifecycleManager implements TokenSupplier, AutoCloseable {

    private static final Logger LOG = Logger.getLogger(TokenLifecycleManager.class);

    private final ClientSettings settings;
    private final IdentityProviderClient provider;
    private final CredentialStore store;
    private final BrowserLauncher browser;
    private final Vertx vertx;
    private final Clock clock;
    private final boolean ownsVertx;

    private final ReentrantLock lock = new ReentrantLock();
    private CredentialBundle bundle;
    private ProviderMetadata metadata;
    private LifecycleState state = LifecycleState.NO_CREDENTIALS;

    public TokenLifecycleManager(
            ClientSettings settings,
            IdentityProviderClient provider,
            CredentialStore store,
            BrowserLauncher browser,
            Vertx vertx,
            Clock clock) {
        this(settings, provider, store, browser, vertx, clock, false);
    }

    private TokenLifecycleManager(
            ClientSettings settings,
            IdentityProviderClient provider,
            CredentialStore store,
            BrowserLauncher browser,
            Vertx vertx,
            Clock clock,
            boolean ownsVertx) {
        this.settings = settings;
        this.provider = provider;
        this.store = store;
        this.browser = browser;
        this.vertx = vertx;
        this.clock = clock;
        this.ownsVertx = ownsVertx;
    }

    /**
     * Standalone manager with its own Vert.x instance, file store and system browser. Close it when done.
     */
    public static TokenLifecycleManager create(ClientSettings settings) {
        final var vertx = Vertx.vertx();
        return new TokenLifecycleManager(
                settings,
                new VertxIdentityProviderClient(vertx, settings.httpTimeout()),
                new FileCredentialStore(settings.tokenFile(), new ObjectMapper()),
                new DesktopBrowserLauncher(),
                vertx,
                Clock.systemUTC(),
                true);
    }

    public LifecycleState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Interactive authorization code login with PKCE.
     *
     * <p>The callback listener is bound for this attempt only and released before the code is
     * exchanged, whatever the outcome.
     *
     * @throws AuthException SECURITY_VIOLATION when the callback state does not match, LOGIN_FAILED
     *                       for provider errors, timeouts and exchange failures
     */
    public CredentialBundle login() {
        lock.lock();
        try {
            transition(LifecycleState.AWAITING_INTERACTIVE_LOGIN);
            final var endpoints = metadata();
            final var pkce = PkceChallenge.generate();
            final var expectedState = PkceChallenge.randomState();

            final String code;
            final URI redirectUri;
            try (var callback = LoopbackCallbackServer.start(vertx, settings.redirectUri(), expectedState)) {
                redirectUri = callback.redirectUri();
                final var authorizationUri = authorizationUri(endpoints, redirectUri, pkce, expectedState);
                openBrowser(authorizationUri);
                code = authorizationCode(callback.await(settings.loginTimeout()));
            }

            final var response = await(provider.exchangeCode(
                    endpoints.tokenEndpoint(), settings.registration(), code, pkce.verifier(), redirectUri));
            final var loggedIn = toBundle(response, null);
            try {
                store.save(loggedIn);
            } catch (IOException e) {
                throw new AuthException(AuthErrorKind.LOGIN_FAILED, "cannot persist credentials", e);
            }
            bundle = loggedIn;
            transition(LifecycleState.HAS_VALID_TOKEN);
            LOG.infov("Logged in to {0}; token expires at {1}", settings.issuer(), loggedIn.expiry());
            return loggedIn;
        } catch (AuthException e) {
            clearInMemory();
            LOG.warnv("Login failed ({0}): {1}", e.kind().tag(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            clearInMemory();
            LOG.errorv(e, "Login failed for {0}", settings.issuer());
            throw new AuthException(AuthErrorKind.LOGIN_FAILED, "login failed", e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the ID token, refreshing first when it expires within the refresh buffer.
     *
     * @throws AuthException LOGIN_REQUIRED when there are no credentials, REFRESH_FAILED when the
     *                       refresh was rejected (state has then been cleared)
     */
    @Override
    public String getToken() {
        lock.lock();
        try {
            if (bundle == null && load().isEmpty()) {
                throw new AuthException(AuthErrorKind.LOGIN_REQUIRED, "no credentials, interactive login required");
            }
            if (clock.instant().plus(settings.refreshBuffer()).isBefore(bundle.expiry())) {
                return bundle.token().idToken();
            }
            return refresh().token().idToken();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Loads persisted credentials for this issuer and client. Unreadable files and bundles for a
     * different issuer or client are ignored.
     */
    public Optional<CredentialBundle> load() {
        lock.lock();
        try {
            final Optional<CredentialBundle> loaded;
            try {
                loaded = store.load();
            } catch (IOException e) {
                LOG.warnv("Ignoring unreadable credential file: {0}", e.getClass().getSimpleName());
                return Optional.empty();
            }
            if (loaded.isEmpty()) {
                return Optional.empty();
            }
            if (!loaded.get().matches(settings)) {
                LOG.infov("Stored credentials belong to {0}/{1}, ignoring",
                        loaded.get().issuer(), loaded.get().clientId());
                return Optional.empty();
            }
            bundle = loaded.get();
            transition(LifecycleState.HAS_VALID_TOKEN);
            return loaded;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a token from stored credentials, falling back to interactive login when there are
     * none or they can no longer be refreshed.
     */
    public String loadOrLogin() {
        lock.lock();
        try {
            if (bundle != null || load().isPresent()) {
                try {
                    return getToken();
                } catch (AuthException e) {
                    if (e.kind() != AuthErrorKind.REFRESH_FAILED) {
                        throw e;
                    }
                    LOG.infov("Stored credentials expired ({0}), starting login", e.kind().tag());
                }
            }
            login();
            return getToken();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Writes the current credentials to the store.
     */
    public void persist() throws IOException {
        lock.lock();
        try {
            if (bundle == null) {
                throw new AuthException(AuthErrorKind.LOGIN_REQUIRED, "no credentials to persist");
            }
            store.save(bundle);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forgets the in-memory credentials and deletes the stored file.
     */
    public void logout() throws IOException {
        lock.lock();
        try {
            clearInMemory();
            store.delete();
            LOG.infov("Logged out of {0}", settings.issuer());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        if (ownsVertx) {
            vertx.closeAndAwait();
        }
    }

    private CredentialBundle refresh() {
        transition(LifecycleState.REFRESHING);
        try {
            final var refreshToken = bundle.token().refreshToken();
            if (refreshToken == null) {
                throw new AuthException(AuthErrorKind.REFRESH_FAILED, "no refresh token");
            }
            final var response = await(provider.refresh(
                    metadata().tokenEndpoint(), settings.registration(), refreshToken, Optional.of(settings.scope())));
            if (response.idToken().isEmpty()) {
                throw new AuthException(AuthErrorKind.REFRESH_FAILED, "refresh response has no id token");
            }
            final var refreshed = toBundle(response, refreshToken);
            bundle = refreshed;
            transition(LifecycleState.HAS_VALID_TOKEN);
            try {
                store.save(refreshed);
            } catch (IOException e) {
                LOG.errorv(e, "Refreshed credentials could not be persisted to the store");
            }
            LOG.debugv("Refreshed token for {0}; expires at {1}", settings.issuer(), refreshed.expiry());
            return refreshed;
        } catch (RuntimeException e) {
            clearInMemory();
            deleteStored();
            LOG.warnv("Token refresh failed, interactive login required: {0}", e.getMessage());
            throw e instanceof AuthException auth && auth.kind() == AuthErrorKind.REFRESH_FAILED
                    ? auth
                    : new AuthException(AuthErrorKind.REFRESH_FAILED, "token refresh failed", e);
        }
    }

    private ProviderMetadata metadata() {
        if (metadata == null) {
            metadata = await(provider.discover(settings.issuer()));
        }
        return metadata;
    }

    private CredentialBundle toBundle(TokenResponse response, String previousRefreshToken) {
        final var idToken = response.idToken()
                .orElseThrow(() -> new AuthException(AuthErrorKind.LOGIN_FAILED, "token response has no id token"));
        final var expiresAt = IdTokens.expiry(idToken)
                .orElseGet(() -> clock.instant().plusSeconds(response.expiresIn()));
        return new CredentialBundle(
                settings.issuer(),
                settings.clientId(),
                new CredentialBundle.Tokens(
                        response.accessToken(),
                        idToken,
                        response.refreshToken().orElse(previousRefreshToken),
                        expiresAt.getEpochSecond()));
    }

    private URI authorizationUri(ProviderMetadata endpoints, URI redirectUri, PkceChallenge pkce, String state) {
        final var params = new LinkedHashMap<String, String>();
        params.put("response_type", "code");
        params.put("client_id", settings.clientId());
        params.put("redirect_uri", redirectUri.toString());
        params.put("scope", settings.scope());
        params.put("state", state);
        params.put("code_challenge", pkce.challenge());
        params.put("code_challenge_method", PkceChallenge.METHOD);
        settings.audience().ifPresent(audience -> params.put("audience", audience));

        final var base = endpoints.authorizationEndpoint().toString();
        return URI.create(base + (base.contains("?") ? "&" : "?") + encode(params));
    }

    private void openBrowser(URI authorizationUri) {
        try {
            browser.open(authorizationUri);
        } catch (IOException e) {
            throw new AuthException(AuthErrorKind.LOGIN_FAILED, "cannot open browser", e);
        }
    }

    private static String authorizationCode(CallbackResult result) {
        if (result instanceof CallbackResult.Authorized authorized) {
            return authorized.code();
        }
        if (result instanceof CallbackResult.Denied denied) {
            throw new AuthException(AuthErrorKind.LOGIN_FAILED, "authorization failed: " + denied.error());
        }
        throw new AuthException(AuthErrorKind.SECURITY_VIOLATION, "callback state does not match this login attempt");
    }

    private <T> T await(Uni<T> uni) {
        return uni.await().atMost(settings.httpTimeout());
    }

    private void clearInMemory() {
        bundle = null;
        transition(LifecycleState.NO_CREDENTIALS);
    }

    private void deleteStored() {
        try {
            store.delete();
        } catch (IOException e) {
            LOG.warnv("Could not delete stored credentials: {0}", e.getMessage());
        }
    }

    private void transition(LifecycleState next) {
        if (state != next) {
            LOG.debugv("Token lifecycle {0} -> {1}", state, next);
            state = next;
        }
    }

    private static String encode(Map<String, String> params) {
        return params.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }
}
