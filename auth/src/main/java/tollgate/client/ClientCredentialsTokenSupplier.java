package tollgate.client;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import org.jboss.logging.Logger;

import tollgate.core.model.auth.AuthErrorKind;
import tollgate.core.model.auth.AuthException;
import tollgate.core.model.auth.ClientRegistration;
import tollgate.core.model.auth.ProviderMetadata;
import tollgate.core.port.out.IdentityProviderClient;

/**
 * Access tokens for a service identity via the client_credentials grant.
 *
 * <p>The token is cached until it is within the buffer of its expiry. Concurrent callers are
 * serialized on a lock, so one fetch serves all of them.
 */
public class ClientCredentialsTokenSupplier implements TokenSupplier {

    private static final Logger LOG = Logger.getLogger(ClientCredentialsTokenSupplier.class);

    public static final Duration DEFAULT_BUFFER = Duration.ofSeconds(180);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final IdentityProviderClient provider;
    private final String issuer;
    private final ClientRegistration client;
    private final Optional<String> audience;
    private final Optional<String> scope;
    private final Duration buffer;
    private final Duration timeout;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private ProviderMetadata metadata;
    private String accessToken;
    private Instant expiresAt = Instant.EPOCH;

    public ClientCredentialsTokenSupplier(
            IdentityProviderClient provider,
            String issuer,
            ClientRegistration client,
            Optional<String> audience,
            Optional<String> scope,
            Clock clock) {
        this(provider, issuer, client, audience, scope, DEFAULT_BUFFER, DEFAULT_TIMEOUT, clock);
    }

    public ClientCredentialsTokenSupplier(
            IdentityProviderClient provider,
            String issuer,
            ClientRegistration client,
            Optional<String> audience,
            Optional<String> scope,
            Duration buffer,
            Duration timeout,
            Clock clock) {
        if (!client.isConfidential()) {
            throw new IllegalArgumentException("client_credentials requires a client secret");
        }
        this.provider = provider;
        this.issuer = issuer;
        this.client = client;
        this.audience = audience;
        this.scope = scope;
        this.buffer = buffer;
        this.timeout = timeout;
        this.clock = clock;
    }

    @Override
    public String getToken() {
        lock.lock();
        try {
            if (accessToken != null && clock.instant().plus(buffer).isBefore(expiresAt)) {
                return accessToken;
            }
            return fetch();
        } finally {
            lock.unlock();
        }
    }

    private String fetch() {
        try {
            if (metadata == null) {
                metadata = provider.discover(issuer).await().atMost(timeout);
            }
            final var response = provider.clientCredentials(metadata.tokenEndpoint(), client, audience, scope)
                    .await()
                    .atMost(timeout);
            accessToken = response.accessToken();
            expiresAt = clock.instant().plusSeconds(response.expiresIn());
            LOG.debugv("Obtained service token for {0}; expires at {1}", client.clientId(), expiresAt);
            return accessToken;
        } catch (RuntimeException e) {
            accessToken = null;
            expiresAt = Instant.EPOCH;
            LOG.warnv("Service token request failed for {0}: {1}", client.clientId(), e.getMessage());
            throw new AuthException(AuthErrorKind.REFRESH_FAILED, "client credentials grant failed", e);
        }
    }
}
