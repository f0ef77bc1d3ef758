package tollgate.core.service.auth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKeySet;

import tollgate.core.config.AuthSettings;
import tollgate.core.model.auth.AuthErrorKind;
import tollgate.core.model.auth.AuthException;
import tollgate.core.model.auth.IdentityProviderException;
import tollgate.core.model.auth.ProviderMetadata;
import tollgate.core.port.out.AuthMetrics;
import tollgate.core.port.out.IdentityProviderClient;
import tollgate.core.port.out.ProviderKeyCache;
import tollgate.core.port.out.SecurityEvents;

/**
 * Caches discovery metadata and key sets per trusted issuer.
 *
 * <p>Features:
 * <ul>
 *   <li>Discovery documents are kept until {@link #invalidate(String)}</li>
 *   <li>Key sets are served for the configured TTL, then fetched again</li>
 *   <li>Concurrent misses for one issuer share a single fetch</li>
 *   <li>Failed fetches fail closed; an expired key set is never served</li>
 * </ul>
 *
 * <p>A shared fetch is memoized, so a caller that cancels does not cancel the fetch for the
 * other waiters.
 */
@ApplicationScoped
public class ProviderKeyCacheService implements ProviderKeyCache {

    private static final Logger LOG = Logger.getLogger(ProviderKeyCacheService.class);

    private final IdentityProviderClient client;
    private final AuthMetrics metrics;
    private final SecurityEvents securityEvents;
    private final Clock clock;
    private final Duration ttl;
    private final Duration fetchTimeout;

    private final Cache<String, CachedKeySet> keySets;
    private final Map<String, ProviderMetadata> discovered = new ConcurrentHashMap<>();
    private final Map<String, Uni<JsonWebKeySet>> inFlightKeyFetches = new ConcurrentHashMap<>();
    private final Map<String, Uni<ProviderMetadata>> inFlightDiscovery = new ConcurrentHashMap<>();

    @Inject
    public ProviderKeyCacheService(
            IdentityProviderClient client,
            AuthSettings settings,
            AuthMetrics metrics,
            SecurityEvents securityEvents,
            MeterRegistry meterRegistry,
            Clock clock) {
        this.client = client;
        this.metrics = metrics;
        this.securityEvents = securityEvents;
        this.clock = clock;
        this.ttl = settings.keyCacheTtl();
        this.fetchTimeout = settings.fetchTimeout();

        this.keySets = Caffeine.newBuilder()
                .maximumSize(Math.max(16, settings.issuers().size() * 2L))
                .expireAfterWrite(ttl)
                .recordStats()
                .build();

        CaffeineCacheMetrics.monitor(meterRegistry, keySets, "tollgate.auth.keys");
    }

    @Override
    public Uni<ProviderMetadata> metadata(String issuer) {
        return Uni.createFrom().deferred(() -> {
            final var known = discovered.get(issuer);
            if (known != null) {
                return Uni.createFrom().item(known);
            }
            // A discovery finishing between the lookup above and this one has already stored its result.
            final var fetch = inFlightDiscovery.computeIfAbsent(issuer,
                    key -> discovered.containsKey(key) ? null : shared(key, inFlightDiscovery, this::discover));
            return fetch != null ? fetch : metadata(issuer);
        });
    }

    @Override
    public Uni<JsonWebKeySet> keySet(String issuer) {
        return Uni.createFrom().deferred(() -> {
            final var cached = freshKeySet(issuer);
            if (cached != null) {
                LOG.debugv("Using cached keys for {0}", issuer);
                return Uni.createFrom().item(cached);
            }
            // A fetch finishing between the lookup above and this one has already cached its keys.
            final var fetch = inFlightKeyFetches.computeIfAbsent(issuer,
                    key -> freshKeySet(key) != null ? null : shared(key, inFlightKeyFetches, this::fetchKeys));
            return fetch != null ? fetch : keySet(issuer);
        });
    }

    private JsonWebKeySet freshKeySet(String issuer) {
        final var cached = keySets.getIfPresent(issuer);
        return cached != null && !cached.isExpired(clock.instant()) ? cached.keySet() : null;
    }

    @Override
    public void invalidate(String issuer) {
        LOG.infov("Invalidating cached metadata and keys for {0}", issuer);
        discovered.remove(issuer);
        keySets.invalidate(issuer);
    }

    /**
     * Wraps a fetch so every subscriber shares one upstream call. The entry leaves the in-flight map
     * when the fetch terminates, so the next miss after a failure or TTL expiry fetches again.
     */
    private static <T> Uni<T> shared(String issuer, Map<String, Uni<T>> inFlight, Function<String, Uni<T>> fetch) {
        final var self = new AtomicReference<Uni<T>>();
        final Uni<T> uni = fetch.apply(issuer)
                .onTermination()
                .invoke(() -> inFlight.remove(issuer, self.get()))
                .memoize()
                .indefinitely();
        self.set(uni);
        return uni;
    }

    private Uni<ProviderMetadata> discover(String issuer) {
        LOG.infov("Discovering provider metadata for {0}", issuer);

        return client.discover(issuer)
                .ifNoItem()
                .after(fetchTimeout)
                .failWith(() -> new IdentityProviderException("Timed out after " + fetchTimeout))
                .map(metadata -> {
                    if (!issuer.equals(metadata.issuer().toString())) {
                        throw new IdentityProviderException(
                                "Discovery document names issuer " + metadata.issuer());
                    }
                    discovered.put(issuer, metadata);
                    return metadata;
                })
                .onFailure()
                .transform(failure -> unavailable(issuer, "discovery", failure));
    }

    private Uni<JsonWebKeySet> fetchKeys(String issuer) {
        return metadata(issuer)
                .flatMap(metadata -> {
                    LOG.infov("Fetching keys for {0} from {1}", issuer, metadata.jwksUri());
                    return client.fetchKeys(metadata.jwksUri())
                            .ifNoItem()
                            .after(fetchTimeout)
                            .failWith(() -> new IdentityProviderException(
                                    "Timed out after " + fetchTimeout + " fetching " + metadata.jwksUri()));
                })
                .map(keySet -> {
                    if (keySet.getJsonWebKeys().isEmpty()) {
                        throw new IdentityProviderException("Empty key set");
                    }
                    keySets.put(issuer, new CachedKeySet(issuer, keySet, clock.instant(), ttl));
                    metrics.recordKeyFetch(issuer, true);
                    LOG.infov("Cached {0} keys for {1}", keySet.getJsonWebKeys().size(), issuer);
                    return keySet;
                })
                .onFailure()
                .invoke(failure -> metrics.recordKeyFetch(issuer, false))
                .onFailure()
                .transform(failure -> unavailable(issuer, "key fetch", failure));
    }

    private Throwable unavailable(String issuer, String step, Throwable failure) {
        if (failure instanceof AuthException) {
            // Already reported by the discovery step.
            return failure;
        }
        LOG.errorv(failure, "Provider {0} unavailable during {1}", issuer, step);
        securityEvents.providerUnavailable(issuer, step + ": " + failure.getMessage());
        return new AuthException(
                AuthErrorKind.PROVIDER_UNAVAILABLE,
                step + " failed for " + issuer + ": " + failure.getMessage(),
                failure);
    }

    private record CachedKeySet(String issuer, JsonWebKeySet keySet, Instant fetchedAt, Duration ttl) {
        boolean isExpired(Instant now) {
            return !now.isBefore(fetchedAt.plus(ttl));
        }
    }
}
