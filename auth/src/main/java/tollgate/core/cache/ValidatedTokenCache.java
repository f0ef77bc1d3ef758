package tollgate.core.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;

import tollgate.core.config.AuthSettings;
import tollgate.core.model.auth.Identity;
import tollgate.core.util.SecureHash;

/**
 * Short-lived memo of tokens that already passed signature and claim validation.
 *
 * <p>Entries are keyed by the SHA-256 of the token, bounded in size with least-recently-used
 * eviction, and expire after the configured TTL or at the token's own expiry, whichever comes
 * first. Only successful validations are stored.
 */
@ApplicationScoped
public class ValidatedTokenCache {

    private final Cache<String, Identity> cache;
    private final long ttlNanos;
    private final Clock clock;

    @Inject
    public ValidatedTokenCache(AuthSettings settings, MeterRegistry meterRegistry, Clock clock) {
        this(settings.tokenCacheTtl(), settings.tokenCacheMaxEntries(), clock, Ticker.systemTicker());
        CaffeineCacheMetrics.monitor(meterRegistry, cache, "tollgate.auth.tokens");
    }

    ValidatedTokenCache(Duration ttl, long maxEntries, Clock clock, Ticker ticker) {
        this.ttlNanos = ttl.toNanos();
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .expireAfter(new TokenLifetimeExpiry())
                .maximumSize(maxEntries)
                .ticker(ticker)
                .recordStats()
                .build();
    }

    public Optional<Identity> get(String token) {
        final var identity = cache.getIfPresent(SecureHash.sha256Hex(token));
        if (identity == null || identity.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(identity);
    }

    public void put(String token, Identity identity) {
        if (lifetimeNanos(identity) <= 0) {
            return;
        }
        cache.put(SecureHash.sha256Hex(token), identity);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    long lifetimeNanos(Identity identity) {
        if (identity.expiresAt() == null) {
            return ttlNanos;
        }
        final var untilExpiry = Duration.between(clock.instant(), identity.expiresAt());
        if (untilExpiry.isNegative() || untilExpiry.isZero()) {
            return 0;
        }
        return Math.min(ttlNanos, untilExpiry.toNanos());
    }

    /**
     * Caps each entry at the shorter of the cache TTL and the remaining token lifetime.
     */
    private class TokenLifetimeExpiry implements Expiry<String, Identity> {
        @Override
        public long expireAfterCreate(String key, Identity value, long currentTime) {
            return lifetimeNanos(value);
        }

        @Override
        public long expireAfterUpdate(String key, Identity value, long currentTime, long currentDuration) {
            return lifetimeNanos(value);
        }

        @Override
        public long expireAfterRead(String key, Identity value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
