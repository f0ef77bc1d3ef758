package tollgate.core.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import tollgate.core.model.auth.TrustedIssuer;

/**
 * Immutable authentication settings, built once at startup and injected into validators and caches.
 *
 * @param enabled                whether inbound requests are authenticated at all
 * @param disabledForDevelopment development-only bypass; refused at startup in production mode
 * @param issuers                trusted providers keyed by their exact issuer URL
 * @param admins                 subjects and emails granted the admin bit
 * @param staticKeys             static bearer keys mapped to the name they authenticate as
 * @param constantTimeKeyCompare compare static keys in constant time instead of a hash lookup
 * @param keyCacheTtl            how long a fetched key set is served
 * @param fetchTimeout           bound on discovery and key set fetches
 * @param tokenCacheTtl          how long a validated token is remembered
 * @param tokenCacheMaxEntries   capacity of the validated-token cache
 * @param clockSkew              tolerance applied to exp and nbf
 * @param publicPaths            HTTP path prefixes that bypass the gate
 */
public record AuthSettings(
        boolean enabled,
        boolean disabledForDevelopment,
        Map<String, TrustedIssuer> issuers,
        Set<String> admins,
        Map<String, String> staticKeys,
        boolean constantTimeKeyCompare,
        Duration keyCacheTtl,
        Duration fetchTimeout,
        Duration tokenCacheTtl,
        int tokenCacheMaxEntries,
        Duration clockSkew,
        List<String> publicPaths) {

    public static final Duration DEFAULT_KEY_CACHE_TTL = Duration.ofSeconds(3600);
    public static final Duration DEFAULT_FETCH_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_TOKEN_CACHE_TTL = Duration.ofSeconds(300);
    public static final int DEFAULT_TOKEN_CACHE_MAX_ENTRIES = 1000;
    public static final Duration DEFAULT_CLOCK_SKEW = Duration.ofSeconds(60);

    public AuthSettings {
        issuers = issuers == null ? Map.of() : Map.copyOf(issuers);
        admins = admins == null ? Set.of() : Set.copyOf(admins);
        staticKeys = staticKeys == null ? Map.of() : Map.copyOf(staticKeys);
        publicPaths = publicPaths == null ? List.of() : List.copyOf(publicPaths);
        requirePositive(keyCacheTtl, "keyCacheTtl");
        requirePositive(fetchTimeout, "fetchTimeout");
        requirePositive(tokenCacheTtl, "tokenCacheTtl");
        if (clockSkew == null || clockSkew.isNegative()) {
            throw new IllegalArgumentException("clockSkew must be zero or positive");
        }
        if (tokenCacheMaxEntries <= 0) {
            throw new IllegalArgumentException("tokenCacheMaxEntries must be positive");
        }
        if (tokenCacheTtl.compareTo(keyCacheTtl) > 0) {
            throw new IllegalArgumentException("tokenCacheTtl must not exceed keyCacheTtl");
        }
        issuers.forEach((key, trusted) -> {
            if (!key.equals(trusted.issuer())) {
                throw new IllegalArgumentException("Issuer map key does not match issuer " + trusted.issuer());
            }
        });
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    /**
     * Whether the gate should validate credentials.
     */
    public boolean authenticationRequired() {
        return enabled && !disabledForDevelopment;
    }

    public Optional<TrustedIssuer> trustedIssuer(String issuer) {
        if (issuer == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(issuers.get(issuer));
    }

    public boolean isAdmin(String subject, Optional<String> email) {
        if (admins.contains(subject)) {
            return true;
        }
        return email.map(admins::contains).orElse(false);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean enabled = true;
        private boolean disabledForDevelopment;
        private final Map<String, TrustedIssuer> issuers = new LinkedHashMap<>();
        private final Set<String> admins = new LinkedHashSet<>();
        private final Map<String, String> staticKeys = new LinkedHashMap<>();
        private boolean constantTimeKeyCompare;
        private Duration keyCacheTtl = DEFAULT_KEY_CACHE_TTL;
        private Duration fetchTimeout = DEFAULT_FETCH_TIMEOUT;
        private Duration tokenCacheTtl = DEFAULT_TOKEN_CACHE_TTL;
        private int tokenCacheMaxEntries = DEFAULT_TOKEN_CACHE_MAX_ENTRIES;
        private Duration clockSkew = DEFAULT_CLOCK_SKEW;
        private final List<String> publicPaths = new ArrayList<>();

        private Builder() {}

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder disabledForDevelopment(boolean disabled) {
            this.disabledForDevelopment = disabled;
            return this;
        }

        public Builder trustIssuer(String issuer, String audience) {
            if (issuers.putIfAbsent(issuer, new TrustedIssuer(issuer, audience)) != null) {
                throw new IllegalArgumentException("Issuer configured twice: " + issuer);
            }
            return this;
        }

        public Builder admin(String subjectOrEmail) {
            admins.add(subjectOrEmail);
            return this;
        }

        public Builder admins(Set<String> values) {
            admins.addAll(values);
            return this;
        }

        /**
         * Registers a static key. Keys must be unique; names may repeat for key rotation.
         */
        public Builder staticKey(String name, String key) {
            if (name == null || name.isBlank() || key == null || key.isBlank()) {
                throw new IllegalArgumentException("Static keys need a name and a key");
            }
            if (staticKeys.putIfAbsent(key, name) != null) {
                throw new IllegalArgumentException("Duplicate static key for name " + name);
            }
            return this;
        }

        public Builder constantTimeKeyCompare(boolean value) {
            this.constantTimeKeyCompare = value;
            return this;
        }

        public Builder keyCacheTtl(Duration value) {
            this.keyCacheTtl = value;
            return this;
        }

        public Builder fetchTimeout(Duration value) {
            this.fetchTimeout = value;
            return this;
        }

        public Builder tokenCacheTtl(Duration value) {
            this.tokenCacheTtl = value;
            return this;
        }

        public Builder tokenCacheMaxEntries(int value) {
            this.tokenCacheMaxEntries = value;
            return this;
        }

        public Builder clockSkew(Duration value) {
            this.clockSkew = value;
            return this;
        }

        public Builder publicPath(String prefix) {
            publicPaths.add(prefix);
            return this;
        }

        public AuthSettings build() {
            return new AuthSettings(
                    enabled,
                    disabledForDevelopment,
                    issuers,
                    admins,
                    staticKeys,
                    constantTimeKeyCompare,
                    keyCacheTtl,
                    fetchTimeout,
                    tokenCacheTtl,
                    tokenCacheMaxEntries,
                    clockSkew,
                    publicPaths);
        }
    }

    @Override
    public String toString() {
        return "AuthSettings[enabled=" + enabled + ", disabledForDevelopment=" + disabledForDevelopment
                + ", issuers=" + issuers.keySet() + ", admins=" + admins.size() + ", staticKeys=" + staticKeys.size()
                + ", keyCacheTtl=" + keyCacheTtl + ", tokenCacheTtl=" + tokenCacheTtl + ", clockSkew=" + clockSkew
                + "]";
    }
}
