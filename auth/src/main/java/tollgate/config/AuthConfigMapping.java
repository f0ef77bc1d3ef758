package tollgate.config;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for inbound authentication.
 *
 * <p>Configuration prefix: {@code tollgate.auth}
 *
 * <h2>Example</h2>
 * <pre>
 * tollgate.auth.issuers.corp.issuer=https://idp.example
 * tollgate.auth.issuers.corp.audience=app1
 * tollgate.auth.admins=alice@example.com,svc-admin
 * tollgate.auth.key-ring=[{"name":"svc-a","key":"sk-123"}]
 * </pre>
 */
@ConfigMapping(prefix = "tollgate.auth")
public interface AuthConfigMapping {

    /**
     * Whether inbound requests are authenticated.
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Development-only switch that lets every request through.
     *
     * <p>Refused at startup when the application runs in production mode.
     */
    @WithDefault("false")
    boolean dangerousDisable();

    /**
     * Trusted identity providers, keyed by an arbitrary local name.
     */
    Map<String, IssuerConfig> issuers();

    /**
     * Subjects and emails that carry the admin bit.
     */
    Optional<Set<String>> admins();

    /**
     * Static bearer keys as a JSON array of {@code {"name": ..., "key": ...}} objects.
     */
    Optional<String> keyRing();

    /**
     * Compare static keys in constant time.
     *
     * <p>Off by default: lookup is a hash probe and the timing channel is an accepted risk.
     */
    @WithDefault("false")
    boolean constantTimeKeyCompare();

    /**
     * Tolerance applied to token expiry and not-before claims.
     */
    @WithDefault("PT60S")
    Duration clockSkew();

    KeyCacheConfig keyCache();

    TokenCacheConfig tokenCache();

    HttpConfig http();

    interface IssuerConfig {

        /**
         * Exact {@code iss} value of the provider.
         */
        String issuer();

        /**
         * Audience tokens from this provider must carry.
         */
        String audience();
    }

    interface KeyCacheConfig {

        /**
         * How long a fetched key set is served before it is fetched again.
         */
        @WithDefault("PT1H")
        Duration ttl();

        /**
         * Bound on discovery and key set requests.
         */
        @WithDefault("PT10S")
        Duration fetchTimeout();
    }

    interface TokenCacheConfig {

        @WithDefault("PT5M")
        Duration ttl();

        @WithDefault("1000")
        int maxEntries();
    }

    interface HttpConfig {

        /**
         * Path prefixes served without authentication.
         */
        @WithDefault("/q/")
        List<String> publicPaths();
    }
}
