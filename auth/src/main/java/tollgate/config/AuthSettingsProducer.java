package tollgate.config;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import tollgate.core.config.AuthSettings;

/**
 * Turns the {@code tollgate.auth} configuration into the immutable {@link AuthSettings} value.
 */
@ApplicationScoped
public class AuthSettingsProducer {

    private static final Logger LOG = Logger.getLogger(AuthSettingsProducer.class);
    private static final TypeReference<List<KeyRingEntry>> KEY_RING_TYPE = new TypeReference<>() {};

    private final AuthConfigMapping config;
    private final ObjectMapper objectMapper;

    @Inject
    public AuthSettingsProducer(AuthConfigMapping config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
    }

    @Produces
    @Singleton
    public AuthSettings authSettings() {
        final var builder = AuthSettings.builder()
                .enabled(config.enabled())
                .disabledForDevelopment(config.dangerousDisable())
                .constantTimeKeyCompare(config.constantTimeKeyCompare())
                .clockSkew(config.clockSkew())
                .keyCacheTtl(config.keyCache().ttl())
                .fetchTimeout(config.keyCache().fetchTimeout())
                .tokenCacheTtl(config.tokenCache().ttl())
                .tokenCacheMaxEntries(config.tokenCache().maxEntries());

        config.issuers().values().forEach(issuer -> builder.trustIssuer(issuer.issuer(), issuer.audience()));
        config.admins().ifPresent(builder::admins);
        config.keyRing().ifPresent(json ->
                parseKeyRing(json).forEach(entry -> builder.staticKey(entry.name(), entry.key())));
        config.http().publicPaths().forEach(builder::publicPath);

        final var settings = builder.build();
        LOG.infov(
                "Authentication settings loaded: issuers={0}, staticKeys={1}, admins={2}, required={3}",
                settings.issuers().keySet(),
                settings.staticKeys().size(),
                settings.admins().size(),
                settings.authenticationRequired());
        return settings;
    }

    List<KeyRingEntry> parseKeyRing(String json) {
        if (json.isBlank()) {
            return List.of();
        }
        try {
            final var entries = objectMapper.readValue(json, KEY_RING_TYPE);
            return entries == null ? List.of() : entries;
        } catch (JsonProcessingException e) {
            // Never echo the input, it holds the keys.
            final var location = e.getLocation();
            final var where = location == null
                    ? ""
                    : " at line " + location.getLineNr() + ", column " + location.getColumnNr();
            throw new IllegalStateException("tollgate.auth.key-ring is not a valid JSON key ring" + where);
        }
    }

    /**
     * One element of the JSON key ring.
     */
    record KeyRingEntry(String name, String key) {}
}
