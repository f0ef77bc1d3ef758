package tollgate.core.port.out;

import io.smallrye.mutiny.Uni;
import org.jose4j.jwk.JsonWebKeySet;

import tollgate.core.model.auth.ProviderMetadata;

/**
 * Port for per-issuer discovery metadata and public keys.
 *
 * <p>Concurrent misses for the same issuer share one fetch. Fetch failures surface as
 * {@link tollgate.core.model.auth.AuthException} with kind
 * {@link tollgate.core.model.auth.AuthErrorKind#PROVIDER_UNAVAILABLE}.
 */
public interface ProviderKeyCache {

    /**
     * Discovery metadata, cached until {@link #invalidate(String)}.
     */
    Uni<ProviderMetadata> metadata(String issuer);

    /**
     * The issuer's current key set, served from cache while within its TTL.
     */
    Uni<JsonWebKeySet> keySet(String issuer);

    /**
     * Drop cached metadata and keys for an issuer.
     */
    void invalidate(String issuer);
}
