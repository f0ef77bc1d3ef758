package tollgate.client;

import java.time.Instant;
import java.util.Optional;

import org.jboss.logging.Logger;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwx.JsonWebStructure;
import org.jose4j.lang.JoseException;

import tollgate.core.model.auth.AuthErrorKind;
import tollgate.core.model.auth.AuthException;

/**
 * Client-side inspection of ID tokens received from the token endpoint. The server verifies
 * signatures; here the client only refuses unsigned tokens and reads the expiry.
 */
final class IdTokens {

    private static final Logger LOG = Logger.getLogger(IdTokens.class);

    private IdTokens() {}

    /**
     * @return the {@code exp} claim, or empty when the token is not a compact JWS or carries no expiry
     * @throws AuthException SECURITY_VIOLATION for an {@code alg=none} token
     */
    static Optional<Instant> expiry(String idToken) {
        if (idToken.chars().filter(c -> c == '.').count() != 2) {
            return Optional.empty();
        }
        try {
            final var structure = JsonWebStructure.fromCompactSerialization(idToken);
            if (!(structure instanceof JsonWebSignature jws)) {
                return Optional.empty();
            }
            final var alg = jws.getAlgorithmHeaderValue();
            if (alg == null || AlgorithmIdentifiers.NONE.equals(alg)) {
                throw new AuthException(AuthErrorKind.SECURITY_VIOLATION, "provider returned an unsigned id token");
            }
            final var claims = JwtClaims.parse(jws.getUnverifiedPayload());
            final var exp = claims.getExpirationTime();
            return exp == null ? Optional.empty() : Optional.of(Instant.ofEpochSecond(exp.getValue()));
        } catch (JoseException | InvalidJwtException | MalformedClaimException e) {
            LOG.debugv("Cannot read id token expiry, using expires_in: {0}", e.getClass().getSimpleName());
            return Optional.empty();
        }
    }
}
