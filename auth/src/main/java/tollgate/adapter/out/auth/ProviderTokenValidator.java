package tollgate.adapter.out.auth;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jwa.AlgorithmConstraints.ConstraintType;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.ErrorCodes;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;

import tollgate.core.cache.ValidatedTokenCache;
import tollgate.core.config.AuthSettings;
import tollgate.core.model.auth.AuthErrorKind;
import tollgate.core.model.auth.AuthException;
import tollgate.core.model.auth.Identity;
import tollgate.core.model.auth.TokenValidationResult;
import tollgate.core.model.auth.TrustedIssuer;
import tollgate.core.port.out.AuthMetrics;
import tollgate.core.port.out.ProviderKeyCache;
import tollgate.spi.CredentialValidator;

/**
 * Validates JWTs issued by trusted identity providers.
 *
 * <p>The token is first decoded without verification to read {@code iss}, {@code kid} and
 * {@code alg}. Only a trusted issuer's keys are then fetched; the key is picked by id when the
 * header names one, otherwise every key of the header's algorithm is tried. Signature, issuer,
 * audience, expiry and not-before are then checked with the configured clock skew.
 *
 * <p>Accepted tokens are remembered in the {@link ValidatedTokenCache}; rejections are not.
 */
@ApplicationScoped
public class ProviderTokenValidator implements CredentialValidator {

    private static final Logger LOG = Logger.getLogger(ProviderTokenValidator.class);
    static final String NAME = "provider";
    private static final int PRIORITY = 100;

    private static final Set<String> SUPPORTED_ALGORITHMS = Set.of(
            AlgorithmIdentifiers.RSA_USING_SHA256,
            AlgorithmIdentifiers.RSA_USING_SHA384,
            AlgorithmIdentifiers.RSA_USING_SHA512,
            AlgorithmIdentifiers.RSA_PSS_USING_SHA256,
            AlgorithmIdentifiers.RSA_PSS_USING_SHA384,
            AlgorithmIdentifiers.RSA_PSS_USING_SHA512,
            AlgorithmIdentifiers.ECDSA_USING_P256_CURVE_AND_SHA256,
            AlgorithmIdentifiers.ECDSA_USING_P384_CURVE_AND_SHA384,
            AlgorithmIdentifiers.ECDSA_USING_P521_CURVE_AND_SHA512);

    private static final JwtConsumer UNVERIFIED = new JwtConsumerBuilder()
            .setSkipAllValidators()
            .setDisableRequireSignature()
            .setSkipSignatureVerification()
            .build();

    private final ProviderKeyCache keyCache;
    private final ValidatedTokenCache tokenCache;
    private final AuthSettings settings;
    private final AuthMetrics metrics;
    private final Clock clock;

    @Inject
    public ProviderTokenValidator(
            ProviderKeyCache keyCache,
            ValidatedTokenCache tokenCache,
            AuthSettings settings,
            AuthMetrics metrics,
            Clock clock) {
        this.keyCache = keyCache;
        this.tokenCache = tokenCache;
        this.settings = settings;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return !settings.issuers().isEmpty();
    }

    @Override
    public Uni<TokenValidationResult> validate(String token) {
        if (token == null || token.isBlank()) {
            return Uni.createFrom().item(TokenValidationResult.invalid(AuthErrorKind.MISSING_CREDENTIAL, null));
        }

        final var cached = tokenCache.get(token);
        if (cached.isPresent()) {
            metrics.recordTokenCacheHit();
            return Uni.createFrom().item(TokenValidationResult.valid(cached.get()));
        }

        return Uni.createFrom()
                .item(() -> inspect(token))
                .flatMap(header -> keyCache.keySet(header.trusted().issuer())
                        .map(keySet -> verify(token, header, keySet)))
                .invoke(result -> {
                    if (result instanceof TokenValidationResult.Valid valid) {
                        tokenCache.put(token, valid.identity());
                    }
                })
                .onFailure(AuthException.class)
                .recoverWithItem(failure ->
                        TokenValidationResult.invalid(((AuthException) failure).kind(), failure.getMessage()))
                .onFailure()
                .recoverWithItem(failure -> {
                    LOG.errorv(failure, "Unexpected failure validating provider token");
                    return TokenValidationResult.invalid(AuthErrorKind.UNAUTHENTICATED, failure.getMessage());
                });
    }

    /**
     * Reads the unverified header and claims and applies the checks that need no key.
     */
    private UnverifiedToken inspect(String token) {
        final JwtClaims claims;
        final JsonWebSignature jws;
        try {
            final var context = UNVERIFIED.process(token);
            if (context.getJoseObjects().size() != 1
                    || !(context.getJoseObjects().get(0) instanceof JsonWebSignature signature)) {
                throw new AuthException(AuthErrorKind.MALFORMED_TOKEN, "not a signed JWT");
            }
            claims = context.getJwtClaims();
            jws = signature;
        } catch (InvalidJwtException e) {
            throw new AuthException(AuthErrorKind.MALFORMED_TOKEN, "undecodable token");
        }

        final var algorithm = jws.getAlgorithmHeaderValue();
        if (algorithm == null || !SUPPORTED_ALGORITHMS.contains(algorithm)) {
            throw new AuthException(AuthErrorKind.INVALID_SIGNATURE, "unsupported algorithm " + algorithm);
        }

        final String issuer;
        final NumericDate expiration;
        try {
            issuer = claims.getIssuer();
            expiration = claims.getExpirationTime();
        } catch (MalformedClaimException e) {
            throw new AuthException(AuthErrorKind.MALFORMED_TOKEN, e.getMessage());
        }

        final TrustedIssuer trusted = settings.trustedIssuer(issuer)
                .orElseThrow(() -> new AuthException(AuthErrorKind.PROVIDER_UNKNOWN, "untrusted issuer " + issuer));

        if (expiration == null) {
            throw new AuthException(AuthErrorKind.MALFORMED_TOKEN, "missing exp");
        }
        final var skewSeconds = settings.clockSkew().toSeconds();
        if (clock.instant().getEpochSecond() - skewSeconds >= expiration.getValue()) {
            throw new AuthException(AuthErrorKind.EXPIRED_TOKEN, "expired at " + expiration);
        }

        return new UnverifiedToken(trusted, jws.getKeyIdHeaderValue(), algorithm);
    }

    private TokenValidationResult verify(String token, UnverifiedToken header, JsonWebKeySet keySet) {
        final var candidates = candidateKeys(header, keySet);
        if (candidates.isEmpty()) {
            return TokenValidationResult.invalid(
                    AuthErrorKind.INVALID_SIGNATURE,
                    header.keyId() != null ? "no key with kid " + header.keyId() : "no key for " + header.algorithm());
        }

        for (final var key : candidates) {
            metrics.recordSignatureVerification(header.trusted().issuer());
            try {
                final var claims = consumerFor(header, key).processToClaims(token);
                return TokenValidationResult.valid(toIdentity(claims, header.trusted()));
            } catch (InvalidJwtException e) {
                if (e.hasErrorCode(ErrorCodes.SIGNATURE_INVALID) && candidates.size() > 1) {
                    continue;
                }
                LOG.debugv("Provider token rejected for {0}: {1}", header.trusted().issuer(), e.getMessage());
                return TokenValidationResult.invalid(classify(e), summarize(e));
            } catch (MalformedClaimException e) {
                return TokenValidationResult.invalid(AuthErrorKind.MALFORMED_TOKEN, e.getMessage());
            }
        }
        return TokenValidationResult.invalid(AuthErrorKind.INVALID_SIGNATURE, "no key verified the signature");
    }

    private List<JsonWebKey> candidateKeys(UnverifiedToken header, JsonWebKeySet keySet) {
        return keySet.getJsonWebKeys().stream()
                .filter(key -> key.getUse() == null || "sig".equals(key.getUse()))
                .filter(key -> header.keyId() != null
                        ? header.keyId().equals(key.getKeyId())
                        : matchesAlgorithm(key, header.algorithm()))
                .toList();
    }

    private static boolean matchesAlgorithm(JsonWebKey key, String algorithm) {
        if (key.getAlgorithm() != null) {
            return algorithm.equals(key.getAlgorithm());
        }
        if (algorithm.startsWith("ES")) {
            return "EC".equals(key.getKeyType());
        }
        return "RSA".equals(key.getKeyType());
    }

    private JwtConsumer consumerFor(UnverifiedToken header, JsonWebKey key) {
        return new JwtConsumerBuilder()
                .setRequireSubject()
                .setRequireExpirationTime()
                .setAllowedClockSkewInSeconds((int) settings.clockSkew().toSeconds())
                .setEvaluationTime(NumericDate.fromMilliseconds(clock.millis()))
                .setExpectedIssuer(header.trusted().issuer())
                .setExpectedAudience(header.trusted().audience())
                .setJwsAlgorithmConstraints(
                        new AlgorithmConstraints(ConstraintType.PERMIT, header.algorithm()))
                .setVerificationKey(key.getKey())
                .build();
    }

    private Identity toIdentity(JwtClaims claims, TrustedIssuer trusted) throws MalformedClaimException {
        final var subject = claims.getSubject();
        final var expiresAt = Instant.ofEpochSecond(claims.getExpirationTime().getValue());
        final Optional<String> email = claims.isClaimValueString("email")
                ? Optional.ofNullable(claims.getStringClaimValue("email"))
                : Optional.empty();
        return Identity.provider(subject, email, trusted.issuer(), expiresAt, settings.isAdmin(subject, email));
    }

    static AuthErrorKind classify(InvalidJwtException e) {
        if (e.hasExpired()) {
            return AuthErrorKind.EXPIRED_TOKEN;
        }
        if (e.hasErrorCode(ErrorCodes.NOT_YET_VALID)) {
            return AuthErrorKind.NOT_YET_VALID;
        }
        if (e.hasErrorCode(ErrorCodes.AUDIENCE_INVALID) || e.hasErrorCode(ErrorCodes.AUDIENCE_MISSING)) {
            return AuthErrorKind.AUDIENCE_MISMATCH;
        }
        if (e.hasErrorCode(ErrorCodes.ISSUER_INVALID) || e.hasErrorCode(ErrorCodes.ISSUER_MISSING)) {
            return AuthErrorKind.ISSUER_MISMATCH;
        }
        if (e.hasErrorCode(ErrorCodes.SIGNATURE_INVALID)
                || e.hasErrorCode(ErrorCodes.SIGNATURE_MISSING)
                || e.getErrorDetails().isEmpty()) {
            return AuthErrorKind.INVALID_SIGNATURE;
        }
        // Remaining codes are claim problems: missing sub or exp, exp before iat, bad claim types.
        return AuthErrorKind.MALFORMED_TOKEN;
    }

    private static String summarize(InvalidJwtException e) {
        return e.getErrorDetails().isEmpty()
                ? "token rejected"
                : e.getErrorDetails().get(0).getErrorMessage();
    }

    private record UnverifiedToken(TrustedIssuer trusted, String keyId, String algorithm) {}
}
