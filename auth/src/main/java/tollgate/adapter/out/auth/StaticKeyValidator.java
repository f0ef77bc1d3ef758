package tollgate.adapter.out.auth;

import java.security.MessageDigest;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tollgate.core.config.AuthSettings;
import tollgate.core.model.auth.AuthErrorKind;
import tollgate.core.model.auth.Identity;
import tollgate.core.model.auth.TokenValidationResult;
import tollgate.core.util.SecureHash;
import tollgate.spi.CredentialValidator;

/**
 * Validates preconfigured service keys.
 *
 * <p>The key table is built once from {@link AuthSettings}. By default a token is looked up with a
 * single hash probe. With {@code constant-time-key-compare} enabled every stored key is compared
 * against the token digest without early exit.
 */
@ApplicationScoped
public class StaticKeyValidator implements CredentialValidator {

    private static final Logger LOG = Logger.getLogger(StaticKeyValidator.class);
    static final String NAME = "static-key";
    private static final int PRIORITY = 200;

    private final Map<String, String> namesByKey;
    private final List<HashedKey> hashedKeys;
    private final boolean constantTime;
    private final AuthSettings settings;

    @Inject
    public StaticKeyValidator(AuthSettings settings) {
        this.settings = settings;
        this.namesByKey = settings.staticKeys();
        this.constantTime = settings.constantTimeKeyCompare();
        this.hashedKeys = constantTime
                ? namesByKey.entrySet().stream()
                        .map(entry -> new HashedKey(SecureHash.sha256(entry.getKey()), entry.getValue()))
                        .toList()
                : List.of();
        LOG.infov("Static key validator loaded {0} keys (constantTime={1})", namesByKey.size(), constantTime);
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
        return !namesByKey.isEmpty();
    }

    @Override
    public Uni<TokenValidationResult> validate(String token) {
        if (token == null || token.isBlank()) {
            return Uni.createFrom().item(TokenValidationResult.invalid(AuthErrorKind.MISSING_CREDENTIAL, null));
        }
        return Uni.createFrom().item(() -> lookup(token)
                .map(name -> TokenValidationResult.valid(Identity.staticKey(name, settings.admins().contains(name))))
                .orElseGet(() ->
                        TokenValidationResult.invalid(AuthErrorKind.INVALID_CREDENTIAL, "unknown static key")));
    }

    private Optional<String> lookup(String token) {
        if (!constantTime) {
            return Optional.ofNullable(namesByKey.get(token));
        }
        final var digest = SecureHash.sha256(token);
        String match = null;
        for (final var candidate : hashedKeys) {
            if (MessageDigest.isEqual(candidate.digest(), digest)) {
                match = candidate.name();
            }
        }
        return Optional.ofNullable(match);
    }

    private record HashedKey(byte[] digest, String name) {}
}
