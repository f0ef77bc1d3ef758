package tollgate.core.service.auth;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.function.Function;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import tollgate.core.model.auth.AuthErrorKind;
import tollgate.core.model.auth.AuthException;
import tollgate.core.model.auth.Identity;
import tollgate.core.model.auth.UserAttribution;
import tollgate.core.port.out.SecurityEvents;

/**
 * Works out which user a request acts for from the {@code x-user-*} headers.
 *
 * <ul>
 *   <li>Static-key callers are services and may act on behalf of any user.</li>
 *   <li>Provider callers are users; claimed ids and emails must match their token.</li>
 *   <li>Without an identity (authentication disabled) the claimed values are taken as given.</li>
 * </ul>
 *
 * <p>Header values may be percent-encoded UTF-8.
 */
@ApplicationScoped
public class UserAttributionResolver {

    private static final Logger LOG = Logger.getLogger(UserAttributionResolver.class);

    public static final String USER_ID_HEADER = "x-user-id";
    public static final String USER_EMAIL_HEADER = "x-user-email";
    public static final String USER_NAME_HEADER = "x-user-name";

    private static final String UNKNOWN = "unknown";

    private final SecurityEvents securityEvents;

    @Inject
    public UserAttributionResolver(SecurityEvents securityEvents) {
        this.securityEvents = securityEvents;
    }

    /**
     * Resolve attribution for a request.
     *
     * @param identity the authenticated caller, or null when authentication is bypassed
     * @param headers  header lookup returning null for absent headers
     * @throws AuthException with {@link AuthErrorKind#IMPERSONATION_DENIED} when a user claims to be
     *     someone else
     */
    public UserAttribution resolve(Identity identity, Function<String, String> headers) {
        final var claimedId = header(headers, USER_ID_HEADER);
        final var claimedEmail = header(headers, USER_EMAIL_HEADER);
        final var claimedName = header(headers, USER_NAME_HEADER);

        if (identity == null) {
            return new UserAttribution(
                    claimedId.orElse(UNKNOWN),
                    claimedEmail.or(() -> Optional.of(UNKNOWN)),
                    claimedName,
                    Optional.empty());
        }

        if (identity.kind() == Identity.Kind.STATIC_KEY) {
            final var delegated = claimedId.isPresent() || claimedEmail.isPresent();
            return new UserAttribution(
                    claimedId.orElse(identity.subject()),
                    claimedEmail.or(identity::email),
                    claimedName,
                    delegated ? Optional.of(identity.subject()) : Optional.empty());
        }

        if (claimedId.isPresent() && !claimedId.get().equals(identity.subject())) {
            throw impersonation(identity, claimedId.get());
        }
        if (claimedEmail.isPresent()
                && identity.email().isPresent()
                && !claimedEmail.get().equals(identity.email().get())) {
            throw impersonation(identity, claimedEmail.get());
        }
        return new UserAttribution(identity.subject(), identity.email(), claimedName, Optional.empty());
    }

    private AuthException impersonation(Identity identity, String claimed) {
        LOG.warnv("Impersonation attempt: subject={0} claimed={1}", identity.subject(), claimed);
        securityEvents.impersonationDenied(identity.subject(), claimed);
        return new AuthException(AuthErrorKind.IMPERSONATION_DENIED, "user impersonation not allowed");
    }

    private static Optional<String> header(Function<String, String> headers, String name) {
        final var raw = headers.apply(name);
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            // URLDecoder would turn '+' into a space; only percent escapes are decoded here.
            return Optional.of(URLDecoder.decode(raw.replace("+", "%2B"), StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            LOG.warnv("Header {0} has invalid percent-encoding, using raw value", name);
            return Optional.of(raw);
        }
    }
}
