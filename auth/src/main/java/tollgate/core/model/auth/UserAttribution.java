package tollgate.core.model.auth;

import java.util.Optional;

/**
 * Who a request acts for, as opposed to who authenticated it.
 *
 * <p>For a user calling directly both are the same. A service calling with a static key may act
 * on behalf of a user, in which case {@code serviceAccount} names the service.
 */
public record UserAttribution(
        String userId, Optional<String> userEmail, Optional<String> userName, Optional<String> serviceAccount) {

    public UserAttribution {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID cannot be null or blank");
        }
        if (userEmail == null) {
            userEmail = Optional.empty();
        }
        if (userName == null) {
            userName = Optional.empty();
        }
        if (serviceAccount == null) {
            serviceAccount = Optional.empty();
        }
    }

    public boolean isDelegated() {
        return serviceAccount.isPresent();
    }
}
