package tollgate.adapter.in.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.LaunchMode;
import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import tollgate.core.config.AuthSettings;

/**
 * Startup guard for the development-only authentication bypass.
 *
 * <p>Fails fast if {@code tollgate.auth.dangerous-disable=true} or {@code tollgate.auth.enabled=false}
 * is set in production mode and warns loudly when either is active elsewhere.
 */
@ApplicationScoped
public class AuthDisabledGuard {

    private static final Logger LOG = Logger.getLogger(AuthDisabledGuard.class);

    private final AuthSettings settings;

    @Inject
    public AuthDisabledGuard(AuthSettings settings) {
        this.settings = settings;
    }

    /**
     * @throws IllegalStateException if either bypass is active in production
     */
    void onStart(@Observes StartupEvent event) {
        if (settings.authenticationRequired()) {
            return;
        }
        final var setting = settings.disabledForDevelopment()
                ? "tollgate.auth.dangerous-disable=true"
                : "tollgate.auth.enabled=false";
        if (currentLaunchMode() == LaunchMode.NORMAL) {
            LOG.errorv("{0} is not allowed in production mode", setting);
            throw new IllegalStateException(setting + " is not allowed in production mode. "
                    + "This setting disables all authentication. "
                    + "Remove this setting or run in dev/test mode.");
        }
        LOG.warnv("Authentication is DISABLED by {0} (launch mode {1}); every request is admitted",
                setting, currentLaunchMode());
    }

    /** Returns the current Quarkus launch mode. */
    LaunchMode currentLaunchMode() {
        return LaunchMode.current();
    }
}
