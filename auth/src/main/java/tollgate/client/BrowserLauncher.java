package tollgate.client;

import java.io.IOException;
import java.net.URI;

/**
 * Opens the provider's authorization page for the user.
 */
@FunctionalInterface
public interface BrowserLauncher {

    void open(URI authorizationUri) throws IOException;
}
