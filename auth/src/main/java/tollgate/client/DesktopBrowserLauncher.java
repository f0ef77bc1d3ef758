package tollgate.client;

import java.awt.Desktop;
import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.net.URI;

import org.jboss.logging.Logger;

/**
 * Opens the system browser, or logs the URL when no desktop is available.
 */
public class DesktopBrowserLauncher implements BrowserLauncher {

    private static final Logger LOG = Logger.getLogger(DesktopBrowserLauncher.class);

    @Override
    public void open(URI authorizationUri) throws IOException {
        if (!GraphicsEnvironment.isHeadless()
                && Desktop.isDesktopSupported()
                && Desktop.getDesktop().isSupported(Desktop.Action.BROWSE)) {
            LOG.infov("Opening browser for login: {0}", authorizationUri);
            Desktop.getDesktop().browse(authorizationUri);
            return;
        }
        LOG.infov("Open this URL in a browser to log in: {0}", authorizationUri);
    }
}
