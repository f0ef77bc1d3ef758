package tollgate.client;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.http.HttpServer;
import io.vertx.mutiny.core.http.HttpServerRequest;
import org.jboss.logging.Logger;

import tollgate.core.model.auth.AuthErrorKind;
import tollgate.core.model.auth.AuthException;

/**
 * Short-lived HTTP listener on the loopback interface that receives the authorization redirect.
 *
 * <p>The first request to the callback path completes the attempt. The state parameter is compared
 * before the code is read; a mismatched callback never exposes its code. Close the server on every
 * exit path, typically with try-with-resources.
 */
public final class LoopbackCallbackServer implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(LoopbackCallbackServer.class);

    private static final String SUCCESS_PAGE =
            "<!DOCTYPE html><html><body><p>Login complete. You can close this window.</p></body></html>";
    private static final String FAILURE_PAGE =
            "<!DOCTYPE html><html><body><p>Login failed. Return to the terminal for details.</p></body></html>";

    private final HttpServer server;
    private final byte[] expectedState;
    private volatile URI redirectUri;
    private final CompletableFuture<CallbackResult> result = new CompletableFuture<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    private LoopbackCallbackServer(HttpServer server, URI redirectUri, String expectedState) {
        this.server = server;
        this.redirectUri = redirectUri;
        this.expectedState = expectedState.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Binds to the host and port of {@code redirectUri}. Port 0 picks a free port; {@link #redirectUri()}
     * then reports the bound one.
     */
    public static LoopbackCallbackServer start(Vertx vertx, URI redirectUri, String expectedState) {
        final var server = vertx.createHttpServer();
        final var path = redirectUri.getPath() == null || redirectUri.getPath().isEmpty() ? "/" : redirectUri.getPath();
        final var host = redirectUri.getHost().startsWith("[")
                ? redirectUri.getHost().substring(1, redirectUri.getHost().length() - 1)
                : redirectUri.getHost();
        final var callbackServer = new LoopbackCallbackServer(server, redirectUri, expectedState);
        server.requestHandler(request -> callbackServer.handle(request, path));
        try {
            server.listenAndAwait(Math.max(redirectUri.getPort(), 0), host);
        } catch (RuntimeException e) {
            throw new AuthException(
                    AuthErrorKind.LOGIN_FAILED, "cannot listen on " + host + ":" + redirectUri.getPort(), e);
        }
        callbackServer.redirectUri = withPort(redirectUri, server.actualPort());
        LOG.debugv("Listening for login callback on {0}", callbackServer.redirectUri);
        return callbackServer;
    }

    public URI redirectUri() {
        return redirectUri;
    }

    /**
     * Blocks until the callback arrives.
     *
     * @throws AuthException with {@link AuthErrorKind#LOGIN_FAILED} on timeout or interruption
     */
    public CallbackResult await(Duration timeout) {
        try {
            return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new AuthException(AuthErrorKind.LOGIN_FAILED, "timed out waiting for login callback", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthException(AuthErrorKind.LOGIN_FAILED, "interrupted waiting for login callback", e);
        } catch (ExecutionException e) {
            throw new AuthException(AuthErrorKind.LOGIN_FAILED, "login callback failed", e.getCause());
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            result.complete(new CallbackResult.Denied("closed", "callback server closed"));
            server.closeAndAwait();
            LOG.debugv("Closed login callback listener on {0}", redirectUri);
        }
    }

    private void handle(HttpServerRequest request, String callbackPath) {
        if (!callbackPath.equals(request.path())) {
            respond(request, 404, FAILURE_PAGE);
            return;
        }
        final var callback = evaluate(request);
        if (result.complete(callback)) {
            LOG.debugv("Received login callback: {0}", callback);
        }
        respond(request, callback instanceof CallbackResult.Authorized ? 200 : 400,
                callback instanceof CallbackResult.Authorized ? SUCCESS_PAGE : FAILURE_PAGE);
    }

    private CallbackResult evaluate(HttpServerRequest request) {
        final var state = request.getParam("state");
        if (state == null || !MessageDigest.isEqual(expectedState, state.getBytes(StandardCharsets.UTF_8))) {
            return new CallbackResult.StateMismatch();
        }
        final var error = request.getParam("error");
        if (error != null) {
            return new CallbackResult.Denied(error, request.getParam("error_description"));
        }
        final var code = request.getParam("code");
        if (code == null || code.isBlank()) {
            return new CallbackResult.Denied("invalid_request", "no authorization code");
        }
        return new CallbackResult.Authorized(code);
    }

    private static void respond(HttpServerRequest request, int status, String body) {
        request.response()
                .setStatusCode(status)
                .putHeader("Content-Type", "text/html; charset=utf-8")
                .putHeader("X-Content-Type-Options", "nosniff")
                .putHeader("X-Frame-Options", "DENY")
                .putHeader("Content-Security-Policy", "default-src 'none'")
                .putHeader("Cache-Control", "no-store")
                .putHeader("Referrer-Policy", "no-referrer")
                .endAndForget(body);
    }

    private static URI withPort(URI uri, int port) {
        try {
            return new URI(uri.getScheme(), null, uri.getHost(), port, uri.getPath(), null, null);
        } catch (URISyntaxException e) {
            throw new IllegalStateException("Cannot rebuild redirect URI " + uri, e);
        }
    }
}
