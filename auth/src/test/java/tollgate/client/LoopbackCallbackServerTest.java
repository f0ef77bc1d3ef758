package tollgate.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.net.URI;
import java.time.Duration;

import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tollgate.core.model.auth.AuthErrorKind;
import tollgate.core.model.auth.AuthException;

@DisplayName("LoopbackCallbackServer")
class LoopbackCallbackServerTest {

    private static final URI REDIRECT = URI.create("http://127.0.0.1:0/callback");
    private static final Duration WAIT = Duration.ofSeconds(5);

    private Vertx vertx;
    private WebClient client;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        client = WebClient.create(vertx);
    }

    @AfterEach
    void tearDown() {
        client.close();
        vertx.close().await().indefinitely();
    }

    @Test
    @DisplayName("matching state yields the authorization code")
    void authorized() {
        try (var server = LoopbackCallbackServer.start(vertx, REDIRECT, "state-1")) {
            final var response = get(server.redirectUri() + "?code=abc&state=state-1");

            assertEquals(200, response.statusCode());
            final var result = assertInstanceOf(CallbackResult.Authorized.class, server.await(WAIT));
            assertEquals("abc", result.code());
        }
    }

    @Test
    @DisplayName("bound port replaces port 0 in the redirect URI")
    void reportsBoundPort() {
        try (var server = LoopbackCallbackServer.start(vertx, REDIRECT, "s")) {
            assertNotEquals(0, server.redirectUri().getPort());
            assertEquals("/callback", server.redirectUri().getPath());
        }
    }

    @Test
    @DisplayName("wrong state is a mismatch even when a code is present")
    void stateMismatch() {
        try (var server = LoopbackCallbackServer.start(vertx, REDIRECT, "state-1")) {
            final var response = get(server.redirectUri() + "?code=abc&state=forged");

            assertEquals(400, response.statusCode());
            assertInstanceOf(CallbackResult.StateMismatch.class, server.await(WAIT));
        }
    }

    @Test
    @DisplayName("missing state is a mismatch")
    void missingState() {
        try (var server = LoopbackCallbackServer.start(vertx, REDIRECT, "state-1")) {
            get(server.redirectUri() + "?code=abc");

            assertInstanceOf(CallbackResult.StateMismatch.class, server.await(WAIT));
        }
    }

    @Test
    @DisplayName("provider error with matching state is reported as denied")
    void denied() {
        try (var server = LoopbackCallbackServer.start(vertx, REDIRECT, "state-1")) {
            get(server.redirectUri() + "?error=access_denied&error_description=nope&state=state-1");

            final var result = assertInstanceOf(CallbackResult.Denied.class, server.await(WAIT));
            assertEquals("access_denied", result.error());
            assertEquals("nope", result.description());
        }
    }

    @Test
    @DisplayName("other paths get 404 and do not complete the login")
    void otherPath() {
        try (var server = LoopbackCallbackServer.start(vertx, REDIRECT, "state-1")) {
            final var base = server.redirectUri();
            final var response = get("http://127.0.0.1:" + base.getPort() + "/favicon.ico");
            assertEquals(404, response.statusCode());

            get(base + "?code=abc&state=state-1");
            assertInstanceOf(CallbackResult.Authorized.class, server.await(WAIT));
        }
    }

    @Test
    @DisplayName("callback page is served with restrictive headers")
    void securityHeaders() {
        try (var server = LoopbackCallbackServer.start(vertx, REDIRECT, "state-1")) {
            final var response = get(server.redirectUri() + "?code=abc&state=state-1");

            assertEquals("nosniff", response.getHeader("X-Content-Type-Options"));
            assertEquals("DENY", response.getHeader("X-Frame-Options"));
            assertEquals("default-src 'none'", response.getHeader("Content-Security-Policy"));
            assertEquals("no-store", response.getHeader("Cache-Control"));
            assertEquals("no-referrer", response.getHeader("Referrer-Policy"));
        }
    }

    @Test
    @DisplayName("await times out with LOGIN_FAILED")
    void timeout() {
        try (var server = LoopbackCallbackServer.start(vertx, REDIRECT, "state-1")) {
            final var e = assertThrows(AuthException.class, () -> server.await(Duration.ofMillis(100)));

            assertEquals(AuthErrorKind.LOGIN_FAILED, e.kind());
        }
    }

    @Test
    @DisplayName("close releases the port for the next attempt")
    void closeReleasesPort() {
        final URI bound;
        try (var server = LoopbackCallbackServer.start(vertx, REDIRECT, "first")) {
            bound = server.redirectUri();
        }

        try (var again = LoopbackCallbackServer.start(vertx, bound, "second")) {
            assertEquals(bound.getPort(), again.redirectUri().getPort());
        }
    }

    @Test
    @DisplayName("a port held by another process fails with LOGIN_FAILED")
    void portInUse() {
        // A second Vert.x instance stands in for another process; servers within one instance share ports.
        final var other = Vertx.vertx();
        try (var server = LoopbackCallbackServer.start(other, REDIRECT, "first")) {
            final var e = assertThrows(AuthException.class,
                    () -> LoopbackCallbackServer.start(vertx, server.redirectUri(), "second"));

            assertEquals(AuthErrorKind.LOGIN_FAILED, e.kind());
        } finally {
            other.close().await().indefinitely();
        }
    }

    private HttpResponse<Buffer> get(String url) {
        return client.getAbs(url).send().await().atMost(WAIT);
    }
}
