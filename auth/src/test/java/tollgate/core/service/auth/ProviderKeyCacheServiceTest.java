package tollgate.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.smallrye.mutiny.Uni;
import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.jwk.RsaJwkGenerator;
import org.jose4j.lang.JoseException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import tollgate.core.config.AuthSettings;
import tollgate.core.model.auth.AuthErrorKind;
import tollgate.core.model.auth.AuthException;
import tollgate.core.model.auth.ClientRegistration;
import tollgate.core.model.auth.IdentityProviderException;
import tollgate.core.model.auth.ProviderMetadata;
import tollgate.core.model.auth.TokenResponse;
import tollgate.core.port.out.AuthMetrics;
import tollgate.core.port.out.IdentityProviderClient;
import tollgate.core.port.out.SecurityEvents;
import tollgate.support.MutableClock;

@DisplayName("ProviderKeyCacheService")
@ExtendWith(MockitoExtension.class)
class ProviderKeyCacheServiceTest {

    private static final String ISSUER = "https://idp.example";
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private static JsonWebKeySet keys;

    @Mock
    private AuthMetrics metrics;

    @Mock
    private SecurityEvents securityEvents;

    private FakeProviderClient client;
    private MutableClock clock;
    private ProviderKeyCacheService service;

    @BeforeAll
    static void generateKeys() throws JoseException {
        final var jwk = RsaJwkGenerator.generateJwk(2048);
        jwk.setKeyId("k1");
        keys = new JsonWebKeySet(jwk);
    }

    @BeforeEach
    void setUp() {
        client = new FakeProviderClient();
        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        service = newService(Duration.ofSeconds(2));
    }

    private ProviderKeyCacheService newService(Duration fetchTimeout) {
        return newService(fetchTimeout, clock);
    }

    private ProviderKeyCacheService newService(Duration fetchTimeout, Clock serviceClock) {
        final var settings = AuthSettings.builder()
                .trustIssuer(ISSUER, "app1")
                .fetchTimeout(fetchTimeout)
                .build();
        return new ProviderKeyCacheService(
                client, settings, metrics, securityEvents, new SimpleMeterRegistry(), serviceClock);
    }

    @Nested
    @DisplayName("single flight")
    class SingleFlight {

        private ExecutorService executor;

        @BeforeEach
        void startExecutor() {
            executor = Executors.newFixedThreadPool(8);
        }

        @AfterEach
        void stopExecutor() {
            executor.shutdownNow();
        }

        @Test
        @DisplayName("should share one fetch between concurrent misses")
        void shouldShareOneFetch() throws Exception {
            client.keyDelay = Duration.ofMillis(300);
            final var start = new CountDownLatch(1);
            final var results = new ArrayList<CompletableFuture<JsonWebKeySet>>();

            for (int i = 0; i < 16; i++) {
                results.add(CompletableFuture.supplyAsync(
                        () -> {
                            try {
                                start.await();
                            } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                                throw new IllegalStateException(e);
                            }
                            return service.keySet(ISSUER).await().atMost(TIMEOUT);
                        },
                        executor));
            }
            start.countDown();
            CompletableFuture.allOf(results.toArray(CompletableFuture[]::new)).get(10, TimeUnit.SECONDS);

            assertEquals(1, client.discoveries.get());
            assertEquals(1, client.keyFetches.get());
            for (final var result : results) {
                assertSame(keys, result.join());
            }
        }

        @Test
        @DisplayName("should reuse keys cached by a fetch that completes between the miss and the in-flight lookup")
        void shouldReuseKeysCachedAfterMiss() {
            final var fetchedAt = Instant.parse("2026-03-01T12:00:00Z");
            // fetch stamp, then an expired first lookup, then fresh for every later read
            final var steps = new SteppingClock(
                    fetchedAt, fetchedAt.plusSeconds(3600), fetchedAt.plusSeconds(10));
            final var stepped = newService(Duration.ofSeconds(2), steps);

            stepped.keySet(ISSUER).await().atMost(TIMEOUT);
            final var second = stepped.keySet(ISSUER).await().atMost(TIMEOUT);

            assertSame(keys, second);
            assertEquals(1, client.keyFetches.get());
        }

        @Test
        @DisplayName("should not cancel the shared fetch when one waiter gives up")
        void shouldKeepFetchWhenOneWaiterCancels() {
            client.keyDelay = Duration.ofMillis(200);

            final var abandoned = service.keySet(ISSUER).subscribe().with(ignored -> {}, ignored -> {});
            final var waiting = service.keySet(ISSUER).subscribeAsCompletionStage();
            abandoned.cancel();

            assertSame(keys, waiting.toCompletableFuture().orTimeout(5, TimeUnit.SECONDS).join());
            assertEquals(1, client.keyFetches.get());
        }
    }

    @Nested
    @DisplayName("expiry")
    class Expiry {

        @Test
        @DisplayName("should serve cached keys within the TTL")
        void shouldServeCachedKeys() {
            service.keySet(ISSUER).await().atMost(TIMEOUT);
            clock.advance(Duration.ofMinutes(59));
            service.keySet(ISSUER).await().atMost(TIMEOUT);

            assertEquals(1, client.keyFetches.get());
            verify(metrics, times(1)).recordKeyFetch(ISSUER, true);
        }

        @Test
        @DisplayName("should fetch again once the TTL has passed, reusing discovery")
        void shouldRefetchAfterTtl() {
            service.keySet(ISSUER).await().atMost(TIMEOUT);
            clock.advance(Duration.ofSeconds(3600));
            service.keySet(ISSUER).await().atMost(TIMEOUT);

            assertEquals(2, client.keyFetches.get());
            assertEquals(1, client.discoveries.get());
        }

        @Test
        @DisplayName("should discover again after invalidate")
        void shouldRediscoverAfterInvalidate() {
            service.keySet(ISSUER).await().atMost(TIMEOUT);
            service.invalidate(ISSUER);
            service.keySet(ISSUER).await().atMost(TIMEOUT);

            assertEquals(2, client.discoveries.get());
            assertEquals(2, client.keyFetches.get());
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        private AuthErrorKind failureKind() {
            final var failure = assertThrows(AuthException.class, () -> service.keySet(ISSUER).await().atMost(TIMEOUT));
            return failure.kind();
        }

        @Test
        @DisplayName("should fail closed with PROVIDER_UNAVAILABLE and report it once")
        void shouldFailClosed() {
            client.keyFailure = new IdentityProviderException("Identity provider returned status 503", 503);

            assertEquals(AuthErrorKind.PROVIDER_UNAVAILABLE, failureKind());
            verify(securityEvents, times(1)).providerUnavailable(eq(ISSUER), anyString());
            verify(metrics).recordKeyFetch(ISSUER, false);
        }

        @Test
        @DisplayName("should not cache a failed fetch")
        void shouldRetryOnNextMiss() {
            client.keyFailure = new IdentityProviderException("connection refused");
            failureKind();

            client.keyFailure = null;

            assertSame(keys, service.keySet(ISSUER).await().atMost(TIMEOUT));
            assertEquals(2, client.keyFetches.get());
        }

        @Test
        @DisplayName("should never serve expired keys when the refresh fails")
        void shouldNotServeStaleKeys() {
            service.keySet(ISSUER).await().atMost(TIMEOUT);
            clock.advance(Duration.ofHours(2));
            client.keyFailure = new IdentityProviderException("connection refused");

            assertEquals(AuthErrorKind.PROVIDER_UNAVAILABLE, failureKind());
        }

        @Test
        @DisplayName("should reject a discovery document naming another issuer")
        void shouldRejectIssuerMismatch() {
            client.discoveredIssuer = "https://evil.example";

            assertEquals(AuthErrorKind.PROVIDER_UNAVAILABLE, failureKind());
            assertEquals(0, client.keyFetches.get());
        }

        @Test
        @DisplayName("should reject an empty key set")
        void shouldRejectEmptyKeySet() {
            client.keySet = new JsonWebKeySet();

            assertEquals(AuthErrorKind.PROVIDER_UNAVAILABLE, failureKind());
        }

        @Test
        @DisplayName("should time out an unresponsive provider")
        void shouldTimeOut() {
            service = newService(Duration.ofMillis(100));
            client.hangOnKeys = true;

            assertEquals(AuthErrorKind.PROVIDER_UNAVAILABLE, failureKind());
        }

        @Test
        @DisplayName("should not emit a security event for a healthy fetch")
        void shouldStayQuietWhenHealthy() {
            service.keySet(ISSUER).await().atMost(TIMEOUT);

            verify(securityEvents, never()).providerUnavailable(anyString(), anyString());
        }
    }

    /**
     * Counts calls and returns canned discovery and key responses.
     */
    /**
     * Returns the given instants in order, then repeats the last one.
     */
    static final class SteppingClock extends Clock {

        private final Deque<Instant> instants;

        SteppingClock(Instant... instants) {
            this.instants = new ArrayDeque<>(List.of(instants));
        }

        @Override
        public synchronized Instant instant() {
            return instants.size() > 1 ? instants.poll() : instants.peek();
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }
    }

    static final class FakeProviderClient implements IdentityProviderClient {

        final AtomicInteger discoveries = new AtomicInteger();
        final AtomicInteger keyFetches = new AtomicInteger();
        volatile String discoveredIssuer = ISSUER;
        volatile JsonWebKeySet keySet = keys;
        volatile Duration keyDelay = Duration.ZERO;
        volatile RuntimeException keyFailure;
        volatile boolean hangOnKeys;

        @Override
        public Uni<ProviderMetadata> discover(String issuer) {
            return Uni.createFrom().item(() -> {
                discoveries.incrementAndGet();
                return new ProviderMetadata(
                        URI.create(discoveredIssuer),
                        URI.create(issuer + "/jwks"),
                        URI.create(issuer + "/authorize"),
                        URI.create(issuer + "/token"));
            });
        }

        @Override
        public Uni<JsonWebKeySet> fetchKeys(URI jwksUri) {
            keyFetches.incrementAndGet();
            if (hangOnKeys) {
                return Uni.createFrom().nothing();
            }
            if (keyFailure != null) {
                return Uni.createFrom().failure(keyFailure);
            }
            final var result = Uni.createFrom().item(keySet);
            return keyDelay.isZero() ? result : result.onItem().delayIt().by(keyDelay);
        }

        @Override
        public Uni<TokenResponse> exchangeCode(
                URI tokenEndpoint, ClientRegistration client, String code, String codeVerifier, URI redirectUri) {
            return Uni.createFrom().failure(new UnsupportedOperationException());
        }

        @Override
        public Uni<TokenResponse> refresh(
                URI tokenEndpoint, ClientRegistration client, String refreshToken, Optional<String> scope) {
            return Uni.createFrom().failure(new UnsupportedOperationException());
        }

        @Override
        public Uni<TokenResponse> clientCredentials(
                URI tokenEndpoint, ClientRegistration client, Optional<String> audience, Optional<String> scope) {
            return Uni.createFrom().failure(new UnsupportedOperationException());
        }
    }
}
