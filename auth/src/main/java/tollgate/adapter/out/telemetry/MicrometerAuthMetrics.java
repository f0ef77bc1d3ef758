package tollgate.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import tollgate.core.model.auth.AuthErrorKind;
import tollgate.core.port.out.AuthMetrics;

/**
 * Records authentication metrics using Micrometer.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code tollgate.auth.attempts} - gate outcomes by {@code outcome} and {@code reason}</li>
 *   <li>{@code tollgate.auth.validator.failures} - per-validator rejections by {@code kind}</li>
 *   <li>{@code tollgate.auth.signature.verifications} - JWT signature checks by issuer</li>
 *   <li>{@code tollgate.auth.key.fetches} - key set fetches by issuer and result</li>
 *   <li>{@code tollgate.auth.token.cache.hits} - tokens served from the validated-token cache</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerAuthMetrics implements AuthMetrics {

    static final String SIGNATURE_VERIFICATIONS = "tollgate.auth.signature.verifications";

    private final MeterRegistry registry;

    @Inject
    public MicrometerAuthMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordAuthenticated(String validator) {
        Counter.builder("tollgate.auth.attempts")
                .description("Request gate outcomes")
                .tag("outcome", "authenticated")
                .tag("reason", validator)
                .register(registry)
                .increment();
    }

    @Override
    public void recordRejected(AuthErrorKind reason) {
        Counter.builder("tollgate.auth.attempts")
                .description("Request gate outcomes")
                .tag("outcome", "rejected")
                .tag("reason", reason.tag())
                .register(registry)
                .increment();
    }

    @Override
    public void recordValidatorFailure(String validator, AuthErrorKind kind) {
        Counter.builder("tollgate.auth.validator.failures")
                .description("Credential rejections per validator")
                .tag("validator", validator)
                .tag("kind", kind.tag())
                .register(registry)
                .increment();
    }

    @Override
    public void recordSignatureVerification(String issuer) {
        Counter.builder(SIGNATURE_VERIFICATIONS)
                .description("JWT signature verifications")
                .tag("issuer", issuer)
                .register(registry)
                .increment();
    }

    @Override
    public void recordKeyFetch(String issuer, boolean success) {
        Counter.builder("tollgate.auth.key.fetches")
                .description("Provider key set fetches")
                .tag("issuer", issuer)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    @Override
    public void recordTokenCacheHit() {
        Counter.builder("tollgate.auth.token.cache.hits")
                .description("Tokens accepted from the validated-token cache")
                .register(registry)
                .increment();
    }

    /**
     * Total signature verifications across issuers.
     */
    public double signatureVerifications() {
        return registry.find(SIGNATURE_VERIFICATIONS).counters().stream()
                .mapToDouble(Counter::count)
                .sum();
    }
}
