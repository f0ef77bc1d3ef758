package tollgate.core.port.in;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.auth.GateDecision;

/**
 * Inbound port used by transport bindings to authenticate a request.
 */
public interface AuthenticateRequest {

    /**
     * Whether requests are checked at all. False only in development with authentication disabled.
     */
    boolean isEnforcing();

    /**
     * Decide on a request from its {@code Authorization} header value.
     *
     * @param authorizationHeader the raw header value, or null when absent
     */
    Uni<GateDecision> admit(String authorizationHeader);
}
