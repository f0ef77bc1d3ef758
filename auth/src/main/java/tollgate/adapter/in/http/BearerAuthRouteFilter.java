package tollgate.adapter.in.http;

import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.vertx.web.RouteFilter;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import org.jboss.logging.Logger;

import tollgate.core.config.AuthSettings;
import tollgate.core.model.auth.AuthException;
import tollgate.core.model.auth.GateDecision;
import tollgate.core.model.auth.Identity;
import tollgate.core.model.auth.UserAttribution;
import tollgate.core.port.in.AuthenticateRequest;
import tollgate.core.service.auth.UserAttributionResolver;

/**
 * HTTP binding of the request gate.
 *
 * <p>Reads the {@code Authorization} header, puts the resulting {@link Identity} and
 * {@link UserAttribution} on the routing context, or ends the request with 401. The 401 body is
 * the same for every failure.
 *
 * <p>Priority 80 runs after the security headers and CORS filters.
 */
@ApplicationScoped
public class BearerAuthRouteFilter {

    private static final Logger LOG = Logger.getLogger(BearerAuthRouteFilter.class);

    public static final String IDENTITY_KEY = "tollgate.identity";
    public static final String ATTRIBUTION_KEY = "tollgate.attribution";
    static final String CHALLENGE = "Bearer realm=\"tollgate\"";

    private final AuthenticateRequest gate;
    private final UserAttributionResolver attributionResolver;
    private final List<String> publicPaths;

    @Inject
    public BearerAuthRouteFilter(
            AuthenticateRequest gate, UserAttributionResolver attributionResolver, AuthSettings settings) {
        this.gate = gate;
        this.attributionResolver = attributionResolver;
        this.publicPaths = settings.publicPaths();
    }

    @RouteFilter(80)
    void authenticate(RoutingContext rc) {
        if (isPublic(rc.normalizedPath())) {
            rc.next();
            return;
        }

        rc.request().pause();
        gate.admit(rc.request().getHeader(HttpHeaders.AUTHORIZATION))
                .subscribe()
                .with(decision -> onDecision(rc, decision), failure -> {
                    LOG.errorv(failure, "Request gate failed for {0}", rc.normalizedPath());
                    unauthorized(rc);
                });
    }

    private void onDecision(RoutingContext rc, GateDecision decision) {
        final Identity identity;
        if (decision instanceof GateDecision.Authenticated authenticated) {
            identity = authenticated.identity();
        } else if (decision instanceof GateDecision.Bypassed) {
            identity = null;
        } else {
            unauthorized(rc);
            return;
        }

        final UserAttribution attribution;
        try {
            attribution = attributionResolver.resolve(identity, name -> rc.request().getHeader(name));
        } catch (AuthException e) {
            forbidden(rc);
            return;
        }

        if (identity != null) {
            rc.put(IDENTITY_KEY, identity);
        }
        rc.put(ATTRIBUTION_KEY, attribution);
        rc.request().resume();
        rc.next();
    }

    private boolean isPublic(String path) {
        return path != null && publicPaths.stream().anyMatch(path::startsWith);
    }

    private static void unauthorized(RoutingContext rc) {
        rc.request().resume();
        rc.response()
                .setStatusCode(401)
                .putHeader(HttpHeaderNames.WWW_AUTHENTICATE, CHALLENGE)
                .putHeader(HttpHeaders.CONTENT_TYPE, "application/json")
                .end(new JsonObject().put("error", "unauthenticated").encode());
    }

    private static void forbidden(RoutingContext rc) {
        rc.request().resume();
        rc.response()
                .setStatusCode(403)
                .putHeader(HttpHeaders.CONTENT_TYPE, "application/json")
                .end(new JsonObject().put("error", "forbidden").encode());
    }

    /**
     * Identity attached by this filter, empty when the request was not authenticated.
     */
    public static Optional<Identity> identity(RoutingContext rc) {
        return Optional.ofNullable(rc.get(IDENTITY_KEY));
    }

    public static Optional<UserAttribution> attribution(RoutingContext rc) {
        return Optional.ofNullable(rc.get(ATTRIBUTION_KEY));
    }
}
