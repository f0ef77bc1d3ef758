package tollgate.adapter.in.grpc;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import io.quarkus.grpc.GlobalInterceptor;
import org.jboss.logging.Logger;

import tollgate.core.model.auth.AuthException;
import tollgate.core.model.auth.GateDecision;
import tollgate.core.model.auth.Identity;
import tollgate.core.model.auth.UserAttribution;
import tollgate.core.port.in.AuthenticateRequest;
import tollgate.core.service.auth.UserAttributionResolver;

/**
 * gRPC binding of the request gate.
 *
 * <p>Authenticates each call from its {@code authorization} metadata. Accepted calls run with
 * {@link #IDENTITY} and {@link #ATTRIBUTION} set in the gRPC {@link Context}; rejected calls are
 * closed with {@code UNAUTHENTICATED} and a fixed description.
 */
@ApplicationScoped
@GlobalInterceptor
public class BearerAuthInterceptor implements ServerInterceptor {

    private static final Logger LOG = Logger.getLogger(BearerAuthInterceptor.class);

    public static final Context.Key<Identity> IDENTITY = Context.key("tollgate.identity");
    public static final Context.Key<UserAttribution> ATTRIBUTION = Context.key("tollgate.attribution");
    private static final Status UNAUTHENTICATED = Status.UNAUTHENTICATED.withDescription("unauthenticated");

    static final Metadata.Key<String> AUTHORIZATION =
            Metadata.Key.of("authorization", Metadata.ASCII_STRING_MARSHALLER);

    private final AuthenticateRequest gate;
    private final UserAttributionResolver attributionResolver;

    @Inject
    public BearerAuthInterceptor(AuthenticateRequest gate, UserAttributionResolver attributionResolver) {
        this.gate = gate;
        this.attributionResolver = attributionResolver;
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {
        final var context = Context.current();
        final var deferred = new DeferredServerCallListener<ReqT>();

        gate.admit(headers.get(AUTHORIZATION))
                .subscribe()
                .with(
                        decision -> deferred.setDelegate(onDecision(context, decision, call, headers, next)),
                        failure -> {
                            LOG.errorv(failure, "Request gate failed for {0}",
                                    call.getMethodDescriptor().getFullMethodName());
                            deferred.setDelegate(close(call, UNAUTHENTICATED));
                        });
        return deferred;
    }

    private <ReqT, RespT> ServerCall.Listener<ReqT> onDecision(
            Context context,
            GateDecision decision,
            ServerCall<ReqT, RespT> call,
            Metadata headers,
            ServerCallHandler<ReqT, RespT> next) {
        final Identity identity;
        if (decision instanceof GateDecision.Authenticated authenticated) {
            identity = authenticated.identity();
        } else if (decision instanceof GateDecision.Bypassed) {
            identity = null;
        } else {
            return close(call, UNAUTHENTICATED);
        }

        final UserAttribution attribution;
        try {
            attribution = attributionResolver.resolve(identity, name -> headers.get(asciiKey(name)));
        } catch (AuthException e) {
            return close(call, Status.PERMISSION_DENIED.withDescription("user impersonation not allowed"));
        }

        var callContext = context.withValue(ATTRIBUTION, attribution);
        if (identity != null) {
            callContext = callContext.withValue(IDENTITY, identity);
        }
        return Contexts.interceptCall(callContext, call, headers, next);
    }

    private static <ReqT, RespT> ServerCall.Listener<ReqT> close(ServerCall<ReqT, RespT> call, Status status) {
        call.close(status, new Metadata());
        return new ServerCall.Listener<>() {};
    }

    private static Metadata.Key<String> asciiKey(String name) {
        return Metadata.Key.of(name, Metadata.ASCII_STRING_MARSHALLER);
    }
}
