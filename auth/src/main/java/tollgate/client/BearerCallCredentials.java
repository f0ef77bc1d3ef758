package tollgate.client;

import java.util.concurrent.Executor;

import io.grpc.CallCredentials;
import io.grpc.Metadata;
import io.grpc.Status;
import org.jboss.logging.Logger;

/**
 * Attaches {@code authorization: Bearer <token>} to outbound gRPC calls.
 *
 * <pre>{@code
 * stub.withCallCredentials(new BearerCallCredentials(manager))
 * }</pre>
 *
 * The token is fetched on the application executor since suppliers may block for a refresh.
 */
public class BearerCallCredentials extends CallCredentials {

    private static final Logger LOG = Logger.getLogger(BearerCallCredentials.class);

    static final Metadata.Key<String> AUTHORIZATION =
            Metadata.Key.of("authorization", Metadata.ASCII_STRING_MARSHALLER);

    private final TokenSupplier tokens;

    public BearerCallCredentials(TokenSupplier tokens) {
        this.tokens = tokens;
    }

    @Override
    public void applyRequestMetadata(RequestInfo requestInfo, Executor appExecutor, MetadataApplier applier) {
        appExecutor.execute(() -> {
            try {
                final var headers = new Metadata();
                headers.put(AUTHORIZATION, "Bearer " + tokens.getToken());
                applier.apply(headers);
            } catch (RuntimeException e) {
                LOG.debugv("No bearer token for outbound call: {0}", e.getMessage());
                applier.fail(Status.UNAUTHENTICATED.withDescription("no credentials").withCause(e));
            }
        });
    }
}
