package tollgate.adapter.in.grpc;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import io.grpc.ServerCall;

/**
 * Buffers listener events until the real listener is known.
 *
 * <p>Used while authentication completes asynchronously; events are replayed in arrival order.
 */
class DeferredServerCallListener<ReqT> extends ServerCall.Listener<ReqT> {

    private final List<Consumer<ServerCall.Listener<ReqT>>> pending = new ArrayList<>();
    private ServerCall.Listener<ReqT> delegate;

    void setDelegate(ServerCall.Listener<ReqT> target) {
        while (true) {
            final List<Consumer<ServerCall.Listener<ReqT>>> batch;
            synchronized (this) {
                if (pending.isEmpty()) {
                    delegate = target;
                    return;
                }
                batch = new ArrayList<>(pending);
                pending.clear();
            }
            batch.forEach(event -> event.accept(target));
        }
    }

    private void dispatch(Consumer<ServerCall.Listener<ReqT>> event) {
        final ServerCall.Listener<ReqT> target;
        synchronized (this) {
            if (delegate == null) {
                pending.add(event);
                return;
            }
            target = delegate;
        }
        event.accept(target);
    }

    @Override
    public void onMessage(ReqT message) {
        dispatch(listener -> listener.onMessage(message));
    }

    @Override
    public void onHalfClose() {
        dispatch(ServerCall.Listener::onHalfClose);
    }

    @Override
    public void onCancel() {
        dispatch(ServerCall.Listener::onCancel);
    }

    @Override
    public void onComplete() {
        dispatch(ServerCall.Listener::onComplete);
    }

    @Override
    public void onReady() {
        dispatch(ServerCall.Listener::onReady);
    }
}
