package ru.aritmos.presencegateway.client;

import io.micronaut.websocket.WebSocketClient;
import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;

import java.util.concurrent.CompletableFuture;

/**
 * {@link PushTransport} поверх Micronaut {@link WebSocketClient}.
 */
public class MicronautPushTransport implements PushTransport {

    private final WebSocketClient client;
    private final String path;

    public MicronautPushTransport(WebSocketClient client, String path) {
        this.client = client;
        this.path = path;
    }

    @Override
    public CompletableFuture<PushChannel> open(Listener listener) {
        CompletableFuture<PushChannel> result = new CompletableFuture<>();
        Publisher<PushClientSocket> publisher = client.connect(PushClientSocket.class, path);

        publisher.subscribe(new Subscriber<>() {
            @Override
            public void onSubscribe(Subscription s) {
                s.request(1);
            }

            @Override
            public void onNext(PushClientSocket socket) {
                socket.bind(listener);
                if (!result.complete(socket)) {
                    // Попытка уже отменена или просрочена.
                    socket.disconnect();
                }
            }

            @Override
            public void onError(Throwable t) {
                result.completeExceptionally(t);
            }

            @Override
            public void onComplete() {
                result.completeExceptionally(new IllegalStateException("WebSocket-соединение не установлено: " + path));
            }
        });
        return result;
    }
}
