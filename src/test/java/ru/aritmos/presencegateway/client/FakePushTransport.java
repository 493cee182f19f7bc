package ru.aritmos.presencegateway.client;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Транспорт-заглушка: каждая попытка подключения управляется тестом вручную.
 */
final class FakePushTransport implements PushTransport {

    final List<Attempt> attempts = new CopyOnWriteArrayList<>();

    @Override
    public CompletableFuture<PushChannel> open(Listener listener) {
        Attempt a = new Attempt(listener);
        attempts.add(a);
        return a.future;
    }

    Attempt last() {
        if (attempts.isEmpty()) {
            throw new AssertionError("попыток подключения не было");
        }
        return attempts.get(attempts.size() - 1);
    }

    static final class Attempt {
        final Listener listener;
        final CompletableFuture<PushChannel> future = new CompletableFuture<>();
        final FakeChannel channel = new FakeChannel();

        Attempt(Listener listener) {
            this.listener = listener;
        }

        void open() {
            future.complete(channel);
        }

        void fail(String message) {
            future.completeExceptionally(new IOException(message));
        }

        void serverSends(String frame) {
            listener.onText(frame);
        }

        void drop(String reason) {
            channel.open = false;
            listener.onClosed(reason);
        }
    }

    static final class FakeChannel implements PushChannel {
        final List<String> sent = new CopyOnWriteArrayList<>();
        volatile boolean open = true;
        volatile int disconnects;

        @Override
        public boolean send(String frame) {
            if (!open) {
                return false;
            }
            sent.add(frame);
            return true;
        }

        @Override
        public void disconnect() {
            open = false;
            disconnects++;
        }

        @Override
        public boolean isOpen() {
            return open;
        }
    }
}
