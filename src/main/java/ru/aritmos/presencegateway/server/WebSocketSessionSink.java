package ru.aritmos.presencegateway.server;

import io.micronaut.websocket.CloseReason;
import io.micronaut.websocket.WebSocketSession;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * {@link FrameSink} поверх Micronaut {@link WebSocketSession}.
 * <p>
 * Запись ожидает подтверждения от Netty, поэтому выполняется только на IO-пуле.
 */
final class WebSocketSessionSink implements FrameSink {

    private static final long SEND_TIMEOUT_SECONDS = 10;
    private static final byte[] PING_PAYLOAD = "presence".getBytes(StandardCharsets.US_ASCII);

    private final WebSocketSession session;

    WebSocketSessionSink(WebSocketSession session) {
        this.session = session;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void sendText(String frame) throws Exception {
        if (!session.isOpen()) {
            throw new IllegalStateException("сессия закрыта");
        }
        session.sendAsync(frame).get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    @Override
    public void sendPing() {
        if (!session.isOpen()) {
            throw new IllegalStateException("сессия закрыта");
        }
        session.sendPingAsync(PING_PAYLOAD);
    }

    @Override
    public void close(int code, String reason) {
        if (session.isOpen()) {
            session.close(new CloseReason(code, reason));
        }
    }
}
