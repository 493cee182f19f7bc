package ru.aritmos.presencegateway.client;

import io.micronaut.websocket.CloseReason;
import io.micronaut.websocket.WebSocketSession;
import io.micronaut.websocket.annotation.ClientWebSocket;
import io.micronaut.websocket.annotation.OnClose;
import io.micronaut.websocket.annotation.OnError;
import io.micronaut.websocket.annotation.OnMessage;
import io.micronaut.websocket.annotation.OnOpen;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.presencegateway.core.SensitiveDataSanitizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Клиентский WebSocket endpoint (Micronaut создаёт экземпляр на каждое подключение).
 * <p>
 * События, пришедшие до {@link #bind(PushTransport.Listener)}, буферизуются и отдаются слушателю при привязке.
 */
@ClientWebSocket
public abstract class PushClientSocket implements PushChannel, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PushClientSocket.class);

    private final Object lock = new Object();
    private volatile WebSocketSession session;
    private PushTransport.Listener listener;
    private final List<String> early = new ArrayList<>();
    private String closeReason;

    @OnOpen
    public void onOpen(WebSocketSession session) {
        this.session = session;
    }

    @OnMessage
    public void onMessage(String message) {
        PushTransport.Listener l;
        synchronized (lock) {
            l = listener;
            if (l == null) {
                early.add(message);
                return;
            }
        }
        l.onText(message);
    }

    @OnClose
    public void onClose(CloseReason reason) {
        closed(reason == null ? "closed" : reason.getCode() + " " + reason.getReason());
    }

    @OnError
    public void onError(Throwable error) {
        log.debug("[PRESENCE][CLIENT] Ошибка транспорта: {}", SensitiveDataSanitizer.sanitizeText(error == null ? null : error.getMessage()));
        closed("error");
    }

    void bind(PushTransport.Listener l) {
        List<String> buffered;
        String reason;
        synchronized (lock) {
            listener = l;
            buffered = new ArrayList<>(early);
            early.clear();
            reason = closeReason;
        }
        buffered.forEach(l::onText);
        if (reason != null) {
            l.onClosed(reason);
        }
    }

    private void closed(String reason) {
        PushTransport.Listener l;
        synchronized (lock) {
            if (closeReason != null) {
                return;
            }
            closeReason = reason;
            l = listener;
        }
        if (l != null) {
            l.onClosed(reason);
        }
    }

    @Override
    public boolean send(String frame) {
        WebSocketSession s = session;
        if (s == null || !s.isOpen()) {
            return false;
        }
        s.sendAsync(frame).whenComplete((r, err) -> {
            if (err != null) {
                log.debug("[PRESENCE][CLIENT] Кадр не отправлен: {}", SensitiveDataSanitizer.sanitizeText(err.getMessage()));
                disconnect();
            }
        });
        return true;
    }

    @Override
    public void disconnect() {
        WebSocketSession s = session;
        if (s != null && s.isOpen()) {
            s.close(CloseReason.NORMAL);
        }
    }

    @Override
    public boolean isOpen() {
        WebSocketSession s = session;
        return s != null && s.isOpen();
    }
}
