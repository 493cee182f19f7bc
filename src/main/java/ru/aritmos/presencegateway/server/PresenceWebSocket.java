package ru.aritmos.presencegateway.server;

import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.TaskScheduler;
import io.micronaut.websocket.CloseReason;
import io.micronaut.websocket.WebSocketPongMessage;
import io.micronaut.websocket.WebSocketSession;
import io.micronaut.websocket.annotation.OnClose;
import io.micronaut.websocket.annotation.OnError;
import io.micronaut.websocket.annotation.OnMessage;
import io.micronaut.websocket.annotation.OnOpen;
import io.micronaut.websocket.annotation.ServerWebSocket;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.presencegateway.config.PresenceServerProperties;
import ru.aritmos.presencegateway.core.SensitiveDataSanitizer;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * WebSocket endpoint push-канала.
 * <p>
 * Первый кадр соединения обрабатывает {@link HandshakeAuthenticator}, остальные - {@link ClientCommandRouter}.
 * Соединение, не приславшее handshake за {@code presence.server.handshake-timeout}, закрывается.
 */
@Singleton
@ServerWebSocket("/ws")
public class PresenceWebSocket {

    private static final Logger log = LoggerFactory.getLogger(PresenceWebSocket.class);

    static final String CONNECTION_ATTRIBUTE = "presence.connection";

    private final ConnectionRegistry registry;
    private final HandshakeAuthenticator authenticator;
    private final ClientCommandRouter router;
    private final PresenceServerProperties serverProperties;
    private final Clock clock;
    private final Executor writerExecutor;
    private final TaskScheduler scheduler;

    public PresenceWebSocket(ConnectionRegistry registry,
                             HandshakeAuthenticator authenticator,
                             ClientCommandRouter router,
                             PresenceServerProperties serverProperties,
                             Clock clock,
                             @Named(TaskExecutors.IO) Executor writerExecutor,
                             @Named(TaskExecutors.SCHEDULED) TaskScheduler scheduler) {
        this.registry = registry;
        this.authenticator = authenticator;
        this.router = router;
        this.serverProperties = serverProperties;
        this.clock = clock;
        this.writerExecutor = writerExecutor;
        this.scheduler = scheduler;
    }

    @OnOpen
    public void onOpen(WebSocketSession session) {
        PushConnection connection = new PushConnection(
                new WebSocketSessionSink(session),
                writerExecutor,
                clock,
                serverProperties.getOutboundQueueCapacity(),
                registry::unregister);
        session.put(CONNECTION_ATTRIBUTE, connection);

        scheduler.schedule(serverProperties.getHandshakeTimeout(), () -> {
            if (!connection.isAuthenticated() && connection.close(CloseCause.HANDSHAKE_TIMEOUT)) {
                log.info("[PRESENCE][HANDSHAKE] Таймаут handshake: connectionId={}", connection.id());
            }
        });
        log.debug("[PRESENCE][HANDSHAKE] Принято соединение {}", connection.id());
    }

    @OnMessage
    public void onMessage(String message, WebSocketSession session) {
        PushConnection connection = connectionOf(session);
        if (connection == null) {
            session.close(CloseReason.INTERNAL_ERROR);
            return;
        }
        if (connection.isClosed()) {
            return;
        }
        connection.touch();
        if (connection.isAuthenticated()) {
            router.route(connection, message);
        } else {
            authenticator.authenticate(connection, message);
        }
    }

    /**
     * Ответ на протокольный ping {@link IdleConnectionReaper}: соединение живо, даже если клиент ничего не отправляет.
     */
    @OnMessage
    public void onPong(WebSocketPongMessage pong, WebSocketSession session) {
        PushConnection connection = connectionOf(session);
        if (connection != null && !connection.isClosed()) {
            connection.touch();
        }
    }

    @OnClose
    public void onClose(WebSocketSession session) {
        PushConnection connection = connectionOf(session);
        if (connection != null) {
            connection.close(CloseCause.PEER_CLOSED);
        }
    }

    @OnError
    public void onError(WebSocketSession session, Throwable error) {
        log.warn("[PRESENCE][REGISTRY] Ошибка транспорта: sessionId={}, error={}",
                session.getId(), SensitiveDataSanitizer.sanitizeText(error == null ? null : error.getMessage()));
        PushConnection connection = connectionOf(session);
        if (connection != null) {
            connection.close(CloseCause.TRANSPORT_ERROR);
        }
    }

    /**
     * Корректное завершение: все живые соединения закрываются с кодом GOING_AWAY.
     */
    @PreDestroy
    public void shutdown() {
        List<PushConnection> all = registry.allConnections();
        for (PushConnection c : all) {
            c.close(CloseCause.SHUTDOWN);
        }
        if (!all.isEmpty()) {
            log.info("[PRESENCE][REGISTRY] Остановка: закрыто соединений {}", all.size());
        }
    }

    private static PushConnection connectionOf(WebSocketSession session) {
        return session.get(CONNECTION_ATTRIBUTE, PushConnection.class).orElse(null);
    }
}
