package ru.aritmos.presencegateway.server;

import io.micronaut.scheduling.TaskExecutors;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.presencegateway.config.PresenceServerProperties;
import ru.aritmos.presencegateway.core.EnvelopeCodec;
import ru.aritmos.presencegateway.core.EnvelopeDecodeException;
import ru.aritmos.presencegateway.core.SensitiveDataSanitizer;
import ru.aritmos.presencegateway.model.EventEnvelope;
import ru.aritmos.presencegateway.model.IdentityClaim;
import ru.aritmos.presencegateway.model.PresenceEventKinds;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Обработка первого кадра соединения.
 * <p>
 * Первый кадр обязан быть заявкой на идентичность ({@code type=auth}). При успехе соединение регистрируется
 * под {@code userId}, отправляется {@code auth-ack} (если включено), затем - начальный снимок состояния по роли.
 * При ошибке соединение закрывается без регистрации, повторов на стороне сервера нет.
 */
@Singleton
public class HandshakeAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(HandshakeAuthenticator.class);

    private final EnvelopeCodec codec;
    private final ConnectionRegistry registry;
    private final HandshakeTokenVerifier tokenVerifier;
    private final InitialStateProvider initialStateProvider;
    private final PresenceServerProperties serverProperties;
    private final Executor executor;

    public HandshakeAuthenticator(EnvelopeCodec codec,
                                  ConnectionRegistry registry,
                                  HandshakeTokenVerifier tokenVerifier,
                                  InitialStateProvider initialStateProvider,
                                  PresenceServerProperties serverProperties,
                                  @Named(TaskExecutors.IO) Executor executor) {
        this.codec = codec;
        this.registry = registry;
        this.tokenVerifier = tokenVerifier;
        this.initialStateProvider = initialStateProvider;
        this.serverProperties = serverProperties;
        this.executor = executor;
    }

    /**
     * Обработать кадр неаутентифицированного соединения.
     *
     * @return true, если соединение допущено в реестр
     */
    public boolean authenticate(PushConnection connection, String frame) {
        if (connection.isAuthenticated()) {
            return true;
        }

        IdentityClaim claim;
        try {
            claim = codec.decodeHandshake(frame);
        } catch (EnvelopeDecodeException e) {
            log.warn("[PRESENCE][HANDSHAKE] Отклонён: connectionId={}, code={}, reason={}",
                    connection.id(), e.code(), SensitiveDataSanitizer.sanitizeText(e.getMessage()));
            connection.close(CloseCause.HANDSHAKE_REJECTED);
            return false;
        }

        if (!tokenVerifier.verify(claim)) {
            log.warn("[PRESENCE][HANDSHAKE] Отклонён: connectionId={}, userId={}, code=BAD_TOKEN", connection.id(), claim.userId());
            connection.close(CloseCause.HANDSHAKE_REJECTED);
            return false;
        }

        if (!connection.bindOwner(claim)) {
            return true;
        }
        if (!registry.register(claim.userId(), connection)) {
            log.debug("[PRESENCE][HANDSHAKE] Соединение {} закрылось до регистрации", connection.id());
            return false;
        }
        log.info("[PRESENCE][HANDSHAKE] Принят: connectionId={}, userId={}, role={}", connection.id(), claim.userId(), claim.role());

        if (serverProperties.isSendAuthAck()) {
            Map<String, Object> ack = new LinkedHashMap<>();
            ack.put("connectionId", connection.id());
            ack.put("userId", claim.userId());
            connection.enqueue(codec.encode(EventEnvelope.of(PresenceEventKinds.AUTH_ACK, codec.toPayload(ack))));
        }

        executor.execute(() -> primeInitialState(connection, claim));
        return true;
    }

    private void primeInitialState(PushConnection connection, IdentityClaim claim) {
        List<EventEnvelope> snapshot;
        try {
            snapshot = initialStateProvider.initialState(claim);
        } catch (RuntimeException e) {
            // Соединение остаётся открытым: дальнейшие push-события всё равно нужны клиенту.
            log.warn("[PRESENCE][HANDSHAKE] Не удалось получить начальное состояние: userId={}, error={}",
                    claim.userId(), SensitiveDataSanitizer.sanitizeText(e.getMessage()));
            return;
        }
        if (snapshot == null || snapshot.isEmpty()) {
            return;
        }
        int sent = 0;
        for (EventEnvelope e : snapshot) {
            if (e != null && connection.enqueue(codec.encode(e))) {
                sent++;
            }
        }
        log.debug("[PRESENCE][HANDSHAKE] Начальное состояние отправлено: userId={}, events={}", claim.userId(), sent);
    }
}
