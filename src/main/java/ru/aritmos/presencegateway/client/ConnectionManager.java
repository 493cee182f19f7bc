package ru.aritmos.presencegateway.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.presencegateway.core.EnvelopeCodec;
import ru.aritmos.presencegateway.core.EnvelopeDecodeException;
import ru.aritmos.presencegateway.core.SensitiveDataSanitizer;
import ru.aritmos.presencegateway.core.SerialExecutor;
import ru.aritmos.presencegateway.model.ConnectionPhase;
import ru.aritmos.presencegateway.model.EventEnvelope;
import ru.aritmos.presencegateway.model.IdentityClaim;
import ru.aritmos.presencegateway.model.PresenceEventKinds;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Клиентский автомат подключения к push-каналу.
 * <p>
 * Фазы: {@code DISCONNECTED → CONNECTING → CONNECTED → (DISCONNECTED | DEGRADED)}, из {@code DEGRADED}
 * восстановление идёт через {@link FallbackScheduler}.
 * <p>
 * Правила:
 * <ul>
 *   <li>подтверждением handshake считается первый корректный кадр от сервера; в этот момент {@code retryCount = 0};</li>
 *   <li>обрыв/ошибка в CONNECTING или CONNECTED: {@code DISCONNECTED}, {@code retryCount++}, повтор через
 *       {@link BackoffPolicy#delayFor(int)}, а после исчерпания попыток - {@code DEGRADED};</li>
 *   <li>отказ сервера в handshake неотличим от сбоя транспорта и обрабатывается так же;</li>
 *   <li>{@link #disable()} отменяет таймер повтора и текущую попытку, после возврата повторов не будет.</li>
 * </ul>
 * <p>
 * Все переходы выполняются под одним монитором. Каждая попытка подключения получает свою «эпоху»:
 * колбэки транспорта и таймеров устаревшей эпохи игнорируются, поэтому параллельных попыток не бывает.
 * Вызовы транспорта выполняются вне монитора. Подписчики вызываются через последовательный исполнитель
 * диспетчера; под монитором задачи для них только ставятся в очередь.
 */
public class ConnectionManager {

    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private final PushTransport transport;
    private final ClientTimer timer;
    private final EnvelopeCodec codec;
    private final Clock clock;
    private final BackoffPolicy backoff;
    private final Duration connectTimeout;
    private final Duration heartbeatInterval;
    private final EventDispatcher dispatcher;

    private final Object lock = new Object();

    private ConnectionPhase phase = ConnectionPhase.DISCONNECTED;
    private int retryCount;
    private Instant lastAttemptAt;
    private Duration lastRetryDelay;
    private boolean enabled = true;
    private IdentityClaim identity;
    private long epoch;
    private PushChannel channel;
    private CompletableFuture<PushChannel> pendingOpen;
    private ClientTimer.Handle retryTimer;
    private ClientTimer.Handle connectTimer;
    private ClientTimer.Handle heartbeatTimer;

    public ConnectionManager(PushTransport transport,
                             ClientTimer timer,
                             EnvelopeCodec codec,
                             Clock clock,
                             Executor dispatchExecutor,
                             BackoffPolicy backoff,
                             Duration connectTimeout,
                             Duration heartbeatInterval) {
        this.transport = transport;
        this.timer = timer;
        this.codec = codec;
        this.clock = clock;
        this.backoff = backoff;
        this.connectTimeout = connectTimeout;
        this.heartbeatInterval = heartbeatInterval;
        this.dispatcher = new EventDispatcher(new SerialExecutor(dispatchExecutor));
    }

    /**
     * Начать попытку подключения.
     * <p>
     * Допустимо из {@code DISCONNECTED} и {@code DEGRADED}, при включённом клиенте и заданной идентичности.
     * В остальных случаях - no-op.
     *
     * @return true, если попытка начата этим вызовом
     */
    public boolean connect() {
        return beginAttempt(-1);
    }

    /**
     * Отключиться без повторов до {@link #enable()}.
     */
    public void disable() {
        List<Transition> fired = new ArrayList<>(1);
        Detached detached;
        synchronized (lock) {
            enabled = false;
            detached = detachLocked();
            moveLocked(ConnectionPhase.DISCONNECTED, fired);
        }
        detached.release();
        publish(fired);
        log.info("[PRESENCE][CLIENT] Push-канал отключён");
    }

    /**
     * Снова разрешить подключение. Счётчик попыток сбрасывается.
     *
     * @return true, если попытка подключения начата
     */
    public boolean enable() {
        synchronized (lock) {
            enabled = true;
            retryCount = 0;
        }
        return connect();
    }

    /**
     * Сменить идентичность (логин/логаут).
     * <p>
     * Текущее соединение закрывается. {@code null} - выход пользователя: подключения нет до следующего вызова.
     */
    public void setIdentity(IdentityClaim claim) {
        List<Transition> fired = new ArrayList<>(1);
        Detached detached;
        boolean reconnect;
        synchronized (lock) {
            identity = claim;
            retryCount = 0;
            detached = detachLocked();
            moveLocked(ConnectionPhase.DISCONNECTED, fired);
            reconnect = claim != null && enabled;
        }
        detached.release();
        publish(fired);
        if (reconnect) {
            connect();
        }
    }

    /**
     * Отправить сообщение серверу.
     * <p>
     * Работает только в {@code CONNECTED}. В остальных фазах сообщение отбрасывается (без очереди),
     * вызывающий код должен считать его недоставленным.
     *
     * @return true, если кадр передан транспорту
     */
    public boolean send(EventEnvelope envelope) {
        PushChannel ch;
        synchronized (lock) {
            if (phase != ConnectionPhase.CONNECTED || channel == null) {
                log.debug("[PRESENCE][CLIENT] Сообщение kind={} не отправлено: phase={}", envelope.kind(), phase);
                return false;
            }
            ch = channel;
        }
        return ch.send(codec.encode(envelope));
    }

    public boolean send(String kind, Object payload) {
        return send(EventEnvelope.of(kind, codec.toPayload(payload)));
    }

    public EventSubscription onEvent(String kind, EventHandler handler) {
        return dispatcher.subscribe(kind, handler);
    }

    /**
     * Подписка на все прикладные события (служебные auth-ack/pong не доставляются).
     */
    public EventSubscription onAnyEvent(EventHandler handler) {
        return dispatcher.subscribeAll(handler);
    }

    public EventSubscription addPhaseListener(ConnectionPhaseListener listener) {
        return dispatcher.addPhaseListener(listener);
    }

    public ConnectionPhase getPhase() {
        synchronized (lock) {
            return phase;
        }
    }

    public int getRetryCount() {
        synchronized (lock) {
            return retryCount;
        }
    }

    public Instant getLastAttemptAt() {
        synchronized (lock) {
            return lastAttemptAt;
        }
    }

    /**
     * @return задержка последнего запланированного повтора (null, если повторов ещё не было)
     */
    public Duration getLastRetryDelay() {
        synchronized (lock) {
            return lastRetryDelay;
        }
    }

    public boolean isEnabled() {
        synchronized (lock) {
            return enabled;
        }
    }

    public IdentityClaim getIdentity() {
        synchronized (lock) {
            return identity;
        }
    }

    /**
     * Остановка при завершении приложения.
     */
    public void shutdown() {
        disable();
    }

    private boolean beginAttempt(long expectedEpoch) {
        List<Transition> fired = new ArrayList<>(1);
        long attemptEpoch;
        IdentityClaim claim;
        int failuresSoFar;
        synchronized (lock) {
            if (expectedEpoch >= 0 && expectedEpoch != epoch) {
                return false;
            }
            if (!enabled || identity == null) {
                log.debug("[PRESENCE][CLIENT] connect() пропущен: enabled={}, identity={}", enabled, identity != null);
                return false;
            }
            if (phase != ConnectionPhase.DISCONNECTED && phase != ConnectionPhase.DEGRADED) {
                return false;
            }
            cancel(retryTimer);
            retryTimer = null;

            attemptEpoch = ++epoch;
            claim = identity;
            failuresSoFar = retryCount;
            lastAttemptAt = clock.instant();
            moveLocked(ConnectionPhase.CONNECTING, fired);
            connectTimer = timer.schedule(connectTimeout, () -> onConnectTimeout(attemptEpoch));
        }
        publish(fired);
        log.info("[PRESENCE][CLIENT] Подключение: userId={}, retryCount={}", claim.userId(), failuresSoFar);
        openTransport(attemptEpoch, claim);
        return true;
    }

    private void openTransport(long attemptEpoch, IdentityClaim claim) {
        CompletableFuture<PushChannel> future;
        try {
            future = transport.open(new AttemptListener(attemptEpoch));
        } catch (RuntimeException e) {
            onFailure(attemptEpoch, "transport open failed: " + e.getMessage());
            return;
        }

        boolean stale;
        synchronized (lock) {
            stale = attemptEpoch != epoch;
            if (!stale) {
                pendingOpen = future;
            }
        }
        if (stale) {
            future.cancel(false);
        }
        future.whenComplete((ch, err) -> {
            if (err != null) {
                onFailure(attemptEpoch, describe(err));
            } else {
                onOpened(attemptEpoch, ch, claim);
            }
        });
    }

    private void onOpened(long attemptEpoch, PushChannel ch, IdentityClaim claim) {
        boolean current;
        synchronized (lock) {
            current = attemptEpoch == epoch && phase == ConnectionPhase.CONNECTING;
            if (current) {
                pendingOpen = null;
                channel = ch;
            }
        }
        if (!current) {
            ch.disconnect();
            return;
        }
        log.debug("[PRESENCE][CLIENT] Транспорт открыт, отправка handshake: userId={}", claim.userId());
        if (!ch.send(codec.encodeHandshake(claim))) {
            onFailure(attemptEpoch, "handshake not sent");
        }
    }

    private void onText(long attemptEpoch, String frame) {
        EventEnvelope envelope;
        try {
            envelope = codec.decode(frame);
        } catch (EnvelopeDecodeException e) {
            log.warn("[PRESENCE][CLIENT] Битый кадр отброшен: code={}", e.code());
            return;
        }

        List<Transition> fired = new ArrayList<>(1);
        synchronized (lock) {
            if (attemptEpoch != epoch) {
                return;
            }
            if (phase == ConnectionPhase.CONNECTING) {
                cancel(connectTimer);
                connectTimer = null;
                retryCount = 0;
                moveLocked(ConnectionPhase.CONNECTED, fired);
                scheduleHeartbeatLocked(attemptEpoch);
            } else if (phase != ConnectionPhase.CONNECTED) {
                return;
            }
        }
        publish(fired);

        if (!envelope.isControl()) {
            dispatcher.dispatch(envelope);
        }
    }

    private void heartbeat(long attemptEpoch) {
        PushChannel ch;
        synchronized (lock) {
            if (attemptEpoch != epoch || phase != ConnectionPhase.CONNECTED || channel == null) {
                return;
            }
            ch = channel;
            scheduleHeartbeatLocked(attemptEpoch);
        }
        if (!ch.send(codec.encode(EventEnvelope.of(PresenceEventKinds.PING, null)))) {
            onFailure(attemptEpoch, "heartbeat not sent");
        }
    }

    /**
     * Таймаут подключения действует только пока попытка не подтверждена: отмена таймера может опоздать
     * относительно уже начавшейся задачи, и тогда она застаёт фазу {@code CONNECTED}.
     */
    private void onConnectTimeout(long attemptEpoch) {
        fail(attemptEpoch, "connect timeout", true);
    }

    private void onFailure(long attemptEpoch, String reason) {
        fail(attemptEpoch, reason, false);
    }

    private void fail(long attemptEpoch, String reason, boolean connectingOnly) {
        List<Transition> fired = new ArrayList<>(2);
        Detached detached;
        Duration delay = null;
        int failures;
        synchronized (lock) {
            if (attemptEpoch != epoch
                    || (phase != ConnectionPhase.CONNECTING && (connectingOnly || phase != ConnectionPhase.CONNECTED))) {
                return;
            }
            detached = detachLocked();
            moveLocked(ConnectionPhase.DISCONNECTED, fired);
            retryCount++;
            failures = retryCount;

            if (backoff.isExhausted(retryCount)) {
                lastAttemptAt = clock.instant();
                moveLocked(ConnectionPhase.DEGRADED, fired);
            } else {
                delay = backoff.delayFor(retryCount);
                lastRetryDelay = delay;
                long retryEpoch = epoch;
                retryTimer = timer.schedule(delay, () -> beginAttempt(retryEpoch));
            }
        }
        detached.release();

        if (delay != null) {
            log.warn("[PRESENCE][CLIENT] Соединение потеряно ({}): повтор №{} через {} мс",
                    SensitiveDataSanitizer.sanitizeText(reason), failures, delay.toMillis());
        } else {
            log.warn("[PRESENCE][CLIENT] Соединение потеряно ({}): попытки исчерпаны ({}), переход в DEGRADED",
                    SensitiveDataSanitizer.sanitizeText(reason), failures);
        }
        publish(fired);
    }

    private void scheduleHeartbeatLocked(long attemptEpoch) {
        heartbeatTimer = timer.schedule(heartbeatInterval, () -> heartbeat(attemptEpoch));
    }

    /**
     * Отвязать текущие ресурсы попытки. Эпоха увеличивается: все колбэки старой попытки станут no-op.
     */
    private Detached detachLocked() {
        epoch++;
        cancel(retryTimer);
        cancel(connectTimer);
        cancel(heartbeatTimer);
        retryTimer = null;
        connectTimer = null;
        heartbeatTimer = null;
        Detached d = new Detached(channel, pendingOpen);
        channel = null;
        pendingOpen = null;
        return d;
    }

    /**
     * Сменить фазу. Уведомление слушателей ставится в последовательную очередь диспетчера здесь же, под монитором,
     * поэтому слушатели видят переходы в том порядке, в котором они произошли.
     */
    private void moveLocked(ConnectionPhase next, List<Transition> fired) {
        if (phase != next) {
            ConnectionPhase previous = phase;
            phase = next;
            fired.add(new Transition(previous, next));
            dispatcher.phaseChanged(previous, next);
        }
    }

    private void publish(List<Transition> fired) {
        for (Transition t : fired) {
            log.info("[PRESENCE][CLIENT] Фаза: {} -> {}", t.from(), t.to());
        }
    }

    private static void cancel(ClientTimer.Handle handle) {
        if (handle != null) {
            handle.cancel();
        }
    }

    private static String describe(Throwable err) {
        Throwable t = err;
        if (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        if (t instanceof CancellationException) {
            return "cancelled";
        }
        String msg = t.getMessage();
        return msg == null ? t.getClass().getSimpleName() : msg;
    }

    private record Transition(ConnectionPhase from, ConnectionPhase to) {
    }

    private record Detached(PushChannel channel, CompletableFuture<PushChannel> pendingOpen) {

        void release() {
            if (pendingOpen != null) {
                pendingOpen.cancel(false);
            }
            if (channel != null) {
                channel.disconnect();
            }
        }
    }

    private final class AttemptListener implements PushTransport.Listener {

        private final long attemptEpoch;

        private AttemptListener(long attemptEpoch) {
            this.attemptEpoch = attemptEpoch;
        }

        @Override
        public void onText(String frame) {
            ConnectionManager.this.onText(attemptEpoch, frame);
        }

        @Override
        public void onClosed(String reason) {
            onFailure(attemptEpoch, reason);
        }
    }
}
