package ru.aritmos.presencegateway.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.presencegateway.core.SensitiveDataSanitizer;
import ru.aritmos.presencegateway.model.IdentityClaim;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Серверное соединение push-канала.
 * <p>
 * Жизненный цикл: принято → (handshake) → аутентифицировано → закрыто.
 * <p>
 * Запись в транспорт выполняется только через ограниченную очередь исходящих кадров, которую разбирает
 * единственная writer-задача. Поэтому параллельные рассылки в одно соединение не перемешивают байты,
 * а порядок кадров совпадает с порядком {@link #enqueue(String)}.
 * <p>
 * Закрытие идемпотентно: слушатель закрытия (снятие с регистрации) вызывается ровно один раз,
 * даже если закрытие пришло одновременно со стороны чтения и записи.
 */
public final class PushConnection {

    private static final Logger log = LoggerFactory.getLogger(PushConnection.class);

    private final FrameSink sink;
    private final Executor writerExecutor;
    private final Clock clock;
    private final int queueCapacity;
    private final Consumer<PushConnection> closeListener;

    private final AtomicReference<IdentityClaim> owner = new AtomicReference<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final Queue<String> outbound = new ConcurrentLinkedQueue<>();
    private final AtomicInteger queued = new AtomicInteger();
    private final AtomicBoolean draining = new AtomicBoolean();

    private final Instant openedAt;
    private volatile Instant lastInboundAt;
    private volatile Instant lastPingAt;
    private volatile CloseCause closeCause;

    public PushConnection(FrameSink sink,
                          Executor writerExecutor,
                          Clock clock,
                          int queueCapacity,
                          Consumer<PushConnection> closeListener) {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity должен быть > 0");
        }
        this.sink = sink;
        this.writerExecutor = writerExecutor;
        this.clock = clock;
        this.queueCapacity = queueCapacity;
        this.closeListener = closeListener;
        this.openedAt = clock.instant();
        this.lastInboundAt = openedAt;
    }

    public String id() {
        return sink.id();
    }

    /**
     * @return userId владельца или null до успешного handshake
     */
    public String ownerUserId() {
        IdentityClaim c = owner.get();
        return c == null ? null : c.userId();
    }

    public IdentityClaim identity() {
        return owner.get();
    }

    public boolean isAuthenticated() {
        return owner.get() != null;
    }

    /**
     * Привязать владельца. Повторная привязка не выполняется.
     *
     * @return true, если владелец установлен этим вызовом
     */
    public boolean bindOwner(IdentityClaim claim) {
        return owner.compareAndSet(null, claim);
    }

    public boolean isClosed() {
        return closed.get();
    }

    public CloseCause closeCause() {
        return closeCause;
    }

    public Instant openedAt() {
        return openedAt;
    }

    /**
     * Отметить входящую активность (любой кадр, включая ping и протокольный pong).
     */
    public void touch() {
        lastInboundAt = clock.instant();
    }

    public Instant lastInboundAt() {
        return lastInboundAt;
    }

    public Duration idleFor(Instant now) {
        return Duration.between(lastInboundAt, now);
    }

    /**
     * Отправить протокольный ping живому соединению.
     * <p>
     * Ошибка отправки приравнивается к ошибке записи: соединение закрывается.
     *
     * @return true, если ping передан транспорту
     */
    public boolean ping() {
        if (closed.get()) {
            return false;
        }
        lastPingAt = clock.instant();
        try {
            sink.sendPing();
            return true;
        } catch (RuntimeException e) {
            log.warn("[PRESENCE][REGISTRY] Ping не отправлен в соединение {}: {}", id(), SensitiveDataSanitizer.sanitizeText(e.getMessage()));
            close(CloseCause.WRITE_FAILED);
            return false;
        }
    }

    /**
     * @return true, если после последнего ping от клиента ещё ничего не пришло
     */
    public boolean isAwaitingPong() {
        Instant p = lastPingAt;
        return p != null && p.isAfter(lastInboundAt);
    }

    public int queuedFrames() {
        return Math.max(0, queued.get());
    }

    /**
     * Поставить кадр в очередь на отправку.
     * <p>
     * Переполнение очереди приравнивается к ошибке записи: соединение закрывается.
     *
     * @return false, если соединение закрыто или очередь переполнена
     */
    public boolean enqueue(String frame) {
        if (closed.get()) {
            return false;
        }
        if (queued.incrementAndGet() > queueCapacity) {
            queued.decrementAndGet();
            log.warn("[PRESENCE][REGISTRY] Переполнена очередь исходящих кадров: connectionId={}, capacity={}", id(), queueCapacity);
            close(CloseCause.QUEUE_OVERFLOW);
            return false;
        }
        outbound.add(frame);
        scheduleDrain();
        return true;
    }

    /**
     * Закрыть соединение.
     *
     * @return true, если соединение закрыто именно этим вызовом
     */
    public boolean close(CloseCause cause) {
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        closeCause = cause;
        outbound.clear();
        queued.set(0);

        try {
            sink.close(cause.code(), cause.reason());
        } catch (RuntimeException e) {
            log.debug("Ошибка закрытия транспорта {}: {}", id(), SensitiveDataSanitizer.sanitizeText(e.getMessage()));
        }

        if (closeListener != null) {
            try {
                closeListener.accept(this);
            } catch (RuntimeException e) {
                log.warn("[PRESENCE][REGISTRY] Ошибка обработчика закрытия соединения {}: {}", id(), SensitiveDataSanitizer.sanitizeText(e.getMessage()));
            }
        }
        return true;
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            writerExecutor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            close(CloseCause.WRITE_FAILED);
        }
    }

    private void drain() {
        String frame;
        while ((frame = outbound.poll()) != null) {
            queued.decrementAndGet();
            if (closed.get()) {
                continue;
            }
            try {
                sink.sendText(frame);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                close(CloseCause.WRITE_FAILED);
            } catch (Exception e) {
                log.warn("[PRESENCE][REGISTRY] Ошибка записи в соединение {}: {}", id(), SensitiveDataSanitizer.sanitizeText(e.getMessage()));
                close(CloseCause.WRITE_FAILED);
            }
        }
        draining.set(false);
        if (!outbound.isEmpty() && !closed.get()) {
            scheduleDrain();
        }
    }

    @Override
    public String toString() {
        return "PushConnection[id=" + id() + ", owner=" + ownerUserId() + ", closed=" + closed.get() + "]";
    }
}
