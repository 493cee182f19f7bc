package ru.aritmos.presencegateway.client;

import io.micronaut.context.annotation.Requires;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.presencegateway.config.PresenceClientProperties;
import ru.aritmos.presencegateway.model.ConnectionPhase;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Восстановление push-канала из режима DEGRADED.
 * <p>
 * Планировщик тикает часто ({@code fallback-check-interval}), но попытка делается не чаще одного раза
 * за {@code fallback-interval}. Дополнительно действует троттлинг: если последняя попытка подключения
 * была позже, чем {@code fallback-cooldown} назад, цикл пропускается.
 */
@Singleton
@Requires(property = "presence.client.enabled", value = "true")
public class FallbackScheduler {

    private static final Logger log = LoggerFactory.getLogger(FallbackScheduler.class);

    private final ConnectionManager manager;
    private final Duration interval;
    private final Duration cooldown;
    private final Clock clock;

    private Instant lastCycleAt;

    @Inject
    public FallbackScheduler(ConnectionManager manager, PresenceClientProperties props, Clock clock) {
        this(manager, props.getFallbackInterval(), props.getFallbackCooldown(), clock);
    }

    public FallbackScheduler(ConnectionManager manager, Duration interval, Duration cooldown, Clock clock) {
        this.manager = manager;
        this.interval = interval;
        this.cooldown = cooldown;
        this.clock = clock;
    }

    @Scheduled(fixedDelay = "${presence.client.fallback-check-interval:15s}")
    void tick() {
        try {
            attemptRecovery();
        } catch (RuntimeException e) {
            log.warn("[PRESENCE][CLIENT] Ошибка цикла восстановления: {}", e.getMessage());
        }
    }

    /**
     * Один цикл восстановления.
     *
     * @return true, если вызван {@link ConnectionManager#connect()} и попытка начата
     */
    public synchronized boolean attemptRecovery() {
        if (manager.getPhase() != ConnectionPhase.DEGRADED) {
            return false;
        }
        Instant now = clock.instant();
        if (lastCycleAt != null && Duration.between(lastCycleAt, now).compareTo(interval) < 0) {
            return false;
        }
        lastCycleAt = now;

        Instant lastAttempt = manager.getLastAttemptAt();
        if (lastAttempt != null && Duration.between(lastAttempt, now).compareTo(cooldown) < 0) {
            log.debug("[PRESENCE][CLIENT] Восстановление пропущено: последняя попытка {}", lastAttempt);
            return false;
        }

        log.info("[PRESENCE][CLIENT] Попытка восстановления push-канала из DEGRADED");
        return manager.connect();
    }
}
