package ru.aritmos.presencegateway.server;

import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.presencegateway.config.PresenceServerProperties;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Периодическое закрытие «полуоткрытых» соединений.
 * <p>
 * Клиент может только слушать и ничего не отправлять, поэтому тишина сама по себе не признак обрыва.
 * Соединению, молчащему дольше половины {@code presence.server.idle-timeout}, отправляется протокольный ping;
 * ответный pong считается входящей активностью. Закрывается только соединение, которое молчит дольше
 * {@code idle-timeout} и не ответило на ping. Закрытие идёт тем же путём, что и штатное отключение
 * (снятие с регистрации через слушатель закрытия).
 */
@Singleton
public class IdleConnectionReaper {

    private static final Logger log = LoggerFactory.getLogger(IdleConnectionReaper.class);

    private final ConnectionRegistry registry;
    private final PresenceServerProperties serverProperties;
    private final Clock clock;

    public IdleConnectionReaper(ConnectionRegistry registry, PresenceServerProperties serverProperties, Clock clock) {
        this.registry = registry;
        this.serverProperties = serverProperties;
        this.clock = clock;
    }

    @Scheduled(fixedDelay = "${presence.server.idle-sweep-interval:15s}", initialDelay = "${presence.server.idle-sweep-interval:15s}")
    void sweep() {
        try {
            reapIdle();
        } catch (RuntimeException e) {
            log.warn("[PRESENCE][REGISTRY] Ошибка проверки простаивающих соединений: {}", e.getMessage());
        }
    }

    /**
     * @return число закрытых соединений
     */
    public int reapIdle() {
        Instant now = clock.instant();
        Duration limit = serverProperties.getIdleTimeout();
        Duration pingAfter = limit.dividedBy(2);
        int closed = 0;
        int pinged = 0;
        for (PushConnection c : registry.allConnections()) {
            Duration idle = c.idleFor(now);
            if (c.isAwaitingPong()) {
                if (idle.compareTo(limit) > 0 && c.close(CloseCause.IDLE_TIMEOUT)) {
                    closed++;
                    log.info("[PRESENCE][REGISTRY] Закрыто по простою (нет pong): connectionId={}, userId={}", c.id(), c.ownerUserId());
                }
            } else if (idle.compareTo(pingAfter) > 0 && c.ping()) {
                pinged++;
            }
        }
        if (pinged > 0) {
            log.debug("[PRESENCE][REGISTRY] Отправлен ping молчащим соединениям: {}", pinged);
        }
        return closed;
    }
}
