package ru.aritmos.presencegateway.client;

import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.presencegateway.config.PresenceClientProperties;
import ru.aritmos.presencegateway.model.IdentityClaim;

/**
 * Подключение сервисного клиента при старте, если идентичность задана конфигурацией.
 * <p>
 * Без {@code presence.client.user-id} клиент ждёт вызова {@link ConnectionManager#setIdentity(IdentityClaim)}.
 */
@Singleton
@Requires(property = "presence.client.enabled", value = "true")
public class PushClientStartup implements ApplicationEventListener<StartupEvent> {

    private static final Logger log = LoggerFactory.getLogger(PushClientStartup.class);

    private final ConnectionManager manager;
    private final PresenceClientProperties props;

    public PushClientStartup(ConnectionManager manager, PresenceClientProperties props) {
        this.manager = manager;
        this.props = props;
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        if (props.getUserId() == null) {
            log.info("[PRESENCE][CLIENT] Push-клиент включён, идентичность не задана: ожидание входа пользователя");
            return;
        }
        log.info("[PRESENCE][CLIENT] Push-клиент: подключение к {}{} как userId={}", props.getBaseUrl(), props.getPath(), props.getUserId());
        manager.setIdentity(new IdentityClaim(props.getUserId(), props.getRole(), props.getToken()));
    }
}
