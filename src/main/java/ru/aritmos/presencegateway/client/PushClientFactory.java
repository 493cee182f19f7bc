package ru.aritmos.presencegateway.client;

import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import io.micronaut.http.client.annotation.Client;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.TaskScheduler;
import io.micronaut.websocket.WebSocketClient;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import ru.aritmos.presencegateway.config.PresenceClientProperties;
import ru.aritmos.presencegateway.core.EnvelopeCodec;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Бины встроенного push-клиента. Создаются только при {@code presence.client.enabled=true}.
 */
@Factory
@Requires(property = "presence.client.enabled", value = "true")
public class PushClientFactory {

    @Singleton
    PushTransport pushTransport(@Client("${presence.client.base-url}") WebSocketClient webSocketClient,
                                PresenceClientProperties props) {
        return new MicronautPushTransport(webSocketClient, props.getPath());
    }

    @Singleton
    ClientTimer clientTimer(@Named(TaskExecutors.SCHEDULED) TaskScheduler scheduler) {
        return new TaskSchedulerClientTimer(scheduler);
    }

    @Singleton
    @Bean(preDestroy = "shutdown")
    ConnectionManager connectionManager(PushTransport transport,
                                        ClientTimer timer,
                                        EnvelopeCodec codec,
                                        Clock clock,
                                        @Named(TaskExecutors.IO) Executor executor,
                                        PresenceClientProperties props) {
        return new ConnectionManager(
                transport,
                timer,
                codec,
                clock,
                executor,
                BackoffPolicy.from(props),
                props.getConnectTimeout(),
                props.getHeartbeatInterval());
    }
}
