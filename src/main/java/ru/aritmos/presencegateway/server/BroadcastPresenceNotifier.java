package ru.aritmos.presencegateway.server;

import jakarta.inject.Singleton;
import ru.aritmos.presencegateway.core.EnvelopeCodec;
import ru.aritmos.presencegateway.model.EventEnvelope;

@Singleton
public class BroadcastPresenceNotifier implements PresenceNotifier {

    private final Broadcaster broadcaster;
    private final EnvelopeCodec codec;

    public BroadcastPresenceNotifier(Broadcaster broadcaster, EnvelopeCodec codec) {
        this.broadcaster = broadcaster;
        this.codec = codec;
    }

    @Override
    public int notify(NotificationTarget target, String kind, Object payload) {
        if (target == null) {
            throw new IllegalArgumentException("target обязателен");
        }
        EventEnvelope envelope = EventEnvelope.of(kind, codec.toPayload(payload));
        return target.isAll()
                ? broadcaster.sendToAll(envelope)
                : broadcaster.sendToUser(target.userId(), envelope);
    }
}
