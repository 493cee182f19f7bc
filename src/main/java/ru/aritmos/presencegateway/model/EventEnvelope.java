package ru.aritmos.presencegateway.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.micronaut.core.annotation.Introspected;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

/**
 * Конверт push-сообщения: тип события + полезная нагрузка.
 * <p>
 * Инвариант: {@code kind} никогда не пустой. Форма {@code payload} определяется только {@code kind}
 * и транспортным слоем не проверяется.
 */
@Introspected
@Schema(name = "EventEnvelope", description = "Конверт push-события")
public record EventEnvelope(
        @Schema(description = "Тип события (например: appointments, doctorUpdate)", requiredMode = Schema.RequiredMode.REQUIRED)
        String kind,

        @Schema(description = "Полезная нагрузка (JSON), зависит от kind")
        JsonNode payload,

        @Schema(description = "Момент формирования события (информационно)")
        Instant issuedAt
) {

    public EventEnvelope {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind события не может быть пустым");
        }
        kind = kind.trim();
        payload = payload == null ? NullNode.getInstance() : payload;
    }

    /**
     * Событие с текущим временем формирования.
     */
    public static EventEnvelope of(String kind, JsonNode payload) {
        return new EventEnvelope(kind, payload, Instant.now());
    }

    /**
     * @return true для служебных типов протокола (auth/auth-ack/ping/pong)
     */
    public boolean isControl() {
        return PresenceEventKinds.isControl(kind);
    }
}
