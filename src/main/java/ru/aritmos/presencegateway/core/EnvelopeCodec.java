package ru.aritmos.presencegateway.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.inject.Singleton;
import ru.aritmos.presencegateway.model.EventEnvelope;
import ru.aritmos.presencegateway.model.IdentityClaim;
import ru.aritmos.presencegateway.model.PresenceEventKinds;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.Map;

/**
 * Кодек wire-формата push-канала.
 * <p>
 * Формат кадра:
 * <pre>
 * {"type": "appointments", "data": {...}, "issuedAt": "2024-05-01T10:00:00Z"}
 * </pre>
 * Поля {@code type/data} совместимы с существующим фронтендом.
 * <p>
 * Кадры клиента допускаются и в «плоском» виде ({@code {"type":"updateAppointment","appointmentId":5}}):
 * если {@code data} отсутствует, payload - это объект без служебных полей.
 */
@Singleton
public class EnvelopeCodec {

    static final String FIELD_TYPE = "type";
    static final String FIELD_DATA = "data";
    static final String FIELD_ISSUED_AT = "issuedAt";

    private final ObjectMapper objectMapper;

    public EnvelopeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Сериализовать конверт в текстовый кадр.
     */
    public String encode(EventEnvelope envelope) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put(FIELD_TYPE, envelope.kind());
        root.set(FIELD_DATA, envelope.payload());
        if (envelope.issuedAt() != null) {
            root.put(FIELD_ISSUED_AT, envelope.issuedAt().toString());
        }
        return write(root);
    }

    /**
     * Разобрать текстовый кадр.
     *
     * @throws EnvelopeDecodeException если кадр пустой, не JSON-объект или без {@code type}
     */
    public EventEnvelope decode(String frame) throws EnvelopeDecodeException {
        ObjectNode root = readObject(frame);

        JsonNode type = root.get(FIELD_TYPE);
        if (type == null || !type.isTextual() || type.asText().isBlank()) {
            throw new EnvelopeDecodeException("MISSING_TYPE", "в кадре нет строкового поля type");
        }

        JsonNode payload;
        if (root.has(FIELD_DATA)) {
            payload = root.get(FIELD_DATA);
        } else {
            ObjectNode flat = objectMapper.createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = root.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                if (!FIELD_TYPE.equals(e.getKey()) && !FIELD_ISSUED_AT.equals(e.getKey())) {
                    flat.set(e.getKey(), e.getValue());
                }
            }
            payload = flat;
        }

        return new EventEnvelope(type.asText(), payload, parseInstant(root.get(FIELD_ISSUED_AT)));
    }

    /**
     * Разобрать первый кадр соединения как заявку на идентичность.
     * <p>
     * Ожидается {@code {"type":"auth","userId":..,"role":..,"token":..}}. {@code userId} может быть строкой или числом.
     */
    public IdentityClaim decodeHandshake(String frame) throws EnvelopeDecodeException {
        EventEnvelope envelope = decode(frame);
        if (!PresenceEventKinds.AUTH.equals(envelope.kind())) {
            throw new EnvelopeDecodeException("NOT_A_HANDSHAKE", "первый кадр должен иметь type=auth, получен " + envelope.kind());
        }
        JsonNode p = envelope.payload();
        if (p == null || !p.isObject()) {
            throw new EnvelopeDecodeException("MISSING_USER_ID", "handshake не содержит userId");
        }

        String userId = scalarText(p.get("userId"));
        if (userId == null) {
            throw new EnvelopeDecodeException("MISSING_USER_ID", "handshake не содержит userId");
        }
        return new IdentityClaim(userId, scalarText(p.get("role")), scalarText(p.get("token")));
    }

    /**
     * Сформировать handshake-кадр клиента (плоский формат).
     */
    public String encodeHandshake(IdentityClaim claim) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put(FIELD_TYPE, PresenceEventKinds.AUTH);
        root.put("userId", claim.userId());
        if (claim.role() != null) {
            root.put("role", claim.role());
        }
        if (claim.token() != null) {
            root.put("token", claim.token());
        }
        return write(root);
    }

    /**
     * Преобразовать произвольный объект доменного слоя в JSON-payload.
     */
    public JsonNode toPayload(Object payload) {
        if (payload == null) {
            return objectMapper.nullNode();
        }
        if (payload instanceof JsonNode node) {
            return node;
        }
        return objectMapper.valueToTree(payload);
    }

    private ObjectNode readObject(String frame) throws EnvelopeDecodeException {
        if (frame == null || frame.isBlank()) {
            throw new EnvelopeDecodeException("BLANK_FRAME", "пустой кадр");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new EnvelopeDecodeException("MALFORMED_JSON", "кадр не является корректным JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new EnvelopeDecodeException("NOT_AN_OBJECT", "кадр должен быть JSON-объектом");
        }
        return (ObjectNode) root;
    }

    private String write(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Не удалось сериализовать кадр: " + e.getOriginalMessage(), e);
        }
    }

    private static Instant parseInstant(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return null;
        }
        try {
            return Instant.parse(node.asText());
        } catch (DateTimeParseException e) {
            // issuedAt информационный - некорректное значение не делает кадр битым.
            return null;
        }
    }

    private static String scalarText(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String t = node.asText();
        return (t == null || t.isBlank()) ? null : t.trim();
    }
}
