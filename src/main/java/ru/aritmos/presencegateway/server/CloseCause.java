package ru.aritmos.presencegateway.server;

/**
 * Причина закрытия серверного соединения и соответствующий WebSocket close-код.
 */
public enum CloseCause {

    HANDSHAKE_REJECTED(1008, "handshake rejected"),
    HANDSHAKE_TIMEOUT(1008, "handshake timeout"),
    IDLE_TIMEOUT(1001, "idle timeout"),
    WRITE_FAILED(1011, "write failed"),
    QUEUE_OVERFLOW(1008, "outbound queue overflow"),
    PEER_CLOSED(1000, "closed"),
    TRANSPORT_ERROR(1011, "transport error"),
    SHUTDOWN(1001, "going away");

    private final int code;
    private final String reason;

    CloseCause(int code, String reason) {
        this.code = code;
        this.reason = reason;
    }

    public int code() {
        return code;
    }

    public String reason() {
        return reason;
    }
}
