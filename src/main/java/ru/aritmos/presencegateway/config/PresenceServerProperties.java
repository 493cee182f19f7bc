package ru.aritmos.presencegateway.config;

import io.micronaut.context.annotation.ConfigurationProperties;

import java.time.Duration;

/**
 * Typed-конфигурация серверной части push-канала.
 * <p>
 * Значения по умолчанию рассчитаны на браузерного клиента с heartbeat каждые ~25 секунд.
 */
@ConfigurationProperties("presence.server")
public class PresenceServerProperties {

    private Duration idleTimeout = Duration.ofSeconds(60);
    private Duration handshakeTimeout = Duration.ofSeconds(10);
    private Duration idleSweepInterval = Duration.ofSeconds(15);
    private int outboundQueueCapacity = 256;
    private boolean sendAuthAck = true;

    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    public void setIdleTimeout(Duration idleTimeout) {
        this.idleTimeout = positiveOr(idleTimeout, Duration.ofSeconds(60));
    }

    public Duration getHandshakeTimeout() {
        return handshakeTimeout;
    }

    public void setHandshakeTimeout(Duration handshakeTimeout) {
        this.handshakeTimeout = positiveOr(handshakeTimeout, Duration.ofSeconds(10));
    }

    public Duration getIdleSweepInterval() {
        return idleSweepInterval;
    }

    public void setIdleSweepInterval(Duration idleSweepInterval) {
        this.idleSweepInterval = positiveOr(idleSweepInterval, Duration.ofSeconds(15));
    }

    public int getOutboundQueueCapacity() {
        return outboundQueueCapacity;
    }

    public void setOutboundQueueCapacity(int outboundQueueCapacity) {
        this.outboundQueueCapacity = outboundQueueCapacity <= 0 ? 256 : outboundQueueCapacity;
    }

    public boolean isSendAuthAck() {
        return sendAuthAck;
    }

    public void setSendAuthAck(boolean sendAuthAck) {
        this.sendAuthAck = sendAuthAck;
    }

    static Duration positiveOr(Duration value, Duration fallback) {
        if (value == null || value.isZero() || value.isNegative()) {
            return fallback;
        }
        return value;
    }
}
