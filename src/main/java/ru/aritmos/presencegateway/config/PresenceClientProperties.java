package ru.aritmos.presencegateway.config;

import io.micronaut.context.annotation.ConfigurationProperties;

import java.time.Duration;

import static ru.aritmos.presencegateway.config.PresenceServerProperties.positiveOr;

/**
 * Typed-конфигурация встроенного push-клиента.
 * <p>
 * Клиент выключен по умолчанию ({@code presence.client.enabled=false}). Идентичность ({@code user-id/role/token})
 * задаётся конфигурацией только для сервисных клиентов; UI-клиент выставляет её через
 * {@link ru.aritmos.presencegateway.client.ConnectionManager#setIdentity}.
 */
@ConfigurationProperties("presence.client")
public class PresenceClientProperties {

    private boolean enabled;
    private String baseUrl = "http://localhost:8080";
    private String path = "/ws";
    private String userId;
    private String role;
    private String token;
    private int maxAttempts = 3;
    private Duration baseDelay = Duration.ofSeconds(2);
    private Duration maxDelay = Duration.ofSeconds(30);
    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration heartbeatInterval = Duration.ofSeconds(25);
    private Duration fallbackInterval = Duration.ofMinutes(10);
    private Duration fallbackCooldown = Duration.ofMinutes(5);
    private Duration fallbackCheckInterval = Duration.ofSeconds(15);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = (baseUrl == null || baseUrl.isBlank()) ? "http://localhost:8080" : baseUrl.trim();
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        if (path == null || path.isBlank()) {
            this.path = "/ws";
            return;
        }
        String p = path.trim();
        this.path = p.startsWith("/") ? p : "/" + p;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = blankToNull(userId);
    }

    public String getRole() {
        return role;
    }

    public void setRole(String role) {
        this.role = blankToNull(role);
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = blankToNull(token);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts <= 0 ? 3 : maxAttempts;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public void setBaseDelay(Duration baseDelay) {
        this.baseDelay = positiveOr(baseDelay, Duration.ofSeconds(2));
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
        this.maxDelay = positiveOr(maxDelay, Duration.ofSeconds(30));
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = positiveOr(connectTimeout, Duration.ofSeconds(5));
    }

    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public void setHeartbeatInterval(Duration heartbeatInterval) {
        this.heartbeatInterval = positiveOr(heartbeatInterval, Duration.ofSeconds(25));
    }

    public Duration getFallbackInterval() {
        return fallbackInterval;
    }

    public void setFallbackInterval(Duration fallbackInterval) {
        this.fallbackInterval = positiveOr(fallbackInterval, Duration.ofMinutes(10));
    }

    public Duration getFallbackCooldown() {
        return fallbackCooldown;
    }

    public void setFallbackCooldown(Duration fallbackCooldown) {
        this.fallbackCooldown = positiveOr(fallbackCooldown, Duration.ofMinutes(5));
    }

    public Duration getFallbackCheckInterval() {
        return fallbackCheckInterval;
    }

    public void setFallbackCheckInterval(Duration fallbackCheckInterval) {
        this.fallbackCheckInterval = positiveOr(fallbackCheckInterval, Duration.ofSeconds(15));
    }

    private static String blankToNull(String v) {
        return (v == null || v.isBlank()) ? null : v.trim();
    }
}
