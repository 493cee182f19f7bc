package ru.aritmos.presencegateway.config;

import io.micronaut.context.annotation.ConfigurationProperties;

/**
 * Typed-конфигурация security-контура presence-gateway.
 * <p>
 * Два независимых контура:
 * <ul>
 *   <li>{@link Mode} - доступ к административному HTTP API;</li>
 *   <li>{@link Handshake} - проверка заявки на идентичность в WebSocket-канале.</li>
 * </ul>
 */
@ConfigurationProperties("presence.security")
public class PresenceSecurityProperties {

    public enum Mode {
        OPEN,
        REQUIRE_AUTH
    }

    private Mode mode = Mode.OPEN;
    private String adminRole = "PRESENCE_ADMIN";
    private Handshake handshake = new Handshake();

    public Mode getMode() {
        return mode;
    }

    public void setMode(Mode mode) {
        this.mode = mode == null ? Mode.OPEN : mode;
    }

    public String getAdminRole() {
        return adminRole;
    }

    public void setAdminRole(String adminRole) {
        this.adminRole = (adminRole == null || adminRole.isBlank()) ? "PRESENCE_ADMIN" : adminRole.trim();
    }

    public Handshake getHandshake() {
        return handshake;
    }

    public void setHandshake(Handshake handshake) {
        this.handshake = handshake == null ? new Handshake() : handshake;
    }

    @ConfigurationProperties("handshake")
    public static class Handshake {

        public enum Verification {
            /** Любая заявка принимается (базовый протокол). */
            NONE,
            /** Заявка обязана нести подпись HMAC-SHA256(secret, userId). */
            HMAC
        }

        private Verification verification = Verification.NONE;
        private String secret;

        public Verification getVerification() {
            return verification;
        }

        public void setVerification(Verification verification) {
            this.verification = verification == null ? Verification.NONE : verification;
        }

        public String getSecret() {
            return secret;
        }

        public void setSecret(String secret) {
            this.secret = (secret == null || secret.isBlank()) ? null : secret;
        }
    }
}
