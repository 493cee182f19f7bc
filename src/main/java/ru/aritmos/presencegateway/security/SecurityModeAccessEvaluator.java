package ru.aritmos.presencegateway.security;

import jakarta.inject.Singleton;
import ru.aritmos.presencegateway.config.PresenceSecurityProperties;

import java.util.List;

/**
 * Оценивает HTTP-доступ согласно режиму безопасности presence-gateway.
 * <p>
 * Путь WebSocket-канала открыт всегда: идентичность в нём подтверждается handshake-кадром, а не HTTP-аутентификацией.
 */
@Singleton
public class SecurityModeAccessEvaluator {

    public enum Decision {
        ALLOW,
        REQUIRE_AUTH
    }

    static final List<String> ALWAYS_ALLOWED = List.of(
            "/ws",
            "/health", "/health/**",
            "/swagger/**", "/swagger-ui/**"
    );

    public Decision evaluate(String path, PresenceSecurityProperties props) {
        PresenceSecurityProperties effective = props == null ? new PresenceSecurityProperties() : props;
        PresenceSecurityProperties.Mode mode = effective.getMode();
        if (mode == null || mode == PresenceSecurityProperties.Mode.OPEN) {
            return Decision.ALLOW;
        }
        if (matchesAny(path, ALWAYS_ALLOWED)) {
            return Decision.ALLOW;
        }
        if (matchesAny(path, List.of("/admin/**"))) {
            return Decision.REQUIRE_AUTH;
        }
        return Decision.ALLOW;
    }

    boolean matchesAny(String path, List<String> patterns) {
        if (path == null || path.isBlank() || patterns == null || patterns.isEmpty()) {
            return false;
        }
        for (String p : patterns) {
            if (matches(path, p)) {
                return true;
            }
        }
        return false;
    }

    private boolean matches(String path, String pattern) {
        if (pattern == null || pattern.isBlank()) {
            return false;
        }
        String p = pattern.trim();
        if ("/**".equals(p)) {
            return true;
        }
        if (p.endsWith("/**")) {
            String prefix = p.substring(0, p.length() - 3);
            return path.equals(prefix) || path.startsWith(prefix + "/");
        }
        if (path.equals(p)) {
            return true;
        }
        return path.endsWith("/") && path.substring(0, path.length() - 1).equals(p);
    }
}
