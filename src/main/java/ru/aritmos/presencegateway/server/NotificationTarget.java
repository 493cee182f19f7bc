package ru.aritmos.presencegateway.server;

/**
 * Адресат уведомления: конкретный пользователь или все подключённые.
 */
public record NotificationTarget(String userId) {

    public static final String ALL = "all";

    private static final NotificationTarget EVERYONE = new NotificationTarget(null);

    public NotificationTarget {
        userId = (userId == null || userId.isBlank()) ? null : userId.trim();
    }

    public static NotificationTarget all() {
        return EVERYONE;
    }

    public static NotificationTarget user(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId обязателен");
        }
        return new NotificationTarget(userId);
    }

    /**
     * Разобрать адресат в формате доменного слоя: {@code "all"} или userId.
     */
    public static NotificationTarget parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("target обязателен");
        }
        return ALL.equalsIgnoreCase(raw.trim()) ? all() : user(raw);
    }

    public boolean isAll() {
        return userId == null;
    }
}
