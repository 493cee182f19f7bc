package ru.aritmos.presencegateway.model;

/**
 * Заявка на идентичность из handshake-кадра.
 * <p>
 * {@code role} - подсказка для выбора начального снимка состояния (patient/doctor).
 * {@code token} - опциональная подпись, проверяется только в режиме HMAC.
 */
public record IdentityClaim(String userId, String role, String token) {

    public IdentityClaim {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId обязателен");
        }
        userId = userId.trim();
        role = (role == null || role.isBlank()) ? null : role.trim();
        token = (token == null || token.isBlank()) ? null : token.trim();
    }

    public static IdentityClaim of(String userId, String role) {
        return new IdentityClaim(userId, role, null);
    }

    public boolean hasRole(String expected) {
        return role != null && role.equalsIgnoreCase(expected);
    }

    @Override
    public String toString() {
        return "IdentityClaim[userId=" + userId + ", role=" + role + ", token=" + (token == null ? "null" : "***") + "]";
    }
}
