package ru.aritmos.presencegateway.server;

import jakarta.inject.Singleton;
import ru.aritmos.presencegateway.config.PresenceSecurityProperties;
import ru.aritmos.presencegateway.model.IdentityClaim;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;

/**
 * Проверка подписи заявки на идентичность.
 * <p>
 * Режим NONE: принимается любая заявка. Режим HMAC: {@code token} обязан совпадать с
 * {@code base64url(HMAC-SHA256(secret, userId))} без padding. Если секрет не задан, в режиме HMAC отклоняется всё.
 */
@Singleton
public class HandshakeTokenVerifier {

    private static final String ALGORITHM = "HmacSHA256";

    private final PresenceSecurityProperties securityProperties;

    public HandshakeTokenVerifier(PresenceSecurityProperties securityProperties) {
        this.securityProperties = securityProperties;
    }

    public boolean verify(IdentityClaim claim) {
        if (claim == null) {
            return false;
        }
        PresenceSecurityProperties.Handshake h = securityProperties.getHandshake();
        if (h == null || h.getVerification() != PresenceSecurityProperties.Handshake.Verification.HMAC) {
            return true;
        }
        String secret = h.getSecret();
        if (secret == null || claim.token() == null) {
            return false;
        }
        byte[] expected = sign(claim.userId(), secret).getBytes(StandardCharsets.US_ASCII);
        byte[] actual = claim.token().getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, actual);
    }

    /**
     * Вычислить подпись для userId. Используется выпускающей стороной (бэкенд логина) и в тестах.
     */
    public static String sign(String userId, String secret) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            byte[] raw = mac.doFinal(userId.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(raw);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 недоступен", e);
        }
    }
}
