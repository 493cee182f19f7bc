package ru.aritmos.presencegateway.server;

import org.junit.jupiter.api.Test;
import ru.aritmos.presencegateway.config.PresenceSecurityProperties;
import ru.aritmos.presencegateway.model.IdentityClaim;

import static org.junit.jupiter.api.Assertions.*;

class HandshakeTokenVerifierTest {

    @Test
    void shouldAcceptAnyClaimWithoutVerification() {
        HandshakeTokenVerifier verifier = new HandshakeTokenVerifier(new PresenceSecurityProperties());

        assertTrue(verifier.verify(IdentityClaim.of("1", "patient")));
        assertFalse(verifier.verify(null));
    }

    @Test
    void shouldRequireMatchingSignatureInHmacMode() {
        PresenceSecurityProperties props = hmac("top-secret");
        HandshakeTokenVerifier verifier = new HandshakeTokenVerifier(props);
        String token = HandshakeTokenVerifier.sign("1", "top-secret");

        assertTrue(verifier.verify(new IdentityClaim("1", "patient", token)));
        assertFalse(verifier.verify(new IdentityClaim("2", "patient", token)), "подпись привязана к userId");
        assertFalse(verifier.verify(new IdentityClaim("1", "patient", null)));
        assertFalse(verifier.verify(new IdentityClaim("1", "patient", HandshakeTokenVerifier.sign("1", "other"))));
    }

    @Test
    void shouldRejectEverythingWhenSecretMissing() {
        HandshakeTokenVerifier verifier = new HandshakeTokenVerifier(hmac(null));

        assertFalse(verifier.verify(new IdentityClaim("1", "patient", "anything")));
    }

    @Test
    void shouldProduceUrlSafeSignatureWithoutPadding() {
        String token = HandshakeTokenVerifier.sign("42", "k");

        assertEquals(43, token.length());
        assertFalse(token.contains("="));
        assertFalse(token.contains("+"));
        assertFalse(token.contains("/"));
        assertEquals(token, HandshakeTokenVerifier.sign("42", "k"));
    }

    static PresenceSecurityProperties hmac(String secret) {
        PresenceSecurityProperties props = new PresenceSecurityProperties();
        props.getHandshake().setVerification(PresenceSecurityProperties.Handshake.Verification.HMAC);
        props.getHandshake().setSecret(secret);
        return props;
    }
}
