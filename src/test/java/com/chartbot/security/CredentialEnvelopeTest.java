package com.chartbot.security;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CredentialEnvelopeTest {
    private static final String IV = "00112233445566778899AABBCCDDEEFF";
    private static final String BLOCK = "0123456789abcdef0123456789abcdef";

    @Test
    void parseTagged_shouldNormalizeHexCase() {
        CredentialEnvelope envelope = CredentialEnvelope.parseTagged("v1:" + IV + ":" + BLOCK);

        assertEquals(IV.toLowerCase(), envelope.ivHex);
        assertEquals("v1:" + IV.toLowerCase() + ":" + BLOCK, envelope.encode());
    }

    @Test
    void parseTagged_shouldRejectMalformedBody() {
        assertThrows(IllegalArgumentException.class, () -> CredentialEnvelope.parseTagged("v1:abc:" + BLOCK));
        assertThrows(IllegalArgumentException.class, () -> CredentialEnvelope.parseTagged("v1:" + IV + ":0123"));
        assertThrows(IllegalArgumentException.class, () -> CredentialEnvelope.parseTagged("v1:" + IV + ":" + BLOCK + ":x"));
        assertThrows(IllegalArgumentException.class, () -> CredentialEnvelope.parseTagged(IV + ":" + BLOCK));
    }

    @Test
    void parseLegacy_shouldOnlyAcceptLegacyShape() {
        assertNotNull(CredentialEnvelope.parseLegacy(IV + ":" + BLOCK + BLOCK));
        assertNull(CredentialEnvelope.parseLegacy("plain-session"));
        assertNull(CredentialEnvelope.parseLegacy("abc:def"));
        assertNull(CredentialEnvelope.parseLegacy("v1:" + IV + ":" + BLOCK));
        assertNull(CredentialEnvelope.parseLegacy(null));
    }
}
