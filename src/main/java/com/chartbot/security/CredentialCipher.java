package com.chartbot.security;

import com.chartbot.automation.error.ConfigurationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * AES-256-CBC encryption for stored session credentials.
 */
public final class CredentialCipher {
    private static final Logger LOG = LogManager.getLogger(CredentialCipher.class);
    private static final String TRANSFORMATION = "AES/CBC/PKCS5Padding";
    private static final HexFormat HEX = HexFormat.of();

    private final SecretKeySpec key;
    private final SecureRandom random = new SecureRandom();

    private CredentialCipher(SecretKeySpec key) {
        this.key = key;
    }

    /**
     * Builds a cipher from a 64 hex character key. A blank key yields a cipher that can only read plaintext.
     */
    public static CredentialCipher fromHexKey(String keyHex) {
        if (keyHex == null || keyHex.trim().isEmpty()) {
            return new CredentialCipher(null);
        }
        String trimmed = keyHex.trim();
        if (trimmed.length() != 64) {
            throw new IllegalArgumentException("crypto.encryption-key must be 64 hex characters (32 bytes)");
        }
        byte[] raw;
        try {
            raw = HEX.parseHex(trimmed);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("crypto.encryption-key must be hex", e);
        }
        return new CredentialCipher(new SecretKeySpec(raw, "AES"));
    }

    public boolean isConfigured() {
        return key != null;
    }

    public String seal(String plaintext) throws ConfigurationException {
        if (key == null) {
            throw new ConfigurationException("crypto.encryption-key is not configured");
        }
        byte[] iv = new byte[16];
        random.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new IvParameterSpec(iv));
            byte[] out = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            return new CredentialEnvelope(HEX.formatHex(iv), HEX.formatHex(out)).encode();
        } catch (GeneralSecurityException e) {
            throw new ConfigurationException("credential encryption failed: " + e.getMessage(), e);
        }
    }

    /**
     * Decodes a stored credential.
     * A tagged value that cannot be decrypted is a configuration error. An untagged value is tried as the
     * legacy encrypted form when it has that shape and otherwise, or on any failure, returned as plaintext.
     */
    public String open(String stored) throws ConfigurationException {
        if (stored == null || stored.trim().isEmpty()) {
            return null;
        }
        if (CredentialEnvelope.isTagged(stored)) {
            if (key == null) {
                throw new ConfigurationException("encrypted credential found but crypto.encryption-key is not configured");
            }
            try {
                return decrypt(CredentialEnvelope.parseTagged(stored));
            } catch (IllegalArgumentException | GeneralSecurityException e) {
                throw new ConfigurationException("credential decryption failed: " + e.getMessage(), e);
            }
        }
        CredentialEnvelope legacy = CredentialEnvelope.parseLegacy(stored);
        if (legacy != null && key != null) {
            try {
                return decrypt(legacy);
            } catch (GeneralSecurityException e) {
                LOG.debug("legacy credential did not decrypt, treating as plaintext: {}", e.getMessage());
            }
        }
        return stored;
    }

    private String decrypt(CredentialEnvelope envelope) throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(Cipher.DECRYPT_MODE, key, new IvParameterSpec(HEX.parseHex(envelope.ivHex)));
        byte[] out = cipher.doFinal(HEX.parseHex(envelope.cipherHex));
        return new String(out, StandardCharsets.UTF_8);
    }
}
