package com.chartbot.security;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Versioned wire form of an encrypted credential: {@code v1:<ivHex>:<cipherHex>}.
 * Values without a version tag are legacy and may be either plaintext or the old {@code iv:cipher} form.
 */
public final class CredentialEnvelope {
    public static final String VERSION_TAG = "v1";

    private static final Pattern HEX = Pattern.compile("[0-9a-fA-F]+");
    private static final int IV_HEX_LENGTH = 32;

    public final String ivHex;
    public final String cipherHex;

    public CredentialEnvelope(String ivHex, String cipherHex) {
        this.ivHex = ivHex.toLowerCase(Locale.ROOT);
        this.cipherHex = cipherHex.toLowerCase(Locale.ROOT);
    }

    public String encode() {
        return VERSION_TAG + ":" + ivHex + ":" + cipherHex;
    }

    public static boolean isTagged(String stored) {
        return stored != null && stored.startsWith(VERSION_TAG + ":");
    }

    /**
     * Parses a tagged value.
     *
     * @throws IllegalArgumentException when the value is tagged but malformed
     */
    public static CredentialEnvelope parseTagged(String stored) {
        if (!isTagged(stored)) {
            throw new IllegalArgumentException("credential is not a " + VERSION_TAG + " envelope");
        }
        String body = stored.substring(VERSION_TAG.length() + 1);
        CredentialEnvelope envelope = parsePair(body);
        if (envelope == null) {
            throw new IllegalArgumentException("malformed " + VERSION_TAG + " credential envelope");
        }
        return envelope;
    }

    /**
     * Untagged value shaped like the legacy {@code ivHex:cipherHex} form, or null.
     */
    public static CredentialEnvelope parseLegacy(String stored) {
        if (stored == null || isTagged(stored)) {
            return null;
        }
        return parsePair(stored.trim());
    }

    private static CredentialEnvelope parsePair(String body) {
        int sep = body.indexOf(':');
        if (sep <= 0 || sep != body.lastIndexOf(':')) {
            return null;
        }
        String iv = body.substring(0, sep);
        String cipher = body.substring(sep + 1);
        if (iv.length() != IV_HEX_LENGTH || !HEX.matcher(iv).matches()) {
            return null;
        }
        if (cipher.isEmpty() || cipher.length() % 32 != 0 || !HEX.matcher(cipher).matches()) {
            return null;
        }
        return new CredentialEnvelope(iv, cipher);
    }
}
