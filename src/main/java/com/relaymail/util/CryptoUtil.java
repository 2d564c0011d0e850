package com.relaymail.util;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Locale;

/**
 * Hashing, SASL decoding and address helpers
 */
public final class CryptoUtil {

    private static final String HMAC_SHA256 = "HmacSHA256";

    private CryptoUtil() {}

    /**
     * Raw SHA-256 digest of a UTF-8 string
     */
    public static byte[] sha256(String input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Base64 HMAC-SHA256 of a UTF-8 string
     */
    public static String hmacSha256Base64(byte[] key, String data) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(key, HMAC_SHA256));
            return Base64.getEncoder().encodeToString(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 not available", e);
        }
    }

    /**
     * Strip angle brackets (<>) from an email address
     */
    public static String stripAngleBrackets(String email) {
        if (email == null) return null;
        String stripped = email.trim();
        if (stripped.startsWith("<")) stripped = stripped.substring(1);
        if (stripped.endsWith(">")) stripped = stripped.substring(0, stripped.length() - 1);
        return stripped.trim();
    }

    /**
     * Canonical form used for credential lookups and cache keys
     */
    public static String normalizeAddress(String email) {
        String stripped = stripAngleBrackets(email);
        return stripped == null ? null : stripped.toLowerCase(Locale.ROOT);
    }

    public static String decodeBase64(String encoded) {
        return new String(Base64.getDecoder().decode(encoded.trim()), StandardCharsets.UTF_8);
    }

    public static String encodeBase64(String plain) {
        return Base64.getEncoder().encodeToString(plain.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Decode a SASL PLAIN response: [authzid]\0authcid\0password
     *
     * @return {username, password}, or null if the response is malformed
     */
    public static String[] decodeAuthPlain(String encoded) {
        String decoded;
        try {
            decoded = decodeBase64(encoded);
        } catch (IllegalArgumentException e) {
            return null;
        }
        String[] parts = decoded.split("\0", -1);
        if (parts.length == 3 && !parts[1].isEmpty()) {
            return new String[]{parts[1], parts[2]};
        } else if (parts.length == 2 && !parts[0].isEmpty()) {
            return new String[]{parts[0], parts[1]};
        }
        return null;
    }

    /**
     * Extract the lower-cased domain from an email address
     */
    public static String extractDomain(String email) {
        if (email == null) return null;
        int at = email.lastIndexOf('@');
        if (at < 0 || at == email.length() - 1) return null;
        return email.substring(at + 1).toLowerCase(Locale.ROOT);
    }
}
