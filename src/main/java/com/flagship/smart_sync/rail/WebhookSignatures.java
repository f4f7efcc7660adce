package com.flagship.smart_sync.rail;

import com.flagship.smart_sync.exception.InvalidWebhookException;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.HexFormat;

/**
 * HMAC-SHA256 signature checks for webhook deliveries.
 */
public final class WebhookSignatures {

    private WebhookSignatures() {
    }

    public static byte[] hmacSha256(String secret, String body) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return mac.doFinal(body.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    /**
     * Verifies a base64-encoded signature.
     *
     * @throws InvalidWebhookException if the secret is unset, the header missing or the signature wrong
     */
    public static void verifyBase64(String secret, String body, String signature) {
        requirePresent(secret, signature);
        byte[] provided;
        try {
            provided = Base64.getDecoder().decode(signature.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidWebhookException("Webhook signature is not base64");
        }
        compare(hmacSha256(secret, body), provided);
    }

    /**
     * Verifies a hex-encoded signature, optionally prefixed with "sha256=".
     */
    public static void verifyHex(String secret, String body, String signature) {
        requirePresent(secret, signature);
        String value = signature.trim();
        if (value.startsWith("sha256=")) {
            value = value.substring("sha256=".length());
        }
        byte[] provided;
        try {
            provided = HexFormat.of().parseHex(value.toLowerCase());
        } catch (IllegalArgumentException e) {
            throw new InvalidWebhookException("Webhook signature is not hex");
        }
        compare(hmacSha256(secret, body), provided);
    }

    private static void requirePresent(String secret, String signature) {
        if (secret == null || secret.isBlank()) {
            throw new InvalidWebhookException("Webhook secret is not configured");
        }
        if (signature == null || signature.isBlank()) {
            throw new InvalidWebhookException("Webhook signature header is missing");
        }
    }

    private static void compare(byte[] expected, byte[] provided) {
        if (!MessageDigest.isEqual(expected, provided)) {
            throw new InvalidWebhookException("Webhook signature does not match");
        }
    }
}
