package com.gzh.webhooks.security;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Verifies GitHub webhook HMAC-SHA256 signatures.
 *
 * <p>GitHub signs every delivery with the secret configured on the webhook.
 * The signature arrives in the {@code X-Hub-Signature-256} request header.
 *
 * <pre>
 * Expected header format:
 *   X-Hub-Signature-256: sha256=&lt;hex-digest&gt;
 * </pre>
 */
public final class HmacVerifier {

    public static final String SIGNATURE_HEADER = "X-Hub-Signature-256";

    private static final String ALGORITHM = "HmacSHA256";
    private static final String PREFIX    = "sha256=";

    private final byte[] secretBytes;

    /**
     * @param sharedSecret the secret configured on the platform's webhook
     */
    public HmacVerifier(String sharedSecret) {
        if (sharedSecret == null || sharedSecret.isBlank()) {
            throw new IllegalArgumentException("sharedSecret must not be null or blank");
        }
        this.secretBytes = sharedSecret.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Verifies the signature header value against the raw request body.
     * Never throws: a missing, malformed or mismatching header yields {@code false}.
     *
     * @param rawBody         the exact bytes received in the HTTP request body
     * @param signatureHeader the value of the {@code X-Hub-Signature-256} header
     * @return {@code true} if the signature is valid, {@code false} otherwise
     */
    public boolean verify(byte[] rawBody, String signatureHeader) {
        if (rawBody == null || signatureHeader == null || !signatureHeader.startsWith(PREFIX)) {
            return false;
        }
        byte[] received;
        try {
            received = HexFormat.of().parseHex(signatureHeader.substring(PREFIX.length()).trim());
        } catch (IllegalArgumentException e) {
            return false;
        }
        // Constant-time comparison to prevent timing attacks
        return MessageDigest.isEqual(computeHmac(rawBody), received);
    }

    /**
     * Computes the header value a sender would attach to {@code rawBody}.
     */
    public String sign(byte[] rawBody) {
        return PREFIX + HexFormat.of().formatHex(computeHmac(rawBody));
    }

    private byte[] computeHmac(byte[] data) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secretBytes, ALGORITHM));
            return mac.doFinal(data);
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
