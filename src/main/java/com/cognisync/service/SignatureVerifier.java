package com.cognisync.service;

import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Verifies webhook authenticity with HMAC-SHA256.
 *
 * HOW IT WORKS:
 *   1. HMAC-SHA256 over the exact raw request bytes, keyed with the
 *      configuration's shared secret
 *   2. Hex-decode the signature the caller sent (an optional "sha256=" prefix
 *      is accepted, GitHub style)
 *   3. Different length from the 32-byte digest → reject straight away
 *   4. Same length → constant-time compare (MessageDigest.isEqual)
 *
 * Anything that fails here must be rejected at the boundary; an unsigned
 * event never reaches the event store.
 */
@Component
public class SignatureVerifier {

    private static final String ALGORITHM = "HmacSHA256";
    private static final String PREFIX = "sha256=";

    public boolean verify(String secret, byte[] rawBody, String providedSignatureHex) {
        if (secret == null || rawBody == null || providedSignatureHex == null) {
            return false;
        }

        byte[] provided;
        try {
            provided = HexFormat.of().parseHex(stripPrefix(providedSignatureHex.trim()));
        } catch (IllegalArgumentException e) {
            return false;
        }

        byte[] computed = computeDigest(secret, rawBody);
        if (provided.length != computed.length) {
            return false;
        }
        return MessageDigest.isEqual(computed, provided);
    }

    String sign(String secret, byte[] rawBody) {
        return HexFormat.of().formatHex(computeDigest(secret, rawBody));
    }

    private byte[] computeDigest(String secret, byte[] rawBody) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return mac.doFinal(rawBody);
        } catch (GeneralSecurityException e) {
            // HmacSHA256 is mandatory on every JRE
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    private static String stripPrefix(String signature) {
        return signature.regionMatches(true, 0, PREFIX, 0, PREFIX.length())
                ? signature.substring(PREFIX.length())
                : signature;
    }
}
