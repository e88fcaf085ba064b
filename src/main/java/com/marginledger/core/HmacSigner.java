package com.marginledger.core;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * HMAC-SHA256 over UTF-8 strings, hex encoded. Used for oracle attestations and for
 * delegated-call signatures.
 */
public final class HmacSigner {

    private static final String ALGORITHM = "HmacSHA256";

    private HmacSigner() {}

    public static String sign(String data, String secretKey) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secretKey.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            byte[] hash = mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to compute " + ALGORITHM, e);
        }
    }

    /** Constant-time comparison of {@code signatureHex} against the expected signature. */
    public static boolean verify(String data, String secretKey, String signatureHex) {
        if (signatureHex == null) {
            return false;
        }
        byte[] expected = sign(data, secretKey).getBytes(StandardCharsets.US_ASCII);
        byte[] actual = signatureHex.toLowerCase().getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, actual);
    }
}
