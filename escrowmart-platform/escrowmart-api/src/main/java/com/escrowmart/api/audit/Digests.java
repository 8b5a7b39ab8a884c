package com.escrowmart.api.audit;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class Digests {

    private Digests() {}

    /**
     * Computes SHA-256 hash of input string.
     */
    public static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Hash over the pipe-joined parts, nulls rendered as empty.
     */
    public static String sha256Of(Object... parts) {
        StringBuilder data = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                data.append('|');
            }
            data.append(parts[i] == null ? "" : parts[i]);
        }
        return sha256(data.toString());
    }
}
