package com.labelsel.selector;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * Derives IDs of the form {@code <tag>:<digest>}, where the digest is the unpadded
 * URL-safe base64 encoding of the SHA-224 hash of the text.
 */
public final class Sha224UniqueIdDeriver implements UniqueIdDeriver {
    public static final Sha224UniqueIdDeriver INSTANCE = new Sha224UniqueIdDeriver();

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    @Override
    public String derive(String namespaceTag, String text) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-224");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-224 not available", e);
        }
        byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
        return namespaceTag + ":" + ENCODER.encodeToString(hash);
    }
}
