package com.driftindexer.ingestion.event;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * 8-byte tag prefixing every Anchor event payload: the first 8 bytes of sha256("event:" + EventName).
 */
public final class Discriminator {

    public static final int LENGTH = 8;

    private final byte[] bytes;

    private Discriminator(byte[] bytes) {
        this.bytes = bytes;
    }

    public static Discriminator of(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Discriminator must be exactly " + LENGTH + " bytes");
        }
        return new Discriminator(bytes.clone());
    }

    public static Discriminator forEvent(String eventName) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256")
                    .digest(("event:" + eventName).getBytes(StandardCharsets.UTF_8));
            return new Discriminator(Arrays.copyOf(hash, LENGTH));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    public byte[] toByteArray() {
        return bytes.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Discriminator)) return false;
        return Arrays.equals(bytes, ((Discriminator) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return HexFormat.of().formatHex(bytes);
    }
}
