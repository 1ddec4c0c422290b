package fr.lapetina.inference.mesh.domain.dht;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * XOR metric over node identifiers.
 *
 * Each id is hashed with SHA-256 and the first 8 bytes are read as an unsigned 64-bit
 * integer. Distances must be compared with {@link Long#compareUnsigned(long, long)}.
 */
public final class XorDistance {

    private XorDistance() {
    }

    public static long hash(String id) {
        byte[] digest = sha256(id);
        long value = 0;
        for (int i = 0; i < Long.BYTES; i++) {
            value = (value << 8) | (digest[i] & 0xFF);
        }
        return value;
    }

    public static long distance(String a, String b) {
        return hash(a) ^ hash(b);
    }

    /**
     * Bucket index for a distance: its bit length, 0 for identical ids, 64 at most.
     */
    public static int bucketIndex(long distance) {
        return Long.SIZE - Long.numberOfLeadingZeros(distance);
    }

    private static byte[] sha256(String id) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(id.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
