// file: core/src/main/java/io/chainmerkle/core/merkle/MerkleHashes.java
package io.chainmerkle.core.merkle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bouncycastle.jcajce.provider.digest.Keccak;

import java.util.Arrays;
import java.util.Objects;

/**
 * Hashing primitives shared by tree construction and verification.
 * <p>
 * Node hashes:
 *  - leaf node     = Keccak-256(raw leaf bytes)
 *  - internal node = Keccak-256(encodePair(sortPair(a, b)))
 * <p>
 * The pair is ordered so the smaller digest (unsigned byte-lexicographic) comes first,
 * which makes {@link #combine(byte[], byte[])} commutative. A proof therefore only
 * needs sibling values, never their side.
 * <p>
 * The ordered pair is serialized as a compact JSON 2-tuple of unsigned byte arrays:
 * <pre>
 *   [[a0,a1,...,a31],[b0,b1,...,b31]]
 * </pre>
 * Changing this encoding changes every root, so it is fixed.
 */
public final class MerkleHashes {

    /** Digest width in bytes (Keccak-256). */
    public static final int HASH_LEN = 32;

    private static final ObjectMapper PAIR_JSON = new ObjectMapper();

    private MerkleHashes() {}

    /** Keccak-256 of the given bytes. */
    public static byte[] keccak256(byte[] data) {
        Objects.requireNonNull(data, "data");
        return new Keccak.Digest256().digest(data);
    }

    /** Initial hash of a leaf node: Keccak-256 over the raw blob. */
    public static byte[] leafDigest(byte[] blob) {
        return keccak256(blob);
    }

    /**
     * Hash two child digests into their parent.
     * Order-independent: combine(a, b) == combine(b, a).
     */
    public static byte[] combine(byte[] a, byte[] b) {
        byte[][] pair = sortPair(a, b);
        return keccak256(encodePair(pair[0], pair[1]));
    }

    /**
     * Order two digests so the smaller one is first.
     * Equal digests keep the second argument first, which yields the same bytes either way.
     */
    public static byte[][] sortPair(byte[] first, byte[] second) {
        requireDigest(first, "first");
        requireDigest(second, "second");
        if (Arrays.compareUnsigned(first, second) < 0) {
            return new byte[][] { first, second };
        }
        return new byte[][] { second, first };
    }

    /** Serialize an already ordered pair as {@code [[..32 ints..],[..32 ints..]]}. */
    static byte[] encodePair(byte[] first, byte[] second) {
        try {
            return PAIR_JSON.writeValueAsBytes(new int[][] { unsigned(first), unsigned(second) });
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to encode digest pair", e);
        }
    }

    static void requireDigest(byte[] digest, String name) {
        Objects.requireNonNull(digest, name);
        if (digest.length != HASH_LEN) {
            throw new IllegalArgumentException(
                    "%s must be %d bytes, got %d".formatted(name, HASH_LEN, digest.length));
        }
    }

    private static int[] unsigned(byte[] bytes) {
        int[] out = new int[bytes.length];
        for (int i = 0; i < bytes.length; i++) out[i] = bytes[i] & 0xff;
        return out;
    }
}
