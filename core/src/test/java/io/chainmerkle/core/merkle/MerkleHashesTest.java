// file: core/src/test/java/io/chainmerkle/core/merkle/MerkleHashesTest.java
package io.chainmerkle.core.merkle;

import io.chainmerkle.core.Hex;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class MerkleHashesTest {

    @Test
    void keccak256_known_vectors() {
        assertEquals("0xc5d2460186f7233c927e7db2dcc703c0e500b653ca82273b7bfad8045d85a470",
                Hex.encode(MerkleHashes.keccak256(new byte[0])));
        assertEquals("0x4e03657aea45a94fc7d47ba826c8d667c0d1e6e33a64a036ec44f58fa12d6c45",
                Hex.encode(MerkleHashes.keccak256("abc".getBytes(StandardCharsets.US_ASCII))));
    }

    @Test
    void combine_is_commutative() {
        Random rnd = new Random(7);
        for (int i = 0; i < 50; i++) {
            byte[] a = new byte[32];
            byte[] b = new byte[32];
            rnd.nextBytes(a);
            rnd.nextBytes(b);
            assertArrayEquals(MerkleHashes.combine(a, b), MerkleHashes.combine(b, a));
        }
        byte[] same = MerkleHashes.leafDigest(new byte[] { 1 });
        assertEquals(32, MerkleHashes.combine(same, same).length);
    }

    @Test
    void sort_pair_uses_unsigned_order() {
        byte[] low = new byte[32];
        byte[] high = new byte[32];
        low[0] = 0x7f;
        high[0] = (byte) 0x80; // negative as a signed byte, larger unsigned

        byte[][] pair = MerkleHashes.sortPair(high, low);
        assertSame(low, pair[0]);
        assertSame(high, pair[1]);
    }

    @Test
    void pair_is_encoded_as_compact_json_tuple() {
        byte[] zeros = new byte[32];
        byte[] ones = new byte[32];
        Arrays.fill(ones, (byte) 0xff);

        String zerosJson = "[" + String.join(",", Collections.nCopies(32, "0")) + "]";
        String onesJson = "[" + String.join(",", Collections.nCopies(32, "255")) + "]";

        String encoded = new String(MerkleHashes.encodePair(zeros, ones), StandardCharsets.UTF_8);
        assertEquals("[" + zerosJson + "," + onesJson + "]", encoded);

        assertArrayEquals(
                MerkleHashes.keccak256(("[" + zerosJson + "," + onesJson + "]").getBytes(StandardCharsets.UTF_8)),
                MerkleHashes.combine(ones, zeros));
    }

    @Test
    void combine_rejects_non_digest_input() {
        assertThrows(IllegalArgumentException.class, () -> MerkleHashes.combine(new byte[31], new byte[32]));
        assertThrows(NullPointerException.class, () -> MerkleHashes.combine(null, new byte[32]));
    }
}
