// file: core/src/test/java/io/chainmerkle/core/merkle/MerkleRootTest.java
package io.chainmerkle.core.merkle;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MerkleRootTest {

    @Test
    void hex_round_trip_and_equality() {
        MerkleRoot root = MerkleTree.build(List.of("x".getBytes(), "y".getBytes())).root();
        MerkleRoot parsed = MerkleRoot.fromHex(root.toHex());

        assertEquals(root, parsed);
        assertEquals(root.hashCode(), parsed.hashCode());
        assertEquals(0, root.compareTo(parsed));
    }

    @Test
    void ordering_is_unsigned() {
        byte[] a = new byte[32];
        byte[] b = new byte[32];
        a[0] = 0x01;
        b[0] = (byte) 0xf0;
        assertTrue(new MerkleRoot(a).compareTo(new MerkleRoot(b)) < 0);
    }

    @Test
    void rejects_wrong_length() {
        assertThrows(IllegalArgumentException.class, () -> new MerkleRoot(new byte[20]));
        assertThrows(IllegalArgumentException.class, () -> MerkleRoot.fromHex("0x1234"));
    }
}
