// file: chain/src/test/java/io/chainmerkle/chain/IdentifierDigestsTest.java
package io.chainmerkle.chain;

import io.chainmerkle.core.Hex;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IdentifierDigestsTest {

    @Test
    void hashes_quoted_identifier_with_sha256() {
        // sha256("\"0xabab...ab\"")
        assertEquals("0x8e8787898cbfd1ac72272413c9761c46d4df6f0cd4e89803c1256bda3fb9e0f5",
                Hex.encode(IdentifierDigests.sha256(ChainFixtures.repeat("ab"))));
    }

    @Test
    void identifier_case_is_normalized() {
        assertArrayEquals(
                IdentifierDigests.sha256(ChainFixtures.repeat("ab")),
                IdentifierDigests.sha256("0x" + "AB".repeat(32)));
    }

    @Test
    void leaves_keep_identifier_order() {
        List<byte[]> leaves = IdentifierDigests.leaves(List.of(ChainFixtures.TX_A1, ChainFixtures.TX_A2));
        assertEquals(2, leaves.size());
        assertEquals(32, leaves.get(0).length);
        assertArrayEquals(IdentifierDigests.sha256(ChainFixtures.TX_A2), leaves.get(1));
    }

    @Test
    void rejects_non_hex_identifier() {
        assertThrows(IllegalArgumentException.class, () -> IdentifierDigests.sha256("not-a-hash"));
    }
}
