// file: server/src/test/java/io/chainmerkle/server/CommitmentServiceTest.java
package io.chainmerkle.server;

import io.chainmerkle.chain.SnapshotBlockSource;
import io.chainmerkle.core.merkle.MerkleTree;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class CommitmentServiceTest {

    private final CommitmentService service = new CommitmentService(new SnapshotBlockSource(List.of(), List.of()));

    private static String b64(int... bytes) {
        byte[] out = new byte[bytes.length];
        for (int i = 0; i < bytes.length; i++) out[i] = (byte) bytes[i];
        return Base64.getEncoder().encodeToString(out);
    }

    @Test
    void build_then_verify_each_leaf() {
        List<String> leaves = List.of(b64(0), b64(1), b64(2), b64(3), b64(4));
        MerkleTree tree = service.build(leaves);

        assertEquals(5, tree.leafCount());
        for (int i = 0; i < leaves.size(); i++) {
            assertTrue(service.verify(leaves.get(i), tree.proof(i).toHex(), tree.root().toHex()));
        }
        assertFalse(service.verify(leaves.get(0), tree.proof(2).toHex(), tree.root().toHex()));
    }

    @Test
    void single_leaf_verifies_with_missing_proof() {
        MerkleTree tree = service.build(List.of(b64(9)));
        assertTrue(service.verify(b64(9), null, tree.root().toHex()));
    }

    @Test
    void bad_input_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> service.build(List.of()));
        assertThrows(IllegalArgumentException.class, () -> service.build(null));
        assertThrows(IllegalArgumentException.class, () -> service.build(List.of("***")));
        assertThrows(IllegalArgumentException.class, () -> service.verify(b64(1), List.of(), null));
        assertThrows(IllegalArgumentException.class, () -> service.verify(b64(1), List.of("0x12"), "0x" + "00".repeat(32)));
        assertThrows(IllegalArgumentException.class,
                () -> service.verify(b64(1), Arrays.asList((String) null), "0x" + "00".repeat(32)));
    }

    @Test
    void unknown_blocks_are_not_found() {
        assertEquals(-1, service.latestBlockNumber());
        assertThrows(NoSuchElementException.class, () -> service.roots(1));
        assertThrows(NoSuchElementException.class, () -> service.receiptProof(1, OptionalLong.empty()));
        assertThrows(NoSuchElementException.class, () -> service.hashProof(1, Optional.empty()));
    }
}
