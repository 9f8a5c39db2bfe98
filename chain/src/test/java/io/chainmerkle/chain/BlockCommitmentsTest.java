// file: chain/src/test/java/io/chainmerkle/chain/BlockCommitmentsTest.java
package io.chainmerkle.chain;

import io.chainmerkle.core.merkle.MerkleHashes;
import io.chainmerkle.core.merkle.MerkleTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Commitment modes over the blocks.json fixture:
 *  - block 100: three transactions, all with receipts,
 *  - block 101: two transactions, the first without a receipt,
 *  - block 102: no transactions.
 */
class BlockCommitmentsTest {

    private BlockCommitments commitments;

    @BeforeEach
    void setUp() {
        commitments = new BlockCommitments(ChainFixtures.source());
    }

    @Test
    void receipt_tree_has_one_leaf_per_receipt() {
        MerkleTree tree = commitments.receiptTree(commitments.block(100));
        assertEquals(3, tree.leafCount());
        assertEquals(4, tree.paddedLeafCount());
    }

    @Test
    void receipt_commitment_defaults_to_first_position() {
        ReceiptCommitment c = commitments.receiptCommitment(commitments.block(100), OptionalLong.empty());

        assertEquals(0, c.position());
        assertEquals(ChainFixtures.TX_A1, c.receipt().txHash());
        assertEquals(2, c.proof().size());
        assertTrue(c.verify());
        assertTrue(MerkleTree.verify(c.leaf(), c.proof(), c.root()));
    }

    @Test
    void receipt_commitment_selects_by_transaction_index() {
        Block block = commitments.block(100);
        ReceiptCommitment c = commitments.receiptCommitment(block, OptionalLong.of(2));

        assertEquals(2, c.position());
        assertEquals(ChainFixtures.TX_A3, c.receipt().txHash());
        assertEquals(commitments.receiptTree(block).root(), c.root());
        assertTrue(c.verify());

        ReceiptCommitment other = commitments.receiptCommitment(block, OptionalLong.of(1));
        assertFalse(c.root().verify(other.leaf(), c.proof()));
    }

    @Test
    void missing_receipts_are_skipped_and_positions_shift() {
        ReceiptCommitment c = commitments.receiptCommitment(commitments.block(101), OptionalLong.of(1));

        assertEquals(0, c.position());
        assertEquals(ChainFixtures.TX_B2, c.receipt().txHash());
        assertTrue(c.proof().isEmpty(), "single receipt gives an empty proof");
        assertArrayEquals(MerkleHashes.leafDigest(c.leaf()), c.root().hash());
    }

    @Test
    void unknown_transaction_index_is_an_error() {
        Block block = commitments.block(100);
        assertThrows(NoSuchElementException.class, () -> commitments.receiptCommitment(block, OptionalLong.of(9)));
    }

    @Test
    void block_without_receipts_cannot_build_receipt_tree() {
        Block empty = commitments.block(102);
        assertThrows(IllegalArgumentException.class, () -> commitments.receiptTree(empty));
        assertThrows(IllegalArgumentException.class, () -> commitments.receiptCommitment(empty, OptionalLong.empty()));
    }

    @Test
    void unknown_block_is_an_error() {
        assertThrows(NoSuchElementException.class, () -> commitments.block(5));
    }

    @Test
    void identifiers_append_transactions_root() {
        assertEquals(
                List.of(ChainFixtures.TX_A1, ChainFixtures.TX_A2, ChainFixtures.TX_A3, ChainFixtures.TX_ROOT_100),
                BlockCommitments.identifiers(commitments.block(100)));
    }

    @Test
    void hash_commitment_double_hashes_identifiers() {
        Block block = commitments.block(100);
        HashCommitment c = commitments.hashCommitment(block, Optional.of(ChainFixtures.TX_A2));

        assertEquals(1, c.position());
        assertArrayEquals(IdentifierDigests.sha256(ChainFixtures.TX_A2), c.leaf());
        assertEquals(2, c.proof().size());
        assertTrue(c.verify());

        MerkleTree direct = MerkleTree.build(IdentifierDigests.leaves(BlockCommitments.identifiers(block)));
        assertEquals(direct.root(), c.root());
        assertFalse(c.root().verify(ChainFixtures.TX_A2.getBytes(), c.proof()), "raw identifier is not the leaf");
    }

    @Test
    void hash_commitment_defaults_to_first_position_and_ignores_case() {
        Block block = commitments.block(100);
        assertEquals(0, commitments.hashCommitment(block, Optional.empty()).position());
        assertEquals(2, commitments.hashCommitment(block, Optional.of(ChainFixtures.TX_A3.toUpperCase().replace("0X", "0x"))).position());
        assertEquals(3, commitments.hashCommitment(block, Optional.of(ChainFixtures.TX_ROOT_100)).position());
    }

    @Test
    void unknown_hash_is_an_error() {
        Block block = commitments.block(100);
        assertThrows(NoSuchElementException.class,
                () -> commitments.hashCommitment(block, Optional.of(ChainFixtures.TX_B2)));
    }

    @Test
    void empty_block_still_has_a_hash_commitment() {
        HashCommitment c = commitments.hashCommitment(commitments.block(102), Optional.empty());
        assertTrue(c.proof().isEmpty());
        assertTrue(c.verify());
    }

    @Test
    void commitments_copy_their_leaf() {
        Block block = commitments.block(100);
        ReceiptCommitment receipt = commitments.receiptCommitment(block, OptionalLong.of(1));
        HashCommitment hash = commitments.hashCommitment(block, Optional.of(ChainFixtures.TX_A2));

        receipt.leaf()[0] ^= 0x01;
        hash.leaf()[0] ^= 0x01;

        assertTrue(receipt.verify());
        assertTrue(hash.verify());
        assertEquals(receipt, commitments.receiptCommitment(block, OptionalLong.of(1)));
        assertEquals(hash.hashCode(), commitments.hashCommitment(block, Optional.of(ChainFixtures.TX_A2)).hashCode());
        assertEquals(hash, commitments.hashCommitment(block, Optional.of(ChainFixtures.TX_A2)));
    }

    @Test
    void roots_cover_both_modes() {
        BlockRoots roots = commitments.roots(commitments.block(100));
        assertEquals(100, roots.blockNumber());
        assertEquals(commitments.receiptTree(commitments.block(100)).root(), roots.receiptRoot().orElseThrow());
        assertEquals(commitments.hashTree(commitments.block(100)).root(), roots.hashRoot());

        BlockRoots empty = commitments.roots(commitments.block(102));
        assertTrue(empty.receiptRoot().isEmpty());
    }
}
