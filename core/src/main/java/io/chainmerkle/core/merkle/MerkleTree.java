// file: core/src/main/java/io/chainmerkle/core/merkle/MerkleTree.java
package io.chainmerkle.core.merkle;

import java.util.List;

/**
 * Immutable binary Merkle tree over an ordered list of opaque leaf blobs.
 * <p>
 * At a high level:
 *  - The leaf list (n >= 1) is padded with empty blobs up to L, the next power of two.
 *  - Each padded leaf is hashed with Keccak-256.
 *  - Internal nodes combine their two children with {@link MerkleHashes#combine}.
 *  - One proof is kept per original leaf; padding leaves never get one.
 * <p>
 * Node indexing (implicit heap layout, 2L - 1 nodes):
 *  - root has id 0,
 *  - children of node v are at 2v+1 and 2v+2,
 *  - leaves occupy ids L-1 .. 2L-2 in padded leaf order.
 * <p>
 * A built tree is never mutated and may be shared across threads.
 */
public interface MerkleTree {

    /** Root commitment. Time: O(1) */
    MerkleRoot root();

    /** Number of original (unpadded) leaves, n. */
    int leafCount();

    /** Padded leaf count L: smallest power of two >= n. */
    int paddedLeafCount();

    /** Proof length shared by every leaf: log2(L). */
    default int depth() {
        return Integer.numberOfTrailingZeros(paddedLeafCount());
    }

    /**
     * Proof for the leaf at position {@code leafIndex} of the input list.
     *
     * @throws IndexOutOfBoundsException if leafIndex is outside [0, leafCount())
     */
    MerkleProof proof(int leafIndex);

    /** All proofs, proofs().get(i) belonging to leaf i. */
    List<MerkleProof> proofs();

    /** Digest stored at a node id of the heap layout. */
    byte[] hashAt(int nodeId);

    boolean isLeaf(int nodeId);

    /**
     * Build a tree over the given leaves, in the given order.
     * O(L) to build, O(n log L) to extract all proofs.
     *
     * @throws IllegalArgumentException if leaves is empty
     */
    static MerkleTree build(List<byte[]> leaves) {
        return new HeapMerkle(leaves);
    }

    /**
     * Check that {@code leaf} sits under {@code root} at the position {@code proof} was taken from.
     * Needs no tree and no leaf index.
     */
    static boolean verify(byte[] leaf, MerkleProof proof, MerkleRoot root) {
        return root.verify(leaf, proof);
    }
}
