// file: core/src/main/java/io/chainmerkle/core/merkle/HeapMerkle.java
package io.chainmerkle.core.merkle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Array-backed Merkle tree:
 *  - leaf list padded with empty blobs to paddedCount = next power of two,
 *  - implicit array layout for nodes,
 *  - Keccak-256 leaves, commutative pair hashing for parents.
 * <p>
 * Tree layout:
 *  - paddedCount leaves, indexed from baseLeafId = paddedCount - 1
 *  - totalNodes = 2 * paddedCount - 1
 *  - node 0 is root
 *  - for node v:
 *      left child  = 2v + 1
 *      right child = 2v + 2
 *      sibling     = v - 1 if v is even, else v + 1
 *      parent      = (v - 1) / 2
 */
final class HeapMerkle implements MerkleTree {
    private static final Logger log = Logger.getLogger(HeapMerkle.class.getName());
    private static final byte[] PADDING_LEAF = new byte[0];

    private final int leafCount;          // n, original leaves
    private final int paddedCount;        // L, power of two
    private final int baseLeafId;         // node id of the first leaf
    private final byte[][] nodeHash;      // nodeId -> hash
    private final List<MerkleProof> proofs;

    HeapMerkle(List<byte[]> leaves) {
        Objects.requireNonNull(leaves, "leaves");
        if (leaves.isEmpty()) throw new IllegalArgumentException("leaves must not be empty");
        this.leafCount = leaves.size();
        this.paddedCount = paddedSize(leafCount);
        this.baseLeafId = paddedCount - 1;
        this.nodeHash = new byte[(paddedCount << 1) - 1][];

        // 1) leaves, padded with empty blobs
        for (int j = 0; j < paddedCount; j++) {
            byte[] blob = j < leafCount ? Objects.requireNonNull(leaves.get(j), "leaf") : PADDING_LEAF;
            nodeHash[baseLeafId + j] = MerkleHashes.leafDigest(blob);
        }

        // 2) parents upward; decreasing ids guarantee both children exist
        for (int v = baseLeafId - 1; v >= 0; v--) {
            nodeHash[v] = MerkleHashes.combine(nodeHash[leftChild(v)], nodeHash[rightChild(v)]);
        }

        // 3) one proof per original leaf
        List<MerkleProof> out = new ArrayList<>(leafCount);
        for (int i = 0; i < leafCount; i++) out.add(extractProof(i));
        this.proofs = Collections.unmodifiableList(out);

        if (log.isLoggable(Level.FINE)) {
            log.fine(String.format("built merkle tree: leaves=%d padded=%d depth=%d",
                    leafCount, paddedCount, depth()));
        }
    }

    @Override public MerkleRoot root() { return new MerkleRoot(nodeHash[0]); }

    @Override public int leafCount() { return leafCount; }

    @Override public int paddedLeafCount() { return paddedCount; }

    @Override public MerkleProof proof(int leafIndex) {
        Objects.checkIndex(leafIndex, leafCount);
        return proofs.get(leafIndex);
    }

    @Override public List<MerkleProof> proofs() { return proofs; }

    @Override public byte[] hashAt(int nodeId) {
        Objects.checkIndex(nodeId, nodeHash.length);
        return nodeHash[nodeId].clone();
    }

    @Override public boolean isLeaf(int nodeId) {
        Objects.checkIndex(nodeId, nodeHash.length);
        return nodeId >= baseLeafId;
    }

    // ---------------- helpers ----------------

    /** Walk from the leaf's node up to (not including) the root, collecting siblings. */
    private MerkleProof extractProof(int leafIndex) {
        List<byte[]> siblings = new ArrayList<>(depth());
        for (int v = baseLeafId + leafIndex; v > 0; v = parent(v)) {
            siblings.add(nodeHash[sibling(v)]);
        }
        return MerkleProof.of(siblings);
    }

    /** Smallest power of two >= n (n >= 1). */
    static int paddedSize(int n) {
        if (n > (1 << 30)) throw new IllegalArgumentException("too many leaves: " + n);
        int size = 1;
        while (size < n) size <<= 1;
        return size;
    }

    static int leftChild(int v) { return (v << 1) + 1; }
    static int rightChild(int v) { return (v << 1) + 2; }
    static int sibling(int v) { return (v & 1) == 0 ? v - 1 : v + 1; }
    static int parent(int v) { return (v - 1) >> 1; }
}
