// file: chain/src/main/java/io/chainmerkle/chain/ReceiptCommitment.java
package io.chainmerkle.chain;

import io.chainmerkle.core.merkle.MerkleProof;
import io.chainmerkle.core.merkle.MerkleRoot;

import java.util.Arrays;
import java.util.Objects;

/**
 * Object-commitment result for one receipt.
 * - leaf:     projection bytes a verifier replays the proof from; copied in and out.
 * - position: leaf position in the block's receipt list.
 */
public record ReceiptCommitment(
        long blockNumber,
        MerkleRoot root,
        MerkleProof proof,
        byte[] leaf,
        int position,
        ReceiptProjection receipt
) {
    public ReceiptCommitment {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(proof, "proof");
        leaf = Objects.requireNonNull(leaf, "leaf").clone();
    }

    @Override
    public byte[] leaf() {
        return leaf.clone();
    }

    public boolean verify() {
        return root.verify(leaf, proof);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ReceiptCommitment other
                && blockNumber == other.blockNumber
                && position == other.position
                && root.equals(other.root)
                && proof.equals(other.proof)
                && Arrays.equals(leaf, other.leaf)
                && Objects.equals(receipt, other.receipt));
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(blockNumber, root, proof, position, receipt) + Arrays.hashCode(leaf);
    }

    @Override
    public String toString() {
        return "ReceiptCommitment[block=" + blockNumber + ", position=" + position + ", root=" + root.toHex() + "]";
    }
}
