// file: chain/src/main/java/io/chainmerkle/chain/HashCommitment.java
package io.chainmerkle.chain;

import io.chainmerkle.core.merkle.MerkleProof;
import io.chainmerkle.core.merkle.MerkleRoot;

import java.util.Arrays;
import java.util.Objects;

/**
 * Identifier-commitment result for one transaction hash (or the appended transactionsRoot).
 * leaf is the SHA-256 identifier digest fed to the tree; copied in and out.
 */
public record HashCommitment(
        long blockNumber,
        MerkleRoot root,
        MerkleProof proof,
        String identifier,
        byte[] leaf,
        int position
) {
    public HashCommitment {
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
        return this == o || (o instanceof HashCommitment other
                && blockNumber == other.blockNumber
                && position == other.position
                && root.equals(other.root)
                && proof.equals(other.proof)
                && Objects.equals(identifier, other.identifier)
                && Arrays.equals(leaf, other.leaf));
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(blockNumber, root, proof, identifier, position) + Arrays.hashCode(leaf);
    }

    @Override
    public String toString() {
        return "HashCommitment[block=" + blockNumber + ", position=" + position + ", identifier=" + identifier + "]";
    }
}
