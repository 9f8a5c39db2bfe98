// file: core/src/main/java/io/chainmerkle/core/merkle/MerkleRoot.java
package io.chainmerkle.core.merkle;

import io.chainmerkle.core.Hex;

import java.util.Arrays;
import java.util.Objects;

/**
 * Root digest of a tree: the public commitment to its ordered leaf list.
 * Compared by unsigned byte-lexicographic order.
 */
public final class MerkleRoot implements Comparable<MerkleRoot> {

    private final byte[] hash;

    public MerkleRoot(byte[] hash) {
        MerkleHashes.requireDigest(hash, "hash");
        this.hash = hash.clone();
    }

    public static MerkleRoot fromHex(String hex) {
        return new MerkleRoot(Hex.decode(hex));
    }

    public byte[] hash() {
        return hash.clone();
    }

    /**
     * True iff replaying {@code proof} from {@code leaf} reproduces this root.
     * A mismatch is a normal negative result, not an error.
     */
    public boolean verify(byte[] leaf, MerkleProof proof) {
        Objects.requireNonNull(proof, "proof");
        return Arrays.equals(hash, proof.computeRoot(leaf));
    }

    public String toHex() {
        return Hex.encode(hash);
    }

    @Override
    public int compareTo(MerkleRoot o) {
        return Arrays.compareUnsigned(hash, o.hash);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof MerkleRoot other && Arrays.equals(hash, other.hash));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(hash);
    }

    @Override
    public String toString() {
        return "MerkleRoot[" + toHex() + "]";
    }
}
