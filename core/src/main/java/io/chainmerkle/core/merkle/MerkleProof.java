// file: core/src/main/java/io/chainmerkle/core/merkle/MerkleProof.java
package io.chainmerkle.core.merkle;

import io.chainmerkle.core.Hex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Inclusion proof for one leaf: sibling digests in leaf-to-root order.
 * <p>
 * Wire form is the plain concatenation of the 32-byte siblings, so no
 * delimiters or length prefixes are needed. An empty proof is valid
 * (single-leaf tree).
 */
public final class MerkleProof {

    private static final MerkleProof EMPTY = new MerkleProof(List.of());

    private final List<byte[]> siblings;

    private MerkleProof(List<byte[]> siblings) {
        this.siblings = siblings;
    }

    /** Copy the given siblings into an immutable proof. */
    public static MerkleProof of(List<byte[]> siblings) {
        Objects.requireNonNull(siblings, "siblings");
        if (siblings.isEmpty()) return EMPTY;
        List<byte[]> copy = new ArrayList<>(siblings.size());
        for (byte[] s : siblings) {
            MerkleHashes.requireDigest(s, "sibling");
            copy.add(s.clone());
        }
        return new MerkleProof(Collections.unmodifiableList(copy));
    }

    public static MerkleProof empty() {
        return EMPTY;
    }

    /**
     * Parse the concatenated wire form.
     *
     * @throws IllegalArgumentException if the length is not a multiple of 32
     */
    public static MerkleProof decode(byte[] encoded) {
        Objects.requireNonNull(encoded, "encoded");
        if (encoded.length % MerkleHashes.HASH_LEN != 0) {
            throw new IllegalArgumentException(
                    "proof length %d is not a multiple of %d".formatted(encoded.length, MerkleHashes.HASH_LEN));
        }
        List<byte[]> out = new ArrayList<>(encoded.length / MerkleHashes.HASH_LEN);
        for (int off = 0; off < encoded.length; off += MerkleHashes.HASH_LEN) {
            out.add(Arrays.copyOfRange(encoded, off, off + MerkleHashes.HASH_LEN));
        }
        return of(out);
    }

    /**
     * Parse siblings given as hex strings (0x prefix optional).
     *
     * @throws IllegalArgumentException if an entry is null or not a 32-byte hex digest
     */
    public static MerkleProof fromHex(List<String> hexSiblings) {
        Objects.requireNonNull(hexSiblings, "hexSiblings");
        List<byte[]> siblings = new ArrayList<>(hexSiblings.size());
        for (int i = 0; i < hexSiblings.size(); i++) {
            String hex = hexSiblings.get(i);
            if (hex == null) throw new IllegalArgumentException("proof sibling " + i + " is null");
            siblings.add(Hex.decode(hex));
        }
        return of(siblings);
    }

    /** Number of siblings, equal to the tree depth. */
    public int size() {
        return siblings.size();
    }

    public boolean isEmpty() {
        return siblings.isEmpty();
    }

    /** Sibling at step i (0 = the leaf's own sibling). */
    public byte[] sibling(int i) {
        return siblings.get(i).clone();
    }

    /** Copies of all siblings in replay order. */
    public List<byte[]> siblings() {
        return siblings.stream().map(byte[]::clone).toList();
    }

    /** Concatenated 32-byte siblings. */
    public byte[] encode() {
        byte[] out = new byte[siblings.size() * MerkleHashes.HASH_LEN];
        for (int i = 0; i < siblings.size(); i++) {
            System.arraycopy(siblings.get(i), 0, out, i * MerkleHashes.HASH_LEN, MerkleHashes.HASH_LEN);
        }
        return out;
    }

    public List<String> toHex() {
        return siblings.stream().map(Hex::encode).toList();
    }

    /**
     * Replay the proof from a leaf blob: start with its leaf digest and
     * combine with each sibling in order. Returns the recomputed root.
     */
    public byte[] computeRoot(byte[] leaf) {
        Objects.requireNonNull(leaf, "leaf");
        byte[] hash = MerkleHashes.leafDigest(leaf);
        for (byte[] sibling : siblings) {
            hash = MerkleHashes.combine(hash, sibling);
        }
        return hash;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MerkleProof other)) return false;
        if (siblings.size() != other.siblings.size()) return false;
        for (int i = 0; i < siblings.size(); i++) {
            if (!Arrays.equals(siblings.get(i), other.siblings.get(i))) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(encode());
    }

    @Override
    public String toString() {
        return "MerkleProof" + toHex();
    }
}
