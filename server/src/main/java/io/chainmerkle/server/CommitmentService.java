// file: server/src/main/java/io/chainmerkle/server/CommitmentService.java
package io.chainmerkle.server;

import io.chainmerkle.chain.BlockCommitments;
import io.chainmerkle.chain.BlockRoots;
import io.chainmerkle.chain.BlockSource;
import io.chainmerkle.chain.HashCommitment;
import io.chainmerkle.chain.ReceiptCommitment;
import io.chainmerkle.core.merkle.MerkleProof;
import io.chainmerkle.core.merkle.MerkleRoot;
import io.chainmerkle.core.merkle.MerkleTree;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Application service behind the HTTP layer.
 *
 * Responsibilities:
 *  - Decode Base64/hex payloads expected by the API.
 *  - Build trees over caller-supplied leaves and verify proofs.
 *  - Resolve blocks from the {@link BlockSource} and delegate to {@link BlockCommitments}.
 *
 * Nothing is cached: every call builds its tree from scratch.
 */
public class CommitmentService {

    /** Upper bound on leaves per build request. */
    static final int MAX_LEAVES = 1 << 20;

    private final BlockSource source;
    private final BlockCommitments commitments;

    public CommitmentService(BlockSource source) {
        this.source = Objects.requireNonNull(source, "source");
        this.commitments = new BlockCommitments(source);
    }

    /**
     * Build a tree over Base64-encoded leaves.
     *
     * @throws IllegalArgumentException on an empty/oversized list or invalid Base64
     */
    public MerkleTree build(List<String> leavesBase64) {
        if (leavesBase64 == null || leavesBase64.isEmpty()) {
            throw new IllegalArgumentException("leavesBase64 must not be empty");
        }
        if (leavesBase64.size() > MAX_LEAVES) {
            throw new IllegalArgumentException("too many leaves (max " + MAX_LEAVES + ")");
        }
        List<byte[]> leaves = new ArrayList<>(leavesBase64.size());
        for (String b64 : leavesBase64) {
            leaves.add(decode(b64));
        }
        return MerkleTree.build(leaves);
    }

    /**
     * Verify a leaf against a root. A mismatch returns false.
     *
     * @throws IllegalArgumentException if an argument is missing or malformed
     */
    public boolean verify(String leafBase64, List<String> proofHex, String rootHex) {
        if (rootHex == null || rootHex.isBlank()) throw new IllegalArgumentException("root must not be empty");
        byte[] leaf = decode(leafBase64);
        MerkleProof proof = MerkleProof.fromHex(proofHex == null ? List.of() : proofHex);
        return MerkleTree.verify(leaf, proof, MerkleRoot.fromHex(rootHex));
    }

    public long latestBlockNumber() {
        return source.latestBlockNumber();
    }

    public BlockRoots roots(long blockNumber) {
        return commitments.roots(commitments.block(blockNumber));
    }

    public ReceiptCommitment receiptProof(long blockNumber, OptionalLong transactionIndex) {
        return commitments.receiptCommitment(commitments.block(blockNumber), transactionIndex);
    }

    public HashCommitment hashProof(long blockNumber, Optional<String> txHash) {
        return commitments.hashCommitment(commitments.block(blockNumber), txHash);
    }

    private static byte[] decode(String base64) {
        if (base64 == null) throw new IllegalArgumentException("leaf must not be null");
        return Base64.getDecoder().decode(base64); // IllegalArgumentException on bad input
    }
}
