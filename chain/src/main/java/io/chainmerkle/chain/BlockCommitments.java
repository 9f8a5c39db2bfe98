// file: chain/src/main/java/io/chainmerkle/chain/BlockCommitments.java
package io.chainmerkle.chain;

import io.chainmerkle.core.Hex;
import io.chainmerkle.core.merkle.MerkleRoot;
import io.chainmerkle.core.merkle.MerkleTree;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.logging.Logger;

/**
 * Assembles leaf lists for a block and builds its commitments.
 * <p>
 * Two modes, both delegating the tree math to {@link MerkleTree}:
 *  - object commitment: one leaf per receipt, the receipt's canonical projection bytes,
 *    in block transaction order (transactions without a receipt are skipped).
 *  - identifier commitment: one leaf per transaction hash plus a final leaf for the
 *    block's transactionsRoot, each leaf being the SHA-256 identifier digest.
 * <p>
 * When no target is given, both modes return the proof for position 0.
 */
public class BlockCommitments {
    private static final Logger log = Logger.getLogger(BlockCommitments.class.getName());

    private final BlockSource source;

    public BlockCommitments(BlockSource source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    /**
     * Look up a block by number.
     *
     * @throws NoSuchElementException if the source does not have it
     */
    public Block block(long number) {
        return source.block(number)
                .orElseThrow(() -> new NoSuchElementException("block not found: " + number));
    }

    /** Receipt projections for the block, in transaction order. */
    public List<ReceiptProjection> receipts(Block block) {
        List<ReceiptProjection> out = new ArrayList<>(block.transactions().size());
        for (String txHash : block.transactions()) {
            Optional<TransactionReceipt> r = source.receipt(txHash);
            if (r.isPresent()) {
                out.add(ReceiptProjection.of(r.get()));
            } else {
                log.warning(() -> "no receipt for tx " + txHash + " in block " + block.number() + ", skipping");
            }
        }
        return out;
    }

    /**
     * Object-commitment tree over every receipt of the block.
     *
     * @throws IllegalArgumentException if the block has no receipts
     */
    public MerkleTree receiptTree(Block block) {
        return buildReceiptTree(block, receipts(block));
    }

    /**
     * Root and proof for one receipt.
     *
     * @param transactionIndex receipt transactionIndex to prove; position 0 when empty
     * @throws IllegalArgumentException if the block has no receipts
     * @throws NoSuchElementException   if no receipt has the requested transactionIndex
     */
    public ReceiptCommitment receiptCommitment(Block block, OptionalLong transactionIndex) {
        Objects.requireNonNull(transactionIndex, "transactionIndex");
        List<ReceiptProjection> receipts = receipts(block);
        MerkleTree tree = buildReceiptTree(block, receipts);

        int position = 0;
        if (transactionIndex.isPresent()) {
            position = positionOfIndex(receipts, transactionIndex.getAsLong());
            if (position < 0) {
                throw new NoSuchElementException(
                        "no receipt with transactionIndex %d in block %d".formatted(transactionIndex.getAsLong(), block.number()));
            }
        }
        ReceiptProjection receipt = receipts.get(position);
        return new ReceiptCommitment(block.number(), tree.root(), tree.proof(position), receipt.toBytes(), position, receipt);
    }

    /** Identifiers committed in identifier mode: tx hashes then transactionsRoot. */
    public static List<String> identifiers(Block block) {
        List<String> ids = new ArrayList<>(block.transactions().size() + 1);
        ids.addAll(block.transactions());
        ids.add(block.transactionsRoot());
        return ids;
    }

    /** Identifier-commitment tree; never empty thanks to the appended transactionsRoot. */
    public MerkleTree hashTree(Block block) {
        return MerkleTree.build(IdentifierDigests.leaves(identifiers(block)));
    }

    /**
     * Root and proof for one transaction hash.
     *
     * @param txHash identifier to prove; position 0 when empty
     * @throws NoSuchElementException if the hash is not among the block's identifiers
     */
    public HashCommitment hashCommitment(Block block, Optional<String> txHash) {
        Objects.requireNonNull(txHash, "txHash");
        List<String> ids = identifiers(block);
        List<byte[]> leaves = IdentifierDigests.leaves(ids);
        MerkleTree tree = MerkleTree.build(leaves);

        int position = 0;
        if (txHash.isPresent()) {
            position = positionOfHash(ids, txHash.get());
            if (position < 0) {
                throw new NoSuchElementException("transaction hash not found in block %d: %s"
                        .formatted(block.number(), txHash.get()));
            }
        }
        return new HashCommitment(block.number(), tree.root(), tree.proof(position), ids.get(position), leaves.get(position), position);
    }

    public BlockRoots roots(Block block) {
        List<ReceiptProjection> receipts = receipts(block);
        var receiptRoot = receipts.isEmpty()
                ? Optional.<MerkleRoot>empty()
                : Optional.of(buildReceiptTree(block, receipts).root());
        return new BlockRoots(block.number(), receiptRoot, hashTree(block).root());
    }

    // ---------------- helpers ----------------

    private static MerkleTree buildReceiptTree(Block block, List<ReceiptProjection> receipts) {
        if (receipts.isEmpty()) {
            throw new IllegalArgumentException("block " + block.number() + " has no receipts to commit to");
        }
        List<byte[]> leaves = receipts.stream().map(ReceiptProjection::toBytes).toList();
        return MerkleTree.build(leaves);
    }

    private static int positionOfIndex(List<ReceiptProjection> receipts, long transactionIndex) {
        for (int i = 0; i < receipts.size(); i++) {
            if (receipts.get(i).index() == transactionIndex) return i;
        }
        return -1;
    }

    private static int positionOfHash(List<String> ids, String txHash) {
        String wanted = Hex.normalize(txHash);
        for (int i = 0; i < ids.size(); i++) {
            if (Hex.normalize(ids.get(i)).equals(wanted)) return i;
        }
        return -1;
    }
}
