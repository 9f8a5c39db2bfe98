// file: chain/src/main/java/io/chainmerkle/chain/SnapshotBlockSource.java
package io.chainmerkle.chain;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chainmerkle.core.Hex;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable in-memory {@link BlockSource}, usually loaded from a JSON snapshot:
 * <pre>
 *   {
 *     "latestBlock": 101,
 *     "blocks":   [ { "number": 100, "hash": "0x..", "transactionsRoot": "0x..", "transactions": ["0x.."] } ],
 *     "receipts": [ { "transactionHash": "0x..", "transactionIndex": 0, "from": "0x..", ... } ]
 *   }
 * </pre>
 * latestBlock is optional and defaults to the highest block number present.
 */
public final class SnapshotBlockSource implements BlockSource {

    /** JSON shape of a snapshot file. */
    public static class SnapshotFile {
        public Long latestBlock;
        public List<Block> blocks;
        public List<TransactionReceipt> receipts;
    }

    private final long latest;
    private final Map<Long, Block> blocks = new HashMap<>();
    private final Map<String, TransactionReceipt> receipts = new HashMap<>();

    public SnapshotBlockSource(List<Block> blocks, List<TransactionReceipt> receipts) {
        this(blocks, receipts, null);
    }

    public SnapshotBlockSource(List<Block> blocks, List<TransactionReceipt> receipts, Long latestBlock) {
        Objects.requireNonNull(blocks, "blocks");
        Objects.requireNonNull(receipts, "receipts");
        long max = -1L;
        for (Block b : blocks) {
            if (this.blocks.putIfAbsent(b.number(), b) != null) {
                throw new IllegalArgumentException("duplicate block " + b.number());
            }
            max = Math.max(max, b.number());
        }
        for (TransactionReceipt r : receipts) {
            if (this.receipts.putIfAbsent(Hex.normalize(r.transactionHash()), r) != null) {
                throw new IllegalArgumentException("duplicate receipt " + r.transactionHash());
            }
        }
        this.latest = latestBlock != null ? latestBlock : max;
    }

    public static SnapshotBlockSource fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try {
            SnapshotFile file = mapper.readValue(path.toFile(), SnapshotFile.class);
            return new SnapshotBlockSource(
                    file.blocks == null ? List.of() : file.blocks,
                    file.receipts == null ? List.of() : file.receipts,
                    file.latestBlock
            );
        } catch (IOException e) {
            throw new RuntimeException("Failed to load block snapshot from " + path, e);
        }
    }

    @Override
    public long latestBlockNumber() {
        return latest;
    }

    @Override
    public Optional<Block> block(long number) {
        return Optional.ofNullable(blocks.get(number));
    }

    @Override
    public Optional<TransactionReceipt> receipt(String transactionHash) {
        return Optional.ofNullable(receipts.get(Hex.normalize(transactionHash)));
    }
}
