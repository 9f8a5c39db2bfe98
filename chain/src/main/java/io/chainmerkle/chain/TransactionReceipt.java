// file: chain/src/main/java/io/chainmerkle/chain/TransactionReceipt.java
package io.chainmerkle.chain;

import java.util.List;
import java.util.Objects;

/**
 * Receipt as handed over by a {@link BlockSource}.
 * - to:   null for contract creation.
 * - root: post-state root, null on chains that report a status code instead.
 */
public record TransactionReceipt(
        String transactionHash,
        long transactionIndex,
        String from,
        String to,
        String blockHash,
        String root,
        String logsBloom,
        List<LogEntry> logs
) {
    public TransactionReceipt {
        Objects.requireNonNull(transactionHash, "transactionHash");
        logs = logs == null ? List.of() : List.copyOf(logs);
    }
}
