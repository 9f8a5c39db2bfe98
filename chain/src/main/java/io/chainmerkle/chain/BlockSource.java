// file: chain/src/main/java/io/chainmerkle/chain/BlockSource.java
package io.chainmerkle.chain;

import java.util.Optional;

/**
 * Where blocks and receipts come from (a node client, a snapshot file, a test fixture).
 * Implementations own all I/O, retries and pagination; commitments only read.
 */
public interface BlockSource {

    long latestBlockNumber();

    Optional<Block> block(long number);

    /** Receipt for a transaction hash, empty if the source does not have it. */
    Optional<TransactionReceipt> receipt(String transactionHash);
}
