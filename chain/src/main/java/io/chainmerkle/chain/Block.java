// file: chain/src/main/java/io/chainmerkle/chain/Block.java
package io.chainmerkle.chain;

import java.util.List;
import java.util.Objects;

/**
 * Block header fields the commitments need.
 * - transactions: transaction hashes in block order.
 * - transactionsRoot: the chain's own transactions trie root, committed as an extra identifier.
 */
public record Block(
        long number,
        String hash,
        String transactionsRoot,
        List<String> transactions
) {
    public Block {
        Objects.requireNonNull(transactionsRoot, "transactionsRoot");
        if (number < 0) throw new IllegalArgumentException("block number must be >= 0");
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }
}
