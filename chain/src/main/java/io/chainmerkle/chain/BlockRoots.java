// file: chain/src/main/java/io/chainmerkle/chain/BlockRoots.java
package io.chainmerkle.chain;

import io.chainmerkle.core.merkle.MerkleRoot;

import java.util.Optional;

/**
 * Both commitments for one block.
 * receiptRoot is empty when the block has no receipts to commit to.
 */
public record BlockRoots(
        long blockNumber,
        Optional<MerkleRoot> receiptRoot,
        MerkleRoot hashRoot
) {}
