// file: chain/src/test/java/io/chainmerkle/chain/ChainFixtures.java
package io.chainmerkle.chain;

import java.net.URISyntaxException;
import java.nio.file.Path;

/** Shared test data: blocks.json on the test classpath. */
final class ChainFixtures {

    static final String TX_A1 = repeat("a1");
    static final String TX_A2 = repeat("a2");
    static final String TX_A3 = repeat("a3");
    static final String TX_B1 = repeat("b1"); // block 101, no receipt
    static final String TX_B2 = repeat("b2");
    static final String TX_ROOT_100 = repeat("c1");

    private ChainFixtures() {}

    static Path snapshotPath() {
        try {
            return Path.of(ChainFixtures.class.getResource("/blocks.json").toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    static SnapshotBlockSource source() {
        return SnapshotBlockSource.fromJsonFile(snapshotPath());
    }

    static String repeat(String twoHexDigits) {
        return "0x" + twoHexDigits.repeat(32);
    }
}
