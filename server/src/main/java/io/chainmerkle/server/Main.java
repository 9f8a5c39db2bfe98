// file: server/src/main/java/io/chainmerkle/server/Main.java
package io.chainmerkle.server;

import io.chainmerkle.chain.BlockSource;
import io.chainmerkle.chain.SnapshotBlockSource;

import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/**
 * Entry point for the commitment server.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Load the block snapshot, if one is configured.
 *  - Create CommitmentService and WebServer, start serving.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        var cfg = ServerConfig.fromArgs(args);

        BlockSource source = buildBlockSource(cfg);
        var service = new CommitmentService(source);
        var web = new WebServer(cfg.httpPort(), service);

        web.start();
        log.info(() -> "chain-merkle listening on http://localhost:" + cfg.httpPort()
                + " (latest block " + source.latestBlockNumber() + ")");

        Runtime.getRuntime().addShutdownHook(new Thread(web::stop));
    }

    private static BlockSource buildBlockSource(ServerConfig cfg) {
        if (cfg.snapshotPath() != null && !cfg.snapshotPath().isBlank()) {
            return SnapshotBlockSource.fromJsonFile(Path.of(cfg.snapshotPath()));
        }
        log.warning("no --snapshot given; /blocks endpoints will return 404");
        return new SnapshotBlockSource(List.of(), List.of());
    }
}
