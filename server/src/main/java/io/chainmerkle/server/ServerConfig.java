// file: server/src/main/java/io/chainmerkle/server/ServerConfig.java
package io.chainmerkle.server;

/**
 * Server configuration parsed from CLI args.
 *
 * Supports:
 *  - httpPort:     HTTP API port
 *  - snapshotPath: optional JSON block snapshot backing the /blocks endpoints
 */
public record ServerConfig(
        int httpPort,
        String snapshotPath
) {

    public ServerConfig {
        if (httpPort <= 0 || httpPort > 65535) throw new IllegalArgumentException("http port out of range");
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --http-port, -p   <port>
     *   --snapshot,  -s   <path>
     *   --help,      -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     */
    public static ServerConfig fromArgs(String[] args) {
        int httpPort = 8080;
        String snapshotPath = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    try {
                        httpPort = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid http-port: " + args[i]);
                        System.exit(1);
                    }
                }

                case "--snapshot", "-s" -> {
                    ensureValue(args, i);
                    snapshotPath = args[++i];
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(httpPort, snapshotPath);
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: server [options]

            Options:
              --http-port, -p   HTTP port (default: 8080)
              --snapshot,  -s   JSON block snapshot for /blocks endpoints (optional)
              --help,      -h   Show this help message
            """);
        System.exit(0);
    }
}
