// file: client/src/main/java/io/chainmerkle/client/Cli.java
package io.chainmerkle.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.chainmerkle.core.merkle.MerkleProof;
import io.chainmerkle.core.merkle.MerkleRoot;
import io.chainmerkle.core.merkle.MerkleTree;

import java.io.IOException;
import java.io.PrintStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * CLI for a running chain-merkle server, plus offline build/verify.
 *
 * Usage:
 *   chainmerkle-cli [--base-url http://host:port] roots <block>
 *   chainmerkle-cli [--base-url http://host:port] receipt-proof <block> [index]
 *   chainmerkle-cli [--base-url http://host:port] hash-proof <block> [txHash]
 *   chainmerkle-cli build <file>...
 *   chainmerkle-cli verify <leafBase64> <rootHex> [siblingHex...]
 *
 * Examples:
 *   chainmerkle-cli roots 100
 *   chainmerkle-cli hash-proof 100 0xa2a2...
 *   chainmerkle-cli verify AQ== 0x5fe7... 0xbc36...
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";

    private final HttpClient http;
    private final String baseUrl;
    private final PrintStream out;
    private final ObjectMapper json = new ObjectMapper();

    Cli(String baseUrl, PrintStream out) {
        this.http = HttpClient.newHttpClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.out = out;
    }

    public static void main(String[] args) {
        try {
            run(args, System.out);
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            if (e.usage) printUsage();
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    /**
     * Parse and execute one command.
     *
     * @throws CliException on usage errors or a non-200 server response
     */
    static void run(String[] args, PrintStream out) throws Exception {
        if (args.length == 0) {
            throw CliException.usage("missing command");
        }

        Map.Entry<String, String[]> parsed = parseBaseUrl(args);
        String[] rest = parsed.getValue();
        if (rest.length == 0) {
            throw CliException.usage("missing command");
        }

        String cmd = rest[0];
        Cli cli = new Cli(parsed.getKey(), out);

        switch (cmd) {
            case "roots" -> {
                if (rest.length != 2) throw CliException.usage("roots requires <block>");
                cli.fetch("/blocks/" + blockNumber(rest[1]) + "/roots");
            }
            case "receipt-proof" -> {
                if (rest.length < 2 || rest.length > 3) throw CliException.usage("receipt-proof requires <block> [index]");
                String query = rest.length == 3 ? "?index=" + encode(rest[2]) : "";
                cli.fetch("/blocks/" + blockNumber(rest[1]) + "/receipt-proof" + query);
            }
            case "hash-proof" -> {
                if (rest.length < 2 || rest.length > 3) throw CliException.usage("hash-proof requires <block> [txHash]");
                String query = rest.length == 3 ? "?tx=" + encode(rest[2]) : "";
                cli.fetch("/blocks/" + blockNumber(rest[1]) + "/hash-proof" + query);
            }
            case "build" -> {
                if (rest.length < 2) throw CliException.usage("build requires at least one <file>");
                cli.build(Arrays.copyOfRange(rest, 1, rest.length));
            }
            case "verify" -> {
                if (rest.length < 3) throw CliException.usage("verify requires <leafBase64> <rootHex> [siblingHex...]");
                cli.verify(rest[1], rest[2], Arrays.asList(rest).subList(3, rest.length));
            }
            default -> throw CliException.usage("unknown command: " + cmd);
        }
    }

    private static Map.Entry<String, String[]> parseBaseUrl(String[] args) {
        if ("--base-url".equals(args[0])) {
            if (args.length < 2) {
                throw CliException.usage("--base-url requires a value");
            }
            String baseUrl = args[1];
            String[] rest = new String[args.length - 2];
            System.arraycopy(args, 2, rest, 0, rest.length);
            return Map.entry(baseUrl, rest);
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    /** GET a server path and pretty-print the JSON body. */
    private void fetch(String path) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .GET()
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new CliException("GET " + path + " failed (" + resp.statusCode() + "): " + resp.body(), false);
        }
        out.println(json.writerWithDefaultPrettyPrinter().writeValueAsString(json.readTree(resp.body())));
    }

    /** Offline: each file's bytes become one leaf, in argument order. */
    private void build(String[] files) throws IOException {
        List<byte[]> leaves = new ArrayList<>(files.length);
        for (String f : files) {
            leaves.add(Files.readAllBytes(Path.of(f)));
        }
        MerkleTree tree = MerkleTree.build(leaves);
        out.println("root " + tree.root().toHex());
        for (int i = 0; i < files.length; i++) {
            out.println(i + " " + files[i] + " " + String.join(" ", tree.proof(i).toHex()));
        }
    }

    /** Offline: replay the proof; prints OK or MISMATCH. */
    private void verify(String leafBase64, String rootHex, List<String> siblings) {
        byte[] leaf;
        MerkleRoot root;
        MerkleProof proof;
        try {
            leaf = Base64.getDecoder().decode(leafBase64);
            root = MerkleRoot.fromHex(rootHex);
            proof = MerkleProof.fromHex(siblings);
        } catch (IllegalArgumentException e) {
            throw new CliException("invalid verify input: " + e.getMessage(), false);
        }
        if (!root.verify(leaf, proof)) {
            throw new CliException("MISMATCH", false);
        }
        out.println("OK");
    }

    private static long blockNumber(String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw CliException.usage("invalid block number: " + raw);
        }
    }

    private static String encode(String raw) {
        return URLEncoder.encode(raw, StandardCharsets.UTF_8);
    }

    private static void printUsage() {
        System.err.println("""
                Usage:
                  chainmerkle-cli [--base-url http://host:port] roots <block>
                  chainmerkle-cli [--base-url http://host:port] receipt-proof <block> [index]
                  chainmerkle-cli [--base-url http://host:port] hash-proof <block> [txHash]
                  chainmerkle-cli build <file>...
                  chainmerkle-cli verify <leafBase64> <rootHex> [siblingHex...]
                """);
    }

    static final class CliException extends RuntimeException {
        final boolean usage;

        CliException(String msg, boolean usage) {
            super(msg);
            this.usage = usage;
        }

        static CliException usage(String msg) {
            return new CliException(msg, true);
        }
    }
}
