// file: server/src/main/java/io/chainmerkle/server/WebServer.java
package io.chainmerkle.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chainmerkle.chain.BlockRoots;
import io.chainmerkle.chain.HashCommitment;
import io.chainmerkle.chain.ReceiptCommitment;
import io.chainmerkle.core.Hex;
import io.chainmerkle.core.merkle.MerkleProof;
import io.chainmerkle.core.merkle.MerkleTree;
import io.chainmerkle.server.dto.*;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Deque;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Thin HTTP adapter over {@link CommitmentService}.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert service results back into JSON.
 *  - Map Java exceptions to HTTP status codes.
 *  - Emit basic per-request logging.
 *
 * Path layout (v0):
 *   - POST /merkle/build                      Build a tree over Base64 leaves
 *   - POST /merkle/verify                     Verify a leaf/proof/root triple
 *   - GET  /blocks/{n}/roots                  Receipt and hash roots of a block
 *   - GET  /blocks/{n}/receipt-proof[?index=] Object-commitment proof (by transactionIndex)
 *   - GET  /blocks/{n}/hash-proof[?tx=]       Identifier-commitment proof (by tx hash)
 *   - GET  /admin/health                      Basic health check
 *
 * Error mapping:
 *   - IllegalArgumentException, invalid JSON           -> 400
 *   - NoSuchElementException, IndexOutOfBoundsException -> 404
 *   - body over MAX_BODY_BYTES                          -> 413
 *   - anything else                                     -> 500
 * A failed verification is a 200 with "valid": false.
 */
public final class WebServer {
    private static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final CommitmentService service;

    public WebServer(int port, CommitmentService service) {
        this.service = service;

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(exchange -> {
                    var path = exchange.getRequestPath();
                    var method = exchange.getRequestMethod().toString();
                    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

                    if ("/admin/health".equals(path)) {
                        respond(exchange, method, () -> Map.of(
                                "status", "ok",
                                "latestBlock", service.latestBlockNumber()));
                    } else if ("/merkle/build".equals(path) || "/merkle/verify".equals(path)) {
                        if (!"POST".equals(method)) {
                            send(exchange, 405, Map.of("error", "method not allowed"));
                            RequestLogger.logRequest(method, path, 405, 0, -1, null);
                        } else if (path.endsWith("build")) {
                            handleBuild(exchange);
                        } else {
                            handleVerify(exchange);
                        }
                    } else if (path.startsWith("/blocks/") && "GET".equals(method)) {
                        handleBlock(exchange, path.substring("/blocks/".length()));
                    } else {
                        send(exchange, 404, Map.of("error", "not found"));
                        RequestLogger.logRequest(method, path, 404, 0, -1, null);
                    }
                }).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- handlers ----------

    /** POST /merkle/build */
    private void handleBuild(HttpServerExchange ex) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> respond(exchange, "POST", () -> {
                    var req = json.readValue(requireSize(data), BuildRequest.class);
                    MerkleTree tree = service.build(req.leavesBase64);

                    var dto = new BuildResponse();
                    dto.root = tree.root().toHex();
                    dto.leafCount = tree.leafCount();
                    dto.paddedLeafCount = tree.paddedLeafCount();
                    dto.proofs = tree.proofs().stream().map(MerkleProof::toHex).toList();
                    return dto;
                }),
                (exchange, ioEx) -> {
                    send(exchange, 400, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest("POST", exchange.getRequestPath(), 400, 0, -1, ioEx);
                }
        );
    }

    /** POST /merkle/verify */
    private void handleVerify(HttpServerExchange ex) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> respond(exchange, "POST", () -> {
                    var req = json.readValue(requireSize(data), VerifyRequest.class);
                    return Map.of("valid", service.verify(req.leafBase64, req.proof, req.root));
                }),
                (exchange, ioEx) -> {
                    send(exchange, 400, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest("POST", exchange.getRequestPath(), 400, 0, -1, ioEx);
                }
        );
    }

    /** GET /blocks/{n}/{roots|receipt-proof|hash-proof} */
    private void handleBlock(HttpServerExchange ex, String rest) {
        respond(ex, "GET", () -> {
            String[] parts = rest.split("/");
            if (parts.length != 2) {
                throw new NoSuchElementException("not found");
            }
            long number;
            try {
                number = Long.parseLong(parts[0]);
            } catch (NumberFormatException nfe) {
                throw new IllegalArgumentException("invalid block number: " + parts[0], nfe);
            }
            var params = ex.getQueryParameters();

            return switch (parts[1]) {
                case "roots" -> rootsDto(service.roots(number));
                case "receipt-proof" -> receiptDto(service.receiptProof(number, indexParam(params.get("index"))));
                case "hash-proof" -> hashDto(service.hashProof(number, Optional.ofNullable(firstOrNull(params.get("tx")))));
                default -> throw new NoSuchElementException("not found");
            };
        });
    }

    // ---------- DTO mapping ----------

    private static RootsResponse rootsDto(BlockRoots roots) {
        var dto = new RootsResponse();
        dto.blockNumber = roots.blockNumber();
        dto.receiptRoot = roots.receiptRoot().map(r -> r.toHex()).orElse(null);
        dto.hashRoot = roots.hashRoot().toHex();
        return dto;
    }

    private static ProofResponse receiptDto(ReceiptCommitment c) {
        var dto = proofDto(c.blockNumber(), c.root().toHex(), c.position(), c.leaf(), c.proof());
        dto.identifier = c.receipt().txHash();
        return dto;
    }

    private static ProofResponse hashDto(HashCommitment c) {
        var dto = proofDto(c.blockNumber(), c.root().toHex(), c.position(), c.leaf(), c.proof());
        dto.identifier = c.identifier();
        return dto;
    }

    private static ProofResponse proofDto(long blockNumber, String root, int position, byte[] leaf, MerkleProof proof) {
        var dto = new ProofResponse();
        dto.blockNumber = blockNumber;
        dto.root = root;
        dto.position = position;
        dto.leafBase64 = Base64.getEncoder().encodeToString(leaf);
        dto.proof = proof.toHex();
        dto.proofHex = Hex.encode(proof.encode());
        return dto;
    }

    // ---------- helpers ----------

    @FunctionalInterface
    private interface Work {
        Object run() throws Exception;
    }

    /** Signals a request body over MAX_BODY_BYTES. */
    private static final class BodyTooLargeException extends RuntimeException {
        BodyTooLargeException() {
            super("request body too large");
        }
    }

    /** Run the work, send its result as JSON and log the request; exceptions become status codes. */
    private void respond(HttpServerExchange ex, String method, Work work) {
        long start = System.nanoTime();
        int status;
        long treeMs = -1L;
        Throwable error = null;
        try {
            long sStart = System.nanoTime();
            Object body = work.run();
            treeMs = (System.nanoTime() - sStart) / 1_000_000L;
            status = 200;
            send(ex, status, body);
        } catch (BodyTooLargeException big) {
            status = 413;
            send(ex, status, Map.of("error", big.getMessage()));
        } catch (JsonProcessingException jsonEx) {
            status = 400;
            error = jsonEx;
            send(ex, status, Map.of("error", "invalid JSON"));
        } catch (IllegalArgumentException bad) {
            status = 400;
            error = bad;
            send(ex, status, Map.of("error", String.valueOf(bad.getMessage())));
        } catch (NoSuchElementException | IndexOutOfBoundsException missing) {
            status = 404;
            error = missing;
            send(ex, status, Map.of("error", String.valueOf(missing.getMessage())));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
        }
        long totalMs = (System.nanoTime() - start) / 1_000_000L;
        RequestLogger.logRequest(method, ex.getRequestPath(), status, totalMs, treeMs, error);
    }

    private static byte[] requireSize(byte[] data) {
        if (data.length > MAX_BODY_BYTES) throw new BodyTooLargeException();
        return data;
    }

    private static OptionalLong indexParam(Deque<String> values) {
        String raw = firstOrNull(values);
        if (raw == null || raw.isBlank()) return OptionalLong.empty();
        try {
            return OptionalLong.of(Long.parseLong(raw));
        } catch (NumberFormatException nfe) {
            throw new IllegalArgumentException("invalid index: " + raw, nfe);
        }
    }

    private static String firstOrNull(Deque<String> deque) {
        return (deque == null || deque.isEmpty()) ? null : deque.getFirst();
    }

    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
