// file: chain/src/main/java/io/chainmerkle/chain/ReceiptProjection.java
package io.chainmerkle.chain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chainmerkle.core.Hex;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Canonical projection of a receipt, used as a leaf in object-commitment mode.
 * <p>
 * Layout is a JSON object with a fixed field order:
 * <pre>
 *   {"tx_hash":..,"index":..,"logs":[..],"from":..,"to":..,"block_hash":..,"root":..,"logs_bloom":..}
 * </pre>
 * Every log is embedded as its own JSON string. Hex fields are lowercased and
 * 0x-prefixed, so the same receipt always yields the same bytes.
 */
@JsonPropertyOrder({"tx_hash", "index", "logs", "from", "to", "block_hash", "root", "logs_bloom"})
public record ReceiptProjection(
        @JsonProperty("tx_hash") String txHash,
        @JsonProperty("index") long index,
        @JsonProperty("logs") List<String> logs,
        @JsonProperty("from") String from,
        @JsonProperty("to") String to,
        @JsonProperty("block_hash") String blockHash,
        @JsonProperty("root") String root,
        @JsonProperty("logs_bloom") String logsBloom
) {
    /** Reported when a receipt carries no state root. */
    static final String ZERO_ROOT = Hex.encode(new byte[32]);

    private static final ObjectMapper JSON = new ObjectMapper();

    public static ReceiptProjection of(TransactionReceipt r) {
        Objects.requireNonNull(r, "receipt");
        List<String> logs = new ArrayList<>(r.logs().size());
        for (LogEntry log : r.logs()) {
            logs.add(write(normalize(log)));
        }
        return new ReceiptProjection(
                Hex.normalize(r.transactionHash()),
                r.transactionIndex(),
                List.copyOf(logs),
                hexOrNull(r.from()),
                hexOrNull(r.to()),
                hexOrNull(r.blockHash()),
                r.root() == null ? ZERO_ROOT : Hex.normalize(r.root()),
                hexOrNull(r.logsBloom())
        );
    }

    /** UTF-8 JSON bytes: the leaf blob. */
    public byte[] toBytes() {
        try {
            return JSON.writeValueAsBytes(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to serialize receipt " + txHash, e);
        }
    }

    private static LogEntry normalize(LogEntry log) {
        return new LogEntry(
                hexOrNull(log.address()),
                log.topics().stream().map(Hex::normalize).toList(),
                hexOrNull(log.data()),
                log.logIndex()
        );
    }

    private static String hexOrNull(String hex) {
        return hex == null ? null : Hex.normalize(hex);
    }

    private static String write(Object value) {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to serialize " + value, e);
        }
    }
}
