// file: chain/src/main/java/io/chainmerkle/chain/LogEntry.java
package io.chainmerkle.chain;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/** Event log emitted by a transaction. */
@JsonPropertyOrder({"address", "topics", "data", "logIndex"})
public record LogEntry(
        String address,
        List<String> topics,
        String data,
        long logIndex
) {
    public LogEntry {
        topics = topics == null ? List.of() : List.copyOf(topics);
    }
}
