// file: server/src/main/java/io/chainmerkle/server/dto/RootsResponse.java
package io.chainmerkle.server.dto;

/**
 * JSON response for GET /blocks/{n}/roots.
 * receiptRoot is null for a block without receipts.
 */
public class RootsResponse {
    public long blockNumber;
    public String receiptRoot;
    public String hashRoot;
}
