// file: server/src/main/java/io/chainmerkle/server/dto/BuildRequest.java
package io.chainmerkle.server.dto;

import java.util.List;

/**
 * JSON body for POST /merkle/build.
 * Example:
 *   { "leavesBase64": ["AA==", "AQ==", "Ag=="] }
 */
public class BuildRequest {
    public List<String> leavesBase64; // leaf blobs in commitment order
}
