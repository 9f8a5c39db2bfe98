// file: server/src/main/java/io/chainmerkle/server/dto/BuildResponse.java
package io.chainmerkle.server.dto;

import java.util.List;

/**
 * JSON response for POST /merkle/build.
 *   {
 *     "root": "0x..",
 *     "leafCount": 3,
 *     "paddedLeafCount": 4,
 *     "proofs": [ ["0x..", "0x.."], ... ]
 *   }
 * proofs[i] belongs to leavesBase64[i].
 */
public class BuildResponse {
    public String root;
    public int leafCount;
    public int paddedLeafCount;
    public List<List<String>> proofs;
}
