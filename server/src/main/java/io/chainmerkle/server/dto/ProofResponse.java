// file: server/src/main/java/io/chainmerkle/server/dto/ProofResponse.java
package io.chainmerkle.server.dto;

import java.util.List;

/**
 * JSON response for GET /blocks/{n}/receipt-proof and /blocks/{n}/hash-proof.
 *   {
 *     "blockNumber": 100,
 *     "root": "0x..",
 *     "position": 1,
 *     "leafBase64": "..",        bytes to replay the proof from
 *     "proof": ["0x..", ...],
 *     "proofHex": "0x..",        concatenated 32-byte siblings
 *     "identifier": "0x.."       hash-proof only
 *   }
 */
public class ProofResponse {
    public long blockNumber;
    public String root;
    public int position;
    public String leafBase64;
    public List<String> proof;
    public String proofHex;
    public String identifier;
}
