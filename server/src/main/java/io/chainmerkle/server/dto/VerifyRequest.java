// file: server/src/main/java/io/chainmerkle/server/dto/VerifyRequest.java
package io.chainmerkle.server.dto;

import java.util.List;

/**
 * JSON body for POST /merkle/verify.
 *   { "leafBase64": "Aw==", "proof": ["0x..", "0x.."], "root": "0x.." }
 */
public class VerifyRequest {
    public String leafBase64;
    public List<String> proof; // sibling digests, leaf-to-root order
    public String root;
}
