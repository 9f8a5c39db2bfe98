// file: chain/src/main/java/io/chainmerkle/chain/IdentifierDigests.java
package io.chainmerkle.chain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chainmerkle.core.Hex;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

/**
 * Leaf blobs for identifier-commitment mode.
 * <p>
 * Each identifier (a 0x hex hash) is serialized as a JSON string, quotes included,
 * and hashed with SHA-256. The tree then hashes that digest again with Keccak-256;
 * the double hash is part of the commitment format and must not be collapsed.
 */
public final class IdentifierDigests {

    private static final ObjectMapper JSON = new ObjectMapper();

    private IdentifierDigests() {}

    /** SHA-256 over the JSON string form of the normalized identifier. */
    public static byte[] sha256(String identifier) {
        String quoted;
        try {
            quoted = JSON.writeValueAsString(Hex.normalize(identifier));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to serialize identifier " + identifier, e);
        }
        return newDigest().digest(quoted.getBytes(StandardCharsets.UTF_8));
    }

    public static List<byte[]> leaves(List<String> identifiers) {
        return identifiers.stream().map(IdentifierDigests::sha256).toList();
    }

    static MessageDigest newDigest() {
        try { return MessageDigest.getInstance("SHA-256"); }
        catch (NoSuchAlgorithmException e) { throw new IllegalStateException(e); }
    }
}
