// file: core/src/main/java/io/chainmerkle/core/Hex.java
package io.chainmerkle.core;

import org.bouncycastle.util.encoders.DecoderException;

import java.util.Objects;

/**
 * 0x-prefixed lowercase hex, the form digests and chain identifiers travel in.
 */
public final class Hex {

    private Hex() {}

    /** Encode as {@code 0x} + lowercase hex. */
    public static String encode(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        return "0x" + org.bouncycastle.util.encoders.Hex.toHexString(bytes);
    }

    /**
     * Decode hex with or without a {@code 0x} prefix.
     *
     * @throws IllegalArgumentException if the text is not valid even-length hex
     */
    public static byte[] decode(String hex) {
        Objects.requireNonNull(hex, "hex");
        String digits = strip(hex);
        if ((digits.length() & 1) != 0) {
            throw new IllegalArgumentException("odd-length hex: " + hex);
        }
        try {
            return org.bouncycastle.util.encoders.Hex.decodeStrict(digits);
        } catch (DecoderException e) {
            throw new IllegalArgumentException("invalid hex: " + hex, e);
        }
    }

    /** Lowercase, 0x-prefixed form of an identifier such as a transaction hash. */
    public static String normalize(String hex) {
        return encode(decode(hex));
    }

    private static String strip(String hex) {
        return hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    }
}
