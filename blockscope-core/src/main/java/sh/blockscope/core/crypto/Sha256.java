// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.core.crypto;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

/**
 * SHA-256 hashing utility.
 *
 * <p>
 * Bitcoin identifies blocks and transactions by the double SHA-256 of their
 * serialization; {@link #doubleHash(byte[])} computes exactly that.
 *
 * <pre>{@code
 * byte[] digest = Sha256.doubleHash(rawTransaction);
 * String txid = Hex.encodeReversed(digest);
 * }</pre>
 *
 * <p>
 * Digest instances are cached per thread.
 */
public final class Sha256 {

    private static final String ALGORITHM = "SHA-256";

    private static final ThreadLocal<MessageDigest> DIGEST = ThreadLocal.withInitial(() -> {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // every Java platform must provide SHA-256
            throw new AssertionError("SHA-256 algorithm not available", e);
        }
    });

    private Sha256() {
        // Utility class
    }

    /**
     * Computes the SHA-256 hash of the input bytes.
     *
     * @param input the data to hash
     * @return 32-byte hash
     * @throws NullPointerException if input is null
     */
    public static byte[] hash(final byte[] input) {
        Objects.requireNonNull(input, "input cannot be null");

        final MessageDigest digest = DIGEST.get();
        digest.reset();
        return digest.digest(input);
    }

    /**
     * Computes {@code SHA256(SHA256(input))}.
     *
     * @param input the data to hash
     * @return 32-byte hash, in internal (little-endian display) byte order
     * @throws NullPointerException if input is null
     */
    public static byte[] doubleHash(final byte[] input) {
        return hash(hash(input));
    }
}
