package io.crosslane.utils;

import org.bouncycastle.crypto.digests.Blake2bDigest;

/**
 * Blake2b digests used for trie node hashes, storage keys and account derivation.
 */
public final class Blake2b {
    public static final int HASH_128_LENGTH = 16;
    public static final int HASH_256_LENGTH = 32;

    private Blake2b() {}

    public static byte[] hash256(byte[]... chunks) {
        return digest(HASH_256_LENGTH, chunks);
    }

    public static byte[] hash128(byte[]... chunks) {
        return digest(HASH_128_LENGTH, chunks);
    }

    private static byte[] digest(int length, byte[]... chunks) {
        Blake2bDigest digest = new Blake2bDigest(length * 8);
        for (byte[] chunk : chunks) {
            digest.update(chunk, 0, chunk.length);
        }
        byte[] result = new byte[length];
        digest.doFinal(result, 0);
        return result;
    }
}
