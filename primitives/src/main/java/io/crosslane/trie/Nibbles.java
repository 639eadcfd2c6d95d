package io.crosslane.trie;

import java.util.Arrays;

// Half-byte paths of the hexary trie. One nibble per array element, high half of a byte first.
final class Nibbles {
    private Nibbles() {}

    static byte[] fromKey(byte[] key) {
        byte[] nibbles = new byte[key.length * 2];
        for (int i = 0; i < key.length; i++) {
            nibbles[2 * i] = (byte) ((key[i] >> 4) & 0x0F);
            nibbles[2 * i + 1] = (byte) (key[i] & 0x0F);
        }
        return nibbles;
    }

    static byte[] pack(byte[] nibbles) {
        byte[] packed = new byte[(nibbles.length + 1) / 2];
        for (int i = 0; i < nibbles.length; i++) {
            if (i % 2 == 0)
                packed[i / 2] = (byte) (nibbles[i] << 4);
            else
                packed[i / 2] |= nibbles[i];
        }
        return packed;
    }

    static byte[] unpack(byte[] packed, int count) {
        if (count < 0 || (count + 1) / 2 != packed.length)
            throw new IllegalArgumentException(
                    String.format("Input data corrupted: `%d` nibbles can not be packed into `%d` bytes", count, packed.length));
        byte[] nibbles = new byte[count];
        for (int i = 0; i < count; i++) {
            int b = packed[i / 2] & 0xFF;
            nibbles[i] = (byte) (i % 2 == 0 ? b >> 4 : b & 0x0F);
        }
        if (count % 2 == 1 && (packed[packed.length - 1] & 0x0F) != 0)
            throw new IllegalArgumentException("Input data corrupted: padding nibble is not zero");
        return nibbles;
    }

    static byte[] slice(byte[] nibbles, int from, int to) {
        return Arrays.copyOfRange(nibbles, from, to);
    }

    // True if `path` starting at `offset` begins with `prefix`
    static boolean matchesAt(byte[] path, int offset, byte[] prefix) {
        if (path.length - offset < prefix.length)
            return false;
        for (int i = 0; i < prefix.length; i++) {
            if (path[offset + i] != prefix[i])
                return false;
        }
        return true;
    }
}
