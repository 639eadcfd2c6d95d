package io.crosslane.trie;

import io.crosslane.utils.Hash;

import java.util.Arrays;
import java.util.Optional;

/**
 * Node with up to 16 children, one per nibble, an optional partial path shared by all of them, and an optional value
 * stored under the key that ends exactly at this node.
 */
public final class BranchNode extends TrieNode {
    public static final int CHILDREN = 16;

    private final byte[] partialPath;
    private final Hash[] children;
    private final byte[] value;

    public BranchNode(byte[] partialPath, Hash[] children, byte[] value) {
        if (children.length != CHILDREN)
            throw new IllegalArgumentException(String.format("Branch node must have `%d` child slots", CHILDREN));
        this.partialPath = partialPath;
        this.children = Arrays.copyOf(children, CHILDREN);
        this.value = value;
    }

    public byte[] partialPath() {
        return Arrays.copyOf(partialPath, partialPath.length);
    }

    public Optional<Hash> child(int nibble) {
        return Optional.ofNullable(children[nibble]);
    }

    public Optional<byte[]> value() {
        return Optional.ofNullable(value).map(v -> Arrays.copyOf(v, v.length));
    }

    short childrenBitmap() {
        int bitmap = 0;
        for (int i = 0; i < CHILDREN; i++) {
            if (children[i] != null)
                bitmap |= 1 << i;
        }
        return (short) bitmap;
    }

    @Override
    byte type() {
        return BRANCH_TYPE;
    }
}
