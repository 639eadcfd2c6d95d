package io.crosslane.trie;

import java.util.Arrays;

public final class LeafNode extends TrieNode {
    private final byte[] partialPath;
    private final byte[] value;

    public LeafNode(byte[] partialPath, byte[] value) {
        this.partialPath = partialPath;
        this.value = value;
    }

    public byte[] partialPath() {
        return Arrays.copyOf(partialPath, partialPath.length);
    }

    public byte[] value() {
        return Arrays.copyOf(value, value.length);
    }

    @Override
    byte type() {
        return LEAF_TYPE;
    }
}
