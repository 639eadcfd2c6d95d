package io.crosslane.trie;

import io.crosslane.utils.Hash;

/**
 * Node of the hexary Patricia trie. A node is referenced by the Blake2b-256 hash of its encoding.
 */
public abstract class TrieNode {
    static final byte EMPTY_TYPE = 0;
    static final byte LEAF_TYPE = 1;
    static final byte BRANCH_TYPE = 2;

    private Hash hash;

    abstract byte type();

    public byte[] bytes() {
        return TrieNodeSerializer.getSerializer().toBytes(this);
    }

    public Hash hash() {
        if (hash == null)
            hash = Hash.of(bytes());
        return hash;
    }
}
