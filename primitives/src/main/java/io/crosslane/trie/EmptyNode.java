package io.crosslane.trie;

// Root of a trie without entries.
public final class EmptyNode extends TrieNode {
    public static final EmptyNode INSTANCE = new EmptyNode();

    private EmptyNode() {}

    @Override
    byte type() {
        return EMPTY_TYPE;
    }
}
