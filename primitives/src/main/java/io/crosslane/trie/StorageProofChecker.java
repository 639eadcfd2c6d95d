package io.crosslane.trie;

import io.crosslane.utils.Hash;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads values from a trie known only by its root hash and a set of encoded nodes.
 */
public final class StorageProofChecker {
    private static final Logger logger = LogManager.getLogger();

    private final Hash root;
    private final Map<Hash, TrieNode> nodes;

    /**
     * @throws StorageProofException if a node can not be decoded or the root node is not part of the proof
     */
    public StorageProofChecker(Hash root, List<byte[]> proof) throws StorageProofException {
        this.root = root;
        this.nodes = new HashMap<>();
        for (byte[] encoded : proof) {
            TrieNode node;
            try {
                node = TrieNodeSerializer.getSerializer().parseBytes(encoded);
            } catch (IllegalArgumentException e) {
                throw new StorageProofException("Storage proof contains a malformed node", e);
            }
            nodes.put(Hash.of(encoded), node);
        }
        if (!nodes.containsKey(root))
            throw new StorageProofException(String.format("Storage root `%s` is not part of the proof", root));
    }

    StorageProofChecker(Hash root, Map<Hash, TrieNode> nodes) {
        this.root = root;
        this.nodes = nodes;
    }

    /**
     * @return the value stored under `key`, empty if the proof shows that the key is absent
     * @throws StorageProofException if a node needed to reach the key is not part of the proof
     */
    public Optional<byte[]> readValue(byte[] key) throws StorageProofException {
        byte[] path = Nibbles.fromKey(key);
        int position = 0;
        TrieNode node = nodes.get(root);
        while (true) {
            if (node instanceof EmptyNode) {
                return Optional.empty();
            } else if (node instanceof LeafNode) {
                LeafNode leaf = (LeafNode) node;
                byte[] partial = leaf.partialPath();
                if (partial.length == path.length - position && Nibbles.matchesAt(path, position, partial))
                    return Optional.of(leaf.value());
                return Optional.empty();
            }
            BranchNode branch = (BranchNode) node;
            byte[] partial = branch.partialPath();
            if (!Nibbles.matchesAt(path, position, partial))
                return Optional.empty();
            position += partial.length;
            if (position == path.length)
                return branch.value();
            Optional<Hash> child = branch.child(path[position]);
            if (child.isEmpty())
                return Optional.empty();
            node = nodes.get(child.get());
            if (node == null) {
                logger.debug("Trie node {} is missing from the storage proof", child.get());
                throw new StorageProofException(String.format("Trie node `%s` is missing from the proof", child.get()));
            }
            position++;
        }
    }
}
