package io.crosslane.trie;

import io.crosslane.utils.ByteArrayWrapper;
import io.crosslane.utils.Hash;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable in-memory hexary Patricia trie built from a full set of entries.
 * Used on the proving side to compute a storage root and to extract storage proofs.
 */
public final class MemoryTrie {
    private final Map<Hash, TrieNode> nodes = new HashMap<>();
    private final Hash rootHash;

    private static final class Entry {
        final byte[] path;
        final byte[] value;

        Entry(byte[] path, byte[] value) {
            this.path = path;
            this.value = value;
        }
    }

    public MemoryTrie(Map<ByteArrayWrapper, byte[]> entries) {
        // sorted so that entries sharing a prefix are adjacent
        var sorted = new TreeMap<>(entries);
        List<Entry> list = new ArrayList<>(sorted.size());
        sorted.forEach((key, value) -> list.add(new Entry(Nibbles.fromKey(key.data()), value)));

        TrieNode root = list.isEmpty() ? EmptyNode.INSTANCE : build(list, 0);
        nodes.put(root.hash(), root);
        rootHash = root.hash();
    }

    public Hash rootHash() {
        return rootHash;
    }

    public Optional<byte[]> get(byte[] key) {
        try {
            return new StorageProofChecker(rootHash, nodes).readValue(key);
        } catch (StorageProofException e) {
            // all nodes are local
            throw new IllegalStateException("Trie is inconsistent", e);
        }
    }

    /**
     * Encoded nodes visited while reading the given keys, deduplicated, in visiting order.
     * Keys absent from the trie are proven absent by the returned nodes.
     */
    public List<byte[]> generateProof(List<byte[]> keys) {
        Map<Hash, byte[]> proof = new LinkedHashMap<>();
        for (byte[] key : keys) {
            byte[] path = Nibbles.fromKey(key);
            int position = 0;
            TrieNode node = nodes.get(rootHash);
            while (node != null) {
                proof.putIfAbsent(node.hash(), node.bytes());
                if (!(node instanceof BranchNode))
                    break;
                BranchNode branch = (BranchNode) node;
                byte[] partial = branch.partialPath();
                if (!Nibbles.matchesAt(path, position, partial))
                    break;
                position += partial.length;
                if (position == path.length)
                    break;
                node = branch.child(path[position]).map(nodes::get).orElse(null);
                position++;
            }
        }
        return new ArrayList<>(proof.values());
    }

    private TrieNode build(List<Entry> entries, int depth) {
        TrieNode node;
        if (entries.size() == 1) {
            Entry entry = entries.get(0);
            node = new LeafNode(Nibbles.slice(entry.path, depth, entry.path.length), entry.value);
        } else {
            int branchDepth = depth + commonPrefixLength(entries, depth);
            byte[] value = null;
            List<List<Entry>> groups = new ArrayList<>(BranchNode.CHILDREN);
            for (int i = 0; i < BranchNode.CHILDREN; i++)
                groups.add(new ArrayList<>());
            for (Entry entry : entries) {
                if (entry.path.length == branchDepth)
                    value = entry.value;
                else
                    groups.get(entry.path[branchDepth]).add(entry);
            }
            Hash[] children = new Hash[BranchNode.CHILDREN];
            for (int i = 0; i < BranchNode.CHILDREN; i++) {
                if (!groups.get(i).isEmpty())
                    children[i] = build(groups.get(i), branchDepth + 1).hash();
            }
            node = new BranchNode(Nibbles.slice(entries.get(0).path, depth, branchDepth), children, value);
        }
        nodes.put(node.hash(), node);
        return node;
    }

    private static int commonPrefixLength(List<Entry> entries, int depth) {
        byte[] first = entries.get(0).path;
        int length = first.length - depth;
        for (Entry entry : entries) {
            int max = Math.min(length, entry.path.length - depth);
            int i = 0;
            while (i < max && entry.path[depth + i] == first[depth + i])
                i++;
            length = i;
        }
        return length;
    }
}
