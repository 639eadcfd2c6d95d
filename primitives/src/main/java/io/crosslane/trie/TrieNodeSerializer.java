package io.crosslane.trie;

import io.crosslane.codec.BytesReader;
import io.crosslane.codec.BytesSerializer;
import io.crosslane.codec.BytesWriter;
import io.crosslane.utils.Hash;

/**
 * Node encodings:
 * <pre>
 * empty:  0x00
 * leaf:   0x01 | nibble count (int) | packed nibbles | value (var bytes)
 * branch: 0x02 | nibble count (int) | packed nibbles | children bitmap (short) | has value | [value] | child hashes
 * </pre>
 */
public final class TrieNodeSerializer implements BytesSerializer<TrieNode> {
    private static final TrieNodeSerializer serializer = new TrieNodeSerializer();

    private TrieNodeSerializer() {
        super();
    }

    public static TrieNodeSerializer getSerializer() {
        return serializer;
    }

    @Override
    public void serialize(TrieNode node, BytesWriter writer) {
        writer.putByte(node.type());
        if (node instanceof LeafNode) {
            LeafNode leaf = (LeafNode) node;
            writePath(leaf.partialPath(), writer);
            writer.putVarBytes(leaf.value());
        } else if (node instanceof BranchNode) {
            BranchNode branch = (BranchNode) node;
            writePath(branch.partialPath(), writer);
            writer.putShort(branch.childrenBitmap());
            var value = branch.value();
            writer.putBoolean(value.isPresent());
            value.ifPresent(writer::putVarBytes);
            for (int i = 0; i < BranchNode.CHILDREN; i++) {
                branch.child(i).ifPresent(child -> writer.putBytes(child.toBytes()));
            }
        }
    }

    @Override
    public TrieNode parse(BytesReader reader) {
        byte type = reader.getByte();
        switch (type) {
            case TrieNode.EMPTY_TYPE:
                return EmptyNode.INSTANCE;
            case TrieNode.LEAF_TYPE:
                return new LeafNode(readPath(reader), reader.getVarBytes());
            case TrieNode.BRANCH_TYPE:
                byte[] path = readPath(reader);
                int bitmap = reader.getShort() & 0xFFFF;
                if (bitmap == 0)
                    throw new IllegalArgumentException("Input data corrupted: branch node without children");
                byte[] value = reader.getBoolean() ? reader.getVarBytes() : null;
                Hash[] children = new Hash[BranchNode.CHILDREN];
                for (int i = 0; i < BranchNode.CHILDREN; i++) {
                    if ((bitmap & (1 << i)) != 0)
                        children[i] = new Hash(reader.getBytes(Hash.LENGTH));
                }
                return new BranchNode(path, children, value);
            default:
                throw new IllegalArgumentException(String.format("Input data corrupted: unknown node type `%d`", type));
        }
    }

    private static void writePath(byte[] nibbles, BytesWriter writer) {
        writer.putInt(nibbles.length);
        writer.putBytes(Nibbles.pack(nibbles));
    }

    private static byte[] readPath(BytesReader reader) {
        int count = reader.getInt();
        if (count < 0)
            throw new IllegalArgumentException(String.format("Input data corrupted: negative path length `%d`", count));
        return Nibbles.unpack(reader.getBytes((count + 1) / 2), count);
    }
}
