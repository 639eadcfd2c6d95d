package io.crosslane.utils;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;

import java.io.IOException;

/**
 * Blake2b-256 digest: header hashes, state roots and trie node references.
 */
@JsonSerialize(using = ToStringSerializer.class)
@JsonDeserialize(using = Hash.HexDeserializer.class)
public final class Hash extends FixedSizeByteArray {
    public static final int LENGTH = Blake2b.HASH_256_LENGTH;

    public static final Hash ZERO = new Hash(new byte[LENGTH]);

    public Hash(byte[] bytes) {
        super(LENGTH, bytes);
    }

    // 0x-prefixed hex
    public Hash(String hex) {
        super(LENGTH, hex);
    }

    // Digest of the concatenation of the chunks
    public static Hash of(byte[]... chunks) {
        return new Hash(Blake2b.hash256(chunks));
    }

    public static class HexDeserializer extends JsonDeserializer<Hash> {
        @Override
        public Hash deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            try {
                return new Hash(parser.getText());
            } catch (IllegalArgumentException e) {
                throw new IOException(String.format("Hash `%s` is malformed: %s", parser.getText(), e.getMessage()), e);
            }
        }
    }
}
