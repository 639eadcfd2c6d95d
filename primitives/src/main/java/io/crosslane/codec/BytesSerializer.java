package io.crosslane.codec;

/**
 * Binary codec of a single type. Implementations are stateless singletons exposed through {@code getSerializer()}.
 */
public interface BytesSerializer<T> {

    void serialize(T obj, BytesWriter writer);

    T parse(BytesReader reader);

    default byte[] toBytes(T obj) {
        BytesWriter writer = new BytesWriter();
        serialize(obj, writer);
        return writer.toBytes();
    }

    // Parses the whole input: trailing bytes are an error
    default T parseBytes(byte[] bytes) {
        BytesReader reader = new BytesReader(bytes);
        T obj = parse(reader);
        reader.ensureFullyConsumed();
        return obj;
    }
}
