package io.crosslane.codec;

public interface BytesSerializable {

    BytesSerializer<? extends BytesSerializable> serializer();

    byte[] bytes();
}
