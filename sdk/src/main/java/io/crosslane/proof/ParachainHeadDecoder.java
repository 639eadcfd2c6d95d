package io.crosslane.proof;

import io.crosslane.utils.Hash;

public interface ParachainHeadDecoder {

    // Throws IllegalArgumentException if the head can not be decoded
    Hash stateRoot(byte[] encodedHead);
}
