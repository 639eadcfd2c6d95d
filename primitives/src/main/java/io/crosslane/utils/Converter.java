package io.crosslane.utils;

import com.google.common.io.BaseEncoding;

public final class Converter {
    private static final String PREFIX = "0x";

    private Converter() {}

    // Get byte array from hex string, with or without the 0x prefix
    public static byte[] fromHexString(String hex) {
        if (hex.startsWith(PREFIX)) {
            hex = hex.substring(PREFIX.length());
        }
        return BaseEncoding.base16().lowerCase().decode(hex.toLowerCase());
    }

    // Get hex string representation of byte array
    public static String toHexString(byte[] bytes) {
        return BaseEncoding.base16().lowerCase().encode(bytes);
    }

    public static String toPrefixedHexString(byte[] bytes) {
        return PREFIX + toHexString(bytes);
    }
}
