package io.crosslane.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import io.crosslane.utils.Converter;
import io.crosslane.utils.FixedSizeByteArray;

/**
 * 32 bytes account identifier. Accounts derived for bridged origins and Ed25519 public keys share this format.
 */
@JsonSerialize(using = ToStringSerializer.class)
public final class AccountId extends FixedSizeByteArray {
    public static final int LENGTH = 32;

    public AccountId(byte[] bytes) {
        super(LENGTH, bytes);
    }

    // Hex with or without the 0x prefix, as account ids appear in configuration files
    public AccountId(String hex) {
        super(LENGTH, Converter.fromHexString(hex));
    }
}
