package io.crosslane.utils;

import org.junit.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.Assert.*;

public class Ed25519Test {

    @Test
    public void whenMessageIsSigned_signatureVerifiesOnlyForThatMessageAndKey() {
        // Arrange
        byte[][] keyPair = Ed25519.createKeyPair("alice".getBytes(StandardCharsets.UTF_8));
        byte[][] otherKeyPair = Ed25519.createKeyPair("bob".getBytes(StandardCharsets.UTF_8));
        byte[] message = "message".getBytes(StandardCharsets.UTF_8);

        // Act
        byte[] signature = Ed25519.sign(keyPair[0], message, keyPair[1]);

        // Assert
        assertEquals(Ed25519.signatureLength(), signature.length);
        assertTrue(Ed25519.verify(signature, message, keyPair[1]));
        assertFalse(Ed25519.verify(signature, "other".getBytes(StandardCharsets.UTF_8), keyPair[1]));
        assertFalse(Ed25519.verify(signature, message, otherKeyPair[1]));
        assertFalse(Ed25519.verify(new byte[3], message, keyPair[1]));
    }

    @Test
    public void whenSeedIsTheSame_keyPairIsTheSame() {
        // Act
        byte[][] first = Ed25519.createKeyPair(new byte[]{1});
        byte[][] second = Ed25519.createKeyPair(new byte[]{1});

        // Assert
        assertArrayEquals(first[0], second[0]);
        assertArrayEquals(first[1], second[1]);
        assertEquals(Ed25519.publicKeyLength(), first[1].length);
    }
}
