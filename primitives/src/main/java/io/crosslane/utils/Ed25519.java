package io.crosslane.utils;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;

public final class Ed25519 {
    private static final Logger logger = LogManager.getLogger();

    private Ed25519() {
    }

    public static int privateKeyLength() {
        return org.bouncycastle.math.ec.rfc8032.Ed25519.SECRET_KEY_SIZE;
    }

    public static int publicKeyLength() {
        return org.bouncycastle.math.ec.rfc8032.Ed25519.PUBLIC_KEY_SIZE;
    }

    public static int signatureLength() {
        return org.bouncycastle.math.ec.rfc8032.Ed25519.SIGNATURE_SIZE;
    }

    /**
     * Deterministic key pair: the private key is the Blake2b-256 digest of the seed.
     *
     * @return array of two elements, the private key followed by the public key
     */
    public static byte[][] createKeyPair(byte[] seed) {
        Ed25519PrivateKeyParameters privateKey = new Ed25519PrivateKeyParameters(Blake2b.hash256(seed), 0);
        Ed25519PublicKeyParameters publicKey = privateKey.generatePublicKey();
        return new byte[][] {privateKey.getEncoded(), publicKey.getEncoded()};
    }

    public static boolean verify(byte[] signature, byte[] message, byte[] publicKey) {
        if (signature.length != signatureLength() || publicKey.length != publicKeyLength())
            return false;
        try {
            return org.bouncycastle.math.ec.rfc8032.Ed25519.verify(signature, 0, publicKey, 0, message, 0, message.length);
        } catch (RuntimeException e) {
            logger.debug("Ed25519 signature verification failed: {}", e.getMessage());
            return false;
        }
    }

    public static byte[] sign(byte[] privateKey, byte[] message, byte[] publicKey) {
        byte[] signature = new byte[signatureLength()];
        org.bouncycastle.math.ec.rfc8032.Ed25519.sign(privateKey, 0, publicKey, 0, message, 0, message.length, signature, 0);
        return signature;
    }
}
