package io.crosslane.trie;

public class StorageProofException extends Exception {
    public StorageProofException(String message) {
        super(message);
    }

    public StorageProofException(String message, Throwable cause) {
        super(message, cause);
    }
}
