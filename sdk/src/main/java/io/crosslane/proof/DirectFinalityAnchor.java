package io.crosslane.proof;

import io.crosslane.errors.BridgeError;
import io.crosslane.utils.Hash;

// Bridged chain has its own finality, followed by a light client.
public class DirectFinalityAnchor implements StateRootAnchor {
    static final String UNKNOWN_HEADER = "Header `%s` is not finalized or is unknown";

    private final FinalityProvider finalityProvider;

    public DirectFinalityAnchor(FinalityProvider finalityProvider) {
        this.finalityProvider = finalityProvider;
    }

    @Override
    public Hash stateRoot(Hash bridgedHeaderHash) throws MessageProofException {
        return finalityProvider.getFinalizedStateRoot(bridgedHeaderHash)
                .orElseThrow(() -> new MessageProofException(BridgeError.UNKNOWN_HEADER, String.format(UNKNOWN_HEADER, bridgedHeaderHash)));
    }
}
