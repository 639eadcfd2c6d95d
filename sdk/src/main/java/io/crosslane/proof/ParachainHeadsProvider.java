package io.crosslane.proof;

import io.crosslane.utils.Hash;

import java.util.Optional;

/**
 * Heads of parachains proven to be finalized through the light client of their relay chain.
 */
public interface ParachainHeadsProvider {

    // Encoded head with the given hash, empty if it has not been imported
    Optional<byte[]> getFinalizedParachainHead(ParaId paraId, Hash headHash);
}
