package io.crosslane.proof;

import io.crosslane.utils.Hash;

import java.util.Optional;

/**
 * Light client of the bridged chain.
 */
public interface FinalityProvider {

    // Empty unless the header has been imported and finalized
    Optional<Hash> getFinalizedStateRoot(Hash headerHash);
}
