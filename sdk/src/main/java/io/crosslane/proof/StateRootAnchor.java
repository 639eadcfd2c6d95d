package io.crosslane.proof;

import io.crosslane.utils.Hash;

/**
 * Source of the state roots storage proofs are checked against.
 */
public interface StateRootAnchor {

    /**
     * @throws MessageProofException if the header is not known to be finalized or its state root can not be found
     */
    Hash stateRoot(Hash bridgedHeaderHash) throws MessageProofException;
}
