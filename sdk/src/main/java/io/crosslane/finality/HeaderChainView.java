package io.crosslane.finality;

import io.crosslane.utils.Hash;

/**
 * Read access to the headers of the bridged chain already imported by the light client.
 */
public interface HeaderChainView {

    long bestNumber();

    long finalizedNumber();

    boolean isKnownHeader(Hash headerHash);
}
