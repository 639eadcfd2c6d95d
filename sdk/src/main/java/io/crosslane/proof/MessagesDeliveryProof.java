package io.crosslane.proof;

import io.crosslane.model.LaneId;
import io.crosslane.utils.Hash;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Proof of the inbound lane state at the bridged chain, used to confirm deliveries of our outbound messages.
 */
public final class MessagesDeliveryProof {
    private final Hash bridgedHeaderHash;
    private final List<byte[]> storageProof;
    private final LaneId laneId;

    public MessagesDeliveryProof(Hash bridgedHeaderHash, List<byte[]> storageProof, LaneId laneId) {
        this.bridgedHeaderHash = bridgedHeaderHash;
        this.storageProof = Collections.unmodifiableList(new ArrayList<>(storageProof));
        this.laneId = laneId;
    }

    public Hash getBridgedHeaderHash() {
        return bridgedHeaderHash;
    }

    public List<byte[]> getStorageProof() {
        return storageProof;
    }

    public LaneId getLaneId() {
        return laneId;
    }

    @Override
    public String toString() {
        return "MessagesDeliveryProof{bridgedHeaderHash=" + bridgedHeaderHash + ", laneId=" + laneId
                + ", nodes=" + storageProof.size() + "}";
    }
}
