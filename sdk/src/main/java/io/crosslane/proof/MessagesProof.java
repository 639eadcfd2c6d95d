package io.crosslane.proof;

import io.crosslane.model.LaneId;
import io.crosslane.utils.Hash;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Proof that the bridged chain has sent messages `noncesStart..=noncesEnd` over a lane, optionally together
 * with the state of that outbound lane. An empty range proves the lane state only.
 */
public final class MessagesProof {
    private final Hash bridgedHeaderHash;
    private final List<byte[]> storageProof;
    private final LaneId laneId;
    private final long noncesStart;
    private final long noncesEnd;

    public MessagesProof(Hash bridgedHeaderHash, List<byte[]> storageProof, LaneId laneId, long noncesStart, long noncesEnd) {
        this.bridgedHeaderHash = bridgedHeaderHash;
        this.storageProof = Collections.unmodifiableList(new ArrayList<>(storageProof));
        this.laneId = laneId;
        this.noncesStart = noncesStart;
        this.noncesEnd = noncesEnd;
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

    public long getNoncesStart() {
        return noncesStart;
    }

    public long getNoncesEnd() {
        return noncesEnd;
    }

    public int size() {
        return storageProof.stream().mapToInt(node -> node.length).sum();
    }

    @Override
    public String toString() {
        return "MessagesProof{bridgedHeaderHash=" + bridgedHeaderHash + ", laneId=" + laneId
                + ", nonces=" + noncesStart + "..=" + noncesEnd + ", nodes=" + storageProof.size() + "}";
    }
}
