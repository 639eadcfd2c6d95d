package io.crosslane.proof;

import io.crosslane.errors.BridgeError;
import io.crosslane.utils.Hash;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Bridged chain is a parachain, finalized by its relay chain. Proofs are anchored to the state root found
 * in a finalized parachain head.
 */
public class ParachainFinalityAnchor implements StateRootAnchor {
    private static final Logger logger = LogManager.getLogger();

    static final String UNKNOWN_PARA_HEAD = "Head `%s` of parachain %d is not finalized or is unknown";
    static final String UNDECODABLE_PARA_HEAD = "State root can not be extracted from head `%s` of parachain %d";

    private final ParachainHeadsProvider headsProvider;
    private final ParaId paraId;
    private final ParachainHeadDecoder headDecoder;

    public ParachainFinalityAnchor(ParachainHeadsProvider headsProvider, ParaId paraId, ParachainHeadDecoder headDecoder) {
        this.headsProvider = headsProvider;
        this.paraId = paraId;
        this.headDecoder = headDecoder;
    }

    @Override
    public Hash stateRoot(Hash bridgedHeaderHash) throws MessageProofException {
        byte[] head = headsProvider.getFinalizedParachainHead(paraId, bridgedHeaderHash)
                .orElseThrow(() -> new MessageProofException(BridgeError.UNKNOWN_HEADER,
                        String.format(UNKNOWN_PARA_HEAD, bridgedHeaderHash, paraId.getId())));
        try {
            return headDecoder.stateRoot(head);
        } catch (IllegalArgumentException e) {
            logger.warn("Finalized head {} of parachain {} can not be decoded: {}", bridgedHeaderHash, paraId.getId(), e.getMessage());
            throw new MessageProofException(BridgeError.PROOF_DECODE_FAILURE,
                    String.format(UNDECODABLE_PARA_HEAD, bridgedHeaderHash, paraId.getId()), e);
        }
    }
}
