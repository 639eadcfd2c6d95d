package io.crosslane.payload;

import io.crosslane.model.AccountId;

import java.util.Optional;

/**
 * Checks that the submitter of an outbound message is allowed to claim the call origin written in its payload.
 */
public final class MessageOriginVerifier {
    static final String BAD_ORIGIN = "Submitter `%s` is not allowed to send a message with origin `%s`";

    private MessageOriginVerifier() {}

    /**
     * @return the source account the message is sent on behalf of, empty for messages sent by root
     * @throws BadOriginException if the submitter can not claim the payload origin
     */
    public static Optional<AccountId> verifyMessageOrigin(RawOrigin submitter, MessagePayload payload) throws BadOriginException {
        CallOrigin origin = payload.getOrigin();
        switch (origin.type()) {
            case SOURCE_ROOT:
                if (submitter.isRoot())
                    return Optional.empty();
                break;
            case TARGET_ACCOUNT:
                AccountId signer = ((TargetAccountOrigin) origin).getSourceAccount();
                if (submitter.isSignedBy(signer))
                    return Optional.of(signer);
                break;
            case SOURCE_ACCOUNT:
                AccountId source = ((SourceAccountOrigin) origin).getSourceAccount();
                if (submitter.isSignedBy(source))
                    return Optional.of(source);
                if (submitter.isRoot())
                    return Optional.empty();
                break;
            default:
                break;
        }
        throw new BadOriginException(String.format(BAD_ORIGIN, submitter, origin));
    }
}
