package io.crosslane.payload;

import com.google.common.primitives.Ints;
import io.crosslane.model.AccountId;
import io.crosslane.model.ChainId;
import io.crosslane.utils.Blake2b;
import io.crosslane.utils.BytesUtils;

import java.nio.charset.StandardCharsets;

/**
 * Accounts that represent bridged origins on this chain. Nobody holds their keys.
 */
public final class AccountDerivation {
    private static final byte[] ROOT_PREFIX = "crosslane/account-derivation/root".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] ACCOUNT_PREFIX = "crosslane/account-derivation/account".getBytes(StandardCharsets.US_ASCII);

    private AccountDerivation() {}

    public static AccountId deriveRootAccount(ChainId chainId) {
        return new AccountId(Blake2b.hash256(ROOT_PREFIX, chainId.toBytes()));
    }

    public static AccountId deriveAccount(ChainId chainId, AccountId sourceAccount) {
        return new AccountId(Blake2b.hash256(ACCOUNT_PREFIX, chainId.toBytes(), sourceAccount.toBytes()));
    }

    /**
     * Digest a target chain account signs to prove it agrees to be the dispatch origin of a bridged call.
     */
    public static byte[] ownershipDigest(byte[] call, AccountId sourceAccount, int specVersion,
                                         ChainId sourceChain, ChainId targetChain) {
        byte[] version = Ints.toByteArray(specVersion);
        return Blake2b.hash256(BytesUtils.concat(call, sourceAccount.toBytes(), version, sourceChain.toBytes(), targetChain.toBytes()));
    }
}
