package io.crosslane.dispatch;

import io.crosslane.fee.Currency;
import io.crosslane.fee.InsufficientBalanceException;
import io.crosslane.model.AccountId;
import io.crosslane.model.Weight;

import java.math.BigInteger;

// Charges the dispatch origin a fixed price per weight unit, paid to the relayer fund.
public class WeightFeeDispatchFeePayer implements DispatchFeePayer {
    private final Currency currency;
    private final AccountId relayerFund;
    private final BigInteger feePerWeightUnit;

    public WeightFeeDispatchFeePayer(Currency currency, AccountId relayerFund, BigInteger feePerWeightUnit) {
        this.currency = currency;
        this.relayerFund = relayerFund;
        this.feePerWeightUnit = feePerWeightUnit;
    }

    @Override
    public void payDispatchFee(AccountId origin, Weight weight) throws DispatchFeePaymentException {
        BigInteger fee = feePerWeightUnit.multiply(BigInteger.valueOf(weight.value()));
        if (fee.signum() == 0)
            return;
        try {
            currency.transfer(origin, relayerFund, fee);
        } catch (InsufficientBalanceException e) {
            throw new DispatchFeePaymentException(String.format("Dispatch fee `%s` can not be paid", fee), e);
        }
    }
}
