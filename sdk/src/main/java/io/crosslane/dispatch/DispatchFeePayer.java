package io.crosslane.dispatch;

import io.crosslane.model.AccountId;
import io.crosslane.model.Weight;

public interface DispatchFeePayer {

    void payDispatchFee(AccountId origin, Weight weight) throws DispatchFeePaymentException;
}
