package com.flagship.property_acquisition.interest;

import com.flagship.property_acquisition.handover.HandoverResult;
import com.flagship.property_acquisition.payment.PaymentInstallment;
import com.flagship.property_acquisition.payment.SettlementStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a deposit payment or verification.
 *
 * The deposit itself either succeeded or the call threw. The handover hand-off that
 * follows a settled deposit is best-effort: when it fails, {@code handover} is null and
 * {@code handoverFailure} says why, and the caller may retry the handover on its own.
 */
@Value
@Builder
public class DepositResult {
    ClientPropertyInterest interest;
    PaymentInstallment installment;
    SettlementStatus settlementStatus;
    boolean duplicate;
    HandoverResult handover;
    String handoverFailure;

    public boolean isHandoverStarted() {
        return handover != null;
    }
}
