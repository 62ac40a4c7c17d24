package com.flagship.property_acquisition.payment;

import com.flagship.property_acquisition.config.AcquisitionProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Stand-in gateway: every reference settles immediately except those carrying the
 * configured pending prefix, which stay PENDING_VERIFICATION until an administrator
 * confirms them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SimulatedPaymentGateway implements PaymentGateway {

    private final AcquisitionProperties properties;

    @Override
    public SettlementStatus verify(String paymentReference) {
        String pendingPrefix = properties.getPaymentGateway().getPendingPrefix();
        SettlementStatus status = pendingPrefix != null && !pendingPrefix.isEmpty()
                && paymentReference.startsWith(pendingPrefix)
                ? SettlementStatus.PENDING_VERIFICATION
                : SettlementStatus.COMPLETED;
        log.debug("Simulated gateway reports {} for reference {}", status, paymentReference);
        return status;
    }
}
