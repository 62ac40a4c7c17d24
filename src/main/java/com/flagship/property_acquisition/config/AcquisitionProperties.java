package com.flagship.property_acquisition.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Tunables for the acquisition flow, bound from the {@code acquisition.*} keys.
 */
@ConfigurationProperties(prefix = "acquisition")
@Getter
@Setter
public class AcquisitionProperties {

    /** Deposit as a fraction of the asking price. */
    private BigDecimal depositRatio = new BigDecimal("0.10");

    /** Accepted absolute deviation from the expected deposit, in currency units. */
    private BigDecimal depositTolerance = BigDecimal.ONE;

    private PaymentGateway paymentGateway = new PaymentGateway();

    @Getter
    @Setter
    public static class PaymentGateway {

        /** References starting with this prefix are reported as still pending by the simulated gateway. */
        private String pendingPrefix = "PENDING-";
    }
}
