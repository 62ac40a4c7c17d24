package com.flagship.property_acquisition.payment;

import com.flagship.property_acquisition.config.AcquisitionProperties;
import com.flagship.property_acquisition.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * The deposit a committed client has to pay: a fixed share of the asking price,
 * accepted within a small absolute tolerance for rounding on the payer's side.
 */
@Component
@RequiredArgsConstructor
public class DepositPolicy {

    private final AcquisitionProperties properties;

    public BigDecimal expectedDeposit(BigDecimal askingPrice) {
        return askingPrice.multiply(properties.getDepositRatio()).setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * @throws ValidationException (field {@code amount}) if the amount is outside the tolerance
     */
    public void validate(BigDecimal amount, BigDecimal askingPrice) {
        BigDecimal expected = expectedDeposit(askingPrice);
        BigDecimal deviation = amount.subtract(expected).abs();
        if (deviation.compareTo(properties.getDepositTolerance()) > 0) {
            throw new ValidationException("amount",
                String.format("Deposit must be %s (%s%% of the asking price), got %s",
                    expected.toPlainString(),
                    properties.getDepositRatio().movePointRight(2).stripTrailingZeros().toPlainString(),
                    amount.toPlainString()));
        }
    }
}
