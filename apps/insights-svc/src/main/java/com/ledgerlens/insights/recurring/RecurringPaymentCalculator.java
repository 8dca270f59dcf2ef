package com.ledgerlens.insights.recurring;

import com.ledgerlens.insights.model.Frequency;
import com.ledgerlens.insights.model.RecurringPayment;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class RecurringPaymentCalculator {

    private static final BigDecimal WEEKS_PER_MONTH = new BigDecimal("4.33");
    private static final int SCALE = 2;

    public BigDecimal monthlyAmount(BigDecimal amount, Frequency frequency) {
        BigDecimal monthly = switch (frequency) {
            case WEEKLY -> amount.multiply(WEEKS_PER_MONTH);
            case MONTHLY -> amount;
            case QUARTERLY -> amount.divide(BigDecimal.valueOf(3), 4, RoundingMode.HALF_UP);
            case YEARLY -> amount.divide(BigDecimal.valueOf(12), 4, RoundingMode.HALF_UP);
        };
        return monthly.setScale(SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Monthly equivalent of all active payments, based on each payment's latest amount.
     */
    public BigDecimal totalMonthlyRecurring(List<RecurringPayment> payments) {
        return payments.stream()
                .filter(RecurringPayment::active)
                .map(payment -> monthlyAmount(payment.latestAmount(), payment.frequency()))
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(SCALE, RoundingMode.HALF_UP);
    }
}
