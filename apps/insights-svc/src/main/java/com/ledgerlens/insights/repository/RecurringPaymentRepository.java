package com.ledgerlens.insights.repository;

import com.ledgerlens.insights.model.RecurringPayment;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface RecurringPaymentRepository {

    /**
     * Replaces the previous scan result.
     */
    void replaceAll(List<RecurringPayment> payments, Instant scannedAt);

    List<RecurringPayment> findAll();

    Optional<RecurringPayment> findById(UUID paymentId);

    void deleteById(UUID paymentId);

    Optional<Instant> lastScannedAt();
}
