package com.ledgerlens.insights.repository;

import com.ledgerlens.insights.model.RecurringPayment;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryRecurringPaymentRepository implements RecurringPaymentRepository {

    private final List<RecurringPayment> storage = new ArrayList<>();
    private Instant lastScannedAt;

    @Override
    public synchronized void replaceAll(List<RecurringPayment> payments, Instant scannedAt) {
        storage.clear();
        storage.addAll(payments);
        lastScannedAt = scannedAt;
    }

    @Override
    public synchronized List<RecurringPayment> findAll() {
        return List.copyOf(storage);
    }

    @Override
    public synchronized Optional<RecurringPayment> findById(UUID paymentId) {
        return storage.stream()
                .filter(payment -> payment.id().equals(paymentId))
                .findFirst();
    }

    @Override
    public synchronized void deleteById(UUID paymentId) {
        storage.removeIf(payment -> payment.id().equals(paymentId));
    }

    @Override
    public synchronized Optional<Instant> lastScannedAt() {
        return Optional.ofNullable(lastScannedAt);
    }
}
