package com.ledgerlens.insights.service;

import com.ledgerlens.insights.config.InsightsProperties;
import com.ledgerlens.insights.model.ExcludedMerchant;
import com.ledgerlens.insights.model.RecurringPayment;
import com.ledgerlens.insights.model.RecurringStatus;
import com.ledgerlens.insights.model.Transaction;
import com.ledgerlens.insights.recurring.RecurringPaymentCalculator;
import com.ledgerlens.insights.recurring.RecurringPaymentDetector;
import com.ledgerlens.insights.repository.ExcludedMerchantRepository;
import com.ledgerlens.insights.repository.RecurringPaymentRepository;
import com.ledgerlens.insights.repository.TransactionRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class RecurringPaymentService {

    private static final Logger log = LoggerFactory.getLogger(RecurringPaymentService.class);

    private final TransactionRepository transactionRepository;
    private final RecurringPaymentRepository recurringPaymentRepository;
    private final ExcludedMerchantRepository excludedMerchantRepository;
    private final RecurringPaymentDetector recurringPaymentDetector;
    private final RecurringPaymentCalculator recurringPaymentCalculator;
    private final InsightsProperties properties;
    private final Clock clock;
    private final AtomicBoolean scanning = new AtomicBoolean(false);

    public RecurringPaymentService(
            TransactionRepository transactionRepository,
            RecurringPaymentRepository recurringPaymentRepository,
            ExcludedMerchantRepository excludedMerchantRepository,
            RecurringPaymentDetector recurringPaymentDetector,
            RecurringPaymentCalculator recurringPaymentCalculator,
            InsightsProperties properties,
            Clock clock
    ) {
        this.transactionRepository = transactionRepository;
        this.recurringPaymentRepository = recurringPaymentRepository;
        this.excludedMerchantRepository = excludedMerchantRepository;
        this.recurringPaymentDetector = recurringPaymentDetector;
        this.recurringPaymentCalculator = recurringPaymentCalculator;
        this.properties = properties;
        this.clock = clock;
    }

    public record RecurringSummary(
            int activeCount,
            int inactiveCount,
            BigDecimal totalMonthlyRecurring,
            Optional<Instant> lastScannedAt
    ) {
    }

    /**
     * Replaces the stored recurring payments with a fresh detection run, minus excluded merchants.
     * A request arriving while a scan is in flight is ignored.
     */
    public ScanResult scan() {
        if (!scanning.compareAndSet(false, true)) {
            log.warn("Recurring payment scan already in progress; ignoring request");
            return ScanResult.skipped();
        }
        try {
            Instant now = clock.instant();
            List<Transaction> snapshot = transactionRepository.findAll();
            List<ExcludedMerchant> exclusions = excludedMerchantRepository.findAll();
            List<RecurringPayment> payments = recurringPaymentDetector.detect(snapshot, properties.recurring(), now, exclusions);
            recurringPaymentRepository.replaceAll(payments, now);
            log.info("Recurring payment scan completed: {} transactions scanned, {} recurring payments, {} exclusions applied",
                    snapshot.size(), payments.size(), exclusions.size());
            return ScanResult.completed(snapshot.size(), payments.size(), now);
        } finally {
            scanning.set(false);
        }
    }

    public List<RecurringPayment> listPayments(Optional<RecurringStatus> status) {
        List<RecurringPayment> payments = recurringPaymentRepository.findAll();
        return status
                .map(wanted -> payments.stream().filter(payment -> payment.status() == wanted).toList())
                .orElse(payments);
    }

    /**
     * Records the payment's merchant as not recurring and drops it from the current result.
     * The exclusion applies to every later scan until exclusions are cleared.
     */
    public ExcludedMerchant markAsNotRecurring(UUID paymentId) {
        RecurringPayment payment = recurringPaymentRepository.findById(paymentId)
                .orElseThrow(() -> new IllegalArgumentException("Recurring payment not found: " + paymentId));
        ExcludedMerchant excluded = excludedMerchantRepository.save(
                new ExcludedMerchant(payment.normalizedName(), clock.instant()));
        recurringPaymentRepository.deleteById(paymentId);
        log.info("Merchant '{}' marked as not recurring", excluded.normalizedName());
        return excluded;
    }

    public List<ExcludedMerchant> listExclusions() {
        return excludedMerchantRepository.findAll();
    }

    public void clearExclusions() {
        excludedMerchantRepository.deleteAll();
        log.info("Cleared excluded merchants");
    }

    public RecurringSummary summary() {
        List<RecurringPayment> payments = recurringPaymentRepository.findAll();
        int active = (int) payments.stream().filter(RecurringPayment::active).count();
        return new RecurringSummary(
                active,
                payments.size() - active,
                recurringPaymentCalculator.totalMonthlyRecurring(payments),
                recurringPaymentRepository.lastScannedAt()
        );
    }
}
