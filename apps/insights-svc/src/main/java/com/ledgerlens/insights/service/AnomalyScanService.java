package com.ledgerlens.insights.service;

import com.ledgerlens.insights.analytics.AnomalyDetectionService;
import com.ledgerlens.insights.config.InsightsProperties;
import com.ledgerlens.insights.model.Transaction;
import com.ledgerlens.insights.repository.TransactionRepository;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AnomalyScanService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyScanService.class);

    private final TransactionRepository transactionRepository;
    private final AnomalyDetectionService anomalyDetectionService;
    private final InsightsProperties properties;
    private final Clock clock;
    private final AtomicBoolean scanning = new AtomicBoolean(false);

    public AnomalyScanService(
            TransactionRepository transactionRepository,
            AnomalyDetectionService anomalyDetectionService,
            InsightsProperties properties,
            Clock clock
    ) {
        this.transactionRepository = transactionRepository;
        this.anomalyDetectionService = anomalyDetectionService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Re-runs anomaly detection over the stored snapshot and writes the annotated copies back.
     * A request arriving while a scan is in flight is ignored.
     */
    public ScanResult scan() {
        if (!scanning.compareAndSet(false, true)) {
            log.warn("Anomaly scan already in progress; ignoring request");
            return ScanResult.skipped();
        }
        try {
            List<Transaction> snapshot = transactionRepository.findAll();
            List<Transaction> annotated = anomalyDetectionService.detectAnomalies(snapshot, properties.anomaly());
            transactionRepository.updateAll(annotated);
            int flagged = (int) annotated.stream().filter(Transaction::anomaly).count();
            log.info("Anomaly scan completed: {} transactions scanned, {} flagged", annotated.size(), flagged);
            return ScanResult.completed(annotated.size(), flagged, clock.instant());
        } finally {
            scanning.set(false);
        }
    }

    public List<Transaction> openAnomalies() {
        return transactionRepository.findAll().stream()
                .filter(Transaction::isOpenAnomaly)
                .toList();
    }

    public Transaction dismissAnomaly(String transactionId) {
        return setDismissed(transactionId, true);
    }

    public Transaction restoreAnomaly(String transactionId) {
        return setDismissed(transactionId, false);
    }

    private Transaction setDismissed(String transactionId, boolean dismissed) {
        Transaction existing = transactionRepository.findById(transactionId)
                .orElseThrow(() -> new IllegalArgumentException("Transaction not found: " + transactionId));
        return transactionRepository.save(existing.withAnomalyDismissed(dismissed));
    }
}
