package com.ledgerlens.insights.controller;

import com.ledgerlens.insights.controller.dto.ExcludedMerchantResponseDto;
import com.ledgerlens.insights.controller.dto.RecurringPaymentResponseDto;
import com.ledgerlens.insights.controller.dto.RecurringSummaryResponseDto;
import com.ledgerlens.insights.controller.dto.ScanResponseDto;
import com.ledgerlens.insights.model.ExcludedMerchant;
import com.ledgerlens.insights.model.RecurringPayment;
import com.ledgerlens.insights.model.RecurringStatus;
import com.ledgerlens.insights.recurring.RecurringPaymentCalculator;
import com.ledgerlens.insights.service.RecurringPaymentService;
import com.ledgerlens.insights.service.ScanResult;
import com.ledgerlens.insights.web.RequestContextHolder;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/recurring-payments")
public class RecurringPaymentsController {

    private final RecurringPaymentService recurringPaymentService;
    private final RecurringPaymentCalculator recurringPaymentCalculator;

    public RecurringPaymentsController(
            RecurringPaymentService recurringPaymentService,
            RecurringPaymentCalculator recurringPaymentCalculator
    ) {
        this.recurringPaymentService = recurringPaymentService;
        this.recurringPaymentCalculator = recurringPaymentCalculator;
    }

    @PostMapping("/scan")
    public ResponseEntity<ScanResponseDto> scan() {
        ScanResult result = recurringPaymentService.scan();
        ScanResponseDto response = ScanResponseDto.from(result, RequestContextHolder.currentTraceId());
        return result.status() == ScanResult.Status.SKIPPED
                ? ResponseEntity.accepted().body(response)
                : ResponseEntity.ok(response);
    }

    @GetMapping
    public ResponseEntity<List<RecurringPaymentResponseDto>> listPayments(
            @RequestParam(value = "status", required = false) String status
    ) {
        Optional<RecurringStatus> wanted = Optional.ofNullable(status)
                .filter(value -> !value.isBlank())
                .map(RecurringStatus::fromValue);
        return ResponseEntity.ok(recurringPaymentService.listPayments(wanted).stream()
                .map(this::mapPayment)
                .toList());
    }

    @GetMapping("/summary")
    public ResponseEntity<RecurringSummaryResponseDto> summary() {
        RecurringPaymentService.RecurringSummary summary = recurringPaymentService.summary();
        return ResponseEntity.ok(new RecurringSummaryResponseDto(
                summary.activeCount(),
                summary.inactiveCount(),
                summary.totalMonthlyRecurring(),
                summary.lastScannedAt().orElse(null),
                RequestContextHolder.currentTraceId()
        ));
    }

    @PostMapping("/{paymentId}/not-recurring")
    public ResponseEntity<ExcludedMerchantResponseDto> markAsNotRecurring(@PathVariable("paymentId") UUID paymentId) {
        return ResponseEntity.ok(mapExclusion(recurringPaymentService.markAsNotRecurring(paymentId)));
    }

    @GetMapping("/exclusions")
    public ResponseEntity<List<ExcludedMerchantResponseDto>> listExclusions() {
        return ResponseEntity.ok(recurringPaymentService.listExclusions().stream()
                .map(this::mapExclusion)
                .toList());
    }

    @DeleteMapping("/exclusions")
    public ResponseEntity<Void> clearExclusions() {
        recurringPaymentService.clearExclusions();
        return ResponseEntity.noContent().build();
    }

    private RecurringPaymentResponseDto mapPayment(RecurringPayment payment) {
        return RecurringPaymentResponseDto.from(
                payment,
                recurringPaymentCalculator.monthlyAmount(payment.latestAmount(), payment.frequency())
        );
    }

    private ExcludedMerchantResponseDto mapExclusion(ExcludedMerchant excludedMerchant) {
        return new ExcludedMerchantResponseDto(excludedMerchant.normalizedName(), excludedMerchant.excludedAt());
    }
}
