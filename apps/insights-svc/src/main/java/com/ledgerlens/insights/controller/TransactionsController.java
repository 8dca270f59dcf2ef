package com.ledgerlens.insights.controller;

import com.ledgerlens.insights.controller.dto.TransactionResponseDto;
import com.ledgerlens.insights.controller.dto.TransactionsImportRequestDto;
import com.ledgerlens.insights.controller.dto.TransactionsImportResponseDto;
import com.ledgerlens.insights.controller.dto.TransactionRequestDto;
import com.ledgerlens.insights.model.Transaction;
import com.ledgerlens.insights.service.AnomalyScanService;
import com.ledgerlens.insights.service.TransactionService;
import com.ledgerlens.insights.web.RequestContextHolder;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/transactions")
public class TransactionsController {

    private final TransactionService transactionService;
    private final AnomalyScanService anomalyScanService;

    public TransactionsController(TransactionService transactionService, AnomalyScanService anomalyScanService) {
        this.transactionService = transactionService;
        this.anomalyScanService = anomalyScanService;
    }

    @PostMapping
    public ResponseEntity<TransactionsImportResponseDto> importTransactions(
            @RequestBody @Valid TransactionsImportRequestDto request
    ) {
        List<Transaction> transactions = request.transactions().stream()
                .map(TransactionRequestDto::toTransaction)
                .toList();
        int imported = transactionService.importTransactions(transactions);
        return ResponseEntity.ok(new TransactionsImportResponseDto(imported, RequestContextHolder.currentTraceId()));
    }

    @GetMapping
    public ResponseEntity<List<TransactionResponseDto>> listTransactions(
            @RequestParam(value = "anomaliesOnly", required = false, defaultValue = "false") boolean anomaliesOnly
    ) {
        List<TransactionResponseDto> response = transactionService.listTransactions(anomaliesOnly).stream()
                .map(TransactionResponseDto::from)
                .toList();
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{transactionId}/dismiss-anomaly")
    public ResponseEntity<TransactionResponseDto> dismissAnomaly(@PathVariable("transactionId") String transactionId) {
        return ResponseEntity.ok(TransactionResponseDto.from(anomalyScanService.dismissAnomaly(transactionId)));
    }

    @PostMapping("/{transactionId}/restore-anomaly")
    public ResponseEntity<TransactionResponseDto> restoreAnomaly(@PathVariable("transactionId") String transactionId) {
        return ResponseEntity.ok(TransactionResponseDto.from(anomalyScanService.restoreAnomaly(transactionId)));
    }
}
