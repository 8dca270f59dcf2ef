package com.ledgerlens.insights.controller;

import com.ledgerlens.insights.controller.dto.ScanResponseDto;
import com.ledgerlens.insights.controller.dto.TransactionResponseDto;
import com.ledgerlens.insights.service.AnomalyScanService;
import com.ledgerlens.insights.service.ScanResult;
import com.ledgerlens.insights.web.RequestContextHolder;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/anomalies")
public class AnomaliesController {

    private final AnomalyScanService anomalyScanService;

    public AnomaliesController(AnomalyScanService anomalyScanService) {
        this.anomalyScanService = anomalyScanService;
    }

    @PostMapping("/scan")
    public ResponseEntity<ScanResponseDto> scan() {
        ScanResult result = anomalyScanService.scan();
        ScanResponseDto response = ScanResponseDto.from(result, RequestContextHolder.currentTraceId());
        return result.status() == ScanResult.Status.SKIPPED
                ? ResponseEntity.accepted().body(response)
                : ResponseEntity.ok(response);
    }

    @GetMapping
    public ResponseEntity<List<TransactionResponseDto>> openAnomalies() {
        return ResponseEntity.ok(anomalyScanService.openAnomalies().stream()
                .map(TransactionResponseDto::from)
                .toList());
    }
}
