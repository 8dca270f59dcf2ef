package com.ledgerlens.insights.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record TransactionsImportRequestDto(@NotNull List<@Valid TransactionRequestDto> transactions) {
}
