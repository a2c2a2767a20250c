package com.helmet.corpus.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.helmet.corpus.model.LedgerEntry;
import com.helmet.corpus.model.LedgerStatus;
import com.helmet.corpus.model.Stage;

import java.time.OffsetDateTime;

public record LedgerEntryResponse(
    Stage stage,

    LedgerStatus status,

    @JsonProperty("error_message")
    String errorMessage,

    int attempts,

    @JsonProperty("updated_at")
    OffsetDateTime updatedAt
) {

    static LedgerEntryResponse from(LedgerEntry entry) {
        return new LedgerEntryResponse(entry.stage(), entry.status(), entry.errorMessage(), entry.attempts(), entry.updatedAt());
    }
}
