package com.helmet.corpus.model;

import java.time.OffsetDateTime;
import java.util.UUID;

public record LedgerEntry(
    UUID paperId,
    Stage stage,
    LedgerStatus status,
    String errorMessage,
    int attempts,
    OffsetDateTime updatedAt
) {}
