package com.helmet.corpus.model;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

public record IndexEntry(
    UUID paperId,
    long insertionSeq,
    String title,
    String abstractText,
    Map<String, String> sourceMetadata,
    Map<Stage, LedgerStatus> ledger,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {

    public LedgerStatus statusFor(Stage stage) {
        return ledger.getOrDefault(stage, LedgerStatus.PENDING);
    }

    public boolean hasAbstract() {
        return abstractText != null && !abstractText.isBlank();
    }

    public String metadata(String field) {
        return sourceMetadata.get(field);
    }
}
