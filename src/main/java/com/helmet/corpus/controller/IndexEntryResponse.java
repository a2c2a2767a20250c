package com.helmet.corpus.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.helmet.corpus.model.IndexEntry;
import com.helmet.corpus.model.LedgerEntry;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record IndexEntryResponse(
    @JsonProperty("paper_id")
    UUID paperId,

    @JsonProperty("insertion_seq")
    long insertionSeq,

    String title,

    @JsonProperty("abstract")
    String abstractText,

    @JsonProperty("source_metadata")
    Map<String, String> sourceMetadata,

    List<LedgerEntryResponse> ledger,

    @JsonProperty("created_at")
    OffsetDateTime createdAt,

    @JsonProperty("updated_at")
    OffsetDateTime updatedAt
) {

    static IndexEntryResponse from(IndexEntry entry, List<LedgerEntry> ledger) {
        return new IndexEntryResponse(
            entry.paperId(),
            entry.insertionSeq(),
            entry.title(),
            entry.abstractText(),
            entry.sourceMetadata(),
            ledger.stream().map(LedgerEntryResponse::from).toList(),
            entry.createdAt(),
            entry.updatedAt()
        );
    }
}
