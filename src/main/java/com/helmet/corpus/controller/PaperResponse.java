package com.helmet.corpus.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.helmet.corpus.model.PaperRecord;

import java.time.OffsetDateTime;
import java.util.UUID;

public record PaperResponse(
    UUID id,

    @JsonProperty("external_source_id")
    String externalSourceId,

    @JsonProperty("raw_content")
    String rawContent,

    @JsonProperty("content_hash")
    String contentHash,

    @JsonProperty("fetched_at")
    OffsetDateTime fetchedAt
) {

    static PaperResponse from(PaperRecord paper) {
        return new PaperResponse(paper.id(), paper.externalSourceId(), paper.rawContent(), paper.contentHash(), paper.fetchedAt());
    }
}
