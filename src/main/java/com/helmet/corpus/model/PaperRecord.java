package com.helmet.corpus.model;

import java.time.OffsetDateTime;
import java.util.UUID;

public record PaperRecord(
    UUID id,
    String externalSourceId,
    String rawContent,
    String contentHash,
    OffsetDateTime fetchedAt
) {}
