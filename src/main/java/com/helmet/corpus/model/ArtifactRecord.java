package com.helmet.corpus.model;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One generated unit of output. {@code paperId} is the join key into the index catalog;
 * {@code references} lists every paper the artifact was derived from (a single id except
 * for evidence synthesis).
 */
public record ArtifactRecord(
    UUID artifactId,
    UUID paperId,
    Stage stage,
    int sequenceIndex,
    List<UUID> references,
    Map<String, Object> payload,
    String generatorVersion,
    OffsetDateTime generatedAt
) {}
