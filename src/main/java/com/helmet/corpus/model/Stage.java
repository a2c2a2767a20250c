package com.helmet.corpus.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

public enum Stage {
    INDEXING("indexing", null),
    EXTRACTION_QUERY("query", "query_artifacts"),
    EVIDENCE_SYNTHESIS("slr", "synthesis_artifacts"),
    LABELING("label", "label_artifacts");

    private final String stageName;
    private final String artifactTable;

    Stage(String stageName, String artifactTable) {
        this.stageName = stageName;
        this.artifactTable = artifactTable;
    }

    @JsonValue
    public String stageName() {
        return stageName;
    }

    /**
     * Name of the derived store the stage writes into; {@code null} for {@link #INDEXING}.
     */
    public String artifactTable() {
        return artifactTable;
    }

    public boolean producesArtifacts() {
        return artifactTable != null;
    }

    public static List<Stage> generationStages() {
        return List.of(EXTRACTION_QUERY, EVIDENCE_SYNTHESIS, LABELING);
    }

    public static Stage fromName(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(stage -> stage.stageName.equals(normalized) || stage.name().equalsIgnoreCase(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown stage: " + name));
    }
}
