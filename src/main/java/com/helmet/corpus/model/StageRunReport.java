package com.helmet.corpus.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.UUID;

/**
 * @param skipped units another run claimed first
 * @param held    entries left RUNNING for the stage and not reclaimed by this run
 */
public record StageRunReport(
    Stage stage,
    int done,
    int failed,
    int skipped,
    int held,
    @JsonProperty("failed_paper_ids") List<UUID> failedPaperIds,
    String error
) {

    public static StageRunReport aborted(Stage stage, String error) {
        return new StageRunReport(stage, 0, 0, 0, 0, List.of(), error);
    }

    @JsonIgnore
    public boolean hasFailures() {
        return failed > 0 || error != null;
    }

    /**
     * True when the stage still has work this run did not finish.
     */
    @JsonIgnore
    public boolean isIncomplete() {
        return hasFailures() || held > 0;
    }

    /**
     * A stage run counts as a failure only when it could not run at all, or when it processed
     * something and nothing succeeded.
     */
    @JsonProperty("all_failed")
    public boolean allFailed() {
        return error != null || (failed > 0 && done == 0);
    }
}
