package com.helmet.corpus.service;

import com.helmet.corpus.model.IngestedPaper;
import com.helmet.corpus.model.RunOptions;
import com.helmet.corpus.model.Stage;
import com.helmet.corpus.model.StageRunReport;

import java.util.List;

public interface PipelineOrchestrator {

    /**
     * Stores a fetched paper and indexes it in the same transaction.
     */
    IngestedPaper ingest(String externalSourceId, String rawContent, boolean overwrite);

    StageRunReport runStage(Stage stage, RunOptions options);

    /**
     * Runs every generation stage in turn; a stage that aborts does not stop the next one.
     */
    List<StageRunReport> runAll(RunOptions options);

    /**
     * Returns RUNNING entries older than the stale threshold to PENDING.
     *
     * @return number of entries recovered
     */
    int recoverInterrupted(Stage stage);
}
