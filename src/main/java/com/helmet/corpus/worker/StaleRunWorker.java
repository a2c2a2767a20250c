package com.helmet.corpus.worker;

import com.helmet.corpus.model.Stage;
import com.helmet.corpus.service.PipelineOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Returns work abandoned by a crashed or killed run to PENDING so the next run picks it up.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StaleRunWorker {

    private final PipelineOrchestrator orchestrator;

    @Scheduled(fixedDelayString = "${app.worker.stale-check-interval-ms:60000}")
    public void recoverStaleRuns() {
        log.debug("Checking for stale RUNNING ledger entries...");

        int recovered = 0;
        for (Stage stage : Stage.values()) {
            recovered += orchestrator.recoverInterrupted(stage);
        }

        if (recovered > 0) {
            log.info("Maintenance returned {} stale entries to PENDING", recovered);
        }
    }
}
