package com.helmet.corpus.controller;

import com.helmet.corpus.model.RunOptions;
import com.helmet.corpus.model.Stage;
import com.helmet.corpus.model.StageRunReport;
import com.helmet.corpus.service.PipelineOrchestrator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class StageRunController {

    private final PipelineOrchestrator orchestrator;

    /**
     * Runs synchronously and answers with the run's report.
     */
    @PostMapping("/stages/{stage}/runs")
    public ResponseEntity<StageRunReport> runStage(
        @PathVariable String stage,
        @RequestParam(defaultValue = "false") boolean force,
        @RequestParam(name = "retry_failed", defaultValue = "false") boolean retryFailed,
        @RequestParam(defaultValue = "false") boolean recover) {

        StageRunReport report = orchestrator.runStage(Stage.fromName(stage), new RunOptions(force, retryFailed, recover));
        return ResponseEntity.ok(report);
    }
}
