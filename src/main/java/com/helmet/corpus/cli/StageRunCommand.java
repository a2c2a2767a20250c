package com.helmet.corpus.cli;

import com.helmet.corpus.model.RunOptions;
import com.helmet.corpus.model.Stage;
import com.helmet.corpus.model.StageRunReport;
import com.helmet.corpus.service.PipelineOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * {@code --stage=<indexing|query|slr|label|all> [--force] [--retry-failed] [--recover]}
 * <p>
 * Exits non-zero while entries are left FAILED or RUNNING.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StageRunCommand implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_PARTIAL_FAILURE = 1;
    static final int EXIT_STAGE_FAILED = 2;
    static final int EXIT_USAGE = 64;

    private static final String ALL_STAGES = "all";

    private final PipelineOrchestrator orchestrator;

    private int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption("stage")) {
            return;
        }

        List<String> values = args.getOptionValues("stage");
        String stageName = values.isEmpty() ? "" : values.get(0);
        RunOptions options = new RunOptions(
            args.containsOption("force"), args.containsOption("retry-failed"), args.containsOption("recover"));

        List<StageRunReport> reports;
        if (ALL_STAGES.equalsIgnoreCase(stageName.trim())) {
            reports = orchestrator.runAll(options);
        } else {
            Stage stage;
            try {
                stage = Stage.fromName(stageName);
            } catch (IllegalArgumentException e) {
                log.error("{}. Expected one of indexing, query, slr, label, all", e.getMessage());
                exitCode = EXIT_USAGE;
                return;
            }
            reports = List.of(orchestrator.runStage(stage, options));
        }

        reports.forEach(report -> log.info("{}: done={}, failed={}, skipped={}, held={}{}",
            report.stage().stageName(), report.done(), report.failed(), report.skipped(), report.held(),
            report.error() != null ? ", aborted: " + report.error() : ""));

        exitCode = exitCodeFor(reports);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static int exitCodeFor(List<StageRunReport> reports) {
        if (reports.stream().anyMatch(StageRunReport::allFailed)) {
            return EXIT_STAGE_FAILED;
        }
        if (reports.stream().anyMatch(StageRunReport::isIncomplete)) {
            return EXIT_PARTIAL_FAILURE;
        }
        return EXIT_OK;
    }
}
