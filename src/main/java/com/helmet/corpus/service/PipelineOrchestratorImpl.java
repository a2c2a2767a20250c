package com.helmet.corpus.service;

import com.helmet.corpus.config.PipelineProperties;
import com.helmet.corpus.exception.ExtractionException;
import com.helmet.corpus.exception.GenerationException;
import com.helmet.corpus.generator.ArtifactGenerator;
import com.helmet.corpus.generator.GeneratorRegistry;
import com.helmet.corpus.generator.SynthesisBatchPolicy;
import com.helmet.corpus.model.ArtifactRecord;
import com.helmet.corpus.model.IndexEntry;
import com.helmet.corpus.model.IngestedPaper;
import com.helmet.corpus.model.LedgerEntry;
import com.helmet.corpus.model.LedgerStatus;
import com.helmet.corpus.model.PaperRecord;
import com.helmet.corpus.model.RunOptions;
import com.helmet.corpus.model.Stage;
import com.helmet.corpus.model.StageRunReport;
import com.helmet.corpus.model.WorkUnit;
import com.helmet.corpus.repository.LedgerRepository;
import com.helmet.corpus.repository.PaperRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Service
@Slf4j
public class PipelineOrchestratorImpl implements PipelineOrchestrator {

    private final PaperStore paperStore;
    private final IndexCatalog indexCatalog;
    private final PaperRepository paperRepository;
    private final LedgerRepository ledgerRepository;
    private final ArtifactCommitService commitService;
    private final GeneratorRegistry generatorRegistry;
    private final SynthesisBatchPolicy batchPolicy;
    private final PipelineProperties properties;
    private final Executor executor;

    public PipelineOrchestratorImpl(
        PaperStore paperStore,
        IndexCatalog indexCatalog,
        PaperRepository paperRepository,
        LedgerRepository ledgerRepository,
        ArtifactCommitService commitService,
        GeneratorRegistry generatorRegistry,
        SynthesisBatchPolicy batchPolicy,
        PipelineProperties properties,
        @Qualifier("pipelineTaskExecutor") Executor executor
    ) {
        this.paperStore = paperStore;
        this.indexCatalog = indexCatalog;
        this.paperRepository = paperRepository;
        this.ledgerRepository = ledgerRepository;
        this.commitService = commitService;
        this.generatorRegistry = generatorRegistry;
        this.batchPolicy = batchPolicy;
        this.properties = properties;
        this.executor = executor;
    }

    @Override
    @Transactional
    public IngestedPaper ingest(String externalSourceId, String rawContent, boolean overwrite) {
        PaperRecord paper = paperStore.put(externalSourceId, rawContent, overwrite);
        IndexEntry entry = indexCatalog.index(paper);
        return new IngestedPaper(paper, entry);
    }

    @Override
    public StageRunReport runStage(Stage stage, RunOptions options) {
        log.info("Starting stage {} (force={}, retryFailed={}, recover={})",
                 stage.stageName(), options.force(), options.retryFailed(), options.recover());

        recoverInterrupted(stage);
        Set<LedgerStatus> claimable = claimableStatuses(stage, options);
        int held = claimable.contains(LedgerStatus.RUNNING) ? 0 : ledgerRepository.countByStatus(stage, LedgerStatus.RUNNING);

        List<CompletableFuture<UnitOutcome>> futures;
        try (Stream<IndexEntry> candidates = indexCatalog.entriesFor(stage, claimable)) {
            futures = units(stage, candidates)
                .map(unit -> CompletableFuture.supplyAsync(() -> process(stage, unit, claimable, options), executor))
                .toList();
        }

        StageRunReport report = summarize(stage, futures.stream().map(CompletableFuture::join).toList(), held);
        log.info("Finished stage {}: done={}, failed={}, skipped={}, held={}",
                 stage.stageName(), report.done(), report.failed(), report.skipped(), report.held());
        if (held > 0) {
            log.warn("Stage {}: {} entries are still RUNNING; rerun with recover once no other run is alive",
                     stage.stageName(), held);
        }
        return report;
    }

    @Override
    public List<StageRunReport> runAll(RunOptions options) {
        List<StageRunReport> reports = new ArrayList<>();
        for (Stage stage : Stage.generationStages()) {
            try {
                reports.add(runStage(stage, options));
            } catch (DataAccessException e) {
                log.error("Stage {} aborted: {}", stage.stageName(), e.getMessage(), e);
                reports.add(StageRunReport.aborted(stage, e.getMessage()));
            }
        }
        return reports;
    }

    @Override
    public int recoverInterrupted(Stage stage) {
        List<UUID> recovered = ledgerRepository.resetStaleRunning(stage, properties.staleThresholdMinutes());
        if (!recovered.isEmpty()) {
            log.info("Stage {}: recovered {} interrupted entries", stage.stageName(), recovered.size());
        }
        return recovered.size();
    }

    /**
     * Indexing always re-attempts failed extractions; generation stages only on request.
     * RUNNING entries are taken over only when recovery is requested.
     */
    static Set<LedgerStatus> claimableStatuses(Stage stage, RunOptions options) {
        Set<LedgerStatus> statuses = EnumSet.of(LedgerStatus.PENDING);
        if (stage == Stage.INDEXING || options.retryFailed() || options.force()) {
            statuses.add(LedgerStatus.FAILED);
        }
        if (options.force()) {
            statuses.add(LedgerStatus.DONE);
        }
        if (options.recover()) {
            statuses.add(LedgerStatus.RUNNING);
        }
        return statuses;
    }

    private Stream<List<IndexEntry>> units(Stage stage, Stream<IndexEntry> candidates) {
        if (stage == Stage.EVIDENCE_SYNTHESIS) {
            return batchPolicy.partition(candidates.toList()).stream();
        }
        return candidates.map(List::of);
    }

    private UnitOutcome process(Stage stage, List<IndexEntry> members, Set<LedgerStatus> claimable, RunOptions options) {
        List<UUID> paperIds = members.stream().map(IndexEntry::paperId).toList();

        try {
            if (!claimAll(stage, members, claimable)) {
                log.debug("Stage {}: unit {} is held elsewhere, skipping", stage.stageName(), paperIds);
                return UnitOutcome.skipped(paperIds);
            }

            if (stage == Stage.INDEXING) {
                return reindex(members.get(0).paperId());
            }

            Map<UUID, PaperRecord> papers = paperRepository.findAllById(paperIds).stream()
                .collect(Collectors.toMap(PaperRecord::id, Function.identity()));

            ArtifactGenerator generator = generatorRegistry.forStage(stage);
            List<ArtifactRecord> artifacts = generator.generate(new WorkUnit(members, papers));

            commitService.commit(stage, paperIds, artifacts, options.force());
            return UnitOutcome.done(paperIds);

        } catch (GenerationException | ExtractionException e) {
            log.warn("Stage {}: generation failed for {}: {}", stage.stageName(), paperIds, e.getMessage());
            return fail(stage, paperIds, e.getMessage(), options.force());
        } catch (Exception e) {
            log.error("Stage {}: unit {} failed: {}", stage.stageName(), paperIds, e.getMessage(), e);
            return fail(stage, paperIds, e.getMessage(), options.force());
        }
    }

    private boolean claimAll(Stage stage, List<IndexEntry> members, Set<LedgerStatus> claimable) {
        List<LedgerEntry> claimed = new ArrayList<>();
        for (IndexEntry member : members) {
            LedgerEntry previous = members.size() > 1 ? snapshot(member.paperId(), stage) : null;
            if (!ledgerRepository.claim(member.paperId(), stage, claimable)) {
                if (!claimed.isEmpty()) {
                    commitService.release(stage, claimed);
                }
                return false;
            }
            if (previous != null) {
                claimed.add(previous);
            }
        }
        return true;
    }

    private LedgerEntry snapshot(UUID paperId, Stage stage) {
        return ledgerRepository.find(paperId, stage)
            .orElseGet(() -> new LedgerEntry(paperId, stage, LedgerStatus.PENDING, null, 0, null));
    }

    private UnitOutcome reindex(UUID paperId) {
        PaperRecord paper = paperStore.get(paperId);
        IndexEntry entry = indexCatalog.index(paper);
        return entry.statusFor(Stage.INDEXING) == LedgerStatus.DONE
            ? UnitOutcome.done(List.of(paperId))
            : UnitOutcome.failed(List.of(paperId));
    }

    private UnitOutcome fail(Stage stage, List<UUID> paperIds, String error, boolean discard) {
        try {
            commitService.fail(stage, paperIds, error, discard);
        } catch (DataAccessException e) {
            log.error("Stage {}: could not record failure for {}, leaving them to the stale sweep: {}",
                      stage.stageName(), paperIds, e.getMessage(), e);
        }
        return UnitOutcome.failed(paperIds);
    }

    private static StageRunReport summarize(Stage stage, List<UnitOutcome> outcomes, int held) {
        int done = 0;
        int failed = 0;
        int skipped = 0;
        List<UUID> failedIds = new ArrayList<>();

        for (UnitOutcome outcome : outcomes) {
            switch (outcome.status()) {
                case DONE -> done += outcome.paperIds().size();
                case FAILED -> {
                    failed += outcome.paperIds().size();
                    failedIds.addAll(outcome.paperIds());
                }
                default -> skipped += outcome.paperIds().size();
            }
        }
        return new StageRunReport(stage, done, failed, skipped, held, List.copyOf(failedIds), null);
    }

    private record UnitOutcome(LedgerStatus status, List<UUID> paperIds) {

        static UnitOutcome done(List<UUID> paperIds) {
            return new UnitOutcome(LedgerStatus.DONE, paperIds);
        }

        static UnitOutcome failed(List<UUID> paperIds) {
            return new UnitOutcome(LedgerStatus.FAILED, paperIds);
        }

        static UnitOutcome skipped(List<UUID> paperIds) {
            return new UnitOutcome(LedgerStatus.PENDING, paperIds);
        }
    }
}
