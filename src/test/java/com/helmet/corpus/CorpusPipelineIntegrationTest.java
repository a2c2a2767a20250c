package com.helmet.corpus;

import com.helmet.corpus.exception.ConflictException;
import com.helmet.corpus.model.IndexEntry;
import com.helmet.corpus.model.IngestedPaper;
import com.helmet.corpus.model.LedgerEntry;
import com.helmet.corpus.model.LedgerStatus;
import com.helmet.corpus.model.RunOptions;
import com.helmet.corpus.model.Stage;
import com.helmet.corpus.model.StageRunReport;
import com.helmet.corpus.repository.ArtifactRepository;
import com.helmet.corpus.repository.BaseIntegrationTest;
import com.helmet.corpus.repository.LedgerRepository;
import com.helmet.corpus.service.IndexCatalog;
import com.helmet.corpus.service.PaperStore;
import com.helmet.corpus.service.PipelineOrchestrator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CorpusPipelineIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private PipelineOrchestrator orchestrator;

    @Autowired
    private PaperStore paperStore;

    @Autowired
    private IndexCatalog indexCatalog;

    @Autowired
    private LedgerRepository ledgerRepository;

    @Autowired
    private ArtifactRepository artifactRepository;

    @Nested
    @DisplayName("Ingestion")
    class IngestionTest {

        @Test
        @DisplayName("Ingesting the same paper twice keeps one record and one index position")
        void shouldBeIdempotent() {
            IngestedPaper first = orchestrator.ingest("PMC1", PaperFixtures.rawPaper("PMC1"), false);
            IngestedPaper second = orchestrator.ingest("PMC1", PaperFixtures.rawPaper("PMC1"), false);

            assertThat(second.paper()).isEqualTo(first.paper());
            assertThat(second.entry().insertionSeq()).isEqualTo(first.entry().insertionSeq());
            assertThat(jdbcClient.sql("SELECT COUNT(*) FROM papers").query(Long.class).single()).isEqualTo(1L);
        }

        @Test
        @DisplayName("Identical content under different source ids yields distinct papers")
        void shouldNotDeduplicateByContent() {
            String raw = PaperFixtures.rawPaper("PMC1");

            UUID first = orchestrator.ingest("PMC1", raw, false).paper().id();
            UUID second = orchestrator.ingest("PMC1-mirror", raw, false).paper().id();

            assertThat(first).isNotEqualTo(second);
            assertThat(indexCatalog.get(first).insertionSeq()).isLessThan(indexCatalog.get(second).insertionSeq());
        }

        @Test
        @DisplayName("Changed content without overwrite is a conflict and leaves the stored paper intact")
        void shouldRejectChangedContent() {
            UUID paperId = orchestrator.ingest("PMC1", PaperFixtures.rawPaper("PMC1"), false).paper().id();
            String changed = PaperFixtures.rawPaper("PMC1", "Revised title", PaperFixtures.ABSTRACT, "cea", null);

            assertThatThrownBy(() -> orchestrator.ingest("PMC1", changed, false)).isInstanceOf(ConflictException.class);
            assertThat(indexCatalog.get(paperId).title()).isEqualTo("Cost-effectiveness of Drug X");

            orchestrator.ingest("PMC1", changed, true);
            assertThat(indexCatalog.get(paperId).title()).isEqualTo("Revised title");
        }

        @Test
        @DisplayName("Content without a title is indexed with indexing FAILED")
        void shouldRecordExtractionFailure() {
            IngestedPaper ingested = orchestrator.ingest("PMC5", "{\"pmcid\": \"PMC5\", \"abstract\": \"Only an abstract here.\"}", false);

            assertThat(ingested.entry().statusFor(Stage.INDEXING)).isEqualTo(LedgerStatus.FAILED);
            assertThat(ingested.entry().abstractText()).isEqualTo("Only an abstract here.");
        }
    }

    @Nested
    @DisplayName("Stage runs")
    class StageRunTest {

        @Test
        @DisplayName("A full run derives every artifact and a rerun adds nothing")
        void shouldGenerateOnceAndRerunAsNoOp() {
            List<UUID> ids = ingestThree();

            List<StageRunReport> reports = orchestrator.runAll(RunOptions.defaults());

            assertThat(reports).allSatisfy(report -> assertThat(report.hasFailures()).isFalse());
            assertThat(reports).extracting(StageRunReport::done).containsExactly(3, 3, 3);
            for (UUID id : ids) {
                assertThat(artifactRepository.countByPaperId(Stage.EXTRACTION_QUERY, id)).isEqualTo(2);
                assertThat(artifactRepository.countByPaperId(Stage.EVIDENCE_SYNTHESIS, id)).isEqualTo(1);
                assertThat(artifactRepository.countByPaperId(Stage.LABELING, id)).isEqualTo(2);
            }
            assertThat(artifactRepository.findByPaperId(Stage.EVIDENCE_SYNTHESIS, ids.get(0)).get(0).references())
                .containsExactlyElementsOf(ids);

            List<StageRunReport> rerun = orchestrator.runAll(RunOptions.defaults());

            assertThat(rerun).extracting(StageRunReport::done).containsExactly(0, 0, 0);
            assertThat(jdbcClient.sql("SELECT COUNT(*) FROM query_artifacts").query(Long.class).single()).isEqualTo(6L);
            assertThat(jdbcClient.sql("SELECT COUNT(*) FROM synthesis_artifacts").query(Long.class).single()).isEqualTo(1L);
            for (Stage stage : Stage.generationStages()) {
                assertThat(indexCatalog.pendingFor(stage)).isEmpty();
            }
        }

        @Test
        @DisplayName("A failing paper is recorded as FAILED and only retried on request")
        void shouldIsolateAndRetryFailures() {
            ingestThree();
            UUID broken = orchestrator.ingest("PMC4",
                PaperFixtures.rawPaper("PMC4", "No abstract", null, "bia", PaperFixtures.FULL_TEXT), false).paper().id();

            StageRunReport first = orchestrator.runStage(Stage.EXTRACTION_QUERY, RunOptions.defaults());

            assertThat(first.done()).isEqualTo(3);
            assertThat(first.failedPaperIds()).containsExactly(broken);
            LedgerEntry ledger = ledgerRepository.find(broken, Stage.EXTRACTION_QUERY).orElseThrow();
            assertThat(ledger.status()).isEqualTo(LedgerStatus.FAILED);
            assertThat(ledger.errorMessage()).contains("Abstract");
            assertThat(indexCatalog.pendingFor(Stage.EXTRACTION_QUERY)).extracting(IndexEntry::paperId).containsExactly(broken);

            StageRunReport rerun = orchestrator.runStage(Stage.EXTRACTION_QUERY, RunOptions.defaults());
            assertThat(rerun.failed()).isZero();

            StageRunReport retry = orchestrator.runStage(Stage.EXTRACTION_QUERY, new RunOptions(false, true));
            assertThat(retry.failedPaperIds()).containsExactly(broken);
            assertThat(ledgerRepository.find(broken, Stage.EXTRACTION_QUERY).orElseThrow().attempts()).isEqualTo(2);
        }

        @Test
        @DisplayName("Work interrupted mid-run is reported as held and completed exactly once on recover")
        void shouldRecoverInterruptedWork() {
            List<UUID> ids = ingestThree();
            UUID interrupted = ids.get(2);

            // a worker took the paper and died before committing
            ledgerRepository.claim(interrupted, Stage.LABELING, EnumSet.of(LedgerStatus.PENDING));

            StageRunReport beforeRecovery = orchestrator.runStage(Stage.LABELING, RunOptions.defaults());
            assertThat(beforeRecovery.done()).isEqualTo(2);
            assertThat(beforeRecovery.held()).isEqualTo(1);
            assertThat(beforeRecovery.isIncomplete()).isTrue();
            assertThat(indexCatalog.pendingFor(Stage.LABELING)).extracting(IndexEntry::paperId).containsExactly(interrupted);
            assertThat(artifactRepository.countByPaperId(Stage.LABELING, interrupted)).isZero();

            StageRunReport afterRecovery = orchestrator.runStage(Stage.LABELING, new RunOptions(false, false, true));
            assertThat(afterRecovery.done()).isEqualTo(1);
            assertThat(afterRecovery.held()).isZero();
            assertThat(artifactRepository.countByPaperId(Stage.LABELING, interrupted)).isEqualTo(2);
            assertThat(jdbcClient.sql("SELECT COUNT(*) FROM label_artifacts").query(Long.class).single()).isEqualTo(6L);

            StageRunReport rerun = orchestrator.runStage(Stage.LABELING, new RunOptions(false, false, true));
            assertThat(rerun.done()).isZero();
            assertThat(jdbcClient.sql("SELECT COUNT(*) FROM label_artifacts").query(Long.class).single()).isEqualTo(6L);
        }
    }

    @Nested
    @DisplayName("Force")
    class ForceTest {

        @Test
        @DisplayName("Force regenerates artifacts in place without duplicating them")
        void shouldReplaceArtifactsWithForce() {
            List<UUID> ids = ingestThree();
            orchestrator.runStage(Stage.EXTRACTION_QUERY, RunOptions.defaults());
            OffsetDateTime firstGeneration = artifactRepository.findByPaperId(Stage.EXTRACTION_QUERY, ids.get(0)).get(0).generatedAt();

            StageRunReport forced = orchestrator.runStage(Stage.EXTRACTION_QUERY, new RunOptions(true, false));

            assertThat(forced.done()).isEqualTo(3);
            assertThat(artifactRepository.countByPaperId(Stage.EXTRACTION_QUERY, ids.get(0))).isEqualTo(2);
            assertThat(artifactRepository.findByPaperId(Stage.EXTRACTION_QUERY, ids.get(0)).get(0).generatedAt())
                .isAfterOrEqualTo(firstGeneration);
        }

        @Test
        @DisplayName("Forced queries drop records the new generation no longer produces")
        void shouldDropSupersededQueries() {
            UUID paperId = ingestThree().get(0);
            orchestrator.runStage(Stage.EXTRACTION_QUERY, RunOptions.defaults());
            orchestrator.ingest("PMC1",
                PaperFixtures.rawPaper("PMC1", "Shorter", "Drug X reduced cost by $500.", "cea", null), true);

            orchestrator.runStage(Stage.EXTRACTION_QUERY, new RunOptions(true, false));

            assertThat(artifactRepository.countByPaperId(Stage.EXTRACTION_QUERY, paperId)).isEqualTo(1);
            assertThat(jdbcClient.sql("SELECT COUNT(*) FROM query_artifacts").query(Long.class).single()).isEqualTo(5L);
        }

        @Test
        @DisplayName("A forced regeneration that fails leaves no artifacts behind")
        void shouldDiscardArtifactsOnFailedForce() {
            UUID paperId = ingestThree().get(0);
            orchestrator.runStage(Stage.EXTRACTION_QUERY, RunOptions.defaults());
            orchestrator.ingest("PMC1", PaperFixtures.rawPaper("PMC1", "No abstract", null, "cea", null), true);

            StageRunReport forced = orchestrator.runStage(Stage.EXTRACTION_QUERY, new RunOptions(true, false));

            assertThat(forced.failedPaperIds()).containsExactly(paperId);
            assertThat(ledgerRepository.find(paperId, Stage.EXTRACTION_QUERY).orElseThrow().status()).isEqualTo(LedgerStatus.FAILED);
            assertThat(artifactRepository.countByPaperId(Stage.EXTRACTION_QUERY, paperId)).isZero();
        }

        @Test
        @DisplayName("Forced labels replace each paper's items")
        void shouldReplaceLabels() {
            List<UUID> ids = ingestThree();
            orchestrator.runStage(Stage.LABELING, RunOptions.defaults());

            StageRunReport forced = orchestrator.runStage(Stage.LABELING, new RunOptions(true, false));

            assertThat(forced.done()).isEqualTo(3);
            for (UUID id : ids) {
                assertThat(artifactRepository.countByPaperId(Stage.LABELING, id)).isEqualTo(2);
            }
            assertThat(jdbcClient.sql("SELECT COUNT(*) FROM label_artifacts").query(Long.class).single()).isEqualTo(6L);
        }

        @Test
        @DisplayName("A regrouped forced synthesis supersedes the earlier batches")
        void shouldSupersedeEarlierBatches() {
            UUID first = orchestrator.ingest("PMC1", PaperFixtures.rawPaper("PMC1"), false).paper().id();
            UUID second = orchestrator.ingest("PMC2", PaperFixtures.rawPaper("PMC2"), false).paper().id();
            orchestrator.runStage(Stage.EVIDENCE_SYNTHESIS, RunOptions.defaults());
            UUID third = orchestrator.ingest("PMC3", PaperFixtures.rawPaper("PMC3"), false).paper().id();
            orchestrator.runStage(Stage.EVIDENCE_SYNTHESIS, RunOptions.defaults());
            assertThat(jdbcClient.sql("SELECT COUNT(*) FROM synthesis_artifacts").query(Long.class).single()).isEqualTo(2L);

            StageRunReport forced = orchestrator.runStage(Stage.EVIDENCE_SYNTHESIS, new RunOptions(true, false));

            assertThat(forced.done()).isEqualTo(3);
            for (UUID id : List.of(first, second, third)) {
                assertThat(artifactRepository.countByPaperId(Stage.EVIDENCE_SYNTHESIS, id)).isEqualTo(1);
            }
            assertThat(jdbcClient.sql("SELECT COUNT(*) FROM synthesis_artifacts").query(Long.class).single()).isEqualTo(1L);
            assertThat(artifactRepository.findByPaperId(Stage.EVIDENCE_SYNTHESIS, first).get(0).references())
                .containsExactly(first, second, third);
        }
    }

    @Nested
    @DisplayName("Ledger")
    class LedgerTest {

        @Test
        @DisplayName("Overwriting a paper does not reset its completed stages")
        void shouldKeepLedgerOnOverwrite() {
            UUID paperId = ingestThree().get(0);
            orchestrator.runStage(Stage.EXTRACTION_QUERY, RunOptions.defaults());

            orchestrator.ingest("PMC1", PaperFixtures.rawPaper("PMC1", "Revised", PaperFixtures.ABSTRACT, "cea", null), true);

            assertThat(ledgerRepository.find(paperId, Stage.EXTRACTION_QUERY).orElseThrow().status()).isEqualTo(LedgerStatus.DONE);
        }
    }

    @Nested
    @DisplayName("Purge")
    class PurgeTest {

        @Test
        @DisplayName("Referenced papers cannot be purged, unreferenced ones take their index entry along")
        void shouldGuardReferencedPapers() {
            List<UUID> ids = ingestThree();
            orchestrator.runStage(Stage.EXTRACTION_QUERY, RunOptions.defaults());
            UUID unprocessed = orchestrator.ingest("PMC9", PaperFixtures.rawPaper("PMC9"), false).paper().id();

            assertThatThrownBy(() -> paperStore.purge(ids.get(0))).isInstanceOf(ConflictException.class);

            paperStore.purge(unprocessed);

            assertThat(paperStore.findByExternalSourceId("PMC9")).isEmpty();
            assertThat(jdbcClient.sql("SELECT COUNT(*) FROM stage_ledger WHERE paper_id = :id")
                .param("id", unprocessed).query(Long.class).single()).isZero();
        }
    }

    private List<UUID> ingestThree() {
        return List.of("PMC1", "PMC2", "PMC3").stream()
            .map(pmcid -> orchestrator.ingest(pmcid, PaperFixtures.rawPaper(pmcid), false).paper().id())
            .toList();
    }
}
