package com.helmet.corpus.controller;

import com.helmet.corpus.model.IndexEntry;
import com.helmet.corpus.model.IngestedPaper;
import com.helmet.corpus.service.IndexCatalog;
import com.helmet.corpus.service.PaperStore;
import com.helmet.corpus.service.PipelineOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequiredArgsConstructor
public class PaperController {

    private final PipelineOrchestrator orchestrator;
    private final PaperStore paperStore;
    private final IndexCatalog indexCatalog;

    @PutMapping("/papers/{externalSourceId}")
    public ResponseEntity<IngestResponse> putPaper(
        @PathVariable String externalSourceId,
        @RequestParam(defaultValue = "false") boolean overwrite,
        @Valid @RequestBody PaperRequest request) {

        boolean existed = paperStore.findByExternalSourceId(externalSourceId).isPresent();

        IngestedPaper ingested = orchestrator.ingest(externalSourceId, request.rawContent(), overwrite);
        IngestResponse response = new IngestResponse(
            PaperResponse.from(ingested.paper()),
            IndexEntryResponse.from(ingested.entry(), indexCatalog.ledger(ingested.paper().id()))
        );

        return ResponseEntity.status(existed ? HttpStatus.OK : HttpStatus.CREATED).body(response);
    }

    @GetMapping("/papers/{id}")
    public ResponseEntity<PaperResponse> getPaper(@PathVariable UUID id) {
        return ResponseEntity.ok(PaperResponse.from(paperStore.get(id)));
    }

    @DeleteMapping("/papers/{id}")
    public ResponseEntity<Void> purgePaper(@PathVariable UUID id) {
        paperStore.purge(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/index/{paperId}")
    public ResponseEntity<IndexEntryResponse> getIndexEntry(@PathVariable UUID paperId) {
        IndexEntry entry = indexCatalog.get(paperId);
        return ResponseEntity.ok(IndexEntryResponse.from(entry, indexCatalog.ledger(paperId)));
    }
}
