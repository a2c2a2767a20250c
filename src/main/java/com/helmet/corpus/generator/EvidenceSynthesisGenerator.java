package com.helmet.corpus.generator;

import com.helmet.corpus.config.GeneratorProperties;
import com.helmet.corpus.exception.GenerationException;
import com.helmet.corpus.model.ArtifactRecord;
import com.helmet.corpus.model.IndexEntry;
import com.helmet.corpus.model.Stage;
import com.helmet.corpus.model.WorkUnit;
import com.helmet.corpus.util.StableIds;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One synthesis query per batch of related papers. The artifact is keyed by the batch, stored
 * under its anchor paper and lists every member as a reference.
 */
@Slf4j
@Component
public final class EvidenceSynthesisGenerator implements ArtifactGenerator {

    private final GeneratorProperties properties;
    private final Clock clock;

    public EvidenceSynthesisGenerator(GeneratorProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public Stage stage() {
        return Stage.EVIDENCE_SYNTHESIS;
    }

    @Override
    public String version() {
        return properties.version();
    }

    @Override
    public List<ArtifactRecord> generate(WorkUnit unit) {
        List<IndexEntry> members = unit.entries();
        if (members.isEmpty()) {
            throw new IllegalArgumentException("Synthesis batch cannot be empty");
        }

        List<UUID> missingAbstract = members.stream()
            .filter(entry -> !entry.hasAbstract())
            .map(IndexEntry::paperId)
            .toList();
        if (!missingAbstract.isEmpty()) {
            throw new GenerationException(missingAbstract.get(0), stage(),
                "Abstract is required for every paper of a synthesis batch, missing for " + missingAbstract);
        }

        List<UUID> references = unit.paperIds();
        UUID batchId = StableIds.batchId(references);
        UUID anchor = references.stream()
            .min(Comparator.comparing(UUID::toString))
            .orElseThrow();

        String groupBy = properties.synthesis().groupBy();
        String topic = members.get(0).metadata(groupBy);

        List<Map<String, Object>> studies = new ArrayList<>(members.size());
        for (IndexEntry member : members) {
            Map<String, Object> study = new LinkedHashMap<>();
            study.put("paper_id", member.paperId().toString());
            putIfPresent(study, "pmcid", member.metadata("pmcid"));
            putIfPresent(study, "first_author", member.metadata("first_author"));
            putIfPresent(study, "year", member.metadata("year"));
            putIfPresent(study, "title", member.title());
            study.put("abstract", member.abstractText());
            studies.add(study);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("batch_id", batchId.toString());
        payload.put("topic", topic == null ? "" : topic);
        payload.put("dimensions", properties.synthesis().dimensions());
        payload.put("studies", studies);

        log.debug("Batch {}: synthesis query over {} papers", batchId, members.size());

        return List.of(new ArtifactRecord(
            StableIds.artifactId(batchId, stage(), 0),
            anchor,
            stage(),
            0,
            references,
            payload,
            version(),
            OffsetDateTime.now(clock)
        ));
    }

    private static void putIfPresent(Map<String, Object> target, String key, String value) {
        if (value != null) {
            target.put(key, value);
        }
    }
}
