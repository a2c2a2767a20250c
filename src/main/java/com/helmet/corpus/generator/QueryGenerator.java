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
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Data-extraction queries: one record per abstract sentence, pairing the target schema with the
 * sentence it should be filled from.
 */
@Slf4j
@Component
public final class QueryGenerator implements ArtifactGenerator {

    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=\\.)\\s+|\\n\\s*\\n");
    private static final int MIN_SENTENCE_LENGTH = 11;

    private final GeneratorProperties properties;
    private final HealthEconomicFieldExtractor fieldExtractor;
    private final Clock clock;

    public QueryGenerator(GeneratorProperties properties, HealthEconomicFieldExtractor fieldExtractor, Clock clock) {
        this.properties = properties;
        this.fieldExtractor = fieldExtractor;
        this.clock = clock;
    }

    @Override
    public Stage stage() {
        return Stage.EXTRACTION_QUERY;
    }

    @Override
    public String version() {
        return properties.version();
    }

    @Override
    public List<ArtifactRecord> generate(WorkUnit unit) {
        IndexEntry entry = unit.single();

        if (!entry.hasAbstract()) {
            throw new GenerationException(entry.paperId(), stage(), "Abstract is required to build extraction queries");
        }

        List<String> windows = sentences(entry.abstractText());
        if (windows.isEmpty()) {
            throw new GenerationException(entry.paperId(), stage(), "Abstract contains no usable sentence");
        }

        List<String> targetFields = properties.query().targetFields();
        OffsetDateTime generatedAt = OffsetDateTime.now(clock);
        List<ArtifactRecord> records = new ArrayList<>(windows.size());

        for (int index = 0; index < windows.size(); index++) {
            String window = windows.get(index);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("target_fields", targetFields);
            payload.put("source_text", window);
            payload.put("fields", fieldExtractor.extract(window, targetFields));
            putIfPresent(payload, "title", entry.title());
            putIfPresent(payload, "pmcid", entry.metadata("pmcid"));
            putIfPresent(payload, "type", entry.metadata("type"));

            records.add(new ArtifactRecord(
                StableIds.artifactId(entry.paperId(), stage(), index),
                entry.paperId(),
                stage(),
                index,
                List.of(entry.paperId()),
                payload,
                version(),
                generatedAt
            ));
        }

        log.debug("Paper {}: built {} extraction queries", entry.paperId(), records.size());
        return records;
    }

    static List<String> sentences(String text) {
        return Arrays.stream(SENTENCE_BOUNDARY.split(text))
            .map(String::trim)
            .filter(sentence -> sentence.length() >= MIN_SENTENCE_LENGTH)
            .toList();
    }

    private static void putIfPresent(Map<String, Object> payload, String key, String value) {
        if (value != null) {
            payload.put(key, value);
        }
    }
}
