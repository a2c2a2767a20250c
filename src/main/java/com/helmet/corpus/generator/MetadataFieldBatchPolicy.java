package com.helmet.corpus.generator;

import com.helmet.corpus.config.GeneratorProperties;
import com.helmet.corpus.model.IndexEntry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups entries sharing the value of one source metadata field (the fetch query type by default),
 * then cuts each group into batches of at most {@code max-batch-size}.
 */
@Component
@RequiredArgsConstructor
public class MetadataFieldBatchPolicy implements SynthesisBatchPolicy {

    static final String UNGROUPED = "";

    private final GeneratorProperties properties;

    @Override
    public List<List<IndexEntry>> partition(List<IndexEntry> entries) {
        String field = properties.synthesis().groupBy();
        int maxBatchSize = properties.synthesis().maxBatchSize();

        Map<String, List<IndexEntry>> groups = new LinkedHashMap<>();
        for (IndexEntry entry : entries) {
            String key = entry.metadata(field);
            groups.computeIfAbsent(key == null ? UNGROUPED : key, k -> new ArrayList<>()).add(entry);
        }

        List<List<IndexEntry>> batches = new ArrayList<>();
        for (List<IndexEntry> group : groups.values()) {
            for (int from = 0; from < group.size(); from += maxBatchSize) {
                batches.add(List.copyOf(group.subList(from, Math.min(group.size(), from + maxBatchSize))));
            }
        }
        return batches;
    }
}
