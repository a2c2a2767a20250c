package com.helmet.corpus.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.helmet.corpus.exception.ExtractionException;
import com.helmet.corpus.model.PaperMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the JSON document written by the paper fetcher:
 * <pre>
 * { "pmcid": ..., "first_author": ..., "title": ..., "source": ..., "year": ...,
 *   "abstract": ..., "type": ..., "full_text": "&lt;article&gt;...&lt;/article&gt;" }
 * </pre>
 * Only {@code title} is required. The full text stays in the paper store.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonPaperMetadataExtractor implements PaperMetadataExtractor {

    static final List<String> METADATA_FIELDS = List.of("pmcid", "first_author", "source", "year", "type");

    private final ObjectMapper objectMapper;

    @Override
    public PaperMetadata extract(String rawContent) {
        JsonNode root;
        try {
            root = objectMapper.readTree(rawContent == null ? "" : rawContent);
        } catch (JsonProcessingException e) {
            throw new ExtractionException("Raw content is not valid JSON: " + e.getOriginalMessage(), PaperMetadata.empty(), e);
        }

        if (root == null || !root.isObject()) {
            throw new ExtractionException("Raw content is not a JSON object", PaperMetadata.empty());
        }

        Map<String, String> fields = new LinkedHashMap<>();
        for (String field : METADATA_FIELDS) {
            String value = text(root, field);
            if (value != null) {
                fields.put(field, value);
            }
        }
        fields.computeIfPresent("type", (key, value) -> value.toLowerCase(Locale.ROOT));

        PaperMetadata metadata = new PaperMetadata(text(root, "title"), text(root, "abstract"), fields);

        if (metadata.title() == null) {
            throw new ExtractionException("Required field 'title' is missing", metadata);
        }

        log.debug("Extracted metadata for pmcid {}: {} fields", fields.get("pmcid"), fields.size());
        return metadata;
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }
}
