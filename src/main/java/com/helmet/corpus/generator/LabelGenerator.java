package com.helmet.corpus.generator;

import com.helmet.corpus.config.GeneratorProperties;
import com.helmet.corpus.exception.GenerationException;
import com.helmet.corpus.model.ArtifactRecord;
import com.helmet.corpus.model.IndexEntry;
import com.helmet.corpus.model.PaperRecord;
import com.helmet.corpus.model.Stage;
import com.helmet.corpus.model.WorkUnit;
import com.helmet.corpus.util.StableIds;
import dev.langchain4j.data.document.DocumentSplitter;
import dev.langchain4j.data.document.splitter.DocumentSplitters;
import dev.langchain4j.data.segment.TextSegment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.UUID;

/**
 * Section-labelling items: a paragraph of the paper and a shuffled set of section titles, one of
 * which is the section the paragraph came from.
 * <p>
 * Picks and shuffles draw from a {@link Random} seeded with the paper id and generator version,
 * so a rerun reproduces the same items in the same order.
 */
@Slf4j
@Component
public final class LabelGenerator implements ArtifactGenerator {

    private static final List<String> EXCLUDED_SECTIONS = List.of("supplementary", "reference");

    private final GeneratorProperties properties;
    private final SnippetSegmenter segmenter;
    private final Clock clock;
    private final DocumentSplitter snippetSplitter;

    public LabelGenerator(GeneratorProperties properties, SnippetSegmenter segmenter, Clock clock) {
        this.properties = properties;
        this.segmenter = segmenter;
        this.clock = clock;
        this.snippetSplitter = DocumentSplitters.recursive(properties.label().maxSnippetChars(), 0);
    }

    @Override
    public Stage stage() {
        return Stage.LABELING;
    }

    @Override
    public String version() {
        return properties.version();
    }

    @Override
    public List<ArtifactRecord> generate(WorkUnit unit) {
        IndexEntry entry = unit.single();
        PaperRecord paper = unit.paper(entry.paperId());
        if (paper == null) {
            throw new GenerationException(entry.paperId(), stage(), "Paper content is not available");
        }

        GeneratorProperties.Label config = properties.label();
        List<SectionParagraph> paragraphs = segmenter.segment(paper.rawContent());
        if (paragraphs.isEmpty()) {
            throw new GenerationException(entry.paperId(), stage(), "Full text with sectioned paragraphs is required for labelling");
        }

        Set<String> sectionSet = new LinkedHashSet<>();
        paragraphs.stream()
            .map(SectionParagraph::section)
            .filter(LabelGenerator::isUsableSection)
            .forEach(sectionSet::add);
        List<String> sections = List.copyOf(sectionSet);

        if (sections.size() < config.minSections()) {
            throw new GenerationException(entry.paperId(), stage(),
                "Only " + sections.size() + " usable section titles, at least " + config.minSections() + " required");
        }

        List<Integer> candidates = new ArrayList<>();
        for (int i = 0; i < paragraphs.size(); i++) {
            if (sectionSet.contains(paragraphs.get(i).section())) {
                candidates.add(i);
            }
        }

        Random random = new Random(seed(entry.paperId()));
        Collections.shuffle(candidates, random);
        List<Integer> picked = new ArrayList<>(candidates.subList(0, Math.min(config.snippetsPerPaper(), candidates.size())));
        picked.sort(Comparator.naturalOrder());

        int distractorCount = Math.min(config.choices() - 1, sections.size() - 1);
        OffsetDateTime generatedAt = OffsetDateTime.now(clock);
        List<ArtifactRecord> records = new ArrayList<>(picked.size());

        for (int index = 0; index < picked.size(); index++) {
            SectionParagraph paragraph = paragraphs.get(picked.get(index));

            List<String> distractors = new ArrayList<>(sections);
            distractors.remove(paragraph.section());
            Collections.shuffle(distractors, random);

            List<String> labels = new ArrayList<>(distractors.subList(0, distractorCount));
            labels.add(paragraph.section());
            Collections.shuffle(labels, random);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("snippet", boundSnippet(paragraph.text()));
            payload.put("candidate_labels", labels);
            payload.put("answer", paragraph.section());
            String pmcid = entry.metadata("pmcid");
            if (pmcid != null) {
                payload.put("pmcid", pmcid);
            }

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

        log.debug("Paper {}: built {} labelling items from {} paragraphs", entry.paperId(), records.size(), paragraphs.size());
        return records;
    }

    private String boundSnippet(String text) {
        List<TextSegment> segments = snippetSplitter.split(dev.langchain4j.data.document.Document.from(text));
        return segments.isEmpty() ? text : segments.get(0).text();
    }

    private long seed(UUID paperId) {
        long versionHash = UUID.nameUUIDFromBytes(version().getBytes(StandardCharsets.UTF_8)).getMostSignificantBits();
        return paperId.getMostSignificantBits() ^ paperId.getLeastSignificantBits() ^ versionHash;
    }

    private static boolean isUsableSection(String title) {
        String lower = title.toLowerCase(Locale.ROOT);
        return EXCLUDED_SECTIONS.stream().noneMatch(lower::contains);
    }
}
