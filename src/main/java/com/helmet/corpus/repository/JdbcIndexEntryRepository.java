package com.helmet.corpus.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.helmet.corpus.model.IndexEntry;
import com.helmet.corpus.model.LedgerStatus;
import com.helmet.corpus.model.PaperMetadata;
import com.helmet.corpus.model.Stage;
import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcIndexEntryRepository implements IndexEntryRepository {

    private static final TypeReference<LinkedHashMap<String, String>> STRING_MAP = new TypeReference<>() {};

    private static final String SELECT_WITH_LEDGER = """
        SELECT e.*,
               (SELECT jsonb_object_agg(sl.stage, sl.status)
                FROM stage_ledger sl
                WHERE sl.paper_id = e.paper_id) AS ledger
        FROM index_entries e
        """;

    private final JdbcClient jdbcClient;
    private final ObjectMapper objectMapper;

    private final RowMapper<IndexEntry> indexEntryRowMapper = (rs, rowNum) -> new IndexEntry(
        rs.getObject("paper_id", UUID.class),
        rs.getLong("insertion_seq"),
        rs.getString("title"),
        rs.getString("abstract"),
        readStringMap(rs.getString("source_metadata")),
        readLedger(rs.getString("ledger")),
        rs.getObject("created_at", OffsetDateTime.class),
        rs.getObject("updated_at", OffsetDateTime.class)
    );

    @Override
    @SneakyThrows
    public void upsert(UUID paperId, PaperMetadata metadata) {
        jdbcClient.sql("""
                INSERT INTO index_entries (paper_id, title, abstract, source_metadata)
                VALUES (:paperId, :title, :abstract, CAST(:metadata AS jsonb))
                ON CONFLICT (paper_id) DO UPDATE
                SET title = EXCLUDED.title,
                    abstract = EXCLUDED.abstract,
                    source_metadata = EXCLUDED.source_metadata,
                    updated_at = NOW()
                """)
            .param("paperId", paperId)
            .param("title", metadata.title())
            .param("abstract", metadata.abstractText())
            .param("metadata", objectMapper.writeValueAsString(metadata.fields()))
            .update();
    }

    @Override
    public Optional<IndexEntry> findById(UUID paperId) {
        return jdbcClient.sql(SELECT_WITH_LEDGER + " WHERE e.paper_id = :paperId")
            .param("paperId", paperId)
            .query(indexEntryRowMapper)
            .optional();
    }

    @Override
    public boolean existsById(UUID paperId) {
        return jdbcClient.sql("SELECT EXISTS (SELECT 1 FROM index_entries WHERE paper_id = :paperId)")
            .param("paperId", paperId)
            .query(Boolean.class)
            .single();
    }

    @Override
    public List<IndexEntry> findPage(Stage stage, Collection<LedgerStatus> statuses, long afterSeq, int limit) {
        if (statuses.isEmpty()) {
            return List.of();
        }

        String sql = SELECT_WITH_LEDGER + """
             LEFT JOIN stage_ledger l ON l.paper_id = e.paper_id AND l.stage = :stage
            WHERE e.insertion_seq > :afterSeq
              AND COALESCE(l.status, 'PENDING') IN (:statuses)
            ORDER BY e.insertion_seq ASC
            LIMIT :limit
            """;

        return jdbcClient.sql(sql)
            .param("stage", stage.stageName())
            .param("afterSeq", afterSeq)
            .param("statuses", statuses.stream().map(Enum::name).toList())
            .param("limit", limit)
            .query(indexEntryRowMapper)
            .list();
    }

    @SneakyThrows
    private Map<String, String> readStringMap(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        return objectMapper.readValue(json, STRING_MAP);
    }

    private Map<Stage, LedgerStatus> readLedger(String json) {
        Map<Stage, LedgerStatus> ledger = new EnumMap<>(Stage.class);
        readStringMap(json).forEach((stage, status) ->
            ledger.put(Stage.fromName(stage), LedgerStatus.valueOf(status)));
        return ledger;
    }
}
