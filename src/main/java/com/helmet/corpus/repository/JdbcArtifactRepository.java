package com.helmet.corpus.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.helmet.corpus.model.ArtifactRecord;
import com.helmet.corpus.model.Stage;
import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcArtifactRepository implements ArtifactRepository {

    private static final TypeReference<LinkedHashMap<String, Object>> PAYLOAD = new TypeReference<>() {};

    private final JdbcClient jdbcClient;
    private final ObjectMapper objectMapper;

    @Override
    public int saveAll(Stage stage, List<ArtifactRecord> records, boolean replace) {
        String table = tableOf(stage);

        String conflictClause = replace
            ? """
                ON CONFLICT (artifact_id) DO UPDATE
                SET payload = EXCLUDED.payload,
                    generator_version = EXCLUDED.generator_version,
                    generated_at = EXCLUDED.generated_at
                """
            : "ON CONFLICT (artifact_id) DO NOTHING";

        String sql = "INSERT INTO " + table + """
             (artifact_id, paper_id, sequence_index, payload, generator_version, generated_at)
            VALUES (:artifactId, :paperId, :sequenceIndex, CAST(:payload AS jsonb), :generatorVersion, :generatedAt)
            """ + conflictClause;

        int written = 0;
        for (ArtifactRecord record : records) {
            written += jdbcClient.sql(sql)
                .param("artifactId", record.artifactId())
                .param("paperId", record.paperId())
                .param("sequenceIndex", record.sequenceIndex())
                .param("payload", toJson(record.payload()))
                .param("generatorVersion", record.generatorVersion())
                .param("generatedAt", record.generatedAt())
                .update();

            if (stage == Stage.EVIDENCE_SYNTHESIS) {
                saveReferences(record, replace);
            }
        }
        return written;
    }

    @Override
    public List<ArtifactRecord> findByPaperId(Stage stage, UUID paperId) {
        if (stage == Stage.EVIDENCE_SYNTHESIS) {
            return jdbcClient.sql("""
                    SELECT a.*
                    FROM synthesis_artifacts a
                    JOIN synthesis_artifact_papers r ON r.artifact_id = a.artifact_id
                    WHERE r.paper_id = :paperId
                    ORDER BY a.generated_at, a.artifact_id
                    """)
                .param("paperId", paperId)
                .query((rs, rowNum) -> mapRow(rs, stage))
                .list()
                .stream()
                .map(artifact -> withReferences(artifact, findReferences(artifact.artifactId())))
                .toList();
        }

        return jdbcClient.sql("SELECT * FROM " + tableOf(stage) + " WHERE paper_id = :paperId ORDER BY sequence_index")
            .param("paperId", paperId)
            .query((rs, rowNum) -> mapRow(rs, stage))
            .list();
    }

    @Override
    public int countByPaperId(Stage stage, UUID paperId) {
        String sql = stage == Stage.EVIDENCE_SYNTHESIS
            ? "SELECT COUNT(*) FROM synthesis_artifact_papers WHERE paper_id = :paperId"
            : "SELECT COUNT(*) FROM " + tableOf(stage) + " WHERE paper_id = :paperId";

        return jdbcClient.sql(sql)
            .param("paperId", paperId)
            .query(Integer.class)
            .single();
    }

    @Override
    public boolean isReferenced(UUID paperId) {
        return jdbcClient.sql("""
                SELECT EXISTS (SELECT 1 FROM query_artifacts WHERE paper_id = :paperId)
                    OR EXISTS (SELECT 1 FROM label_artifacts WHERE paper_id = :paperId)
                    OR EXISTS (SELECT 1 FROM synthesis_artifacts WHERE paper_id = :paperId)
                    OR EXISTS (SELECT 1 FROM synthesis_artifact_papers WHERE paper_id = :paperId)
                """)
            .param("paperId", paperId)
            .query(Boolean.class)
            .single();
    }

    @Override
    public int deleteByPaperIds(Stage stage, Collection<UUID> paperIds) {
        if (paperIds.isEmpty()) {
            return 0;
        }
        if (stage != Stage.EVIDENCE_SYNTHESIS) {
            return jdbcClient.sql("DELETE FROM " + tableOf(stage) + " WHERE paper_id IN (:paperIds)")
                .param("paperIds", List.copyOf(paperIds))
                .update();
        }

        jdbcClient.sql("DELETE FROM synthesis_artifact_papers WHERE paper_id IN (:paperIds)")
            .param("paperIds", List.copyOf(paperIds))
            .update();

        // a batch that lost every member no longer describes any paper
        int dropped = jdbcClient.sql("""
                DELETE FROM synthesis_artifacts a
                WHERE NOT EXISTS (SELECT 1 FROM synthesis_artifact_papers r WHERE r.artifact_id = a.artifact_id)
                """)
            .update();

        jdbcClient.sql("""
                UPDATE synthesis_artifacts a
                SET paper_id = (
                    SELECT r.paper_id
                    FROM synthesis_artifact_papers r
                    WHERE r.artifact_id = a.artifact_id
                    ORDER BY r.paper_id::text
                    LIMIT 1
                )
                WHERE a.paper_id IN (:paperIds)
                """)
            .param("paperIds", List.copyOf(paperIds))
            .update();

        return dropped;
    }

    private void saveReferences(ArtifactRecord record, boolean replace) {
        if (replace) {
            jdbcClient.sql("DELETE FROM synthesis_artifact_papers WHERE artifact_id = :artifactId")
                .param("artifactId", record.artifactId())
                .update();
        }

        List<UUID> references = record.references();
        for (int position = 0; position < references.size(); position++) {
            jdbcClient.sql("""
                    INSERT INTO synthesis_artifact_papers (artifact_id, paper_id, position)
                    VALUES (:artifactId, :paperId, :position)
                    ON CONFLICT (artifact_id, paper_id) DO NOTHING
                    """)
                .param("artifactId", record.artifactId())
                .param("paperId", references.get(position))
                .param("position", position)
                .update();
        }
    }

    private List<UUID> findReferences(UUID artifactId) {
        return jdbcClient.sql("SELECT paper_id FROM synthesis_artifact_papers WHERE artifact_id = :artifactId ORDER BY position")
            .param("artifactId", artifactId)
            .query(UUID.class)
            .list();
    }

    private ArtifactRecord mapRow(ResultSet rs, Stage stage) throws SQLException {
        UUID paperId = rs.getObject("paper_id", UUID.class);

        return new ArtifactRecord(
            rs.getObject("artifact_id", UUID.class),
            paperId,
            stage,
            rs.getInt("sequence_index"),
            List.of(paperId),
            fromJson(rs.getString("payload")),
            rs.getString("generator_version"),
            rs.getObject("generated_at", OffsetDateTime.class)
        );
    }

    private static ArtifactRecord withReferences(ArtifactRecord artifact, List<UUID> references) {
        return new ArtifactRecord(
            artifact.artifactId(),
            artifact.paperId(),
            artifact.stage(),
            artifact.sequenceIndex(),
            references,
            artifact.payload(),
            artifact.generatorVersion(),
            artifact.generatedAt()
        );
    }

    @SneakyThrows
    private String toJson(Map<String, Object> payload) {
        return objectMapper.writeValueAsString(payload);
    }

    @SneakyThrows
    private Map<String, Object> fromJson(String json) {
        return objectMapper.readValue(json, PAYLOAD);
    }

    private static String tableOf(Stage stage) {
        if (!stage.producesArtifacts()) {
            throw new IllegalArgumentException("Stage " + stage.stageName() + " has no artifact store");
        }
        return stage.artifactTable();
    }
}
