package com.helmet.corpus.repository;

import com.helmet.corpus.exception.EntityNotFoundException;
import com.helmet.corpus.model.PaperRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcPaperRepository implements PaperRepository {

    private final JdbcClient jdbcClient;

    private final RowMapper<PaperRecord> paperRowMapper = (rs, rowNum) -> new PaperRecord(
        rs.getObject("id", UUID.class),
        rs.getString("external_source_id"),
        rs.getString("raw_content"),
        rs.getString("content_hash"),
        rs.getObject("fetched_at", OffsetDateTime.class)
    );

    @Override
    public Optional<PaperRecord> insertIfAbsent(PaperRecord paper) {
        return jdbcClient.sql("""
                INSERT INTO papers (id, external_source_id, raw_content, content_hash)
                VALUES (:id, :externalSourceId, :rawContent, :contentHash)
                ON CONFLICT (id) DO NOTHING
                RETURNING *
                """)
            .param("id", paper.id())
            .param("externalSourceId", paper.externalSourceId())
            .param("rawContent", paper.rawContent())
            .param("contentHash", paper.contentHash())
            .query(paperRowMapper)
            .optional();
    }

    @Override
    public Optional<PaperRecord> findById(UUID id) {
        return jdbcClient.sql("SELECT * FROM papers WHERE id = :id")
            .param("id", id)
            .query(paperRowMapper)
            .optional();
    }

    @Override
    public Optional<PaperRecord> findByExternalSourceId(String externalSourceId) {
        return jdbcClient.sql("SELECT * FROM papers WHERE external_source_id = :externalSourceId")
            .param("externalSourceId", externalSourceId)
            .query(paperRowMapper)
            .optional();
    }

    @Override
    public List<PaperRecord> findAllById(Collection<UUID> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return jdbcClient.sql("SELECT * FROM papers WHERE id IN (:ids)")
            .param("ids", ids)
            .query(paperRowMapper)
            .list();
    }

    @Override
    public PaperRecord replaceContent(UUID id, String rawContent, String contentHash) {
        return jdbcClient.sql("""
                UPDATE papers
                SET raw_content = :rawContent,
                    content_hash = :contentHash,
                    fetched_at = NOW()
                WHERE id = :id
                RETURNING *
                """)
            .param("rawContent", rawContent)
            .param("contentHash", contentHash)
            .param("id", id)
            .query(paperRowMapper)
            .optional()
            .orElseThrow(() -> new EntityNotFoundException(id));
    }

    @Override
    public void delete(UUID id) {
        int rowsAffected = jdbcClient.sql("DELETE FROM papers WHERE id = :id")
            .param("id", id)
            .update();

        if (rowsAffected == 0) {
            throw new EntityNotFoundException(id);
        }
    }
}
