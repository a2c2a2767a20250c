package com.helmet.corpus.repository;

import com.helmet.corpus.model.LedgerEntry;
import com.helmet.corpus.model.LedgerStatus;
import com.helmet.corpus.model.Stage;
import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.PreparedStatement;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcLedgerRepository implements LedgerRepository {

    private final JdbcClient jdbcClient;

    private final JdbcTemplate jdbcTemplate;

    private final RowMapper<LedgerEntry> ledgerRowMapper = (rs, rowNum) -> new LedgerEntry(
        rs.getObject("paper_id", UUID.class),
        Stage.fromName(rs.getString("stage")),
        LedgerStatus.valueOf(rs.getString("status")),
        rs.getString("error_message"),
        rs.getInt("attempts"),
        rs.getObject("updated_at", OffsetDateTime.class)
    );

    @Override
    public void seed(UUID paperId, Collection<Stage> stages) {
        if (stages == null || stages.isEmpty()) {
            return;
        }

        List<Stage> ordered = List.copyOf(stages);
        String sql = """
                INSERT INTO stage_ledger (paper_id, stage, status)
                VALUES (?, ?, 'PENDING')
                ON CONFLICT (paper_id, stage) DO NOTHING
            """;

        jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
            @Override
            @SneakyThrows
            public void setValues(PreparedStatement ps, int i) {
                ps.setObject(1, paperId);
                ps.setString(2, ordered.get(i).stageName());
            }

            @Override
            public int getBatchSize() {
                return ordered.size();
            }
        });
    }

    @Override
    public void mark(UUID paperId, Stage stage, LedgerStatus status, String error) {
        String sql = """
            INSERT INTO stage_ledger (paper_id, stage, status, error_message)
            VALUES (:paperId, :stage, :status, :error)
            ON CONFLICT (paper_id, stage) DO UPDATE
            SET status = EXCLUDED.status,
                error_message = EXCLUDED.error_message,
                updated_at = NOW()
            WHERE stage_ledger.status IS DISTINCT FROM EXCLUDED.status
               OR stage_ledger.error_message IS DISTINCT FROM EXCLUDED.error_message
            """;

        jdbcClient.sql(sql)
            .param("paperId", paperId)
            .param("stage", stage.stageName())
            .param("status", status.name())
            .param("error", error)
            .update();
    }

    @Override
    public boolean claim(UUID paperId, Stage stage, Collection<LedgerStatus> expected) {
        if (expected.isEmpty()) {
            return false;
        }

        String sql = """
            INSERT INTO stage_ledger (paper_id, stage, status, attempts)
            VALUES (:paperId, :stage, 'RUNNING', 1)
            ON CONFLICT (paper_id, stage) DO UPDATE
            SET status = 'RUNNING',
                attempts = stage_ledger.attempts + 1,
                error_message = NULL,
                updated_at = NOW()
            WHERE stage_ledger.status IN (:expected)
            RETURNING paper_id
            """;

        return jdbcClient.sql(sql)
            .param("paperId", paperId)
            .param("stage", stage.stageName())
            .param("expected", expected.stream().map(Enum::name).toList())
            .query(UUID.class)
            .optional()
            .isPresent();
    }

    @Override
    public Optional<LedgerEntry> find(UUID paperId, Stage stage) {
        return jdbcClient.sql("SELECT * FROM stage_ledger WHERE paper_id = :paperId AND stage = :stage")
            .param("paperId", paperId)
            .param("stage", stage.stageName())
            .query(ledgerRowMapper)
            .optional();
    }

    @Override
    public List<LedgerEntry> findByPaperId(UUID paperId) {
        return jdbcClient.sql("SELECT * FROM stage_ledger WHERE paper_id = :paperId ORDER BY stage")
            .param("paperId", paperId)
            .query(ledgerRowMapper)
            .list();
    }

    @Override
    @Transactional
    public List<UUID> resetStaleRunning(Stage stage, int staleThresholdMinutes) {
        String sql = """
            UPDATE stage_ledger
            SET status = 'PENDING',
                updated_at = NOW()
            WHERE stage = :stage
              AND paper_id IN (
                SELECT paper_id
                FROM stage_ledger
                WHERE stage = :stage
                  AND status = 'RUNNING'
                  AND updated_at <= NOW() - (INTERVAL '1 minute' * :staleMins)
                FOR UPDATE SKIP LOCKED
            )
            RETURNING paper_id
            """;

        return jdbcClient.sql(sql)
            .param("stage", stage.stageName())
            .param("staleMins", staleThresholdMinutes)
            .query(UUID.class)
            .list();
    }

    @Override
    public int countByStatus(Stage stage, LedgerStatus status) {
        return jdbcClient.sql("SELECT COUNT(*) FROM stage_ledger WHERE stage = :stage AND status = :status")
            .param("stage", stage.stageName())
            .param("status", status.name())
            .query(Integer.class)
            .single();
    }
}
