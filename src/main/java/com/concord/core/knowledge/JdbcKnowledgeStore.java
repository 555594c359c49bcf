package com.concord.core.knowledge;

import com.concord.core.model.Conflict;
import com.concord.core.model.Decision;
import com.concord.core.model.HistoricalPattern;
import com.concord.core.model.PatternOutcome;
import com.concord.core.model.Resolution;
import com.concord.core.model.TaskPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-backed {@link KnowledgeStore}.
 * <p>
 * Plans and resolutions are stored as JSON documents keyed by id; decision outcomes
 * are stored one row each and aggregated per pattern on query. Tables are created by
 * {@link #createTables()}. Only portable SQL is used, so replacing a plan revision is
 * a delete and an insert inside one transaction.
 */
public class JdbcKnowledgeStore implements KnowledgeStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcKnowledgeStore.class);

    private static final String PLANS = "concord_plans";
    private static final String OUTCOMES = "concord_decision_outcomes";
    private static final String RESOLUTIONS = "concord_resolutions";

    private static final String CREATE_PLANS_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                plan_id      VARCHAR(255) NOT NULL PRIMARY KEY,
                objective_id VARCHAR(255),
                revision     INT NOT NULL,
                plan         TEXT NOT NULL,
                saved_at     TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """.formatted(PLANS);

    private static final String CREATE_OUTCOMES_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                decision_id VARCHAR(255) NOT NULL,
                task_id     VARCHAR(255) NOT NULL,
                context     VARCHAR(255) NOT NULL,
                pattern_id  VARCHAR(255) NOT NULL,
                success     BOOLEAN NOT NULL,
                elapsed_ms  BIGINT NOT NULL,
                recorded_at TIMESTAMP NOT NULL
            )
            """.formatted(OUTCOMES);

    private static final String CREATE_RESOLUTIONS_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                conflict_id VARCHAR(255) NOT NULL PRIMARY KEY,
                severity    VARCHAR(16) NOT NULL,
                strategy    VARCHAR(32) NOT NULL,
                resolution  TEXT NOT NULL,
                resolved_at TIMESTAMP NOT NULL
            )
            """.formatted(RESOLUTIONS);

    private static final String DELETE_PLAN_SQL = "DELETE FROM %s WHERE plan_id = ?".formatted(PLANS);

    private static final String INSERT_PLAN_SQL = """
            INSERT INTO %s (plan_id, objective_id, revision, plan) VALUES (?, ?, ?, ?)
            """.formatted(PLANS);

    private static final String SELECT_PLAN_SQL = "SELECT plan FROM %s WHERE plan_id = ?".formatted(PLANS);

    private static final String INSERT_OUTCOME_SQL = """
            INSERT INTO %s (decision_id, task_id, context, pattern_id, success, elapsed_ms, recorded_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """.formatted(OUTCOMES);

    private static final String SELECT_PATTERNS_SQL = """
            SELECT pattern_id,
                   SUM(CASE WHEN success THEN 1 ELSE 0 END) AS successes,
                   COUNT(*) AS samples
            FROM %s
            WHERE context = ?
            GROUP BY pattern_id
            ORDER BY samples DESC, pattern_id
            """.formatted(OUTCOMES);

    private static final String DELETE_RESOLUTION_SQL =
            "DELETE FROM %s WHERE conflict_id = ?".formatted(RESOLUTIONS);

    private static final String INSERT_RESOLUTION_SQL = """
            INSERT INTO %s (conflict_id, severity, strategy, resolution, resolved_at) VALUES (?, ?, ?, ?, ?)
            """.formatted(RESOLUTIONS);

    private static final String SELECT_RESOLUTION_SQL =
            "SELECT resolution FROM %s WHERE conflict_id = ?".formatted(RESOLUTIONS);

    private final DataSource dataSource;
    private final PlanCodec codec = new PlanCodec();

    public JdbcKnowledgeStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    /**
     * Creates the store's tables if they do not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            for (String ddl : List.of(CREATE_PLANS_SQL, CREATE_OUTCOMES_SQL, CREATE_RESOLUTIONS_SQL)) {
                try (PreparedStatement stmt = conn.prepareStatement(ddl)) {
                    stmt.execute();
                }
            }
            log.info("Knowledge store tables ensured");
        }
    }

    @Override
    public void saveDecisionOutcome(Decision decision, PatternOutcome outcome) {
        if (decision.selected() == null) {
            return;
        }
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_OUTCOME_SQL)) {
            stmt.setString(1, decision.id());
            stmt.setString(2, decision.taskId());
            stmt.setString(3, decision.selected().capability());
            stmt.setString(4, decision.selected().patternId());
            stmt.setBoolean(5, outcome.success());
            stmt.setLong(6, outcome.elapsed().toMillis());
            stmt.setTimestamp(7, Timestamp.from(decision.timestamp()));
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new KnowledgeStoreException("Failed to save outcome of decision " + decision.id(), e);
        }
    }

    @Override
    public List<HistoricalPattern> queryHistoricalPatterns(String context) {
        var patterns = new ArrayList<HistoricalPattern>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_PATTERNS_SQL)) {
            stmt.setString(1, context);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    long samples = rs.getLong("samples");
                    long successes = rs.getLong("successes");
                    patterns.add(new HistoricalPattern(context, rs.getString("pattern_id"),
                            samples == 0 ? 0.0 : (double) successes / samples, (int) samples));
                }
            }
        } catch (SQLException e) {
            throw new KnowledgeStoreException("Failed to query patterns for context '" + context + "'", e);
        }
        return patterns;
    }

    @Override
    public void savePlan(TaskPlan plan) {
        String json = codec.encode(plan);
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement delete = conn.prepareStatement(DELETE_PLAN_SQL);
                 PreparedStatement insert = conn.prepareStatement(INSERT_PLAN_SQL)) {
                delete.setString(1, plan.id());
                delete.executeUpdate();
                insert.setString(1, plan.id());
                insert.setString(2, plan.objectiveId());
                insert.setInt(3, plan.revision());
                insert.setString(4, json);
                insert.executeUpdate();
                conn.commit();
                log.debug("Saved plan '{}' revision {}", plan.id(), plan.revision());
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new KnowledgeStoreException("Failed to save plan " + plan.id(), e);
        }
    }

    @Override
    public Optional<TaskPlan> loadPlan(String planId) {
        return selectDocument(SELECT_PLAN_SQL, planId, "plan").map(codec::decode);
    }

    @Override
    public void saveResolution(Conflict conflict, Resolution resolution) {
        String json = codec.encode(resolution);
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement delete = conn.prepareStatement(DELETE_RESOLUTION_SQL);
                 PreparedStatement insert = conn.prepareStatement(INSERT_RESOLUTION_SQL)) {
                delete.setString(1, conflict.id());
                delete.executeUpdate();
                insert.setString(1, conflict.id());
                insert.setString(2, conflict.severity().name());
                insert.setString(3, resolution.strategy().name());
                insert.setString(4, json);
                insert.setTimestamp(5, Timestamp.from(resolution.resolvedAt()));
                insert.executeUpdate();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new KnowledgeStoreException("Failed to save resolution of conflict " + conflict.id(), e);
        }
    }

    public Optional<Resolution> loadResolution(String conflictId) {
        return selectDocument(SELECT_RESOLUTION_SQL, conflictId, "resolution").map(codec::decodeResolution);
    }

    private Optional<String> selectDocument(String sql, String id, String column) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(rs.getString(column));
                }
            }
        } catch (SQLException e) {
            throw new KnowledgeStoreException("Failed to load " + column + " '" + id + "'", e);
        }
        return Optional.empty();
    }
}
