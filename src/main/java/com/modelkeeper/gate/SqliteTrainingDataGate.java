package com.modelkeeper.gate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gate over the {@code cached_books} catalog table. A record qualifies when it is flagged for
 * training, meets the quality score and was enriched or fetched after the cursor.
 */
public class SqliteTrainingDataGate implements TrainingDataGate {
    private static final Logger log = LoggerFactory.getLogger(SqliteTrainingDataGate.class);

    static final String COUNT_NEW_SQL = """
            SELECT COUNT(*)
            FROM cached_books
            WHERE in_training = 1
              AND training_quality_score >= ?
              AND (last_enrichment_at > ? OR metadata_fetched_at > ?)
            """;
    private static final String COUNT_TOTAL_SQL = "SELECT COUNT(*) FROM cached_books WHERE in_training = 1";
    private static final String COUNT_BY_QUALITY_SQL = """
            SELECT
                CASE
                    WHEN training_quality_score >= 0.8 THEN 'excellent'
                    WHEN training_quality_score >= 0.6 THEN 'good'
                    WHEN training_quality_score >= 0.4 THEN 'fair'
                    ELSE 'poor'
                END AS quality,
                COUNT(*)
            FROM cached_books
            WHERE in_training = 1
            GROUP BY quality
            """;
    private static final String COUNT_NEW_ANY_QUALITY_SQL = """
            SELECT COUNT(*)
            FROM cached_books
            WHERE in_training = 1
              AND (last_enrichment_at > ? OR metadata_fetched_at > ?)
            """;

    private final Path databasePath;
    private final GateCursorStore cursorStore;
    private final Clock clock;

    public SqliteTrainingDataGate(Path databasePath, GateCursorStore cursorStore) {
        this(databasePath, cursorStore, Clock.systemDefaultZone());
    }

    public SqliteTrainingDataGate(Path databasePath, GateCursorStore cursorStore, Clock clock) {
        this.databasePath = databasePath;
        this.cursorStore = cursorStore;
        this.clock = clock;
    }

    @Override
    public int countNew(double minQualityScore) throws IOException {
        String cursor = GateCursorStore.format(cursorStore.read());
        try (Connection connection = connect();
                PreparedStatement statement = connection.prepareStatement(COUNT_NEW_SQL)) {
            statement.setDouble(1, minQualityScore);
            statement.setString(2, cursor);
            statement.setString(3, cursor);
            int count = singleCount(statement);
            log.debug("gate.count minQuality={} cursor={} count={}", minQualityScore, cursor, count);
            return count;
        } catch (SQLException e) {
            throw new IOException("Training data query failed on " + databasePath + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void markConsumed(Instant now) throws IOException {
        cursorStore.write(LocalDateTime.ofInstant(now, clock.getZone()));
    }

    @Override
    public TrainingStatistics statistics() throws IOException {
        String cursor = GateCursorStore.format(cursorStore.read());
        try (Connection connection = connect()) {
            int total;
            try (PreparedStatement statement = connection.prepareStatement(COUNT_TOTAL_SQL)) {
                total = singleCount(statement);
            }

            Map<String, Integer> byQuality = new LinkedHashMap<>();
            try (PreparedStatement statement = connection.prepareStatement(COUNT_BY_QUALITY_SQL);
                    ResultSet rows = statement.executeQuery()) {
                while (rows.next()) {
                    byQuality.put(rows.getString(1), rows.getInt(2));
                }
            }

            int newSinceCursor;
            try (PreparedStatement statement = connection.prepareStatement(COUNT_NEW_ANY_QUALITY_SQL)) {
                statement.setString(1, cursor);
                statement.setString(2, cursor);
                newSinceCursor = singleCount(statement);
            }
            return new TrainingStatistics(total, byQuality, newSinceCursor, cursor);
        } catch (SQLException e) {
            throw new IOException("Training statistics query failed on " + databasePath + ": " + e.getMessage(), e);
        }
    }

    private Connection connect() throws IOException, SQLException {
        if (!Files.isRegularFile(databasePath)) {
            throw new NoSuchFileException(databasePath.toString(), null, "training database not found");
        }
        return DriverManager.getConnection("jdbc:sqlite:" + databasePath.toAbsolutePath());
    }

    private static int singleCount(PreparedStatement statement) throws SQLException {
        try (ResultSet rows = statement.executeQuery()) {
            return rows.next() ? rows.getInt(1) : 0;
        }
    }
}
