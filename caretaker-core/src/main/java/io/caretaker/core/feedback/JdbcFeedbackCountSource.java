package io.caretaker.core.feedback;

import io.caretaker.core.database.DatabaseTarget;
import io.caretaker.core.database.DbKind;
import java.io.IOException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Counts {@code 'like'} and {@code 'dislike'} rows of the {@code feedback_log} table.
 */
public final class JdbcFeedbackCountSource implements FeedbackCountSource {
    private static final String COUNT_SQL = """
        SELECT
          COALESCE(SUM(CASE WHEN feedback = 'like' THEN 1 ELSE 0 END), 0) AS likes,
          COALESCE(SUM(CASE WHEN feedback = 'dislike' THEN 1 ELSE 0 END), 0) AS dislikes
        FROM feedback_log
        """;

    private final DatabaseTarget target;

    public JdbcFeedbackCountSource(DatabaseTarget target) {
        this.target = Objects.requireNonNull(target, "target must not be null");
    }

    @Override
    public FeedbackCounts load() throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(COUNT_SQL);
             ResultSet resultSet = statement.executeQuery()) {
            if (!resultSet.next()) {
                return new FeedbackCounts(0, 0);
            }
            return new FeedbackCounts(resultSet.getLong("likes"), resultSet.getLong("dislikes"));
        } catch (SQLException e) {
            throw new IOException("Failed to query feedback counts from " + target.describe(), e);
        }
    }

    private Connection openConnection() throws SQLException {
        if (target.kind() == DbKind.SQLITE) {
            return DriverManager.getConnection(target.jdbcUrl());
        }
        return DriverManager.getConnection(target.jdbcUrl(), target.user(), target.password());
    }
}
