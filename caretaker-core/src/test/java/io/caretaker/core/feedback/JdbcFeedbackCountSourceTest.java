package io.caretaker.core.feedback;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.caretaker.core.database.DatabaseTarget;
import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JdbcFeedbackCountSourceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldCountLikesAndDislikes() throws Exception {
        Path database = tempDir.resolve("feedback.db");
        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + database.toAbsolutePath());
             Statement statement = connection.createStatement()) {
            statement.execute("CREATE TABLE feedback_log (id INTEGER PRIMARY KEY, feedback TEXT, comment TEXT)");
            statement.execute("INSERT INTO feedback_log (feedback) VALUES ('like'), ('like'), ('like'), ('dislike'), ('neutral')");
        }
        JdbcFeedbackCountSource source = new JdbcFeedbackCountSource(DatabaseTarget.parse("sqlite:" + database.toAbsolutePath()));

        FeedbackCounts counts = source.load();

        assertThat(counts.likes()).isEqualTo(3);
        assertThat(counts.dislikes()).isEqualTo(1);
    }

    @Test
    void emptyTableShouldYieldZeroCounts() throws Exception {
        Path database = tempDir.resolve("empty.db");
        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + database.toAbsolutePath());
             Statement statement = connection.createStatement()) {
            statement.execute("CREATE TABLE feedback_log (id INTEGER PRIMARY KEY, feedback TEXT)");
        }

        FeedbackCounts counts = new JdbcFeedbackCountSource(DatabaseTarget.parse("sqlite:" + database.toAbsolutePath())).load();

        assertThat(counts).isEqualTo(new FeedbackCounts(0, 0));
    }

    @Test
    void missingTableShouldSurfaceAsIoException() {
        Path database = tempDir.resolve("blank.db");
        JdbcFeedbackCountSource source = new JdbcFeedbackCountSource(DatabaseTarget.parse("sqlite:" + database.toAbsolutePath()));

        assertThatThrownBy(source::load)
            .isInstanceOf(IOException.class)
            .hasMessageContaining("feedback counts");
    }
}
