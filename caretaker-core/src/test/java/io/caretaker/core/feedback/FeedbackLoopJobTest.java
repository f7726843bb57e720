package io.caretaker.core.feedback;

import static org.assertj.core.api.Assertions.assertThat;

import io.caretaker.core.model.Status;
import io.caretaker.core.scheduler.JobResult;
import io.caretaker.core.support.MutableClock;
import io.caretaker.core.support.RecordingSink;
import java.io.IOException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class FeedbackLoopJobTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-04-01T00:00:00Z"), ZoneOffset.UTC);
    private final RecordingSink sink = new RecordingSink();
    private final List<FeedbackRatio> requests = new ArrayList<>();

    @Test
    void shouldRequestRetrainingAndAlertWhenThresholdExceeded() {
        FeedbackLoopJob job = job(() -> new FeedbackCounts(65, 35), requests::add);

        JobResult result = job.run();

        assertThat(result.status()).isEqualTo(Status.WARNING);
        assertThat(result.detail()).containsEntry("retrain", true).containsEntry("retrain_requested", true);
        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).dislikes()).isEqualTo(35);
        assertThat(sink.messages()).hasSize(2);
        assertThat(sink.messages().get(0)).contains("threshold exceeded").contains("35.00%");
        assertThat(sink.messages().get(1)).contains("Feedback loop report").contains("retraining needed");
    }

    @Test
    void shouldOnlyReportWhenFeedbackIsHealthy() {
        FeedbackLoopJob job = job(() -> new FeedbackCounts(90, 10), requests::add);

        JobResult result = job.run();

        assertThat(result.status()).isEqualTo(Status.OK);
        assertThat(requests).isEmpty();
        assertThat(sink.messages()).hasSize(1);
        assertThat(sink.messages().get(0)).contains("healthy");
    }

    @Test
    void queryFailureShouldYieldErrorResult() {
        FeedbackLoopJob job = job(() -> {
            throw new IOException("connection refused");
        }, requests::add);

        JobResult result = job.run();

        assertThat(result.status()).isEqualTo(Status.ERROR);
        assertThat(result.errorMessage()).contains("connection refused");
        assertThat(sink.messages()).isEmpty();
    }

    @Test
    void requesterFailureShouldBeRecordedInDetail() {
        FeedbackLoopJob job = job(() -> new FeedbackCounts(1, 9), ratio -> {
            throw new IllegalStateException("pipeline offline");
        });

        JobResult result = job.run();

        assertThat(result.status()).isEqualTo(Status.WARNING);
        assertThat(result.detail()).containsEntry("retrain_requested", false);
        assertThat(result.errorMessage()).contains("pipeline offline");
    }

    private FeedbackLoopJob job(FeedbackCountSource source, RetrainingRequester requester) {
        return new FeedbackLoopJob(source, new FeedbackThresholdEvaluator(), 0.3, sink, requester, clock);
    }
}
