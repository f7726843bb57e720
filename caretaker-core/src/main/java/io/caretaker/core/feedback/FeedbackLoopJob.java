package io.caretaker.core.feedback;

import io.caretaker.core.notify.NotificationSink;
import io.caretaker.core.notify.NotificationSinks;
import io.caretaker.core.notify.SendResult;
import io.caretaker.core.scheduler.JobHandler;
import io.caretaker.core.scheduler.JobResult;
import java.io.IOException;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scheduled feedback check: load counts, evaluate, report, and request retraining when the
 * dislike ratio is over the threshold.
 */
public final class FeedbackLoopJob implements JobHandler {
    private static final Logger LOG = LoggerFactory.getLogger(FeedbackLoopJob.class);
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final FeedbackCountSource source;
    private final FeedbackThresholdEvaluator evaluator;
    private final double threshold;
    private final NotificationSink sink;
    private final RetrainingRequester requester;
    private final Clock clock;

    public FeedbackLoopJob(
        FeedbackCountSource source,
        FeedbackThresholdEvaluator evaluator,
        double threshold,
        NotificationSink sink,
        RetrainingRequester requester,
        Clock clock
    ) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.threshold = threshold;
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.requester = Objects.requireNonNull(requester, "requester must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public JobResult run() {
        FeedbackCounts counts;
        try {
            counts = source.load();
        } catch (IOException e) {
            LOG.error("Could not load feedback counts: {}", e.getMessage());
            return JobResult.error("feedback query failed: " + e.getMessage(), clock.instant());
        }

        FeedbackRatio ratio = evaluator.evaluate(counts, threshold);
        LOG.info(
            "Feedback likes={} dislikes={} total={} ratio={} threshold={}",
            ratio.likes(),
            ratio.dislikes(),
            ratio.total(),
            percent(ratio.ratio(), 2),
            percent(ratio.threshold(), 0)
        );

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("likes", ratio.likes());
        detail.put("dislikes", ratio.dislikes());
        detail.put("total", ratio.total());
        detail.put("ratio", ratio.ratio());
        detail.put("threshold", ratio.threshold());
        detail.put("retrain", ratio.decision());

        if (ratio.decision()) {
            send(retrainAlert(ratio));
            try {
                requester.requestRetraining(ratio);
                detail.put("retrain_requested", true);
            } catch (Exception e) {
                LOG.error("Retraining request failed", e);
                detail.put("retrain_requested", false);
                detail.put("error", "retraining request failed: " + e.getMessage());
            }
        }
        send(report(ratio));

        return ratio.decision()
            ? JobResult.warning(detail, clock.instant())
            : JobResult.ok(detail, clock.instant());
    }

    private String retrainAlert(FeedbackRatio ratio) {
        return "*Negative feedback threshold exceeded*\n"
            + "- Current dislike ratio: " + percent(ratio.ratio(), 2) + "\n"
            + "- Threshold: " + percent(ratio.threshold(), 0) + "\n"
            + "- Action: retraining requested";
    }

    private String report(FeedbackRatio ratio) {
        return "*Feedback loop report*\n"
            + "- Likes: " + ratio.likes() + "\n"
            + "- Dislikes: " + ratio.dislikes() + "\n"
            + "- Total: " + ratio.total() + "\n"
            + "- Dislike ratio: " + percent(ratio.ratio(), 1) + "\n"
            + "- Status: " + (ratio.decision() ? "retraining needed" : "healthy") + "\n"
            + "- Generated: " + TIME_FORMAT.format(clock.instant().atZone(clock.getZone()));
    }

    private void send(String message) {
        SendResult result = NotificationSinks.sendQuietly(sink, message);
        if (!result.ok()) {
            LOG.warn("Feedback notification failed via {}: {}", sink.name(), result.error());
        }
    }

    private static String percent(double value, int decimals) {
        return String.format(Locale.ROOT, "%." + decimals + "f%%", value * 100.0);
    }
}
