package io.caretaker.core.feedback;

import java.util.Objects;

/**
 * Decides whether accumulated negative feedback warrants a retraining request. Stateless.
 */
public final class FeedbackThresholdEvaluator {
    public static final double DEFAULT_THRESHOLD = 0.3;

    public FeedbackRatio evaluate(FeedbackCounts counts, double threshold) {
        Objects.requireNonNull(counts, "counts must not be null");
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be within [0, 1], got " + threshold);
        }
        long total = counts.total();
        double ratio = total == 0 ? 0.0 : (double) counts.dislikes() / total;
        return new FeedbackRatio(counts.likes(), counts.dislikes(), total, ratio, threshold, ratio > threshold);
    }
}
