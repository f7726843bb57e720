package io.caretaker.core.feedback;

/**
 * @param ratio dislikes divided by total, or {@code 0} when there is no feedback
 * @param decision whether {@code ratio} exceeds {@code threshold}
 */
public record FeedbackRatio(
    long likes,
    long dislikes,
    long total,
    double ratio,
    double threshold,
    boolean decision
) {
}
