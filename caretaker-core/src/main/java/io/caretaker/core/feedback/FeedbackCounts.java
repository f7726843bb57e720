package io.caretaker.core.feedback;

public record FeedbackCounts(long likes, long dislikes) {

    public FeedbackCounts {
        if (likes < 0 || dislikes < 0) {
            throw new IllegalArgumentException("feedback counts must not be negative");
        }
    }

    public long total() {
        return likes + dislikes;
    }
}
