package io.caretaker.core.feedback;

import java.io.IOException;

@FunctionalInterface
public interface FeedbackCountSource {

    FeedbackCounts load() throws IOException;
}
