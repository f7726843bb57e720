package io.caretaker.core.feedback;

/**
 * Hands a positive retraining decision to the external retraining pipeline.
 */
@FunctionalInterface
public interface RetrainingRequester {

    void requestRetraining(FeedbackRatio ratio) throws Exception;
}
