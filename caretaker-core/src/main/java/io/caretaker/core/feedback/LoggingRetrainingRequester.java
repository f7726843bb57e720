package io.caretaker.core.feedback;

import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default requester when no retraining pipeline is attached: the request is only logged.
 */
public final class LoggingRetrainingRequester implements RetrainingRequester {
    private static final Logger LOG = LoggerFactory.getLogger(LoggingRetrainingRequester.class);

    @Override
    public void requestRetraining(FeedbackRatio ratio) {
        LOG.warn(
            "Retraining requested: dislike ratio {} exceeds threshold {} ({} of {} feedback entries)",
            String.format(Locale.ROOT, "%.4f", ratio.ratio()),
            ratio.threshold(),
            ratio.dislikes(),
            ratio.total()
        );
    }
}
