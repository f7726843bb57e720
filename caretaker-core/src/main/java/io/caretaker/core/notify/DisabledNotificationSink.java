package io.caretaker.core.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Used when no channel is configured: every send is a logged no-op.
 */
public final class DisabledNotificationSink implements NotificationSink {
    private static final Logger LOG = LoggerFactory.getLogger(DisabledNotificationSink.class);

    private final String reason;

    public DisabledNotificationSink(String reason) {
        this.reason = reason == null ? "" : reason;
    }

    @Override
    public String name() {
        return "disabled";
    }

    @Override
    public SendResult send(String message) {
        LOG.info("Notification skipped ({}): {}", reason, firstLine(message));
        return SendResult.skipped();
    }

    private String firstLine(String message) {
        if (message == null) {
            return "";
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}
