package io.caretaker.core.notify;

/**
 * Outcome of a single {@link NotificationSink#send(String)} call.
 *
 * @param ok whether the message was delivered, or intentionally skipped because no channel is configured
 * @param error channel error code or transport failure; {@code null} when {@code ok}
 * @param delivered {@code false} when the send was skipped
 */
public record SendResult(boolean ok, String error, boolean delivered) {

    public static SendResult sent() {
        return new SendResult(true, null, true);
    }

    public static SendResult skipped() {
        return new SendResult(true, null, false);
    }

    public static SendResult failed(String error) {
        return new SendResult(false, error == null || error.isBlank() ? "unknown_error" : error, false);
    }
}
