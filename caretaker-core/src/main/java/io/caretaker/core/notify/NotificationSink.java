package io.caretaker.core.notify;

/**
 * Sends a plain-text alert to an external channel. Implementations must not throw and must be
 * safe to call from several threads.
 */
public interface NotificationSink {

    String name();

    SendResult send(String message);
}
