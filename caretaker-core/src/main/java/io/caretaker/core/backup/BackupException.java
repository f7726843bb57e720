package io.caretaker.core.backup;

/**
 * A backup run failed. The run's {@link BackupRecord} carries the message.
 */
public class BackupException extends Exception {

    public BackupException(String message) {
        super(message);
    }

    public BackupException(String message, Throwable cause) {
        super(message, cause);
    }
}
