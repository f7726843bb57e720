package io.caretaker.core.backup;

public class BackupInProgressException extends IllegalStateException {

    public BackupInProgressException() {
        super("a backup is already running; concurrent runs are not allowed");
    }
}
