package io.caretaker.core.backup;

public class BackupVerificationException extends BackupException {

    public BackupVerificationException(String message) {
        super(message);
    }
}
