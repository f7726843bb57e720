package io.caretaker.core.backup;

/**
 * The external dump utility could not be started or exited with a non-zero status.
 */
public class DumpException extends BackupException {
    private final int exitCode;

    public DumpException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public DumpException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
    }

    /**
     * @return the utility's exit status, or {@code -1} when it never ran to completion
     */
    public int exitCode() {
        return exitCode;
    }
}
