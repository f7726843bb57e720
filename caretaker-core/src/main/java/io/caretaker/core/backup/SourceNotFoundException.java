package io.caretaker.core.backup;

import java.nio.file.Path;

public class SourceNotFoundException extends BackupException {

    public SourceNotFoundException(Path source) {
        super("database file not found: " + source);
    }
}
