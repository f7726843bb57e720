package io.caretaker.core.backup;

import io.caretaker.core.database.DatabaseTarget;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Produces a raw dump of one database engine inside the backup directory. On failure no partial
 * output is left behind.
 */
public interface DatabaseDumper {

    Path dump(DatabaseTarget target, Path backupDir, String timestamp) throws BackupException, IOException;
}
