package io.caretaker.core.backup;

import java.nio.file.Path;

public record PackResult(Path archive, int logCount) {
}
