package io.caretaker.core.backup;

import java.time.Duration;

public class DumpTimeoutException extends DumpException {

    public DumpTimeoutException(String command, Duration timeout) {
        super(command + " did not finish within " + timeout.toSeconds() + "s and was killed", -1);
    }
}
