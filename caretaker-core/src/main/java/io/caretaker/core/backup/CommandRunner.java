package io.caretaker.core.backup;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Runs an external program to completion.
 */
@FunctionalInterface
public interface CommandRunner {

    /**
     * @param environment variables added to the inherited environment
     * @throws IOException if the program cannot be started
     * @throws TimeoutException if it is still running after {@code timeout}; the process has been killed
     */
    CommandResult run(List<String> command, Map<String, String> environment, Duration timeout)
        throws IOException, InterruptedException, TimeoutException;
}
