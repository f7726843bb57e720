package io.caretaker.core.backup;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public final class ProcessCommandRunner implements CommandRunner {
    private static final int MAX_OUTPUT_CHARS = 12_000;
    private static final Duration KILL_GRACE = Duration.ofSeconds(5);

    @Override
    public CommandResult run(List<String> command, Map<String, String> environment, Duration timeout)
        throws IOException, InterruptedException, TimeoutException {
        ProcessBuilder builder = new ProcessBuilder(command).redirectErrorStream(true);
        builder.environment().putAll(environment);
        Process process = builder.start();

        // drained concurrently so a chatty process cannot block on a full pipe
        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));

        boolean finished;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }
        if (!finished) {
            process.destroyForcibly();
            process.waitFor(KILL_GRACE.toMillis(), TimeUnit.MILLISECONDS);
            throw new TimeoutException(command.get(0) + " timed out after " + timeout.toSeconds() + "s");
        }
        return new CommandResult(process.exitValue(), truncate(collect(output)));
    }

    private String collect(CompletableFuture<String> output) throws InterruptedException {
        try {
            return output.get(KILL_GRACE.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException e) {
            return "(output unavailable: " + e.getMessage() + ")";
        }
    }

    private static String readAll(InputStream stream) {
        try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private String truncate(String output) {
        if (output.length() <= MAX_OUTPUT_CHARS) {
            return output;
        }
        return output.substring(output.length() - MAX_OUTPUT_CHARS);
    }
}
