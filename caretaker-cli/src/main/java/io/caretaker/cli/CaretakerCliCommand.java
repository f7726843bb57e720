package io.caretaker.cli;

import picocli.CommandLine.Command;

@Command(name = "caretaker", mixinStandardHelpOptions = true, description = "Scheduled health checks, backups and feedback monitoring")
public final class CaretakerCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
