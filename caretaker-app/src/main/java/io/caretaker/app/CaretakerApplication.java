package io.caretaker.app;

import io.caretaker.cli.BackupCommand;
import io.caretaker.cli.CaretakerCliCommand;
import io.caretaker.cli.CliContext;
import io.caretaker.cli.FeedbackCommand;
import io.caretaker.cli.HealthCommand;
import io.caretaker.cli.InitCommand;
import io.caretaker.cli.RunCommand;
import io.caretaker.cli.StatusCommand;
import io.caretaker.core.config.ConfigPaths;
import io.caretaker.core.config.ConfigService;
import io.caretaker.core.feedback.LoggingRetrainingRequester;
import io.caretaker.core.runtime.CaretakerRuntime;
import java.nio.file.Path;
import java.util.Map;
import picocli.CommandLine;

public final class CaretakerApplication {
    static final String ENV_CONFIG_PATH = "CARETAKER_CONFIG";

    private CaretakerApplication() {
    }

    public static void main(String[] args) {
        System.exit(execute(System.getenv(), args));
    }

    static int execute(Map<String, String> environment, String... args) {
        ConfigService configService = new ConfigService(environment);
        CliContext context = new CliContext(
            configService,
            configPath(environment),
            config -> CaretakerRuntime.create(config, new LoggingRetrainingRequester())
        );
        return commandLine(context).execute(args);
    }

    static CommandLine commandLine(CliContext context) {
        CommandLine commandLine = new CommandLine(new CaretakerCliCommand());
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("health", new HealthCommand(context));
        commandLine.addSubcommand("backup", new BackupCommand(context));
        commandLine.addSubcommand("feedback", new FeedbackCommand(context));
        commandLine.addSubcommand("run", new RunCommand(context));
        return commandLine;
    }

    static Path configPath(Map<String, String> environment) {
        String override = environment.get(ENV_CONFIG_PATH);
        if (override == null || override.isBlank()) {
            return ConfigPaths.defaultConfigPath();
        }
        return ConfigPaths.resolve(override.trim());
    }
}
