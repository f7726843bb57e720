package io.caretaker.cli;

import io.caretaker.core.config.ConfigService;
import io.caretaker.core.config.model.CaretakerConfig;
import io.caretaker.core.feedback.LoggingRetrainingRequester;
import io.caretaker.core.runtime.CaretakerRuntime;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    RuntimeFactory runtimeFactory
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, config -> CaretakerRuntime.create(config, new LoggingRetrainingRequester()));
    }

    /**
     * Loads and validates the configuration, then builds the runtime from it.
     */
    CaretakerRuntime loadRuntime() throws Exception {
        CaretakerConfig config = configService.load(configPath);
        configService.validate(config);
        return runtimeFactory.create(config);
    }
}
