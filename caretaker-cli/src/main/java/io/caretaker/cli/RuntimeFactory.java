package io.caretaker.cli;

import io.caretaker.core.config.model.CaretakerConfig;
import io.caretaker.core.runtime.CaretakerRuntime;

@FunctionalInterface
public interface RuntimeFactory {
    CaretakerRuntime create(CaretakerConfig config) throws Exception;
}
