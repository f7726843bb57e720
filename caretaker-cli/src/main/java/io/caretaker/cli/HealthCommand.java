package io.caretaker.cli;

import io.caretaker.core.model.Status;
import io.caretaker.core.monitor.HealthSample;
import io.caretaker.core.monitor.Thresholds;
import io.caretaker.core.runtime.CaretakerRuntime;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "health", description = "Sample CPU, memory and disk usage against thresholds")
public final class HealthCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--cpu", description = "CPU threshold in percent")
    Double cpu;

    @Option(names = "--mem", description = "Memory threshold in percent")
    Double mem;

    @Option(names = "--disk", description = "Disk threshold in percent")
    Double disk;

    public HealthCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            CaretakerRuntime runtime = context.loadRuntime();
            Thresholds configured = runtime.thresholds();
            Thresholds thresholds = new Thresholds(
                cpu == null ? configured.cpu() : cpu,
                mem == null ? configured.mem() : mem,
                disk == null ? configured.disk() : disk
            );
            HealthSample sample = runtime.healthMonitor().check(thresholds);

            System.out.println("Status: " + sample.status().label());
            if (sample.status() == Status.ERROR) {
                System.err.println("Health check failed: " + sample.error());
                return 1;
            }
            System.out.println(sample.summary());
            for (String alert : sample.alerts()) {
                System.out.println("Alert: " + alert);
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Health command failed: " + e.getMessage());
            return 1;
        }
    }
}
