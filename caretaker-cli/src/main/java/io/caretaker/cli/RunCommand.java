package io.caretaker.cli;

import io.caretaker.core.model.Status;
import io.caretaker.core.runtime.CaretakerRuntime;
import io.caretaker.core.scheduler.Job;
import io.caretaker.core.scheduler.JobScheduler;
import io.caretaker.core.scheduler.ShutdownToken;
import io.caretaker.core.scheduler.SignalShutdownHandler;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "run", description = "Run the job scheduler until SIGINT or SIGTERM")
public final class RunCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--once", description = "Run every registered job once and exit")
    boolean once;

    public RunCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            CaretakerRuntime runtime = context.loadRuntime();
            ShutdownToken shutdown = new ShutdownToken();
            JobScheduler scheduler = runtime.newScheduler(shutdown);
            List<Job> jobs = scheduler.jobs();
            for (Job job : jobs) {
                System.out.println("Job " + job.name() + ": " + job.trigger().describe() + ", next run " + job.nextRun());
            }

            if (once) {
                scheduler.runAll();
                boolean failed = false;
                for (Job job : scheduler.jobs()) {
                    Status status = job.lastResult() == null ? Status.ERROR : job.lastResult().status();
                    System.out.println(job.name() + ": " + status.label());
                    failed |= status == Status.ERROR;
                }
                return failed ? 1 : 0;
            }

            List<String> signals = new SignalShutdownHandler(shutdown).install();
            System.out.println("Scheduler running; stop with " + String.join(" or ", signals));
            scheduler.run();
            System.out.println("Scheduler stopped: " + shutdown.reason().orElse("unknown"));
            return 0;
        } catch (Exception e) {
            System.err.println("Run command failed: " + e.getMessage());
            return 1;
        }
    }
}
