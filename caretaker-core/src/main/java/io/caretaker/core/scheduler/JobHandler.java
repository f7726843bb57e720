package io.caretaker.core.scheduler;

@FunctionalInterface
public interface JobHandler {

    /**
     * Performs one execution. Any exception is converted by the scheduler into an
     * {@link io.caretaker.core.model.Status#ERROR} result.
     */
    JobResult run() throws Exception;
}
