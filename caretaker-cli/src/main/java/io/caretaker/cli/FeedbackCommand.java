package io.caretaker.cli;

import io.caretaker.core.feedback.FeedbackCountSource;
import io.caretaker.core.feedback.FeedbackCounts;
import io.caretaker.core.feedback.FeedbackRatio;
import io.caretaker.core.model.Status;
import io.caretaker.core.runtime.CaretakerRuntime;
import io.caretaker.core.scheduler.JobResult;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "feedback", description = "Evaluate the dislike ratio against the retraining threshold")
public final class FeedbackCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--threshold", description = "Dislike ratio threshold within [0, 1]")
    Double threshold;

    @Option(names = "--likes", description = "Like count; skips the database query when given with --dislikes")
    Long likes;

    @Option(names = "--dislikes", description = "Dislike count; skips the database query when given with --likes")
    Long dislikes;

    @Option(names = "--notify", description = "Run the full feedback loop: send the report and request retraining when needed")
    boolean notify;

    public FeedbackCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if ((likes == null) != (dislikes == null)) {
                System.err.println("Feedback command failed: --likes and --dislikes must be given together");
                return 1;
            }
            CaretakerRuntime runtime = context.loadRuntime();
            double limit = threshold == null ? runtime.config().feedback().threshold() : threshold;

            if (likes == null && notify) {
                JobResult result = runtime.newFeedbackLoopJob(limit).run();
                if (result.status() == Status.ERROR) {
                    System.err.println("Feedback loop failed: " + result.errorMessage());
                    return 1;
                }
                System.out.println("Feedback loop: " + result.status().label() + " " + result.detail());
                return 0;
            }

            FeedbackCounts counts;
            if (likes != null) {
                counts = new FeedbackCounts(likes, dislikes);
            } else {
                FeedbackCountSource source = runtime.feedbackSource().orElse(null);
                if (source == null) {
                    System.err.println("Feedback command failed: no feedback database configured"
                        + " (set feedback.databaseUrl or FEEDBACK_DATABASE_URL, or pass --likes and --dislikes)");
                    return 1;
                }
                counts = source.load();
            }

            FeedbackRatio ratio = runtime.feedbackEvaluator().evaluate(counts, limit);
            System.out.println("Likes: " + ratio.likes());
            System.out.println("Dislikes: " + ratio.dislikes());
            System.out.println("Total: " + ratio.total());
            System.out.println("Ratio: " + String.format(Locale.ROOT, "%.4f", ratio.ratio()));
            System.out.println("Threshold: " + ratio.threshold());
            System.out.println("Retraining needed: " + ratio.decision());
            return 0;
        } catch (Exception e) {
            System.err.println("Feedback command failed: " + e.getMessage());
            return 1;
        }
    }
}
