package build.orchestra;

import build.orchestra.outcome.BuildBad;
import build.orchestra.outcome.BuildOutcome;

import java.io.PrintStream;
import java.util.Collection;
import java.util.function.Consumer;

public interface BuildCallback {

    Consumer<BuildOutcome> step(String project, Collection<String> dependencies);

    static BuildCallback nop() {
        return (project, dependencies) -> outcome -> {
        };
    }

    static BuildCallback printing(PrintStream out) {
        return (project, dependencies) -> {
            long started = System.nanoTime();
            if (project == null) {
                out.printf("Running build with %d projects%n", dependencies.size());
                return outcome -> out.printf("%s build in %.2f seconds%n",
                        outcome.isSuccess() ? "COMPLETED" : "FAILED",
                        seconds(started));
            } else {
                return outcome -> {
                    if (outcome instanceof BuildBad bad) {
                        out.printf("[%s] %s: %s%n", bad.status().tag().toUpperCase(), project, bad.reason());
                    } else {
                        out.printf("[BUILT] %s in %.2f seconds%n", project, seconds(started));
                    }
                };
            }
        };
    }

    private static double seconds(long started) {
        return ((double) (System.nanoTime() - started) / 1_000_000) / 1_000;
    }
}
