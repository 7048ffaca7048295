package build.orchestra.outcome;

import build.orchestra.config.Notification;

import java.util.List;
import java.util.Set;

public record BuildBad(String project, Status status, String reason, List<BuildOutcome> outcomes) implements BuildOutcome {

    public static final String FAILURE = "failure";

    public BuildBad {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public BuildBad(String project, Status status, String reason) {
        this(project, status, reason, null);
    }

    @Override
    public Set<String> tags() {
        return Set.of(FAILURE, "bad", status.tag, Notification.ALWAYS);
    }

    @Override
    public String describe() {
        return project + ": " + status.tag + ", " + reason;
    }

    public enum Status {

        FAILED("failed"), BROKEN_DEPENDENCY("dependency"), CANCELED("canceled"), EXTRACTION_FAILED("extraction");

        private final String tag;

        Status(String tag) {
            this.tag = tag;
        }

        public String tag() {
            return tag;
        }
    }
}
