package build.orchestra.outcome;

import build.orchestra.config.Notification;

import java.util.Set;

public record ExtractionFailed(String project, String reason) implements BuildOutcome {

    @Override
    public Set<String> tags() {
        return Set.of(BuildBad.FAILURE, "bad", "extraction", Notification.ALWAYS);
    }

    @Override
    public String describe() {
        return project + ": extraction failed, " + reason;
    }
}
