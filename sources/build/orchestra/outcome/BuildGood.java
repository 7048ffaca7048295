package build.orchestra.outcome;

import build.orchestra.config.Notification;
import build.orchestra.repository.BuildArtifactsOut;

import java.util.List;
import java.util.Set;

public record BuildGood(String project, BuildArtifactsOut artifacts, List<BuildOutcome> outcomes) implements BuildOutcome {

    public static final String SUCCESS = "success";

    public BuildGood {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public BuildGood(String project, BuildArtifactsOut artifacts) {
        this(project, artifacts, null);
    }

    @Override
    public Set<String> tags() {
        return Set.of(SUCCESS, "good", Notification.ALWAYS);
    }
}
