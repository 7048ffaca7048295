package build.orchestra.outcome;

import build.orchestra.config.Notification;

import java.util.List;
import java.util.Set;

public record ExtractionOk(String project, List<ProjectConfigAndExtracted> pces) implements BuildOutcome {

    public ExtractionOk {
        pces = List.copyOf(pces);
    }

    @Override
    public Set<String> tags() {
        return Set.of(BuildGood.SUCCESS, "extracted", Notification.ALWAYS);
    }
}
