package build.orchestra.outcome;

import build.orchestra.config.ProjectConfig;
import build.orchestra.project.ExtractedMeta;

public record ProjectConfigAndExtracted(ProjectConfig config, ExtractedMeta extracted) {
}
