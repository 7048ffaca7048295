package build.orchestra;

import build.orchestra.repository.ArtifactLocation;

import java.nio.file.Path;
import java.util.List;

public record BuildInput(Path repository, List<ArtifactLocation> artifacts, String uuid, String version, Path outRepository) {

    public BuildInput {
        artifacts = List.copyOf(artifacts);
    }
}
