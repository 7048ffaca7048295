package build.orchestra.repository;

import java.util.List;
import java.util.Objects;

public record SubArtifactsOut(String subName, List<ArtifactLocation> artifacts, List<ArtifactSha> shas) {

    public SubArtifactsOut {
        Objects.requireNonNull(subName, "subName");
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        shas = shas == null ? List.of() : List.copyOf(shas);
    }

    public SubArtifactsOut withSubName(String subName) {
        return new SubArtifactsOut(subName, artifacts, shas);
    }
}
