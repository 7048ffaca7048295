package build.orchestra.repository;

import java.util.List;

public record BuildArtifactsOut(List<SubArtifactsOut> results) {

    public BuildArtifactsOut {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public List<ArtifactLocation> artifacts() {
        return results.stream().flatMap(result -> result.artifacts().stream()).toList();
    }

    public List<ArtifactSha> shas() {
        return results.stream().flatMap(result -> result.shas().stream()).toList();
    }
}
