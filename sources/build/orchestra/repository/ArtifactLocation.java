package build.orchestra.repository;

import build.orchestra.project.ModuleRef;

import java.util.Objects;

public record ArtifactLocation(ModuleRef info, String version, String crossSuffix) {

    public ArtifactLocation {
        Objects.requireNonNull(info, "info");
        Objects.requireNonNull(version, "version");
        crossSuffix = crossSuffix == null ? "" : crossSuffix;
    }

    public ArtifactLocation withCrossSuffix(String crossSuffix) {
        return new ArtifactLocation(info, version, crossSuffix);
    }
}
