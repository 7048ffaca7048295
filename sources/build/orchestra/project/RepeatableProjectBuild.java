package build.orchestra.project;

import build.orchestra.Identity;
import build.orchestra.config.BuildOptions;
import build.orchestra.config.ProjectConfig;

import java.util.List;
import java.util.Objects;

public record RepeatableProjectBuild(ProjectConfig config,
                                     String version,
                                     List<String> dependencies,
                                     List<String> subprojects,
                                     BuildOptions buildOptions) {

    public RepeatableProjectBuild {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(version, "version");
        dependencies = dependencies == null ? List.of() : dependencies.stream().sorted().distinct().toList();
        subprojects = subprojects == null ? List.of() : subprojects.stream().sorted().distinct().toList();
        buildOptions = buildOptions == null ? BuildOptions.DEFAULT : buildOptions;
    }

    public String name() {
        return config.name();
    }

    public String uuid() {
        return Identity.of(this);
    }
}
