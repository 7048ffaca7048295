package build.orchestra.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record DistributedBuildConfig(List<ProjectConfig> projects,
                                     @JsonProperty("build-options") BuildOptions buildOptions,
                                     @JsonProperty("notification-options") NotificationOptions notificationOptions) {

    public DistributedBuildConfig {
        projects = projects == null ? List.of() : List.copyOf(projects);
        buildOptions = buildOptions == null ? BuildOptions.DEFAULT : buildOptions;
        notificationOptions = notificationOptions == null ? NotificationOptions.DEFAULT : notificationOptions;
    }

    public DistributedBuildConfig(List<ProjectConfig> projects, BuildOptions buildOptions) {
        this(projects, buildOptions, null);
    }
}
