package build.orchestra;

import build.orchestra.config.AssembleOptions;
import build.orchestra.config.ProjectConfig;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public final class BuildSystems {

    private final Map<String, BuildSystem> systems;

    private BuildSystems(Map<String, BuildSystem> systems) {
        this.systems = systems;
    }

    public static BuildSystems of(BuildSystem... systems) {
        Map<String, BuildSystem> registered = new LinkedHashMap<>();
        for (BuildSystem system : systems) {
            if (registered.putIfAbsent(system.name(), system) != null) {
                throw new IllegalArgumentException("Build system registered twice: " + system.name());
            }
        }
        return new BuildSystems(Collections.unmodifiableMap(registered));
    }

    public BuildSystem get(String kind) {
        BuildSystem system = systems.get(kind);
        if (system == null) {
            throw new ConfigurationException("Build system \"" + kind + "\" is unknown, known systems are: "
                    + String.join(", ", systems.keySet()));
        }
        return system;
    }

    public boolean contains(String kind) {
        return systems.containsKey(kind);
    }

    public Set<String> kinds() {
        return systems.keySet();
    }

    public void validate(Collection<ProjectConfig> projects) {
        for (ProjectConfig project : projects) {
            get(project.system());
            if (project.extra() instanceof AssembleOptions options) {
                validate(options.parts());
            }
        }
    }
}
