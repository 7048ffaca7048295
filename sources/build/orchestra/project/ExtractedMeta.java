package build.orchestra.project;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

public record ExtractedMeta(String version,
                            @JsonProperty("projects") List<ModuleDescriptor> modules,
                            @JsonProperty("subproj") List<String> subprojects) {

    public ExtractedMeta {
        Objects.requireNonNull(version, "version");
        modules = modules == null ? List.of() : List.copyOf(modules);
        subprojects = subprojects == null ? List.of() : List.copyOf(subprojects);
    }
}
