package build.orchestra.project;

import java.util.List;
import java.util.Objects;

public record ModuleDescriptor(String name,
                               String organization,
                               List<ModuleRef> artifacts,
                               List<ModuleRef> dependencies) {

    public ModuleDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(organization, "organization");
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public String key() {
        return organization + "#" + name;
    }
}
