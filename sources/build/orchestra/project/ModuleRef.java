package build.orchestra.project;

import java.util.Objects;

public record ModuleRef(String name, String organization, String extension, String classifier) {

    public ModuleRef {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(organization, "organization");
        extension = extension == null ? "jar" : extension;
    }

    public ModuleRef(String name, String organization) {
        this(name, organization, null, null);
    }

    public String key() {
        return organization + "#" + name;
    }
}
