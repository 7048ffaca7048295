package build.orchestra.assemble;

import build.orchestra.project.ModuleRef;

import java.util.Objects;
import java.util.Set;

public record CoreModules(String organization, String prefix, String library, Set<String> additional) {

    public static final CoreModules SCALA = new CoreModules("org.scala-lang",
            "scala",
            "scala-library",
            Set.of("org.scala-lang.plugins#continuations"));

    public CoreModules {
        Objects.requireNonNull(organization, "organization");
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(library, "library");
        additional = additional == null ? Set.of() : Set.copyOf(additional);
    }

    public static CoreModules of(String organization, String library) {
        return new CoreModules(organization, library, library, null);
    }

    public boolean isCore(ModuleRef module) {
        return module.organization().equals(organization) && NameFixer.fixName(module.name()).startsWith(prefix)
                || additional.contains(module.key());
    }

    public boolean isLibrary(ModuleRef module) {
        return module.organization().equals(organization) && module.name().equals(library);
    }
}
