package build.orchestra.config;

import java.util.List;

public record AssembleOptions(List<ProjectConfig> parts, BuildOptions options) implements BuildSystemOptions {

    public static final String KIND = "assemble";

    public static final AssembleOptions DEFAULT = new AssembleOptions(null, null);

    public AssembleOptions {
        parts = parts == null ? List.of() : List.copyOf(parts);
        options = options == null ? BuildOptions.DEFAULT : options;
    }

    public AssembleOptions withParts(List<ProjectConfig> parts) {
        return new AssembleOptions(parts, options);
    }
}
