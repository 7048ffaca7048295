package build.orchestra.config;

public sealed interface BuildSystemOptions permits EmptyOptions, ScalaOptions, AssembleOptions {

    static BuildSystemOptions defaults(String system) {
        return switch (system) {
            case AssembleOptions.KIND -> AssembleOptions.DEFAULT;
            case ScalaOptions.KIND -> ScalaOptions.DEFAULT;
            default -> EmptyOptions.INSTANCE;
        };
    }
}
