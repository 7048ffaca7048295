package build.orchestra.config;

public record EmptyOptions() implements BuildSystemOptions {

    public static final EmptyOptions INSTANCE = new EmptyOptions();
}
