package build.orchestra.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ScalaOptions(@JsonProperty("build-number") BuildNumber buildNumber,
                           @JsonProperty("build-target") String buildTarget,
                           @JsonProperty("build-options") List<String> buildOptions,
                           List<String> exclude) implements BuildSystemOptions {

    public static final String KIND = "scala";

    public static final ScalaOptions DEFAULT = new ScalaOptions(null, null, null, null);

    public ScalaOptions {
        buildTarget = buildTarget == null ? "distpack-maven-opt" : buildTarget;
        buildOptions = buildOptions == null ? List.of() : List.copyOf(buildOptions);
        exclude = exclude == null ? List.of() : exclude.stream().sorted().distinct().toList();
    }

    public record BuildNumber(String major, String minor, String patch, String bnum) {
    }
}
