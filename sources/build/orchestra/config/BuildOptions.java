package build.orchestra.config;

import com.fasterxml.jackson.annotation.JsonProperty;

public record BuildOptions(@JsonProperty("cross-version") CrossVersion crossVersion) {

    public static final BuildOptions DEFAULT = new BuildOptions(null);

    public BuildOptions {
        if (crossVersion == null) {
            crossVersion = CrossVersion.DISABLED;
        }
    }
}
