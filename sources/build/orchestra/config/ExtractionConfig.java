package build.orchestra.config;

import build.orchestra.Identity;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public record ExtractionConfig(@JsonProperty("project") ProjectConfig buildConfig, BuildOptions options) {

    public ExtractionConfig {
        Objects.requireNonNull(buildConfig, "buildConfig");
        options = options == null ? BuildOptions.DEFAULT : options;
    }

    public String uuid() {
        return Identity.of(this);
    }
}
