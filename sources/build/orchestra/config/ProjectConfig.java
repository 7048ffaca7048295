package build.orchestra.config;

import build.orchestra.Identity;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

public record ProjectConfig(String name,
                            String system,
                            String uri,
                            @JsonProperty("set-version") String setVersion,
                            BuildSystemOptions extra,
                            @JsonIgnore List<Notification> notifications) {

    public ProjectConfig {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(system, "system");
        Objects.requireNonNull(uri, "uri");
        extra = extra == null ? BuildSystemOptions.defaults(system) : extra;
        notifications = notifications == null ? List.of() : List.copyOf(notifications);
    }

    public ProjectConfig(String name, String system, String uri, BuildSystemOptions extra) {
        this(name, system, uri, null, extra, null);
    }

    public ProjectConfig withUri(String uri) {
        return new ProjectConfig(name, system, uri, setVersion, extra, notifications);
    }

    public ProjectConfig withExtra(BuildSystemOptions extra) {
        return new ProjectConfig(name, system, uri, setVersion, extra, notifications);
    }

    public String uuid() {
        return Identity.of(this);
    }
}
