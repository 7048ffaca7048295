package build.orchestra.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public record NotificationTemplate(String id,
                                   String summary,
                                   @JsonProperty("short") String shortText,
                                   @JsonProperty("long") String longText) {

    public NotificationTemplate {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(summary, "summary");
    }
}
