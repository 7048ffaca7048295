package build.orchestra.config;

import build.orchestra.ConfigurationException;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

public record Notification(String kind, List<String> when, String template) {

    public static final String ALWAYS = "always";

    public Notification {
        Objects.requireNonNull(kind, "kind");
        when = when == null ? List.of(ALWAYS) : when.stream().sorted().distinct().toList();
    }

    public Notification(String kind) {
        this(kind, null, null);
    }

    public boolean triggers(Collection<String> tags) {
        return when.stream().anyMatch(tags::contains);
    }

    public ResolvedTemplate resolveTemplate(NotificationTemplate fallback, List<NotificationTemplate> defined) {
        NotificationTemplate resolved;
        if (template == null) {
            resolved = fallback;
        } else {
            resolved = defined.stream()
                    .filter(candidate -> candidate.id().equals(template))
                    .findFirst()
                    .orElseThrow(() -> new ConfigurationException(
                            "The requested notification template \"" + template + "\" was not found"));
        }
        String shortText = resolved.shortText() == null ? resolved.summary() : resolved.shortText();
        String longText = resolved.longText() == null ? shortText : resolved.longText();
        return new ResolvedTemplate(resolved.id(), resolved.summary(), shortText, longText);
    }

    public record ResolvedTemplate(String id, String summary, String shortText, String longText) {
    }
}
