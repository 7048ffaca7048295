package build.orchestra.config;

import java.util.List;

public record NotificationOptions(List<NotificationTemplate> templates, List<Notification> notifications) {

    public static final NotificationOptions DEFAULT = new NotificationOptions(null, null);

    public NotificationOptions {
        templates = templates == null ? List.of() : List.copyOf(templates);
        notifications = notifications == null ? List.of(new Notification("console")) : List.copyOf(notifications);
    }
}
