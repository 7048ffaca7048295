package build.orchestra.notification;

import build.orchestra.ConfigurationException;
import build.orchestra.config.DistributedBuildConfig;
import build.orchestra.config.Notification;
import build.orchestra.config.NotificationTemplate;
import build.orchestra.config.ProjectConfig;
import build.orchestra.outcome.BuildOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class Notifications {

    private static final Logger log = LoggerFactory.getLogger(Notifications.class);

    private final Map<String, Notifier> notifiers;

    public Notifications(List<Notifier> notifiers) {
        Map<String, Notifier> registered = new LinkedHashMap<>();
        notifiers.forEach(notifier -> registered.put(notifier.kind(), notifier));
        this.notifiers = Collections.unmodifiableMap(registered);
    }

    public static Notifications console() {
        return new Notifications(List.of(new ConsoleNotifier()));
    }

    public void validate(DistributedBuildConfig config) {
        List<NotificationTemplate> templates = config.notificationOptions().templates();
        for (Notification notification : all(config)) {
            notifier(notification);
            if (notification.template() != null
                    && templates.stream().noneMatch(template -> template.id().equals(notification.template()))) {
                throw new ConfigurationException("The requested notification template \""
                        + notification.template() + "\" was not found");
            }
        }
    }

    public int send(DistributedBuildConfig config, BuildOutcome root) {
        Map<String, BuildOutcome> outcomes = new LinkedHashMap<>();
        root.outcomes().forEach(outcome -> outcomes.put(outcome.project(), outcome));
        List<NotificationTemplate> templates = config.notificationOptions().templates();
        int sent = 0;
        for (ProjectConfig project : config.projects()) {
            BuildOutcome outcome = outcomes.get(project.name());
            if (outcome == null) {
                throw new IllegalStateException("Internal error: no outcome for " + project.name());
            }
            for (Notification notification : project.notifications()) {
                sent += send(notification, outcome, templates) ? 1 : 0;
            }
        }
        for (Notification notification : config.notificationOptions().notifications()) {
            sent += send(notification, root, templates) ? 1 : 0;
        }
        return sent;
    }

    private boolean send(Notification notification, BuildOutcome outcome, List<NotificationTemplate> templates) {
        if (!notification.triggers(outcome.tags())) {
            return false;
        }
        Notifier notifier = notifier(notification);
        Notification.ResolvedTemplate template = notification.resolveTemplate(outcome.defaultTemplate(), templates);
        try {
            notifier.send(notification, expand(template, outcome), outcome);
            return true;
        } catch (Exception e) {
            log.warn("Could not send {} notification for {}", notification.kind(), outcome.project(), e);
            return false;
        }
    }

    private Notifier notifier(Notification notification) {
        Notifier notifier = notifiers.get(notification.kind());
        if (notifier == null) {
            throw new ConfigurationException("Unknown notification kind \"" + notification.kind() + "\"");
        }
        return notifier;
    }

    private static List<Notification> all(DistributedBuildConfig config) {
        List<Notification> notifications = new ArrayList<>();
        config.projects().forEach(project -> notifications.addAll(project.notifications()));
        notifications.addAll(config.notificationOptions().notifications());
        return notifications;
    }

    private static Notification.ResolvedTemplate expand(Notification.ResolvedTemplate template, BuildOutcome outcome) {
        return new Notification.ResolvedTemplate(template.id(),
                expand(template.summary(), outcome),
                expand(template.shortText(), outcome),
                expand(template.longText(), outcome));
    }

    private static String expand(String text, BuildOutcome outcome) {
        return text.replace("${project}", outcome.project()).replace("${outcome}", outcome.describe());
    }
}
