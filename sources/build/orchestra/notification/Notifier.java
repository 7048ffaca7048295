package build.orchestra.notification;

import build.orchestra.config.Notification;
import build.orchestra.outcome.BuildOutcome;

public interface Notifier {

    String kind();

    void send(Notification notification, Notification.ResolvedTemplate template, BuildOutcome outcome) throws Exception;
}
