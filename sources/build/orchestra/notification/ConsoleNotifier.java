package build.orchestra.notification;

import build.orchestra.config.Notification;
import build.orchestra.outcome.BuildOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ConsoleNotifier implements Notifier {

    public static final String KIND = "console";

    private static final Logger log = LoggerFactory.getLogger(ConsoleNotifier.class);

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public void send(Notification notification, Notification.ResolvedTemplate template, BuildOutcome outcome) {
        for (String line : template.longText().split("\n")) {
            if (outcome.isSuccess()) {
                log.info(line);
            } else {
                log.error(line);
            }
        }
    }
}
