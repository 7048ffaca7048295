package build.orchestra.outcome;

import build.orchestra.config.Notification;
import build.orchestra.config.NotificationTemplate;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletionException;

public sealed interface BuildOutcome permits ExtractionOk, ExtractionFailed, BuildGood, BuildBad {

    String project();

    Set<String> tags();

    default List<BuildOutcome> outcomes() {
        return List.of();
    }

    default boolean isSuccess() {
        return tags().contains(BuildGood.SUCCESS);
    }

    default NotificationTemplate defaultTemplate() {
        String summary = (isSuccess() ? "SUCCESS: " : "FAILED: ") + project();
        return new NotificationTemplate(isSuccess() ? "success" : "failure", summary, null, describe());
    }

    default String describe() {
        return project() + ": " + String.join(", ", tags().stream().filter(tag -> !tag.equals(Notification.ALWAYS)).sorted().toList());
    }

    static String reason(Throwable throwable) {
        Throwable cause = throwable;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() == null ? cause.getClass().getName() : cause.getMessage();
    }
}
