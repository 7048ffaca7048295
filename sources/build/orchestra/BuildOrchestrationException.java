package build.orchestra;

import java.util.concurrent.CompletionException;

public class BuildOrchestrationException extends CompletionException {

    private final String project;

    public BuildOrchestrationException(String project, Throwable cause) {
        super("Failed to process " + project, cause);
        this.project = project;
    }

    public String project() {
        return project;
    }
}
