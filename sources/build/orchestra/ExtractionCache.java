package build.orchestra;

import build.orchestra.config.ExtractionConfig;
import build.orchestra.config.ProjectConfig;
import build.orchestra.outcome.BuildOutcome;
import build.orchestra.outcome.ExtractionFailed;
import build.orchestra.outcome.ExtractionOk;
import build.orchestra.outcome.ProjectConfigAndExtracted;
import build.orchestra.project.ExtractedMeta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

public class ExtractionCache {

    private static final Logger log = LoggerFactory.getLogger(ExtractionCache.class);

    private final BuildSystems systems;
    private final SourceResolver sources;

    private final Map<String, CompletableFuture<BuildOutcome>> extractions = new ConcurrentHashMap<>();

    public ExtractionCache(BuildSystems systems, SourceResolver sources) {
        this.systems = systems;
        this.sources = sources;
    }

    public BuildSystems systems() {
        return systems;
    }

    public SourceResolver sources() {
        return sources;
    }

    public ProjectConfig resolve(ProjectConfig config, Path dir) throws IOException {
        return systems.get(config.system()).resolve(config, dir, this);
    }

    public BuildOutcome extract(ExtractionConfig config, Path dir) {
        String uuid = config.uuid(), name = config.buildConfig().name();
        CompletableFuture<BuildOutcome> future = new CompletableFuture<>();
        CompletableFuture<BuildOutcome> existing = extractions.putIfAbsent(uuid, future);
        if (existing != null) {
            log.debug("Awaiting extraction of {} ({})", name, uuid);
            return existing.join();
        }
        BuildOutcome outcome;
        try {
            log.info("Extracting dependencies of {}", name);
            ExtractedMeta extracted = systems.get(config.buildConfig().system()).extractDependencies(config, dir, this);
            outcome = new ExtractionOk(name, List.of(new ProjectConfigAndExtracted(config.buildConfig(), extracted)));
        } catch (Exception e) {
            log.warn("Extraction of {} failed", name, e);
            outcome = new ExtractionFailed(name, BuildOutcome.reason(e));
        } catch (Error e) {
            future.completeExceptionally(new BuildOrchestrationException(name, e));
            throw e;
        }
        future.complete(outcome);
        return outcome;
    }

    public Optional<BuildOutcome> cached(ExtractionConfig config) {
        CompletableFuture<BuildOutcome> future = extractions.get(config.uuid());
        return future == null || !future.isDone() || future.isCompletedExceptionally()
                ? Optional.empty()
                : Optional.of(future.join());
    }
}
