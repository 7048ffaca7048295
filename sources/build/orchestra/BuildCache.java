package build.orchestra;

import build.orchestra.outcome.BuildBad;
import build.orchestra.outcome.BuildGood;
import build.orchestra.outcome.BuildOutcome;
import build.orchestra.project.RepeatableProjectBuild;
import build.orchestra.repository.ArtifactLocation;
import build.orchestra.repository.ArtifactStore;
import build.orchestra.repository.BuildArtifactsOut;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

public class BuildCache {

    private static final Logger log = LoggerFactory.getLogger(BuildCache.class);

    static final String BUILDS = "builds", INPUT = "input", OUTPUT = "output";

    private final ExtractionCache extractor;
    private final ArtifactStore store;
    private final Path directory;

    private final Map<String, CompletableFuture<BuildOutcome>> builds = new ConcurrentHashMap<>();

    public BuildCache(ExtractionCache extractor, ArtifactStore store, Path directory) {
        this.extractor = extractor;
        this.store = store;
        this.directory = directory;
    }

    public ExtractionCache extractor() {
        return extractor;
    }

    public ArtifactStore store() {
        return store;
    }

    public BuildOutcome checkCacheThenBuild(RepeatableProjectBuild project, Path dir) {
        String uuid = project.uuid();
        CompletableFuture<BuildOutcome> future = new CompletableFuture<>();
        CompletableFuture<BuildOutcome> existing = builds.putIfAbsent(uuid, future);
        if (existing != null) {
            log.debug("Awaiting build of {} ({})", project.name(), uuid);
            return existing.join();
        }
        try {
            BuildOutcome outcome = build(uuid, project, dir);
            future.complete(outcome);
            return outcome;
        } catch (RuntimeException | Error e) {
            future.completeExceptionally(new BuildOrchestrationException(project.name(), e));
            throw e;
        }
    }

    private BuildOutcome build(String uuid, RepeatableProjectBuild project, Path dir) {
        Optional<BuildArtifactsOut> published;
        try {
            published = store.artifacts(uuid);
        } catch (IOException e) {
            return new BuildBad(project.name(), BuildBad.Status.FAILED, BuildOutcome.reason(e));
        }
        if (published.isPresent()) {
            log.info("Found artifacts of {} ({}) in store", project.name(), uuid);
            return new BuildGood(project.name(), published.get());
        }
        for (String dependency : project.dependencies()) {
            if (!store.contains(dependency)) {
                throw new IllegalStateException("Internal error: dependency " + dependency
                        + " of " + project.name() + " was not built");
            }
        }
        Path folder = directory.resolve(BUILDS).resolve(uuid);
        try {
            Path input = folder.resolve(INPUT), output = folder.resolve(OUTPUT);
            Directories.clean(input);
            Directories.clean(output);
            List<ArtifactLocation> artifacts = store.retrieve(project.dependencies(), input);
            log.info("Building {} ({}) with {} dependencies", project.name(), uuid, project.dependencies().size());
            BuildArtifactsOut result = extractor.systems().get(project.config().system()).runBuild(project,
                    dir,
                    new BuildInput(input, artifacts, uuid, project.version(), output),
                    this);
            store.publish(uuid, result, output);
            return new BuildGood(project.name(), result);
        } catch (CancellationException e) {
            log.warn("Build of {} was canceled", project.name());
            discard(folder);
            return new BuildBad(project.name(), BuildBad.Status.CANCELED, BuildOutcome.reason(e));
        } catch (Exception e) {
            log.warn("Build of {} failed", project.name(), e);
            discard(folder);
            return new BuildBad(project.name(), BuildBad.Status.FAILED, BuildOutcome.reason(e));
        }
    }

    private static void discard(Path folder) {
        try {
            Directories.delete(folder);
        } catch (IOException e) {
            log.error("Could not remove partial output in {}", folder, e);
        }
    }
}
