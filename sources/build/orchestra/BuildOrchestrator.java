package build.orchestra;

import build.orchestra.config.DistributedBuildConfig;
import build.orchestra.config.ExtractionConfig;
import build.orchestra.config.OrchestraSettings;
import build.orchestra.config.ProjectConfig;
import build.orchestra.notification.Notifications;
import build.orchestra.outcome.BuildBad;
import build.orchestra.outcome.BuildGood;
import build.orchestra.outcome.BuildOutcome;
import build.orchestra.outcome.ExtractionFailed;
import build.orchestra.outcome.ExtractionOk;
import build.orchestra.project.ExtractedMeta;
import build.orchestra.project.ModuleDescriptor;
import build.orchestra.project.ModuleRef;
import build.orchestra.project.RepeatableProjectBuild;
import build.orchestra.repository.ArtifactStore;
import build.orchestra.repository.BuildArtifactsOut;
import build.orchestra.repository.SubArtifactsOut;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;
import java.util.stream.Collectors;

public class BuildOrchestrator {

    public static final String ROOT = "<root>";

    static final String PROJECTS = "projects", STORE = "store";

    private static final Logger log = LoggerFactory.getLogger(BuildOrchestrator.class);

    private final Path directory;
    private final int workers;
    private final ExtractionCache extractor;
    private final BuildCache builder;
    private final Notifications notifications;
    private final BuildCallback callback;

    public BuildOrchestrator(BuildSystems systems,
                             SourceResolver sources,
                             OrchestraSettings settings,
                             Notifications notifications,
                             BuildCallback callback) throws IOException {
        directory = settings.directory();
        workers = settings.workers();
        extractor = new ExtractionCache(systems, sources);
        builder = new BuildCache(extractor, new ArtifactStore(directory.resolve(STORE)), directory);
        this.notifications = notifications;
        this.callback = callback;
    }

    public static BuildOrchestrator of(BuildSystems systems) throws IOException {
        return new BuildOrchestrator(systems,
                SourceResolver.defaults(),
                OrchestraSettings.load(),
                Notifications.console(),
                BuildCallback.printing(System.out));
    }

    public ExtractionCache extractor() {
        return extractor;
    }

    public BuildCache builder() {
        return builder;
    }

    public BuildOutcome build(DistributedBuildConfig config) {
        extractor.systems().validate(config.projects());
        notifications.validate(config);
        Set<String> names = new LinkedHashSet<>(), duplicates = new TreeSet<>();
        config.projects().forEach(project -> {
            if (!names.add(project.name())) {
                duplicates.add(project.name());
            }
        });
        if (!duplicates.isEmpty()) {
            throw new ConfigurationException("These project names appear twice: " + String.join(", ", duplicates));
        }
        ExecutorService executorService = Executors.newFixedThreadPool(workers);
        try {
            BuildOutcome root = execute(config, executorService);
            notifications.send(config, root);
            return root;
        } finally {
            executorService.shutdownNow();
        }
    }

    private BuildOutcome execute(DistributedBuildConfig config, ExecutorService executorService) {
        Consumer<BuildOutcome> completion = callback.step(null, names(config.projects()));
        Map<String, CompletableFuture<BuildOutcome>> extractions = new LinkedHashMap<>();
        for (ProjectConfig project : config.projects()) {
            Path dir = directory.resolve(PROJECTS).resolve(Identity.of(project.name()));
            extractions.put(project.name(), CompletableFuture.supplyAsync(() -> {
                ProjectConfig resolved;
                try {
                    resolved = extractor.resolve(project, dir);
                } catch (Exception e) {
                    log.warn("Resolution of {} failed", project.name(), e);
                    return new ExtractionFailed(project.name(), "Resolution failed: " + BuildOutcome.reason(e));
                }
                return extractor.extract(new ExtractionConfig(resolved, config.buildOptions()), dir);
            }, executorService));
        }
        List<BuildOutcome> extracted = new ArrayList<>();
        extractions.values().forEach(future -> extracted.add(future.join()));
        List<String> failed = extracted.stream()
                .filter(outcome -> outcome instanceof ExtractionFailed)
                .map(BuildOutcome::project)
                .toList();
        if (!failed.isEmpty()) {
            BuildOutcome root = new BuildBad(ROOT,
                    BuildBad.Status.EXTRACTION_FAILED,
                    "Extraction failed for: " + String.join(", ", failed),
                    extracted);
            completion.accept(root);
            return root;
        }
        Map<String, ExtractionOk> projects = new LinkedHashMap<>();
        extracted.forEach(outcome -> projects.put(outcome.project(), (ExtractionOk) outcome));
        Map<String, Set<String>> graph = graph(projects);
        Map<String, RepeatableProjectBuild> repeatable = new LinkedHashMap<>();
        Map<String, Set<String>> transitive = new LinkedHashMap<>();
        for (String name : order(graph)) {
            Set<String> dependencies = new TreeSet<>();
            for (String dependency : graph.get(name)) {
                dependencies.add(dependency);
                dependencies.addAll(transitive.get(dependency));
            }
            transitive.put(name, dependencies);
            ExtractionOk outcome = projects.get(name);
            ProjectConfig project = outcome.pces().get(0).config();
            ExtractedMeta meta = outcome.pces().get(0).extracted();
            repeatable.put(name, new RepeatableProjectBuild(project,
                    project.setVersion() == null ? meta.version() : project.setVersion(),
                    dependencies.stream().map(dependency -> repeatable.get(dependency).uuid()).toList(),
                    meta.subprojects(),
                    config.buildOptions()));
        }
        Map<String, CompletableFuture<BuildOutcome>> dispatched = new LinkedHashMap<>();
        for (RepeatableProjectBuild project : repeatable.values()) {
            Set<String> dependencies = graph.get(project.name());
            Consumer<BuildOutcome> step = callback.step(project.name(), dependencies);
            Map<String, CompletableFuture<BuildOutcome>> preliminaries = new LinkedHashMap<>();
            dependencies.forEach(dependency -> preliminaries.put(dependency, dispatched.get(dependency)));
            CompletableFuture<Void> ready = CompletableFuture.allOf(preliminaries.values().toArray(CompletableFuture<?>[]::new));
            dispatched.put(project.name(), ready.thenApplyAsync(ignored -> {
                List<String> broken = preliminaries.entrySet().stream()
                        .filter(entry -> !(entry.getValue().join() instanceof BuildGood))
                        .map(Map.Entry::getKey)
                        .toList();
                BuildOutcome outcome = broken.isEmpty()
                        ? builder.checkCacheThenBuild(project, directory.resolve(PROJECTS).resolve(Identity.of(project.name())))
                        : new BuildBad(project.name(), BuildBad.Status.BROKEN_DEPENDENCY, "Dependency failed: " + String.join(", ", broken));
                step.accept(outcome);
                return outcome;
            }, executorService).exceptionally(throwable -> {
                log.error("Unexpected failure while building {}", project.name(), throwable);
                BuildOutcome outcome = new BuildBad(project.name(), BuildBad.Status.FAILED, BuildOutcome.reason(throwable));
                step.accept(outcome);
                return outcome;
            }));
        }
        List<BuildOutcome> outcomes = new ArrayList<>();
        for (ProjectConfig project : config.projects()) {
            outcomes.add(dispatched.get(project.name()).join());
        }
        List<String> bad = outcomes.stream().filter(outcome -> !outcome.isSuccess()).map(BuildOutcome::project).toList();
        BuildOutcome root;
        if (bad.isEmpty()) {
            List<SubArtifactsOut> results = new ArrayList<>();
            outcomes.forEach(outcome -> results.addAll(((BuildGood) outcome).artifacts().results()));
            root = new BuildGood(ROOT, new BuildArtifactsOut(results), outcomes);
        } else {
            root = new BuildBad(ROOT, BuildBad.Status.FAILED, "Failed projects: " + String.join(", ", bad), outcomes);
        }
        completion.accept(root);
        return root;
    }

    static Map<String, Set<String>> graph(Map<String, ExtractionOk> projects) {
        Map<String, String> owners = new LinkedHashMap<>();
        projects.forEach((name, outcome) -> {
            for (ModuleDescriptor module : outcome.pces().get(0).extracted().modules()) {
                String previous = owners.putIfAbsent(module.key(), name);
                if (previous != null && !previous.equals(name)) {
                    throw new ConfigurationException(module.key() + " is provided by both " + previous + " and " + name);
                }
            }
        });
        Map<String, Set<String>> graph = new LinkedHashMap<>();
        projects.forEach((name, outcome) -> {
            Set<String> dependencies = new LinkedHashSet<>();
            for (ModuleDescriptor module : outcome.pces().get(0).extracted().modules()) {
                for (ModuleRef dependency : module.dependencies()) {
                    String owner = owners.get(dependency.key());
                    if (owner != null && !owner.equals(name)) {
                        dependencies.add(owner);
                    }
                }
            }
            graph.put(name, dependencies);
        });
        return graph;
    }

    static List<String> order(Map<String, Set<String>> graph) {
        List<String> ordered = new ArrayList<>();
        Set<String> done = new LinkedHashSet<>();
        Map<String, Set<String>> pending = new LinkedHashMap<>(graph);
        while (!pending.isEmpty()) {
            List<String> ready = pending.entrySet().stream()
                    .filter(entry -> done.containsAll(entry.getValue()))
                    .map(Map.Entry::getKey)
                    .toList();
            if (ready.isEmpty()) {
                throw new ConfigurationException("Cycle in the dependency graph between: " + String.join(", ", pending.keySet()));
            }
            ready.forEach(pending::remove);
            done.addAll(ready);
            ordered.addAll(ready);
        }
        return ordered;
    }

    private static Set<String> names(Collection<ProjectConfig> projects) {
        return projects.stream().map(ProjectConfig::name).collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
