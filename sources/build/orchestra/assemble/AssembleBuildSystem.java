package build.orchestra.assemble;

import build.orchestra.BuildCache;
import build.orchestra.BuildInput;
import build.orchestra.BuildSystem;
import build.orchestra.ConfigurationException;
import build.orchestra.ConsistencyException;
import build.orchestra.Directories;
import build.orchestra.ExtractionCache;
import build.orchestra.Identity;
import build.orchestra.SourceResolver;
import build.orchestra.config.AssembleOptions;
import build.orchestra.config.BuildSystemOptions;
import build.orchestra.config.CrossVersion;
import build.orchestra.config.ExtractionConfig;
import build.orchestra.config.ProjectConfig;
import build.orchestra.ivy.IvyDescriptorRewriter;
import build.orchestra.maven.MavenPomRewriter;
import build.orchestra.outcome.BuildBad;
import build.orchestra.outcome.BuildGood;
import build.orchestra.outcome.BuildOutcome;
import build.orchestra.outcome.ExtractionFailed;
import build.orchestra.outcome.ExtractionOk;
import build.orchestra.outcome.ProjectConfigAndExtracted;
import build.orchestra.project.ExtractedMeta;
import build.orchestra.project.ModuleDescriptor;
import build.orchestra.project.ModuleRef;
import build.orchestra.project.RepeatableProjectBuild;
import build.orchestra.repository.ArtifactLocation;
import build.orchestra.repository.ArtifactSha;
import build.orchestra.repository.BuildArtifactsOut;
import build.orchestra.repository.RepositoryPath;
import build.orchestra.repository.SubArtifactsOut;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

public class AssembleBuildSystem implements BuildSystem {

    private static final Logger log = LoggerFactory.getLogger(AssembleBuildSystem.class);

    static final String PROJECTS = "projects";

    private static final Pattern
            POM_NAME = Pattern.compile(".*/([^/]*)/([^/]*)/\\1-[^/]*\\.pom"),
            IVY_NAME = Pattern.compile("[^/]*/([^/]*)/[^/]*/ivys/ivy\\.xml");

    private final CoreModules core;
    private final MavenPomRewriter pomRewriter = new MavenPomRewriter();
    private final IvyDescriptorRewriter ivyRewriter = new IvyDescriptorRewriter();

    public AssembleBuildSystem() {
        this(CoreModules.SCALA);
    }

    public AssembleBuildSystem(CoreModules core) {
        this.core = core;
    }

    @Override
    public String name() {
        return AssembleOptions.KIND;
    }

    @Override
    public Class<? extends BuildSystemOptions> optionsType() {
        return AssembleOptions.class;
    }

    @Override
    public ProjectConfig resolve(ProjectConfig config, Path dir, ExtractionCache extractor) throws IOException {
        if (!SourceResolver.isNil(config.uri())) {
            throw new ConfigurationException("The uri of assemble " + config.name() + " must be \"nil\" or start with \"nil:\"");
        }
        ProjectConfig resolved = SourceResolver.nil().resolve(config, dir);
        AssembleOptions options = options(resolved);
        List<ProjectConfig> parts = new ArrayList<>();
        for (ProjectConfig part : options.parts()) {
            log.info("Resolving part {} of {}", part.name(), config.name());
            parts.add(extractor.resolve(part, projectsDir(dir, part)));
        }
        return resolved.withExtra(options.withParts(parts));
    }

    @Override
    public ExtractedMeta extractDependencies(ExtractionConfig config, Path dir, ExtractionCache extractor) {
        AssembleOptions options = options(config.buildConfig());
        Set<String> names = new LinkedHashSet<>(), duplicates = new LinkedHashSet<>();
        options.parts().forEach(part -> {
            if (!names.add(part.name())) {
                duplicates.add(part.name());
            }
        });
        if (!duplicates.isEmpty()) {
            throw new ConsistencyException("These subproject names appear twice: " + String.join(", ", duplicates));
        }
        List<BuildOutcome> outcomes = new ArrayList<>();
        for (ProjectConfig part : options.parts()) {
            outcomes.add(extractor.extract(new ExtractionConfig(part, options.options()), projectsDir(dir, part)));
        }
        List<String> failed = outcomes.stream()
                .filter(outcome -> outcome instanceof ExtractionFailed)
                .map(BuildOutcome::project)
                .toList();
        if (!failed.isEmpty()) {
            throw new ConsistencyException("Extraction failed for parts: " + String.join(", ", failed));
        }
        List<ProjectConfigAndExtracted> extracted = outcomes.stream()
                .flatMap(outcome -> ((ExtractionOk) outcome).pces().stream())
                .toList();
        Map<String, List<String>> owners = new TreeMap<>();
        for (ProjectConfigAndExtracted pce : extracted) {
            for (ModuleDescriptor module : pce.extracted().modules()) {
                owners.computeIfAbsent(module.key(), key -> new ArrayList<>()).add(pce.config().name());
            }
        }
        List<String> conflicts = new ArrayList<>();
        owners.forEach((module, parts) -> {
            if (parts.size() > 1) {
                log.error("{} is provided by: {}", module, String.join(", ", parts));
                conflicts.add(module + " is provided by: " + String.join(", ", parts));
            }
        });
        if (!conflicts.isEmpty()) {
            throw new ConsistencyException("Duplicate artifacts found in project " + config.buildConfig().name()
                    + ": " + String.join("; ", conflicts));
        }
        ExtractedMeta meta = new ExtractedMeta("0.0.0",
                extracted.stream().flatMap(pce -> pce.extracted().modules().stream()).toList(),
                outcomes.stream().map(BuildOutcome::project).toList());
        log.info("These subprojects will be built: {}", String.join(", ", meta.subprojects()));
        return meta;
    }

    @Override
    public BuildArtifactsOut runBuild(RepeatableProjectBuild project,
                                      Path dir,
                                      BuildInput input,
                                      BuildCache runner) throws IOException {
        AssembleOptions options = options(project.config());
        Path repository = input.outRepository();
        Directories.clean(repository);
        Map<String, BuildArtifactsOut> parts = new LinkedHashMap<>();
        List<String> uuids = new ArrayList<>(), failures = new ArrayList<>();
        boolean canceled = false;
        for (ProjectConfig part : options.parts()) {
            log.info("Building part {} of {}", part.name(), project.name());
            RepeatableProjectBuild build = repeatable(part, options, runner.extractor());
            BuildOutcome outcome = runner.checkCacheThenBuild(build, projectsDir(dir, part));
            if (outcome instanceof BuildGood good) {
                parts.put(part.name(), good.artifacts());
                uuids.add(build.uuid());
            } else if (outcome instanceof BuildBad bad) {
                canceled |= bad.status() == BuildBad.Status.CANCELED;
                failures.add("Part " + part.name() + ": " + bad.status().tag() + ", " + bad.reason());
            } else {
                throw new IllegalStateException("Internal error: unexpected build outcome for part " + part.name());
            }
        }
        if (!failures.isEmpty()) {
            if (canceled) {
                throw new CancellationException(String.join("; ", failures));
            }
            throw new ConsistencyException(String.join("; ", failures));
        }
        parts = NameFixer.uniqueSubprojects(parts);
        log.info("Collected subprojects: {}", String.join(", ", parts.values().stream()
                .flatMap(artifacts -> artifacts.results().stream())
                .map(SubArtifactsOut::subName)
                .toList()));

        Optional<String> coreVersion = parts.values().stream()
                .flatMap(artifacts -> artifacts.artifacts().stream())
                .filter(artifact -> core.isLibrary(artifact.info()))
                .map(ArtifactLocation::version)
                .findFirst();
        // Parts are built with the nested options, the result is cross-versioned by the assemble's own.
        CrossVersion crossVersion = project.buildOptions().crossVersion();
        if (crossVersion.requiresVersion() && coreVersion.isEmpty()) {
            throw new ConsistencyException("In assemble " + project.name() + ", the requested cross-version level is "
                    + crossVersion + ", but no " + core.library() + " was found among the artifacts");
        }
        String suffix = crossVersion.suffix(coreVersion.orElse(""));

        log.info("Retrieving artifacts of {} parts into {}", uuids.size(), repository);
        runner.store().retrieve(uuids, repository);

        Map<String, List<ArtifactLocation>> renamed = new LinkedHashMap<>();
        for (Map.Entry<String, BuildArtifactsOut> entry : parts.entrySet()) {
            List<ArtifactLocation> artifacts = new ArrayList<>();
            for (SubArtifactsOut sub : entry.getValue().results()) {
                sub.artifacts().forEach(artifact -> artifacts.add(core.isCore(artifact.info())
                        ? artifact
                        : artifact.withCrossSuffix(suffix)));
                for (ArtifactSha sha : sub.shas()) {
                    move(repository, sha.location(), suffix);
                }
            }
            renamed.put(entry.getKey(), artifacts);
        }

        Map<String, ArtifactLocation> available = new HashMap<>();
        renamed.values().forEach(artifacts -> artifacts.forEach(artifact -> available.putIfAbsent(artifact.info().key(), artifact)));
        rewriteDescriptors(repository, available);

        List<SubArtifactsOut> results = new ArrayList<>();
        for (Map.Entry<String, List<ArtifactLocation>> entry : renamed.entrySet()) {
            results.add(new SubArtifactsOut(entry.getKey(), entry.getValue(), shas(repository, entry.getValue(), suffix)));
        }
        return new BuildArtifactsOut(results);
    }

    private RepeatableProjectBuild repeatable(ProjectConfig part, AssembleOptions options, ExtractionCache extractor) {
        ExtractionConfig config = new ExtractionConfig(part, options.options());
        BuildOutcome extracted = extractor.cached(config).orElseThrow(() -> new IllegalStateException(
                "Internal error: extraction metadata not found for part " + part.name()));
        if (!(extracted instanceof ExtractionOk ok) || ok.pces().isEmpty()) {
            throw new IllegalStateException("Internal error: no extraction result for part " + part.name());
        }
        ProjectConfigAndExtracted pce = ok.pces().get(0);
        // Parts are built in isolation and never see one another's artifacts.
        return new RepeatableProjectBuild(pce.config(),
                pce.config().setVersion() == null ? pce.extracted().version() : pce.config().setVersion(),
                List.of(),
                pce.extracted().subprojects(),
                options.options());
    }

    private void move(Path repository, String location, String suffix) throws IOException {
        Optional<RepositoryPath> parsed = RepositoryPath.parse(location);
        if (parsed.isEmpty()) {
            log.error("Path cannot be parsed: {}. Continuing...", location);
            return;
        }
        RepositoryPath path = parsed.get();
        if (core.isCore(new ModuleRef(path.name(), path.organization()))) {
            return;
        }
        String name = NameFixer.fixName(path.name()) + suffix;
        if (name.equals(path.name())) {
            return;
        }
        Path source = repository.resolve(path.location(path.name())), target = repository.resolve(path.location(name));
        Files.createDirectories(target.getParent());
        Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        log.debug("Renamed {} to {}", location, RepositoryPath.relative(repository, target));
    }

    private void rewriteDescriptors(Path repository, Map<String, ArtifactLocation> available) throws IOException {
        List<Path> files;
        try (Stream<Path> stream = Files.walk(repository)) {
            files = stream.filter(Files::isRegularFile).sorted().toList();
        }
        for (Path file : files) {
            String location = "/" + RepositoryPath.relative(repository, file);
            if (file.getFileName().toString().endsWith(".pom")) {
                Matcher matcher = POM_NAME.matcher(location);
                if (matcher.matches()) {
                    pomRewriter.rewrite(file, matcher.group(1), available, NameFixer::fixName);
                } else {
                    log.warn("Cannot determine the artifact id of {}", location);
                }
            } else if (file.getFileName().toString().equals("ivy.xml")) {
                Matcher matcher = IVY_NAME.matcher(location.substring(1));
                if (matcher.matches()) {
                    ivyRewriter.rewrite(file, matcher.group(1), available, NameFixer::fixName);
                } else {
                    log.warn("Cannot determine the module name of {}", location);
                }
            }
        }
    }

    private List<ArtifactSha> shas(Path repository, List<ArtifactLocation> artifacts, String suffix) throws IOException {
        Set<Path> directories = new LinkedHashSet<>();
        for (ArtifactLocation artifact : artifacts) {
            String cross = core.isCore(artifact.info()) ? "" : suffix;
            directories.add(RepositoryPath.mavenDirectory(repository, artifact.info(), cross));
            directories.add(RepositoryPath.ivyDirectory(repository, artifact.info(), cross));
        }
        List<ArtifactSha> shas = new ArrayList<>();
        for (Path directory : directories) {
            shas.addAll(ArtifactSha.scan(repository, directory));
        }
        return shas;
    }

    static Path projectsDir(Path dir, ProjectConfig part) {
        return dir.resolve(PROJECTS).resolve(Identity.of(part.name()));
    }

    private static AssembleOptions options(ProjectConfig config) {
        if (config.extra() instanceof AssembleOptions options) {
            return options;
        }
        throw new IllegalStateException("Internal error: assemble options are of the wrong type in project " + config.name());
    }
}
