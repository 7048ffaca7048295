package build.orchestra.test;

import build.orchestra.BuildCache;
import build.orchestra.BuildInput;
import build.orchestra.BuildSystem;
import build.orchestra.ExtractionCache;
import build.orchestra.config.ExtractionConfig;
import build.orchestra.project.ExtractedMeta;
import build.orchestra.project.ModuleDescriptor;
import build.orchestra.project.ModuleRef;
import build.orchestra.project.RepeatableProjectBuild;
import build.orchestra.repository.ArtifactLocation;
import build.orchestra.repository.ArtifactSha;
import build.orchestra.repository.BuildArtifactsOut;
import build.orchestra.repository.Checksums;
import build.orchestra.repository.RepositoryPath;
import build.orchestra.repository.SubArtifactsOut;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class FakeBuildSystem implements BuildSystem {

    public static final String KIND = "fake";

    private final Map<String, Project> projects = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> extractions = new ConcurrentHashMap<>(), builds = new ConcurrentHashMap<>();
    private final Map<String, List<String>> inputs = new ConcurrentHashMap<>();

    public static ModuleDescriptor module(String organization, String name, ModuleRef... dependencies) {
        return new ModuleDescriptor(name, organization, List.of(new ModuleRef(name, organization)), List.of(dependencies));
    }

    public FakeBuildSystem with(String name, String version, ModuleDescriptor... modules) {
        projects.put(name, new Project(version, List.of(modules), "", null, null, null, false));
        return this;
    }

    public FakeBuildSystem suffixed(String name, String suffix) {
        projects.computeIfPresent(name, (key, project) -> new Project(project.version(), project.modules(), suffix,
                project.extractionFailure(), project.buildFailure(), project.latch(), project.ivy()));
        return this;
    }

    public FakeBuildSystem failingExtraction(String name, RuntimeException exception) {
        projects.computeIfPresent(name, (key, project) -> new Project(project.version(), project.modules(), project.suffix(),
                exception, project.buildFailure(), project.latch(), project.ivy()));
        return this;
    }

    public FakeBuildSystem failingBuild(String name, RuntimeException exception) {
        projects.computeIfPresent(name, (key, project) -> new Project(project.version(), project.modules(), project.suffix(),
                project.extractionFailure(), exception, project.latch(), project.ivy()));
        return this;
    }

    public FakeBuildSystem blocking(String name, CountDownLatch latch) {
        projects.computeIfPresent(name, (key, project) -> new Project(project.version(), project.modules(), project.suffix(),
                project.extractionFailure(), project.buildFailure(), latch, project.ivy()));
        return this;
    }

    public FakeBuildSystem ivy(String name) {
        projects.computeIfPresent(name, (key, project) -> new Project(project.version(), project.modules(), project.suffix(),
                project.extractionFailure(), project.buildFailure(), project.latch(), true));
        return this;
    }

    public int extractions(String name) {
        return extractions.getOrDefault(name, new AtomicInteger()).get();
    }

    public int builds(String name) {
        return builds.getOrDefault(name, new AtomicInteger()).get();
    }

    public List<String> inputs(String name) {
        return inputs.get(name);
    }

    @Override
    public String name() {
        return KIND;
    }

    @Override
    public ExtractedMeta extractDependencies(ExtractionConfig config, Path dir, ExtractionCache extractor) {
        String name = config.buildConfig().name();
        extractions.computeIfAbsent(name, key -> new AtomicInteger()).incrementAndGet();
        Project project = project(name);
        await(project);
        if (project.extractionFailure() != null) {
            throw project.extractionFailure();
        }
        return new ExtractedMeta(project.version(),
                project.modules(),
                project.modules().stream().map(ModuleDescriptor::name).toList());
    }

    @Override
    public BuildArtifactsOut runBuild(RepeatableProjectBuild build,
                                      Path dir,
                                      BuildInput input,
                                      BuildCache runner) throws IOException {
        builds.computeIfAbsent(build.name(), key -> new AtomicInteger()).incrementAndGet();
        try (Stream<Path> files = Files.walk(input.repository())) {
            inputs.put(build.name(), files.filter(Files::isRegularFile)
                    .map(file -> RepositoryPath.relative(input.repository(), file))
                    .sorted()
                    .toList());
        }
        Project project = project(build.name());
        await(project);
        List<SubArtifactsOut> results = new ArrayList<>();
        for (ModuleDescriptor module : project.modules()) {
            ModuleRef ref = new ModuleRef(module.name(), module.organization());
            Path base = project.ivy()
                    ? RepositoryPath.ivyDirectory(input.outRepository(), ref, project.suffix())
                    : RepositoryPath.mavenDirectory(input.outRepository(), ref, project.suffix());
            if (project.ivy()) {
                publishIvy(base.resolve(input.version()), module, project.suffix(), input.version());
            } else {
                publishMaven(base.resolve(input.version()), module, project.suffix(), input.version());
            }
            if (project.buildFailure() != null) {
                throw project.buildFailure();
            }
            results.add(new SubArtifactsOut(module.name(),
                    List.of(new ArtifactLocation(ref, input.version(), project.suffix())),
                    ArtifactSha.scan(input.outRepository(), base)));
        }
        return new BuildArtifactsOut(results);
    }

    private static void publishMaven(Path directory, ModuleDescriptor module, String suffix, String version) throws IOException {
        Files.createDirectories(directory);
        String prefix = module.name() + suffix + "-" + version;
        Checksums.write(Files.writeString(directory.resolve(prefix + ".jar"), module.key() + ":" + version));
        Checksums.write(Files.writeString(directory.resolve(prefix + ".pom"), pom(module, suffix, version)));
    }

    private static void publishIvy(Path directory, ModuleDescriptor module, String suffix, String version) throws IOException {
        Path jars = Files.createDirectories(directory.resolve("jars")), ivys = Files.createDirectories(directory.resolve(RepositoryPath.IVYS));
        Checksums.write(Files.writeString(jars.resolve(module.name() + suffix + ".jar"), module.key() + ":" + version));
        Checksums.write(Files.writeString(ivys.resolve("ivy.xml"), ivy(module, suffix, version)));
    }

    public static String ivy(ModuleDescriptor module, String suffix, String version) {
        StringBuilder ivy = new StringBuilder()
                .append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n")
                .append("<ivy-module version=\"2.0\">\n")
                .append("  <info organisation=\"").append(module.organization())
                .append("\" module=\"").append(module.name()).append(suffix)
                .append("\" revision=\"").append(version).append("\"/>\n")
                .append("  <publications>\n")
                .append("    <artifact name=\"").append(module.name()).append(suffix).append("\" type=\"jar\" ext=\"jar\"/>\n")
                .append("  </publications>\n")
                .append("  <dependencies>\n");
        for (ModuleRef dependency : module.dependencies()) {
            ivy.append("    <dependency org=\"").append(dependency.organization())
                    .append("\" name=\"").append(dependency.name())
                    .append("\" rev=\"0.1\"/>\n");
        }
        return ivy.append("  </dependencies>\n").append("</ivy-module>\n").toString();
    }

    public static String pom(ModuleDescriptor module, String suffix, String version) {
        StringBuilder pom = new StringBuilder()
                .append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n")
                .append("<project xmlns=\"http://maven.apache.org/POM/4.0.0\">\n")
                .append("  <modelVersion>4.0.0</modelVersion>\n")
                .append("  <groupId>").append(module.organization()).append("</groupId>\n")
                .append("  <artifactId>").append(module.name()).append(suffix).append("</artifactId>\n")
                .append("  <version>").append(version).append("</version>\n")
                .append("  <dependencies>\n");
        for (ModuleRef dependency : module.dependencies()) {
            pom.append("    <dependency>\n")
                    .append("      <groupId>").append(dependency.organization()).append("</groupId>\n")
                    .append("      <artifactId>").append(dependency.name()).append("</artifactId>\n")
                    .append("      <version>0.1</version>\n")
                    .append("    </dependency>\n");
        }
        return pom.append("  </dependencies>\n").append("</project>\n").toString();
    }

    private Project project(String name) {
        Project project = projects.get(name);
        if (project == null) {
            throw new IllegalStateException("No fake project registered for " + name);
        }
        return project;
    }

    private static void await(Project project) {
        if (project.latch() == null) {
            return;
        }
        try {
            if (!project.latch().await(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("Latch was not released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private record Project(String version,
                           List<ModuleDescriptor> modules,
                           String suffix,
                           RuntimeException extractionFailure,
                           RuntimeException buildFailure,
                           CountDownLatch latch,
                           boolean ivy) {
    }
}
