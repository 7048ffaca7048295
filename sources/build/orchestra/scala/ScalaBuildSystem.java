package build.orchestra.scala;

import build.orchestra.BuildCache;
import build.orchestra.BuildInput;
import build.orchestra.BuildSystem;
import build.orchestra.ExtractionCache;
import build.orchestra.config.BuildSystemOptions;
import build.orchestra.config.ExtractionConfig;
import build.orchestra.config.ProjectConfig;
import build.orchestra.config.ScalaOptions;
import build.orchestra.process.ProcessHandler;
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
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.function.Function;
import java.util.stream.Stream;

public class ScalaBuildSystem implements BuildSystem {

    private static final Logger log = LoggerFactory.getLogger(ScalaBuildSystem.class);

    static final String GROUP = "org.scala-lang", PLUGINS = GROUP + ".plugins";

    static final String VERSION_FILE = "build/quick/classes/library/library.properties", VERSION_PROPERTY = "version.number";

    private static final ModuleRef
            LIBRARY = new ModuleRef("scala-library", GROUP),
            REFLECT = new ModuleRef("scala-reflect", GROUP),
            ACTORS = new ModuleRef("scala-actors", GROUP),
            ACTORS_MIGRATION = new ModuleRef("scala-actors-migration", GROUP),
            SWING = new ModuleRef("scala-swing", GROUP),
            JLINE = new ModuleRef("jline", GROUP),
            COMPILER = new ModuleRef("scala-compiler", GROUP),
            SCALAP = new ModuleRef("scalap", GROUP),
            PARTEST = new ModuleRef("partest", GROUP),
            CONTINUATIONS = new ModuleRef("continuations", PLUGINS);

    static final List<ModuleDescriptor> MODULES = List.of(
            module(JLINE),
            module(LIBRARY),
            module(REFLECT, LIBRARY),
            module(ACTORS, LIBRARY),
            module(ACTORS_MIGRATION, LIBRARY, ACTORS),
            module(SWING, LIBRARY),
            module(COMPILER, REFLECT, JLINE),
            module(SCALAP, COMPILER),
            module(PARTEST, COMPILER, ACTORS),
            module(CONTINUATIONS, LIBRARY));

    private final Function<List<String>, ProcessHandler> ant;

    public ScalaBuildSystem() {
        this(ProcessHandler.OfProcess.ofCommand("ant"));
    }

    public ScalaBuildSystem(Function<List<String>, ProcessHandler> ant) {
        this.ant = ant;
    }

    @Override
    public String name() {
        return ScalaOptions.KIND;
    }

    @Override
    public Class<? extends BuildSystemOptions> optionsType() {
        return ScalaOptions.class;
    }

    @Override
    public ExtractedMeta extractDependencies(ExtractionConfig config, Path dir, ExtractionCache extractor) {
        ScalaOptions options = options(config.buildConfig());
        List<ModuleDescriptor> modules = modules(options);
        ScalaOptions.BuildNumber number = options.buildNumber();
        String version = number == null
                ? "0.0.0"
                : number.major() + "." + number.minor() + "." + number.patch() + (number.bnum() == null || number.bnum().isEmpty() ? "" : "-" + number.bnum());
        return new ExtractedMeta(version, modules, modules.stream().map(ModuleDescriptor::name).toList());
    }

    @Override
    public BuildArtifactsOut runBuild(RepeatableProjectBuild project,
                                      Path dir,
                                      BuildInput input,
                                      BuildCache runner) throws IOException {
        ScalaOptions options = options(project.config());
        Path logs = Files.createDirectories(input.outRepository().resolveSibling("logs"));
        List<String> arguments = new ArrayList<>();
        arguments.add(options.buildTarget());
        arguments.addAll(options.buildOptions());
        run(arguments, dir, logs, "build");
        String version = version(dir);
        log.info("Deploying Scala {} into {}", version, input.outRepository());
        String repository = input.outRepository().toAbsolutePath().toString();
        run(List.of("deploy.local",
                "-Dlocal.snapshot.repository=" + repository,
                "-Dlocal.release.repository=" + repository,
                "-Dmaven.version.number=" + version), dir.resolve("dists").resolve("maven").resolve("latest"), logs, "deploy");
        List<SubArtifactsOut> results = new ArrayList<>();
        for (ModuleDescriptor module : modules(options)) {
            ModuleRef ref = new ModuleRef(module.name(), module.organization());
            results.add(new SubArtifactsOut(module.name(),
                    List.of(new ArtifactLocation(ref, version, "")),
                    ArtifactSha.scan(input.outRepository(), RepositoryPath.mavenDirectory(input.outRepository(), ref, ""))));
        }
        return new BuildArtifactsOut(results);
    }

    private void run(List<String> arguments, Path dir, Path logs, String step) throws IOException {
        ProcessHandler handler = ant.apply(arguments);
        log.debug("Running {} in {}", handler.commands(), dir);
        int exitCode = handler.execute(dir, logs.resolve(step + ".out"), logs.resolve(step + ".err"));
        if (exitCode != 0) {
            throw new IOException("Could not run scala ant build, error code: " + exitCode);
        }
    }

    static String version(Path dir) throws IOException {
        Path file = dir.resolve(VERSION_FILE);
        if (!Files.isRegularFile(file)) {
            throw new IOException("Unable to load scala version number, " + VERSION_FILE + " not found");
        }
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file)) {
            properties.load(reader);
        }
        String version = properties.getProperty(VERSION_PROPERTY);
        if (version == null) {
            throw new IOException("Unable to load scala version number, " + VERSION_PROPERTY + " not set");
        }
        return version;
    }

    private static List<ModuleDescriptor> modules(ScalaOptions options) {
        return MODULES.stream().filter(module -> !options.exclude().contains(module.name())).toList();
    }

    private static ModuleDescriptor module(ModuleRef ref, ModuleRef... dependencies) {
        return new ModuleDescriptor(ref.name(), ref.organization(), List.of(ref), Stream.of(dependencies).toList());
    }

    private static ScalaOptions options(ProjectConfig config) {
        return config.extra() instanceof ScalaOptions options ? options : ScalaOptions.DEFAULT;
    }
}
