package build.orchestra;

import build.orchestra.config.BuildSystemOptions;
import build.orchestra.config.EmptyOptions;
import build.orchestra.config.ExtractionConfig;
import build.orchestra.config.ProjectConfig;
import build.orchestra.project.ExtractedMeta;
import build.orchestra.project.RepeatableProjectBuild;
import build.orchestra.repository.BuildArtifactsOut;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A backend that knows how to extract the dependency information of a project of a given kind and how to
 * build it into a repository.
 */
public interface BuildSystem {

    /**
     * Returns the kind of projects this build system handles, as named by a project's {@code system}.
     *
     * @return The kind of this build system.
     */
    String name();

    /**
     * Returns the type that the {@code extra} property of a project of this kind is decoded into.
     *
     * @return The options type of this build system.
     */
    default Class<? extends BuildSystemOptions> optionsType() {
        return EmptyOptions.class;
    }

    /**
     * Pins the project's source and makes it available in the supplied directory.
     *
     * @param config    The configuration of the project.
     * @param dir       The directory to check out the project into.
     * @param extractor The extraction cache of the current run.
     * @return The configuration with a pinned source.
     * @throws IOException If an I/O error occurs.
     */
    default ProjectConfig resolve(ProjectConfig config, Path dir, ExtractionCache extractor) throws IOException {
        return extractor.sources().resolve(config, dir);
    }

    ExtractedMeta extractDependencies(ExtractionConfig config, Path dir, ExtractionCache extractor) throws IOException;

    BuildArtifactsOut runBuild(RepeatableProjectBuild project, Path dir, BuildInput input, BuildCache runner) throws IOException;
}
