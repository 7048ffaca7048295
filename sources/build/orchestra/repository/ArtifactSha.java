package build.orchestra.repository;

import build.orchestra.HashDigestFunction;
import build.orchestra.HashFunction;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

public record ArtifactSha(String sha, String location) {

    public static final String MAVEN_METADATA = "maven-metadata-local.xml";

    static final HashFunction SHA1 = new HashDigestFunction(HashDigestFunction.SHA1);

    public static ArtifactSha of(Path file, Path repository) throws IOException {
        return new ArtifactSha(SHA1.hex(file), RepositoryPath.relative(repository, file));
    }

    public static List<ArtifactSha> scan(Path repository, Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<Path> files;
        try (Stream<Path> stream = Files.walk(directory)) {
            files = stream.filter(Files::isRegularFile)
                    .filter(file -> !file.getFileName().toString().equals(MAVEN_METADATA))
                    .sorted()
                    .toList();
        }
        List<ArtifactSha> shas = new ArrayList<>();
        for (Path file : files) {
            shas.add(of(file, repository));
        }
        return shas;
    }
}
