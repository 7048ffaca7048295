package build.orchestra.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public class ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(ArtifactStore.class);

    private static final String RAW = "raw", META = "meta";

    private final Path root;
    private final ObjectMapper mapper = JsonMapper.builder().build();

    public ArtifactStore(Path root) throws IOException {
        this.root = root;
        Files.createDirectories(root.resolve(RAW));
        Files.createDirectories(root.resolve(META));
    }

    public void publish(String uuid, BuildArtifactsOut artifacts, Path repository) throws IOException {
        for (ArtifactSha sha : artifacts.shas()) {
            Path target = root.resolve(RAW).resolve(sha.sha());
            if (Files.exists(target)) {
                continue;
            }
            Path source = repository.resolve(sha.location());
            if (!Files.isRegularFile(source)) {
                throw new IllegalStateException("Cannot publish " + sha.location() + " of " + uuid + ", file not found");
            }
            String actual = ArtifactSha.SHA1.hex(source);
            if (!actual.equals(sha.sha())) {
                throw new IllegalStateException("Checksum mismatch for " + sha.location() + ": expected "
                        + sha.sha() + " but found " + actual);
            }
            Path temporary = Files.createTempFile(root.resolve(RAW), sha.sha(), ".tmp");
            try {
                Files.copy(source, temporary, StandardCopyOption.REPLACE_EXISTING);
                Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(temporary);
            }
        }
        Path temporary = Files.createTempFile(root.resolve(META), uuid, ".tmp");
        try {
            mapper.writeValue(temporary.toFile(), artifacts);
            Files.move(temporary, root.resolve(META).resolve(uuid), StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temporary);
        }
        log.debug("Published {} files of {}", artifacts.shas().size(), uuid);
    }

    public boolean contains(String uuid) {
        return Files.exists(root.resolve(META).resolve(uuid));
    }

    public Optional<BuildArtifactsOut> artifacts(String uuid) throws IOException {
        Path file = root.resolve(META).resolve(uuid);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try (InputStream inputStream = Files.newInputStream(file)) {
            return Optional.of(mapper.readValue(inputStream, BuildArtifactsOut.class));
        }
    }

    public List<ArtifactLocation> retrieve(Collection<String> uuids, Path repository) throws IOException {
        List<ArtifactLocation> locations = new ArrayList<>();
        for (String uuid : uuids) {
            BuildArtifactsOut artifacts = artifacts(uuid).orElseThrow(() -> new IllegalStateException(
                    "Internal error: no artifacts were published for " + uuid));
            for (ArtifactSha sha : artifacts.shas()) {
                Path source = root.resolve(RAW).resolve(sha.sha()), target = repository.resolve(sha.location());
                if (!Files.exists(source)) {
                    throw new IllegalStateException("Internal error: missing content " + sha.sha() + " for " + sha.location());
                }
                Files.createDirectories(target.getParent());
                Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
            }
            locations.addAll(artifacts.artifacts());
            log.debug("Retrieved {} files of {} into {}", artifacts.shas().size(), uuid, repository);
        }
        return locations;
    }
}
