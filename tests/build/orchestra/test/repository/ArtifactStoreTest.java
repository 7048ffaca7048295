package build.orchestra.test.repository;

import build.orchestra.project.ModuleRef;
import build.orchestra.repository.ArtifactLocation;
import build.orchestra.repository.ArtifactSha;
import build.orchestra.repository.ArtifactStore;
import build.orchestra.repository.BuildArtifactsOut;
import build.orchestra.repository.SubArtifactsOut;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ArtifactStoreTest {

    @TempDir
    private Path root, repository, target;

    private ArtifactStore store;

    @BeforeEach
    public void setUp() throws IOException {
        store = new ArtifactStore(root);
    }

    private BuildArtifactsOut artifacts() throws IOException {
        Path jar = Files.writeString(Files.createDirectories(repository.resolve("org/foo/foo/1.0")).resolve("foo-1.0.jar"), "foo");
        ArtifactLocation location = new ArtifactLocation(new ModuleRef("foo", "org.foo"), "1.0", "");
        return new BuildArtifactsOut(List.of(new SubArtifactsOut("foo", List.of(location), List.of(ArtifactSha.of(jar, repository)))));
    }

    @Test
    public void can_publish_and_retrieve() throws IOException {
        BuildArtifactsOut artifacts = artifacts();
        store.publish("uuid", artifacts, repository);
        assertThat(store.contains("uuid")).isTrue();
        assertThat(store.artifacts("uuid")).contains(artifacts);
        List<ArtifactLocation> locations = store.retrieve(List.of("uuid"), target);
        assertThat(locations).isEqualTo(artifacts.artifacts());
        assertThat(target.resolve("org/foo/foo/1.0/foo-1.0.jar")).content().isEqualTo("foo");
    }

    @Test
    public void unknown_build_is_absent() throws IOException {
        assertThat(store.contains("uuid")).isFalse();
        assertThat(store.artifacts("uuid")).isEmpty();
        assertThatThrownBy(() -> store.retrieve(List.of("uuid"), target))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("Internal error");
    }

    @Test
    public void checksum_mismatch_is_rejected() throws IOException {
        BuildArtifactsOut artifacts = artifacts();
        Files.writeString(repository.resolve("org/foo/foo/1.0/foo-1.0.jar"), "bar");
        assertThatThrownBy(() -> store.publish("uuid", artifacts, repository))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("Checksum mismatch");
        assertThat(store.contains("uuid")).isFalse();
    }
}
