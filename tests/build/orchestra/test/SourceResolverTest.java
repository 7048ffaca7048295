package build.orchestra.test;

import build.orchestra.ConfigurationException;
import build.orchestra.SourceResolver;
import build.orchestra.config.ProjectConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SourceResolverTest {

    @TempDir
    private Path source, target;

    @Test
    public void nil_uri_is_resolved_unchanged() throws IOException {
        ProjectConfig config = new ProjectConfig("foo", "fake", "nil:foo", null);
        assertThat(SourceResolver.defaults().resolve(config, target.resolve("foo"))).isEqualTo(config);
        assertThat(target.resolve("foo")).isDirectory();
    }

    @Test
    public void directory_is_copied_and_pinned() throws IOException {
        Files.writeString(Files.createDirectories(source.resolve("sub")).resolve("file"), "foo");
        ProjectConfig config = new ProjectConfig("foo", "fake", source.toUri().toString(), null);
        ProjectConfig resolved = SourceResolver.defaults().resolve(config, target);
        assertThat(resolved.uri()).startsWith(source.toUri().toString()).matches(".*#[0-9a-f]{40}");
        assertThat(target.resolve("sub").resolve("file")).content().isEqualTo("foo");
        assertThat(SourceResolver.defaults().resolve(resolved, target)).isEqualTo(resolved);
    }

    @Test
    public void changed_directory_does_not_match_pin() throws IOException {
        Files.writeString(source.resolve("file"), "foo");
        ProjectConfig resolved = SourceResolver.directory().resolve(
                new ProjectConfig("foo", "fake", source.toUri().toString(), null),
                target);
        Files.writeString(source.resolve("file"), "bar");
        assertThatThrownBy(() -> SourceResolver.directory().resolve(resolved, target))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("changed since it was pinned");
    }

    @Test
    public void unknown_scheme_is_rejected() {
        assertThatThrownBy(() -> SourceResolver.defaults().resolve(
                new ProjectConfig("foo", "fake", "git://example.com/foo.git", null),
                target)).isInstanceOf(ConfigurationException.class).hasMessageContaining("No resolver");
    }
}
