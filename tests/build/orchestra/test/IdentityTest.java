package build.orchestra.test;

import build.orchestra.Identity;
import build.orchestra.config.AssembleOptions;
import build.orchestra.config.BuildOptions;
import build.orchestra.config.CrossVersion;
import build.orchestra.config.EmptyOptions;
import build.orchestra.config.Notification;
import build.orchestra.config.ProjectConfig;
import build.orchestra.config.ScalaOptions;
import build.orchestra.project.RepeatableProjectBuild;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class IdentityTest {

    @Test
    public void identity_is_stable() {
        ProjectConfig config = new ProjectConfig("foo", "fake", "nil:foo", EmptyOptions.INSTANCE);
        assertThat(Identity.of(config))
                .isEqualTo(Identity.of(new ProjectConfig("foo", "fake", "nil:foo", EmptyOptions.INSTANCE)))
                .matches("[0-9a-f]{40}");
    }

    @Test
    public void identity_differs_for_different_content() {
        ProjectConfig config = new ProjectConfig("foo", "fake", "nil:foo", EmptyOptions.INSTANCE);
        assertThat(Identity.of(config)).isNotEqualTo(Identity.of(config.withUri("nil:bar")));
    }

    @Test
    public void absent_values_hash_like_defaults() {
        assertThat(Identity.of(new ProjectConfig("foo", "assemble", "nil", null)))
                .isEqualTo(Identity.of(new ProjectConfig("foo", "assemble", "nil", new AssembleOptions(List.of(), BuildOptions.DEFAULT))));
        assertThat(Identity.of(new BuildOptions(null))).isEqualTo(Identity.of(new BuildOptions(CrossVersion.DISABLED)));
    }

    @Test
    public void unordered_values_do_not_affect_identity() {
        assertThat(Identity.of(new ScalaOptions(null, null, null, List.of("b", "a"))))
                .isEqualTo(Identity.of(new ScalaOptions(null, null, null, List.of("a", "b"))));
        ProjectConfig config = new ProjectConfig("foo", "fake", "nil", EmptyOptions.INSTANCE);
        assertThat(new RepeatableProjectBuild(config, "1.0", List.of("y", "x"), List.of(), null).uuid())
                .isEqualTo(new RepeatableProjectBuild(config, "1.0", List.of("x", "y"), List.of(), null).uuid());
    }

    @Test
    public void ordered_values_affect_identity() {
        ProjectConfig first = new ProjectConfig("a", "fake", "nil", null), second = new ProjectConfig("b", "fake", "nil", null);
        assertThat(Identity.of(new AssembleOptions(List.of(first, second), null)))
                .isNotEqualTo(Identity.of(new AssembleOptions(List.of(second, first), null)));
    }

    @Test
    public void notifications_do_not_affect_identity() {
        ProjectConfig config = new ProjectConfig("foo", "fake", "nil", null, null, null);
        ProjectConfig notified = new ProjectConfig("foo", "fake", "nil", null, null, List.of(new Notification("console")));
        assertThat(config.uuid()).isEqualTo(notified.uuid());
    }

    @Test
    public void dependencies_fold_into_build_identity() {
        ProjectConfig config = new ProjectConfig("foo", "fake", "nil", null);
        assertThat(new RepeatableProjectBuild(config, "1.0", List.of("x"), List.of(), null).uuid())
                .isNotEqualTo(new RepeatableProjectBuild(config, "1.0", List.of("y"), List.of(), null).uuid());
    }
}
