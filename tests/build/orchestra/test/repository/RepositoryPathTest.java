package build.orchestra.test.repository;

import build.orchestra.repository.RepositoryPath;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

public class RepositoryPathTest {

    @Test
    public void can_parse_maven_path() {
        RepositoryPath path = RepositoryPath.parse("org/scala-lang/modules/scala-xml_2.11.0-M5/1.0-RC4/scala-xml_2.11.0-M5-1.0-RC4-sources.jar").orElseThrow();
        assertThat(path.layout()).isEqualTo(RepositoryPath.Layout.MAVEN);
        assertThat(path.organization()).isEqualTo("org.scala-lang.modules");
        assertThat(path.name()).isEqualTo("scala-xml_2.11.0-M5");
        assertThat(path.version()).isEqualTo("1.0-RC4");
        assertThat(path.location("scala-xml_2.11")).isEqualTo("org/scala-lang/modules/scala-xml_2.11/1.0-RC4/scala-xml_2.11-1.0-RC4-sources.jar");
    }

    @Test
    public void can_parse_ivy_descriptor_path() {
        RepositoryPath path = RepositoryPath.parse("org.scala-lang/scala-compiler/2.10.2/ivys/ivy.xml.sha1").orElseThrow();
        assertThat(path.layout()).isEqualTo(RepositoryPath.Layout.IVY_DESCRIPTOR);
        assertThat(path.organization()).isEqualTo("org.scala-lang");
        assertThat(path.name()).isEqualTo("scala-compiler");
        assertThat(path.location("compiler")).isEqualTo("org.scala-lang/compiler/2.10.2/ivys/ivy.xml.sha1");
    }

    @Test
    public void can_parse_ivy_artifact_path() {
        RepositoryPath path = RepositoryPath.parse("org.scala-lang/scala-compiler/2.10.2/docs/scala-compiler-javadoc.jar").orElseThrow();
        assertThat(path.layout()).isEqualTo(RepositoryPath.Layout.IVY);
        assertThat(path.folder()).isEqualTo("docs");
        assertThat(path.suffix()).isEqualTo("-javadoc.jar");
        assertThat(path.location("compiler")).isEqualTo("org.scala-lang/compiler/2.10.2/docs/compiler-javadoc.jar");
    }

    @Test
    public void cannot_parse_unknown_path() {
        assertThat(RepositoryPath.parse("some/file.txt")).isEqualTo(Optional.empty());
    }
}
