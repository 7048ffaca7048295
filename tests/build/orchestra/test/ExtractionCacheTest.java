package build.orchestra.test;

import build.orchestra.BuildSystems;
import build.orchestra.ExtractionCache;
import build.orchestra.SourceResolver;
import build.orchestra.config.ExtractionConfig;
import build.orchestra.config.ProjectConfig;
import build.orchestra.outcome.BuildOutcome;
import build.orchestra.outcome.ExtractionFailed;
import build.orchestra.outcome.ExtractionOk;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

public class ExtractionCacheTest {

    @TempDir
    private Path root;

    private FakeBuildSystem system;
    private ExtractionCache extractor;

    @BeforeEach
    public void setUp() {
        system = new FakeBuildSystem().with("foo", "1.0", FakeBuildSystem.module("org.foo", "foo"));
        extractor = new ExtractionCache(BuildSystems.of(system), SourceResolver.defaults());
    }

    @Test
    public void can_extract() {
        ExtractionConfig config = new ExtractionConfig(new ProjectConfig("foo", FakeBuildSystem.KIND, "nil", null), null);
        assertThat(extractor.cached(config)).isEmpty();
        BuildOutcome outcome = extractor.extract(config, root);
        assertThat(outcome).isInstanceOf(ExtractionOk.class);
        assertThat(((ExtractionOk) outcome).pces()).hasSize(1);
        assertThat(((ExtractionOk) outcome).pces().get(0).extracted().version()).isEqualTo("1.0");
        assertThat(extractor.cached(config)).contains(outcome);
    }

    @Test
    public void extracts_at_most_once_under_concurrency() throws Exception {
        CountDownLatch latch = new CountDownLatch(1);
        system.blocking("foo", latch);
        ExtractionConfig config = new ExtractionConfig(new ProjectConfig("foo", FakeBuildSystem.KIND, "nil", null), null);
        ExecutorService executorService = Executors.newFixedThreadPool(4);
        try {
            List<Future<BuildOutcome>> futures = new ArrayList<>();
            for (int index = 0; index < 8; index++) {
                futures.add(executorService.submit(() -> extractor.extract(config, root)));
            }
            latch.countDown();
            BuildOutcome first = futures.get(0).get();
            for (Future<BuildOutcome> future : futures) {
                assertThat(future.get()).isSameAs(first);
            }
        } finally {
            executorService.shutdownNow();
        }
        assertThat(system.extractions("foo")).isEqualTo(1);
    }

    @Test
    public void failure_becomes_outcome() {
        system.failingExtraction("foo", new IllegalStateException("broken"));
        BuildOutcome outcome = extractor.extract(
                new ExtractionConfig(new ProjectConfig("foo", FakeBuildSystem.KIND, "nil", null), null),
                root);
        assertThat(outcome).isEqualTo(new ExtractionFailed("foo", "broken"));
        assertThat(outcome.tags()).contains("failure", "extraction", "always");
    }

    @Test
    public void failed_extraction_is_not_repeated() {
        system.failingExtraction("foo", new IllegalStateException("broken"));
        ExtractionConfig config = new ExtractionConfig(new ProjectConfig("foo", FakeBuildSystem.KIND, "nil", null), null);
        extractor.extract(config, root);
        extractor.extract(config, root);
        assertThat(system.extractions("foo")).isEqualTo(1);
    }
}
