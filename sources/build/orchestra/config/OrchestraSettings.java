package build.orchestra.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.nio.file.Path;

public record OrchestraSettings(int workers, Path directory) {

    public static OrchestraSettings load() {
        return of(ConfigFactory.load());
    }

    public static OrchestraSettings of(Config config) {
        Config settings = config.withFallback(ConfigFactory.defaultReference()).getConfig("orchestra");
        int workers = settings.getInt("workers");
        return new OrchestraSettings(
                workers > 0 ? workers : Runtime.getRuntime().availableProcessors(),
                Path.of(settings.getString("directory")));
    }
}
