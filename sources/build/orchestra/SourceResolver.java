package build.orchestra;

import build.orchestra.config.ProjectConfig;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HexFormat;
import java.util.Map;

@FunctionalInterface
public interface SourceResolver {

    String NIL = "nil";

    ProjectConfig resolve(ProjectConfig config, Path dir) throws IOException;

    static SourceResolver nil() {
        return (config, dir) -> {
            if (!isNil(config.uri())) {
                throw new ConfigurationException("Not a nil uri in " + config.name() + ": " + config.uri());
            }
            Files.createDirectories(dir);
            return config;
        };
    }

    static SourceResolver directory() {
        return (config, dir) -> {
            URI uri = URI.create(config.uri());
            String base = uri.getScheme() + ":" + uri.getRawSchemeSpecificPart();
            Path source = Path.of(URI.create(base));
            if (!Files.isDirectory(source)) {
                throw new IOException("Source directory of " + config.name() + " does not exist: " + source);
            }
            Directories.clean(dir);
            Directories.copy(source, dir);
            String pin = HexFormat.of().formatHex(HashFunction.combine(
                    HashFunction.read(dir, new HashDigestFunction(HashDigestFunction.SHA1)),
                    HashDigestFunction.SHA1));
            if (uri.getFragment() != null && !uri.getFragment().equals(pin)) {
                throw new IllegalStateException("Source of " + config.name() + " changed since it was pinned to " + uri.getFragment());
            }
            return config.withUri(base + "#" + pin);
        };
    }

    static SourceResolver of(Map<String, SourceResolver> resolvers) {
        return (config, dir) -> {
            String scheme = isNil(config.uri()) ? NIL : URI.create(config.uri()).getScheme();
            SourceResolver resolver = scheme == null ? null : resolvers.get(scheme);
            if (resolver == null) {
                throw new ConfigurationException("No resolver for " + config.uri() + " of " + config.name());
            }
            return resolver.resolve(config, dir);
        };
    }

    static SourceResolver defaults() {
        return of(Map.of(NIL, nil(), "file", directory()));
    }

    static boolean isNil(String uri) {
        return uri.equals(NIL) || uri.startsWith(NIL + ":");
    }
}
