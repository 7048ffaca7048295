package build.orchestra.repository;

import build.orchestra.project.ModuleRef;

import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public record RepositoryPath(Layout layout,
                             String organization,
                             String name,
                             String version,
                             String folder,
                             String suffix) {

    public static final String IVYS = "ivys";

    private static final Pattern
            MAVEN = Pattern.compile("(.*)/([^/]*)/([^/]*)/\\2(-[^/]*)"),
            IVY_DESCRIPTOR = Pattern.compile("([^/]*)/([^/]*)/([^/]*)/(" + IVYS + ")/([^/]*)"),
            IVY = Pattern.compile("([^/]*)/([^/]*)/([^/]*)/([^/]*)/\\2([^/]*)");

    public static Optional<RepositoryPath> parse(String location) {
        Matcher matcher = MAVEN.matcher(location);
        if (matcher.matches()) {
            return Optional.of(new RepositoryPath(Layout.MAVEN,
                    matcher.group(1).replace('/', '.'),
                    matcher.group(2),
                    matcher.group(3),
                    null,
                    matcher.group(4)));
        }
        matcher = IVY_DESCRIPTOR.matcher(location);
        if (matcher.matches()) {
            return Optional.of(new RepositoryPath(Layout.IVY_DESCRIPTOR,
                    matcher.group(1),
                    matcher.group(2),
                    matcher.group(3),
                    matcher.group(4),
                    matcher.group(5)));
        }
        matcher = IVY.matcher(location);
        if (matcher.matches()) {
            return Optional.of(new RepositoryPath(Layout.IVY,
                    matcher.group(1),
                    matcher.group(2),
                    matcher.group(3),
                    matcher.group(4),
                    matcher.group(5)));
        }
        return Optional.empty();
    }

    public String directory(String name) {
        return switch (layout) {
            case MAVEN -> organization.replace('.', '/') + "/" + name + "/" + version;
            case IVY_DESCRIPTOR, IVY -> organization + "/" + name + "/" + version + "/" + folder;
        };
    }

    public String location(String name) {
        return directory(name) + "/" + switch (layout) {
            case MAVEN, IVY -> name + suffix;
            case IVY_DESCRIPTOR -> suffix;
        };
    }

    public static Path mavenDirectory(Path repository, ModuleRef ref, String crossSuffix) {
        Path directory = repository;
        for (String element : ref.organization().split("\\.")) {
            directory = directory.resolve(element);
        }
        return directory.resolve(ref.name() + crossSuffix);
    }

    public static Path ivyDirectory(Path repository, ModuleRef ref, String crossSuffix) {
        return repository.resolve(ref.organization()).resolve(ref.name() + crossSuffix);
    }

    public static String relative(Path repository, Path file) {
        return repository.relativize(file).toString().replace('\\', '/');
    }

    public enum Layout {
        MAVEN, IVY_DESCRIPTOR, IVY
    }
}
