package build.orchestra.assemble;

import build.orchestra.repository.BuildArtifactsOut;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

public final class NameFixer {

    public static final String DEFAULT_SUBPROJECT = "default-sbt-project";

    private static final Pattern CROSS_SUFFIX = Pattern.compile("_\\d+\\.\\d+[^_/]*$");

    private NameFixer() {
    }

    public static String fixName(String name) {
        return CROSS_SUFFIX.matcher(name).replaceFirst("");
    }

    public static Map<String, BuildArtifactsOut> uniqueSubprojects(Map<String, BuildArtifactsOut> parts) {
        Map<String, BuildArtifactsOut> named = new LinkedHashMap<>();
        parts.forEach((part, artifacts) -> named.put(part, new BuildArtifactsOut(artifacts.results().stream()
                .map(sub -> sub.subName().equals(DEFAULT_SUBPROJECT) ? sub.withSubName(part + "-" + DEFAULT_SUBPROJECT) : sub)
                .toList())));
        Map<String, Integer> occurrences = new HashMap<>();
        named.values().forEach(artifacts -> artifacts.results().forEach(sub -> occurrences.merge(sub.subName(), 1, Integer::sum)));
        Map<String, BuildArtifactsOut> unique = new LinkedHashMap<>();
        named.forEach((part, artifacts) -> unique.put(part, new BuildArtifactsOut(artifacts.results().stream()
                .map(sub -> occurrences.get(sub.subName()) > 1 ? sub.withSubName(part + "-" + sub.subName()) : sub)
                .toList())));
        return unique;
    }
}
