package build.orchestra.repository;

import build.orchestra.HashDigestFunction;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Checksums {

    public static final List<String> EXTENSIONS = List.of("md5", "sha1");

    private static final Map<String, HashDigestFunction> ALGORITHMS = new LinkedHashMap<>();

    static {
        ALGORITHMS.put("md5", new HashDigestFunction(HashDigestFunction.MD5));
        ALGORITHMS.put("sha1", new HashDigestFunction(HashDigestFunction.SHA1));
    }

    private Checksums() {
    }

    public static void write(Path file) throws IOException {
        for (Map.Entry<String, HashDigestFunction> entry : ALGORITHMS.entrySet()) {
            Files.writeString(sibling(file, entry.getKey()), entry.getValue().hex(file), StandardCharsets.UTF_8);
        }
    }

    public static boolean isChecksum(Path file) {
        String name = file.getFileName().toString();
        return EXTENSIONS.stream().anyMatch(extension -> name.endsWith("." + extension));
    }

    public static Path sibling(Path file, String extension) {
        return file.resolveSibling(file.getFileName() + "." + extension);
    }
}
