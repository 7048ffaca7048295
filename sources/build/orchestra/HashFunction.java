package build.orchestra;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.ArrayDeque;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.SortedMap;
import java.util.TreeMap;

@FunctionalInterface
public interface HashFunction {

    byte[] hash(Path file) throws IOException;

    default String hex(Path file) throws IOException {
        return HexFormat.of().formatHex(hash(file));
    }

    static SortedMap<Path, byte[]> read(Path folder, HashFunction hash) throws IOException {
        SortedMap<Path, byte[]> checksums = new TreeMap<>();
        Queue<Path> queue = new ArrayDeque<>(List.of(folder));
        do {
            Path current = queue.remove();
            if (Files.isDirectory(current)) {
                try (DirectoryStream<Path> stream = Files.newDirectoryStream(current)) {
                    stream.forEach(queue::add);
                }
            } else {
                checksums.put(folder.relativize(current), hash.hash(current));
            }
        } while (!queue.isEmpty());
        return checksums;
    }

    static byte[] combine(Map<Path, byte[]> checksums, String algorithm) {
        MessageDigest digest = HashDigestFunction.digest(algorithm);
        for (Map.Entry<Path, byte[]> entry : checksums.entrySet()) {
            digest.update(entry.getKey().toString().replace('\\', '/').getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(entry.getValue());
        }
        return digest.digest();
    }
}
