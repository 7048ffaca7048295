package build.orchestra;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public class HashDigestFunction implements HashFunction {

    public static final String MD5 = "MD5", SHA1 = "SHA-1";

    private final String algorithm;

    public HashDigestFunction(String algorithm) {
        this.algorithm = algorithm;
    }

    public String algorithm() {
        return algorithm;
    }

    @Override
    public byte[] hash(Path file) throws IOException {
        MessageDigest digest = digest(algorithm);
        try (FileChannel channel = FileChannel.open(file)) {
            if (channel.size() > 0) {
                digest.update(channel.map(FileChannel.MapMode.READ_ONLY, 0, channel.size()));
            }
        }
        return digest.digest();
    }

    static MessageDigest digest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
