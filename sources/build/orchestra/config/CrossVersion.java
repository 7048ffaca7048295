package build.orchestra.config;

import build.orchestra.ConfigurationException;
import build.orchestra.ConsistencyException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public enum CrossVersion {

    DISABLED("disabled"), FULL("full"), BINARY("binary"), STANDARD("standard");

    private static final Pattern BINARY_VERSION = Pattern.compile("(\\d+\\.\\d+)(?:\\..+)?");

    private final String label;

    CrossVersion(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static CrossVersion of(String label) {
        for (CrossVersion crossVersion : values()) {
            if (crossVersion.label.equals(label)) {
                return crossVersion;
            }
        }
        throw new ConfigurationException("Unrecognized cross-version option \"" + label + "\"");
    }

    public boolean requiresVersion() {
        return this != DISABLED;
    }

    public String suffix(String version) {
        return switch (this) {
            case DISABLED -> "";
            case FULL -> "_" + version;
            case BINARY -> "_" + binary(version);
            // Any hyphen is taken as a pre-release marker.
            case STANDARD -> "_" + (version.contains("-") ? version : binary(version));
        };
    }

    public static String binary(String version) {
        Matcher matcher = BINARY_VERSION.matcher(version);
        if (!matcher.matches()) {
            throw new ConsistencyException("Cannot extract binary version from string \"" + version + "\"");
        }
        return matcher.group(1);
    }

    @Override
    public String toString() {
        return label;
    }
}
