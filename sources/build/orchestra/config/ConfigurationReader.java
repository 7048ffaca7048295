package build.orchestra.config;

import build.orchestra.BuildSystems;
import build.orchestra.ConfigurationException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigRenderOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

public class ConfigurationReader {

    private static final Set<String> PROJECT_FIELDS = Set.of("name", "system", "uri", "set-version", "extra", "notifications");

    private final ObjectMapper mapper;

    public ConfigurationReader(BuildSystems systems) {
        mapper = JsonMapper.builder()
                .addModule(new SimpleModule().addDeserializer(ProjectConfig.class, new ProjectConfigDeserializer(systems)))
                .build();
    }

    public DistributedBuildConfig read(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Configuration file not found: " + file);
        }
        Config config;
        try {
            config = ConfigFactory.parseFile(file.toFile()).resolve();
        } catch (ConfigException e) {
            throw new ConfigurationException("Cannot parse " + file + ": " + e.getMessage(), e);
        }
        return read(config);
    }

    public DistributedBuildConfig read(String text) {
        try {
            return read(ConfigFactory.parseString(text).resolve());
        } catch (ConfigException e) {
            throw new ConfigurationException("Cannot parse configuration: " + e.getMessage(), e);
        }
    }

    public DistributedBuildConfig read(Config config) {
        try {
            return mapper.readValue(config.root().render(ConfigRenderOptions.concise()), DistributedBuildConfig.class);
        } catch (IOException | RuntimeException e) {
            for (Throwable cause = e; cause != null; cause = cause.getCause()) {
                if (cause instanceof ConfigurationException configurationException) {
                    throw configurationException;
                }
            }
            throw new ConfigurationException("Cannot decode configuration: " + e.getMessage(), e);
        }
    }

    static class ProjectConfigDeserializer extends StdDeserializer<ProjectConfig> {

        private final BuildSystems systems;

        ProjectConfigDeserializer(BuildSystems systems) {
            super(ProjectConfig.class);
            this.systems = systems;
        }

        @Override
        public ProjectConfig deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            ObjectMapper codec = (ObjectMapper) parser.getCodec();
            JsonNode node = codec.readTree(parser);
            Iterator<String> fields = node.fieldNames();
            while (fields.hasNext()) {
                String field = fields.next();
                if (!PROJECT_FIELDS.contains(field)) {
                    throw new ConfigurationException("Unknown project property \"" + field + "\"");
                }
            }
            String name = text(node, "name", null);
            String system = text(node, "system", name);
            if (!systems.contains(system)) {
                throw new ConfigurationException("Build system \"" + system + "\" of project " + name + " is unknown");
            }
            JsonNode extra = node.get("extra");
            BuildSystemOptions options = extra == null || extra.isNull()
                    ? BuildSystemOptions.defaults(system)
                    : codec.treeToValue(extra, systems.get(system).optionsType());
            JsonNode notifications = node.get("notifications");
            return new ProjectConfig(name,
                    system,
                    text(node, "uri", name),
                    node.hasNonNull("set-version") ? node.get("set-version").asText() : null,
                    options,
                    notifications == null ? null : codec.readerFor(new TypeReference<List<Notification>>() {
                    }).readValue(notifications));
        }

        private static String text(JsonNode node, String property, String project) {
            JsonNode value = node.get(property);
            if (value == null || !value.isValueNode() || value.isNull()) {
                throw new ConfigurationException("Missing \"" + property + "\""
                        + (project == null ? " in project" : " in project " + project));
            }
            return value.asText();
        }
    }
}
