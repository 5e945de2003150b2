package com.sysmuse.consolidation.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sysmuse.consolidation.ConfigurationException;
import com.sysmuse.consolidation.util.LoggingUtil;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;

/**
 * RunConfigLoader - reads a JSON run configuration into a {@link ProcessingConfig}.
 *
 * Relative paths in the file (input folder, output file, schema file) are resolved
 * against the directory holding the configuration file.
 */
public class RunConfigLoader {

    private final ObjectMapper mapper = new ObjectMapper();
    private final Properties loggingProperties = new Properties();

    public ProcessingConfig loadFromFile(String configFilePath) throws IOException {
        return loadFromFile(Paths.get(configFilePath));
    }

    public ProcessingConfig loadFromFile(Path configFile) throws IOException {
        if (!Files.isRegularFile(configFile)) {
            throw new ConfigurationException("Run configuration file not found: " + configFile);
        }
        LoggingUtil.info("Loading run configuration from: " + configFile);
        JsonNode root = mapper.readTree(configFile.toFile());
        Path baseDir = configFile.toAbsolutePath().getParent();
        return fromJson(root, baseDir);
    }

    /**
     * Build a config from an already parsed document.
     *
     * @param baseDir directory relative paths are resolved against; null keeps them as given
     */
    public ProcessingConfig fromJson(JsonNode root, Path baseDir) throws IOException {
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Run configuration must be a JSON object");
        }
        if (!root.hasNonNull("input_folder")) {
            throw new ConfigurationException("input_folder is required");
        }

        ProcessingConfig.Builder builder = ProcessingConfig.builder(resolve(baseDir, root.get("input_folder").asText()));

        if (root.hasNonNull("output_file")) {
            builder.outputFile(resolve(baseDir, root.get("output_file").asText()));
        }
        if (root.has("recursive")) {
            builder.recursive(root.get("recursive").asBoolean());
        }
        if (root.hasNonNull("file_type_filter")) {
            builder.fileTypeFilter(stringList(root.get("file_type_filter"), "file_type_filter"));
        }
        if (root.hasNonNull("schema_map")) {
            builder.schemaMap(schemaMap(root.get("schema_map"), "schema_map"));
        } else if (root.hasNonNull("schema_file")) {
            Path schemaFile = Paths.get(resolve(baseDir, root.get("schema_file").asText()));
            builder.schemaMap(loadSchemaMap(schemaFile));
        }
        if (root.has("to_lower")) {
            builder.toLower(root.get("to_lower").asBoolean());
        }
        if (root.has("spaces_to_underscores")) {
            builder.spacesToUnderscores(root.get("spaces_to_underscores").asBoolean());
        }
        if (root.hasNonNull("index_mode")) {
            builder.indexMode(root.get("index_mode").asText());
        }
        if (root.has("index_start")) {
            JsonNode start = root.get("index_start");
            if (!start.canConvertToLong()) {
                throw new ConfigurationException("index_start must be an integer, got: " + start);
            }
            builder.indexStart(start.asLong());
        }
        if (root.hasNonNull("columns")) {
            builder.columns(stringList(root.get("columns"), "columns"));
        }
        if (root.has("force_in_memory")) {
            builder.forceInMemory(root.get("force_in_memory").asBoolean());
        }
        if (root.hasNonNull("read_options")) {
            builder.readOptions(options(root.get("read_options"), "read_options"));
        }
        if (root.hasNonNull("write_options")) {
            builder.writeOptions(options(root.get("write_options"), "write_options"));
        }

        loggingProperties.clear();
        if (root.has("logging")) {
            parseLogging(root.get("logging"));
        }
        return builder.build();
    }

    /**
     * Logging settings of the last loaded file as logging.level, logging.console and
     * logging.file properties; empty when the file had no logging section.
     */
    public Properties getLoggingProperties() {
        return loggingProperties;
    }

    /**
     * Alias map file: an object from standard column name to a list of aliases.
     */
    public Map<String, List<String>> loadSchemaMap(Path schemaFile) throws IOException {
        if (!Files.isRegularFile(schemaFile)) {
            throw new ConfigurationException("Schema file not found: " + schemaFile);
        }
        LoggingUtil.debug("Loading schema map from: " + schemaFile);
        return schemaMap(mapper.readTree(schemaFile.toFile()), schemaFile.toString());
    }

    private void parseLogging(JsonNode loggingNode) {
        if (!loggingNode.isObject()) {
            throw new ConfigurationException("logging must be an object");
        }
        if (loggingNode.has("level")) {
            loggingProperties.setProperty("logging.level", loggingNode.get("level").asText());
        }
        if (loggingNode.has("console")) {
            loggingProperties.setProperty("logging.console", String.valueOf(loggingNode.get("console").asBoolean()));
        }
        JsonNode file = loggingNode.get("file");
        if (file != null && file.isTextual()) {
            loggingProperties.setProperty("logging.file", file.asText());
        } else if (file != null && file.asBoolean()) {
            String fileName = loggingNode.has("filename")
                    ? loggingNode.get("filename").asText()
                    : LoggingUtil.DEFAULT_LOG_FILE;
            loggingProperties.setProperty("logging.file", fileName);
        }
    }

    private Map<String, Object> options(JsonNode node, String label) {
        if (!node.isObject()) {
            throw new ConfigurationException(label + " must be a JSON object mapping option names to values, got: " +
                    node.getNodeType());
        }
        Map<String, Object> options = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            options.put(field.getKey(), optionValue(field.getValue()));
        }
        return options;
    }

    private Object optionValue(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToInt() ? (Object) node.intValue() : node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isArray()) {
            List<Object> values = new ArrayList<>();
            for (JsonNode element : node) {
                values.add(optionValue(element));
            }
            return values;
        }
        if (node.isObject()) {
            return mapper.convertValue(node, Map.class);
        }
        return node.asText();
    }

    private static Map<String, List<String>> schemaMap(JsonNode node, String label) {
        if (!node.isObject()) {
            throw new ConfigurationException(label + " must map standard column names to alias lists");
        }
        Map<String, List<String>> schemaMap = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            schemaMap.put(field.getKey(), stringList(field.getValue(), label + "." + field.getKey()));
        }
        return schemaMap;
    }

    /**
     * A list of strings, or a single string (comma separated lists are split).
     */
    private static List<String> stringList(JsonNode node, String label) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode element : node) {
                if (!element.isValueNode()) {
                    throw new ConfigurationException(label + " entries must be strings, got: " + element);
                }
                values.add(element.asText());
            }
        } else if (node.isValueNode()) {
            values.addAll(Arrays.asList(node.asText().split(",")));
        } else {
            throw new ConfigurationException(label + " must be a string or a list of strings");
        }
        return values;
    }

    private static String resolve(Path baseDir, String path) {
        if (baseDir == null || path == null || path.trim().isEmpty()) {
            return path;
        }
        Path candidate = Paths.get(path.trim());
        return candidate.isAbsolute() ? candidate.toString() : baseDir.resolve(candidate).normalize().toString();
    }
}
