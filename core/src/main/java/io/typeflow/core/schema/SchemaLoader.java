package io.typeflow.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.typeflow.core.error.SchemaParseException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Builds schema definitions from YAML documents:
 *
 * <pre>
 * classes:
 *   User:
 *     description: A registered user
 *     properties:
 *       name:
 *         type: string
 *         alias: username
 *       age: int?            # shorthand for {type: int?}
 * enums:
 *   Status:
 *     values:
 *       - ACTIVE
 *       - name: INACTIVE
 *         alias: inactive
 * </pre>
 *
 * <p>A class or enum entry with {@code extend: true} adds to a definition already present in the
 * target registry instead of defining a new one. Unknown keys are rejected so that typos fail at
 * load time instead of being silently ignored.
 *
 * <p>Thread-safe: holds no mutable state.
 */
public final class SchemaLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Recognized top-level keys. */
    private static final Set<String> KNOWN_ROOT_KEYS = Set.of("classes", "enums");

    /** Recognized keys of a class entry. */
    private static final Set<String> KNOWN_CLASS_KEYS = Set.of("alias", "description", "extend", "properties");

    /** Recognized keys of a property entry. */
    private static final Set<String> KNOWN_PROPERTY_KEYS = Set.of("type", "alias", "description");

    /** Recognized keys of an enum entry. */
    private static final Set<String> KNOWN_ENUM_KEYS = Set.of("alias", "description", "extend", "values");

    /** Recognized keys of an enum value entry. */
    private static final Set<String> KNOWN_VALUE_KEYS = Set.of("name", "alias", "description");

    /**
     * Parses the YAML file at the given path into a new registry.
     *
     * @throws SchemaParseException if the YAML is invalid or has unknown keys
     */
    public SchemaRegistry load(Path path) {
        SchemaRegistry registry = new SchemaRegistry();
        loadInto(path, registry);
        return registry;
    }

    /** Parses the YAML file at the given path into an existing registry. */
    public void loadInto(Path path, SchemaRegistry registry) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new SchemaParseException("Failed to read or parse YAML: " + e.getMessage(), e, null, source);
        }
        loadInto(root, source, registry);
    }

    /** Parses YAML text into a new registry. */
    public SchemaRegistry parse(String yaml, String source) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(yaml);
        } catch (IOException e) {
            throw new SchemaParseException("Failed to parse YAML: " + e.getMessage(), e, null, source);
        }
        SchemaRegistry registry = new SchemaRegistry();
        loadInto(root, source, registry);
        return registry;
    }

    /** Applies an already-parsed document to {@code registry}. */
    public void loadInto(JsonNode root, String source, SchemaRegistry registry) {
        Objects.requireNonNull(registry, "registry must not be null");
        if (root == null || root.isNull() || root.isMissingNode()) {
            return;
        }
        if (!root.isObject()) {
            throw new SchemaParseException("Schema document must be a mapping", null, source);
        }
        rejectUnknownKeys(root, KNOWN_ROOT_KEYS, "schema root", null, source);

        for (Map.Entry<String, JsonNode> entry : fields(root.path("classes"), "classes", source)) {
            loadClass(entry.getKey(), entry.getValue(), source, registry);
        }
        for (Map.Entry<String, JsonNode> entry : fields(root.path("enums"), "enums", source)) {
            loadEnum(entry.getKey(), entry.getValue(), source, registry);
        }
    }

    private void loadClass(String name, JsonNode node, String source, SchemaRegistry registry) {
        requireMapping(node, "class '" + name + "'", name, source);
        rejectUnknownKeys(node, KNOWN_CLASS_KEYS, "class '" + name + "'", name, source);

        ClassBuilder builder =
                node.path("extend").asBoolean(false) ? registry.extendClass(name) : registry.defineClass(name);
        optionalString(node, "alias", name, source).ifPresent(builder::alias);
        optionalString(node, "description", name, source).ifPresent(builder::description);

        for (Map.Entry<String, JsonNode> entry : fields(node.path("properties"), "properties", source)) {
            String propertyName = entry.getKey();
            JsonNode propertyNode = entry.getValue();
            PropertyBuilder property = builder.property(propertyName);
            if (propertyNode.isTextual()) {
                property.type(propertyNode.asText());
                continue;
            }
            String block = "property '" + name + "." + propertyName + "'";
            requireMapping(propertyNode, block, name, source);
            rejectUnknownKeys(propertyNode, KNOWN_PROPERTY_KEYS, block, name, source);
            property.type(optionalString(propertyNode, "type", name, source)
                    .orElseThrow(() -> new SchemaParseException("Missing 'type' in " + block, name, source)));
            optionalString(propertyNode, "alias", name, source).ifPresent(property::alias);
            optionalString(propertyNode, "description", name, source).ifPresent(property::description);
        }
    }

    private void loadEnum(String name, JsonNode node, String source, SchemaRegistry registry) {
        requireMapping(node, "enum '" + name + "'", name, source);
        rejectUnknownKeys(node, KNOWN_ENUM_KEYS, "enum '" + name + "'", name, source);

        EnumBuilder builder =
                node.path("extend").asBoolean(false) ? registry.extendEnum(name) : registry.defineEnum(name);
        optionalString(node, "alias", name, source).ifPresent(builder::alias);
        optionalString(node, "description", name, source).ifPresent(builder::description);

        JsonNode values = node.path("values");
        if (values.isMissingNode() || values.isNull()) {
            return;
        }
        if (!values.isArray()) {
            throw new SchemaParseException("'values' of enum '" + name + "' must be a list", name, source);
        }
        for (JsonNode valueNode : values) {
            if (valueNode.isTextual()) {
                builder.value(valueNode.asText());
                continue;
            }
            String block = "value of enum '" + name + "'";
            requireMapping(valueNode, block, name, source);
            rejectUnknownKeys(valueNode, KNOWN_VALUE_KEYS, block, name, source);
            EnumValueBuilder value = builder.value(optionalString(valueNode, "name", name, source)
                    .orElseThrow(() -> new SchemaParseException("Missing 'name' in " + block, name, source)));
            optionalString(valueNode, "alias", name, source).ifPresent(value::alias);
            optionalString(valueNode, "description", name, source).ifPresent(value::description);
        }
    }

    private static Iterable<Map.Entry<String, JsonNode>> fields(JsonNode node, String block, String source) {
        if (node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (!node.isObject()) {
            throw new SchemaParseException("'" + block + "' must be a mapping", null, source);
        }
        return node::fields;
    }

    private static Optional<String> optionalString(
            JsonNode node, String field, String typeName, String source) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        if (!value.isValueNode()) {
            throw new SchemaParseException("Field '" + field + "' must be a scalar", typeName, source);
        }
        return Optional.of(value.asText());
    }

    private static void requireMapping(JsonNode node, String block, String typeName, String source) {
        if (node == null || !node.isObject()) {
            throw new SchemaParseException("Expected a mapping for " + block, typeName, source);
        }
    }

    private static void rejectUnknownKeys(
            JsonNode node, Set<String> knownKeys, String blockName, String typeName, String source) {
        Iterator<String> names = node.fieldNames();
        List<String> unknown = StreamSupport.stream(((Iterable<String>) () -> names).spliterator(), false)
                .filter(key -> !knownKeys.contains(key))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new SchemaParseException(
                    "Unknown key" + (unknown.size() > 1 ? "s" : "") + " in " + blockName + ": " + unknown
                            + ", recognized keys are: " + knownKeys.stream().sorted().toList(),
                    typeName,
                    source);
        }
    }
}
