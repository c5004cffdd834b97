package io.typeflow.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Renders a target type as a JSON Schema (draft 2020-12) describing the shape of its final
 * values. Referenced classes and enums go under {@code $defs}, so recursive classes export as
 * recursive {@code $ref}s. Property keys are the canonical property names, never aliases.
 *
 * <p>Thread-safe: holds only an immutable snapshot.
 */
public final class JsonSchemaExporter {

    public static final String DIALECT = "https://json-schema.org/draft/2020-12/schema";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final SchemaSnapshot schema;

    public JsonSchemaExporter(SchemaSnapshot schema) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
    }

    /**
     * Exports {@code target} with every definition it transitively references.
     *
     * @throws io.typeflow.core.error.UnknownTypeReferenceException if {@code target} names a type
     *     absent from the snapshot
     */
    public ObjectNode export(TypeRef target) {
        schema.requireResolvable(target);
        ObjectNode root = NODES.objectNode();
        root.put("$schema", DIALECT);
        root.setAll(typeSchema(target));

        Set<String> pending = new LinkedHashSet<>();
        SchemaSnapshot.collectNames(target, pending);
        if (pending.isEmpty()) {
            return root;
        }
        ObjectNode defs = root.putObject("$defs");
        Deque<String> queue = new ArrayDeque<>(pending);
        Set<String> done = new LinkedHashSet<>();
        while (!queue.isEmpty()) {
            String name = queue.poll();
            if (!done.add(name)) {
                continue;
            }
            schema.classDef(name).ifPresent(classDef -> {
                defs.set(name, classSchema(classDef));
                for (PropertyDef property : classDef.properties()) {
                    Set<String> referenced = new LinkedHashSet<>();
                    SchemaSnapshot.collectNames(property.type(), referenced);
                    referenced.stream().filter(r -> !done.contains(r)).forEach(queue::add);
                }
            });
            schema.enumDef(name).ifPresent(enumDef -> defs.set(name, enumSchema(enumDef)));
        }
        return root;
    }

    private ObjectNode classSchema(ClassDef classDef) {
        ObjectNode node = NODES.objectNode();
        node.put("type", "object");
        if (classDef.metadata().description() != null) {
            node.put("description", classDef.metadata().description());
        }
        ObjectNode properties = node.putObject("properties");
        ArrayNode required = NODES.arrayNode();
        for (PropertyDef property : classDef.properties()) {
            ObjectNode propertySchema = typeSchema(property.type());
            if (property.metadata().description() != null) {
                propertySchema.put("description", property.metadata().description());
            }
            properties.set(property.name(), propertySchema);
            if (!property.type().isOptional()) {
                required.add(property.name());
            }
        }
        if (!required.isEmpty()) {
            node.set("required", required);
        }
        return node;
    }

    private ObjectNode enumSchema(EnumDef enumDef) {
        ObjectNode node = NODES.objectNode();
        node.put("type", "string");
        if (enumDef.metadata().description() != null) {
            node.put("description", enumDef.metadata().description());
        }
        ArrayNode values = node.putArray("enum");
        enumDef.values().forEach(v -> values.add(v.name()));
        return node;
    }

    private ObjectNode typeSchema(TypeRef type) {
        ObjectNode node = NODES.objectNode();
        if (type instanceof TypeRef.Primitive primitive) {
            node.put("type", switch (primitive.kind()) {
                case STRING -> "string";
                case INT -> "integer";
                case FLOAT -> "number";
                case BOOL -> "boolean";
            });
        } else if (type instanceof TypeRef.Literal literal) {
            JsonNode value = literal.value();
            node.put("type", value.isTextual() ? "string" : value.isBoolean() ? "boolean" : "integer");
            node.set("const", value);
        } else if (type instanceof TypeRef.Named named) {
            node.put("$ref", "#/$defs/" + named.name());
        } else if (type instanceof TypeRef.OptionalOf optional) {
            ArrayNode anyOf = node.putArray("anyOf");
            anyOf.add(typeSchema(optional.inner()));
            anyOf.add(NODES.objectNode().put("type", "null"));
        } else if (type instanceof TypeRef.ListOf list) {
            node.put("type", "array");
            node.set("items", typeSchema(list.element()));
        } else if (type instanceof TypeRef.MapOf map) {
            node.put("type", "object");
            node.set("additionalProperties", typeSchema(map.value()));
        } else if (type instanceof TypeRef.UnionOf union) {
            ArrayNode anyOf = node.putArray("anyOf");
            union.alternatives().forEach(alternative -> anyOf.add(typeSchema(alternative)));
        } else if (type instanceof TypeRef.Media media) {
            node.put("type", "object");
            ObjectNode properties = node.putObject("properties");
            properties.putObject("kind").put("const", media.kind().typeName());
            properties.putObject("url").put("type", "string");
            properties.putObject("base64").put("type", "string");
            properties.putObject("media_type").put("type", "string");
            node.putArray("required").add("kind");
        }
        return node;
    }
}
