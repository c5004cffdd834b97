package io.typeflow.core.schema;

import io.typeflow.core.error.DuplicateDefinitionException;
import io.typeflow.core.error.UnknownTypeReferenceException;
import io.typeflow.core.error.UnresolvedTypeReferenceException;
import io.typeflow.core.error.UnresolvedTypeReferenceException.DanglingReference;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mutable, name-addressed registry of class and enum definitions, built by a caller before any
 * operation runs. Names are unique across classes and enums, and insertion order is kept for
 * {@link #describe()} and for field ordering.
 *
 * <p>Not thread-safe. A registry must not be mutated while a {@link SchemaSnapshot} taken from it
 * is in use by decode sessions; the snapshot itself is immutable and freely shareable.
 */
public final class SchemaRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaRegistry.class);

    private final Map<String, ClassBuilder> classes = new LinkedHashMap<>();
    private final Map<String, EnumBuilder> enums = new LinkedHashMap<>();

    /**
     * Defines a new class.
     *
     * @throws DuplicateDefinitionException if a class or enum with this name already exists
     */
    public ClassBuilder defineClass(String name) {
        requireFreeName(name);
        ClassBuilder builder = new ClassBuilder(name);
        classes.put(name, builder);
        return builder;
    }

    /**
     * Defines a new enum.
     *
     * @throws DuplicateDefinitionException if a class or enum with this name already exists
     */
    public EnumBuilder defineEnum(String name) {
        requireFreeName(name);
        EnumBuilder builder = new EnumBuilder(name);
        enums.put(name, builder);
        return builder;
    }

    /**
     * Returns the builder of an existing class so that more properties can be added to it.
     *
     * @throws UnknownTypeReferenceException if no class with this name is defined
     */
    public ClassBuilder extendClass(String name) {
        ClassBuilder builder = classes.get(name);
        if (builder == null) {
            throw new UnknownTypeReferenceException(name);
        }
        return builder;
    }

    /**
     * Returns the builder of an existing enum so that more values can be added to it.
     *
     * @throws UnknownTypeReferenceException if no enum with this name is defined
     */
    public EnumBuilder extendEnum(String name) {
        EnumBuilder builder = enums.get(name);
        if (builder == null) {
            throw new UnknownTypeReferenceException(name);
        }
        return builder;
    }

    public boolean hasClass(String name) {
        return classes.containsKey(name);
    }

    public boolean hasEnum(String name) {
        return enums.containsKey(name);
    }

    /**
     * Validates every type reference and returns an immutable snapshot.
     *
     * @throws UnresolvedTypeReferenceException listing every property whose type names an
     *     undefined class or enum, or that has no type at all
     */
    public SchemaSnapshot snapshot() {
        List<ClassDef> classDefs = classDefs();
        List<EnumDef> enumDefs = enumDefs();

        List<DanglingReference> dangling = new ArrayList<>();
        for (ClassDef classDef : classDefs) {
            for (PropertyDef property : classDef.properties()) {
                if (property.type() == null) {
                    dangling.add(new DanglingReference(classDef.name(), property.name(), null));
                    continue;
                }
                Set<String> names = new LinkedHashSet<>();
                SchemaSnapshot.collectNames(property.type(), names);
                for (String referenced : names) {
                    if (!classes.containsKey(referenced) && !enums.containsKey(referenced)) {
                        dangling.add(new DanglingReference(classDef.name(), property.name(), referenced));
                    }
                }
            }
        }
        if (!dangling.isEmpty()) {
            throw new UnresolvedTypeReferenceException(dangling);
        }

        SchemaSnapshot snapshot = new SchemaSnapshot(classDefs, enumDefs);
        LOG.debug("Schema snapshot taken: classes={}, enums={}", classDefs.size(), enumDefs.size());
        return snapshot;
    }

    /**
     * Renders every definition in insertion order. Unlike {@link #snapshot()} this never fails:
     * properties without a type are rendered as {@code <unset>}.
     */
    public String describe() {
        return SchemaDescriber.describe(classDefs(), enumDefs());
    }

    @Override
    public String toString() {
        return describe();
    }

    private List<ClassDef> classDefs() {
        List<ClassDef> defs = new ArrayList<>(classes.size());
        classes.values().forEach(c -> defs.add(c.toDef()));
        return defs;
    }

    private List<EnumDef> enumDefs() {
        List<EnumDef> defs = new ArrayList<>(enums.size());
        enums.values().forEach(e -> defs.add(e.toDef()));
        return defs;
    }

    private void requireFreeName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("type name must not be null or blank");
        }
        if (classes.containsKey(name) || enums.containsKey(name)) {
            throw new DuplicateDefinitionException(name);
        }
    }
}
