package io.typeflow.core.schema;

import io.typeflow.core.error.UnknownTypeReferenceException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, validated view of a {@link SchemaRegistry}. Every named reference inside it resolves
 * to a class or an enum of the same snapshot.
 *
 * <p>Thread-safe: all fields are final and collections are unmodifiable, so one snapshot can back
 * any number of concurrent decode sessions.
 */
public final class SchemaSnapshot {

    private static final SchemaSnapshot EMPTY = new SchemaSnapshot(List.of(), List.of());

    private final Map<String, ClassDef> classes;
    private final Map<String, EnumDef> enums;

    SchemaSnapshot(List<ClassDef> classDefs, List<EnumDef> enumDefs) {
        Map<String, ClassDef> classMap = new LinkedHashMap<>();
        classDefs.forEach(c -> classMap.put(c.name(), c));
        Map<String, EnumDef> enumMap = new LinkedHashMap<>();
        enumDefs.forEach(e -> enumMap.put(e.name(), e));
        this.classes = Collections.unmodifiableMap(classMap);
        this.enums = Collections.unmodifiableMap(enumMap);
    }

    /** A snapshot with no definitions, enough for primitive-only target types. */
    public static SchemaSnapshot empty() {
        return EMPTY;
    }

    public Optional<ClassDef> classDef(String name) {
        return Optional.ofNullable(classes.get(name));
    }

    public Optional<EnumDef> enumDef(String name) {
        return Optional.ofNullable(enums.get(name));
    }

    /** Classes in insertion order. */
    public Map<String, ClassDef> classes() {
        return classes;
    }

    /** Enums in insertion order. */
    public Map<String, EnumDef> enums() {
        return enums;
    }

    /**
     * Checks that every name used by {@code target} is defined in this snapshot.
     *
     * @return {@code target}, for chaining
     * @throws UnknownTypeReferenceException naming the first undefined type
     */
    public TypeRef requireResolvable(TypeRef target) {
        Set<String> names = new LinkedHashSet<>();
        collectNames(target, names);
        for (String name : names) {
            if (!classes.containsKey(name) && !enums.containsKey(name)) {
                throw new UnknownTypeReferenceException(name);
            }
        }
        return target;
    }

    /** Renders every definition in insertion order, identically to the source registry. */
    public String describe() {
        return SchemaDescriber.describe(List.copyOf(classes.values()), List.copyOf(enums.values()));
    }

    @Override
    public String toString() {
        return "SchemaSnapshot[classes=" + classes.keySet() + ", enums=" + enums.keySet() + "]";
    }

    /** Adds every class or enum name mentioned by {@code type} to {@code names}. */
    static void collectNames(TypeRef type, Set<String> names) {
        if (type instanceof TypeRef.Named named) {
            names.add(named.name());
        } else if (type instanceof TypeRef.OptionalOf optional) {
            collectNames(optional.inner(), names);
        } else if (type instanceof TypeRef.ListOf list) {
            collectNames(list.element(), names);
        } else if (type instanceof TypeRef.MapOf map) {
            collectNames(map.value(), names);
        } else if (type instanceof TypeRef.UnionOf union) {
            union.alternatives().forEach(alternative -> collectNames(alternative, names));
        }
    }
}
