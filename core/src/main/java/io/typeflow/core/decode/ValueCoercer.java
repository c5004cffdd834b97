package io.typeflow.core.decode;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.typeflow.core.decode.RawValue.Entry;
import io.typeflow.core.decode.RawValue.RawArray;
import io.typeflow.core.decode.RawValue.RawObject;
import io.typeflow.core.decode.RawValue.RawString;
import io.typeflow.core.decode.RawValue.RawToken;
import io.typeflow.core.error.IncompleteValueException.Unresolved;
import io.typeflow.core.model.MediaKind;
import io.typeflow.core.model.MediaValue;
import io.typeflow.core.model.ValuePaths;
import io.typeflow.core.schema.ClassDef;
import io.typeflow.core.schema.EnumDef;
import io.typeflow.core.schema.PropertyDef;
import io.typeflow.core.schema.SchemaSnapshot;
import io.typeflow.core.schema.TypeRef;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Applies a target type to a {@link RawValue}. Returns the resolved portion of the value, or
 * {@code null} when nothing at that path has resolved yet.
 *
 * <p>During a partial pass, anything that may still be arriving is simply left out. Fragments
 * that are complete and cannot fit the type become sticky local failures in the session's
 * {@link DecodeMemory}. During the final pass, optional values that did not resolve become
 * JSON {@code null} and required ones are reported as problems.
 *
 * <p>Stateless apart from the schema; thread-safe.
 */
final class ValueCoercer {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final Pattern GROUPED_NUMBER = Pattern.compile("[+-]?\\d{1,3}(,\\d{3})+(\\.\\d+)?");
    private static final List<String> URL_PREFIXES = List.of("http://", "https://", "data:", "gs://", "s3://", "file:");

    private final SchemaSnapshot schema;

    ValueCoercer(SchemaSnapshot schema) {
        this.schema = schema;
    }

    /** One coercion pass over the whole payload. */
    static final class Pass {

        private record Problem(Unresolved unresolved, boolean hard) {}

        private final boolean finalPass;
        private final DecodeMemory memory;
        private final List<Problem> problems = new ArrayList<>();

        private Pass(boolean finalPass, DecodeMemory memory) {
            this.finalPass = finalPass;
            this.memory = memory;
        }

        static Pass partial(DecodeMemory memory) {
            return new Pass(false, memory);
        }

        static Pass finalPass(DecodeMemory memory) {
            return new Pass(true, memory);
        }

        /** Same memory, separate problem list. */
        private Pass scoped() {
            return new Pass(finalPass, memory);
        }

        /** Forked memory, separate problem list. */
        private Pass trial() {
            return new Pass(finalPass, memory.copy());
        }

        boolean isFinal() {
            return finalPass;
        }

        /** Unresolved required paths, first reason per path. */
        List<Unresolved> unresolved() {
            Map<String, Unresolved> byPath = new LinkedHashMap<>();
            for (Problem problem : problems) {
                byPath.putIfAbsent(problem.unresolved().path(), problem.unresolved());
            }
            return List.copyOf(byPath.values());
        }

        private void unresolved(String path, String reason, boolean hard) {
            if (finalPass) {
                problems.add(new Problem(new Unresolved(path, reason), hard));
            }
        }

        private boolean hasHardProblem() {
            return problems.stream().anyMatch(Problem::hard);
        }
    }

    JsonNode coerce(TypeRef type, RawValue raw, String path, Pass pass) {
        if (type instanceof TypeRef.OptionalOf optional) {
            return coerceOptional(optional, raw, path, pass);
        }
        if (raw == null || isEmptyToken(raw)) {
            pass.unresolved(path, "missing", false);
            return null;
        }
        Optional<DecodeMemory.Failure> failure = pass.memory.failure(path);
        if (failure.isPresent()) {
            pass.unresolved(path, failure.get().reason(), failure.get().hard());
            return null;
        }
        if (type instanceof TypeRef.Primitive primitive) {
            return coercePrimitive(primitive.kind(), raw, path, pass);
        }
        if (type instanceof TypeRef.Literal literal) {
            return coerceLiteral(literal, raw, path, pass);
        }
        if (type instanceof TypeRef.Named named) {
            Optional<ClassDef> classDef = schema.classDef(named.name());
            if (classDef.isPresent()) {
                return coerceClass(classDef.get(), raw, path, pass);
            }
            EnumDef enumDef = schema.enumDef(named.name())
                    .orElseThrow(() -> new IllegalStateException("Unresolvable type " + named.name()));
            return coerceEnum(enumDef, raw, path, pass);
        }
        if (type instanceof TypeRef.ListOf list) {
            return coerceList(list, raw, path, pass);
        }
        if (type instanceof TypeRef.MapOf map) {
            return coerceMap(map, raw, path, pass);
        }
        if (type instanceof TypeRef.UnionOf union) {
            return coerceUnion(union, raw, path, pass);
        }
        if (type instanceof TypeRef.Media media) {
            return coerceMedia(media.kind(), raw, path, pass);
        }
        throw new IllegalStateException("Unhandled type " + type);
    }

    private JsonNode coerceOptional(TypeRef.OptionalOf optional, RawValue raw, String path, Pass pass) {
        if (raw instanceof RawToken token && token.isNull()) {
            return NODES.nullNode();
        }
        if (raw == null || isEmptyToken(raw)) {
            return pass.finalPass ? NODES.nullNode() : null;
        }
        Pass inner = pass.scoped();
        JsonNode value = coerce(optional.inner(), raw, path, inner);
        if (!pass.finalPass || inner.problems.isEmpty()) {
            return value == null && pass.finalPass ? NODES.nullNode() : value;
        }
        if (!inner.hasHardProblem() && (value == null || ValuePaths.leaves(value).isEmpty())) {
            return NODES.nullNode();
        }
        pass.problems.addAll(inner.problems);
        return value;
    }

    private JsonNode coercePrimitive(TypeRef.PrimitiveKind kind, RawValue raw, String path, Pass pass) {
        Optional<String> text = completeText(raw, path, pass, kind.typeName());
        if (text.isEmpty()) {
            return null;
        }
        String value = text.get();
        if (raw instanceof RawToken token && token.isNull()) {
            return fail(path, "null is not a " + kind.typeName(), pass);
        }
        return switch (kind) {
            case STRING -> NODES.textNode(value);
            case INT -> parseInteger(value)
                    .<JsonNode>map(n -> n == n.intValue() ? NODES.numberNode(n.intValue()) : NODES.numberNode(n))
                    .orElseGet(() -> fail(path, "not an int: '" + value + "'", pass));
            case FLOAT -> parseDecimal(value)
                    .<JsonNode>map(d -> NODES.numberNode(d.doubleValue()))
                    .orElseGet(() -> fail(path, "not a float: '" + value + "'", pass));
            case BOOL -> parseBoolean(value)
                    .<JsonNode>map(NODES::booleanNode)
                    .orElseGet(() -> fail(path, "not a bool: '" + value + "'", pass));
        };
    }

    private JsonNode coerceLiteral(TypeRef.Literal literal, RawValue raw, String path, Pass pass) {
        Optional<String> text = completeText(raw, path, pass, literal.toString());
        if (text.isEmpty()) {
            return null;
        }
        if (raw instanceof RawToken token && token.isNull()) {
            return fail(path, "null is not " + literal, pass);
        }
        JsonNode expected = literal.value();
        String value = text.get().strip();
        boolean matches;
        if (expected.isTextual()) {
            matches = text.get().equals(expected.textValue()) || value.equalsIgnoreCase(expected.textValue().strip());
        } else if (expected.isBoolean()) {
            matches = parseBoolean(value).filter(b -> b == expected.booleanValue()).isPresent();
        } else {
            matches = parseInteger(value).filter(n -> n == expected.longValue()).isPresent();
        }
        if (!matches) {
            return fail(path, "expected " + literal + ", got '" + value + "'", pass);
        }
        if (expected.isIntegralNumber() && expected.longValue() == expected.intValue()) {
            return NODES.numberNode(expected.intValue());
        }
        return expected;
    }

    private JsonNode coerceEnum(EnumDef def, RawValue raw, String path, Pass pass) {
        Optional<String> text = completeText(raw, path, pass, def.name());
        if (text.isEmpty()) {
            return null;
        }
        EnumMatcher.Match match = EnumMatcher.match(def, text.get());
        if (match.matched()) {
            return NODES.textNode(match.value());
        }
        if (match.ambiguous()) {
            pass.memory.fail(path, "ambiguous " + def.name() + " value '" + text.get() + "': " + match.candidates(), true);
            pass.unresolved(path, pass.memory.failure(path).orElseThrow().reason(), true);
            return null;
        }
        return fail(path, "no " + def.name() + " value matches '" + text.get() + "'", pass);
    }

    private JsonNode coerceClass(ClassDef def, RawValue raw, String path, Pass pass) {
        if (!(raw instanceof RawObject object)) {
            return wrongShape(raw, path, pass, "object " + def.name());
        }
        ObjectNode out = NODES.objectNode();
        for (PropertyDef property : def.properties()) {
            RawValue value = findEntry(object, property).map(Entry::value).orElse(null);
            JsonNode resolved = coerce(property.type(), value, ValuePaths.field(path, property.name()), pass);
            if (resolved != null) {
                out.set(property.name(), resolved);
            }
        }
        return out;
    }

    private JsonNode coerceMap(TypeRef.MapOf map, RawValue raw, String path, Pass pass) {
        if (!(raw instanceof RawObject object)) {
            return wrongShape(raw, path, pass, "map");
        }
        ObjectNode out = NODES.objectNode();
        Set<String> seen = new HashSet<>();
        for (Entry entry : object.entries()) {
            if (!seen.add(entry.key())) {
                continue;
            }
            JsonNode resolved = coerce(map.value(), entry.value(), ValuePaths.field(path, entry.key()), pass);
            if (resolved != null) {
                out.set(entry.key(), resolved);
            }
        }
        return out;
    }

    private JsonNode coerceList(TypeRef.ListOf list, RawValue raw, String path, Pass pass) {
        if (!(raw instanceof RawArray array)) {
            return wrongShape(raw, path, pass, "list");
        }
        ArrayNode out = NODES.arrayNode();
        List<RawValue> elements = array.elements();
        for (int i = 0; i < elements.size(); i++) {
            RawValue element = elements.get(i);
            boolean trailing = i == elements.size() - 1 && !array.closed() && !element.isComplete();
            if (trailing && !pass.finalPass) {
                break;
            }
            JsonNode resolved = coerce(list.element(), element, ValuePaths.index(path, i), pass);
            out.add(resolved != null ? resolved : NODES.nullNode());
        }
        return out;
    }

    private JsonNode coerceUnion(TypeRef.UnionOf union, RawValue raw, String path, Pass pass) {
        OptionalInt pinned = pass.memory.unionChoice(path);
        if (pinned.isPresent()) {
            return coerce(union.alternatives().get(pinned.getAsInt()), raw, path, pass);
        }

        Map<String, JsonNode> shown = pass.memory.unionLeaves(path);
        int bestIndex = -1;
        int bestLeaves = -1;
        int tied = 0;
        JsonNode bestValue = null;
        Pass bestTrial = null;
        int knownFailures = pass.memory.failureCount();
        for (int i = 0; i < union.alternatives().size(); i++) {
            Pass trial = pass.trial();
            JsonNode value = coerce(union.alternatives().get(i), raw, path, trial);
            if (trial.memory.failureCount() > knownFailures || !trial.problems.isEmpty()) {
                continue;
            }
            Map<String, JsonNode> leaves = value == null ? Map.of() : ValuePaths.leaves(value);
            if (!leaves.entrySet().containsAll(shown.entrySet())) {
                continue;
            }
            int score = value == null ? -1 : leaves.size();
            if (score > bestLeaves) {
                bestIndex = i;
                bestLeaves = score;
                bestValue = value;
                bestTrial = trial;
                tied = 1;
            } else if (score == bestLeaves) {
                tied++;
            }
        }

        if (bestTrial == null) {
            if (pass.finalPass || raw.isComplete()) {
                return fail(path, "no alternative of " + union + " matches", pass);
            }
            return null;
        }
        pass.memory.adopt(bestTrial.memory);
        if (bestLeaves > 0) {
            // Ties stay unpinned; whichever alternative wins later must keep these leaves.
            if (tied == 1) {
                pass.memory.pinUnion(path, bestIndex);
            } else {
                pass.memory.showUnionLeaves(path, ValuePaths.leaves(bestValue));
            }
        }
        return bestValue;
    }

    private JsonNode coerceMedia(MediaKind kind, RawValue raw, String path, Pass pass) {
        if (raw instanceof RawObject object) {
            if (!object.closed()) {
                pass.unresolved(path, "incomplete " + kind.typeName(), false);
                return null;
            }
            Optional<String> url = stringEntry(object, "url");
            if (url.isPresent() && !url.get().isBlank()) {
                return MediaValue.fromUrl(url.get(), kind).toJson();
            }
            Optional<String> base64 = stringEntry(object, "base64").or(() -> stringEntry(object, "data"));
            if (base64.isPresent() && !base64.get().isEmpty()) {
                String mediaType = stringEntry(object, "media_type")
                        .or(() -> stringEntry(object, "mediaType"))
                        .orElse(null);
                return MediaValue.fromBase64(base64.get(), mediaType, kind).toJson();
            }
            return fail(path, kind.typeName() + " needs 'url' or 'base64'", pass);
        }
        Optional<String> text = completeText(raw, path, pass, kind.typeName());
        if (text.isEmpty()) {
            return null;
        }
        String candidate = text.get().strip();
        String lower = candidate.toLowerCase(Locale.ROOT);
        if (URL_PREFIXES.stream().anyMatch(lower::startsWith)) {
            return MediaValue.fromUrl(candidate, kind).toJson();
        }
        return fail(path, "not a " + kind.typeName() + " reference: '" + candidate + "'", pass);
    }

    /** The text of a complete scalar; records a local failure for complete containers. */
    private Optional<String> completeText(RawValue raw, String path, Pass pass, String expected) {
        if (raw instanceof RawString string) {
            if (string.closed()) {
                return Optional.of(string.text());
            }
        } else if (raw instanceof RawToken token) {
            if (token.complete()) {
                return Optional.of(token.text());
            }
        } else {
            fail(path, "expected " + expected + ", got " + shapeName(raw), pass);
            return Optional.empty();
        }
        pass.unresolved(path, "incomplete " + expected, false);
        return Optional.empty();
    }

    /** A container arrived where another shape was expected. Scalars fail only once complete. */
    private JsonNode wrongShape(RawValue raw, String path, Pass pass, String expected) {
        if (raw instanceof RawObject || raw instanceof RawArray || raw.isComplete()) {
            return fail(path, "expected " + expected + ", got " + shapeName(raw), pass);
        }
        pass.unresolved(path, "incomplete " + expected, false);
        return null;
    }

    private static JsonNode fail(String path, String reason, Pass pass) {
        pass.memory.fail(path, reason, false);
        pass.unresolved(path, reason, false);
        return null;
    }

    /** First entry in payload order whose key matches the alias or name, exactly or ignoring case. */
    private static Optional<Entry> findEntry(RawObject object, PropertyDef property) {
        String name = property.name();
        String alias = property.metadata().alias();
        for (Entry entry : object.entries()) {
            String key = entry.key();
            if (key.equals(name) || key.equals(alias) || key.equalsIgnoreCase(name) || key.equalsIgnoreCase(alias)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    private static Optional<String> stringEntry(RawObject object, String key) {
        for (Entry entry : object.entries()) {
            if (entry.key().equalsIgnoreCase(key)) {
                if (entry.value() instanceof RawString string && string.closed()) {
                    return Optional.of(string.text());
                }
                if (entry.value() instanceof RawToken token && token.complete() && !token.isNull()) {
                    return Optional.of(token.text());
                }
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static boolean isEmptyToken(RawValue raw) {
        return raw instanceof RawToken token && token.text().isEmpty();
    }

    private static String shapeName(RawValue raw) {
        if (raw instanceof RawObject) {
            return "object";
        }
        if (raw instanceof RawArray) {
            return "list";
        }
        return "'" + (raw instanceof RawString string ? string.text() : ((RawToken) raw).text()) + "'";
    }

    static Optional<Long> parseInteger(String text) {
        return parseDecimal(text).flatMap(decimal -> {
            try {
                return Optional.of(decimal.longValueExact());
            } catch (ArithmeticException e) {
                return Optional.empty();
            }
        });
    }

    static Optional<BigDecimal> parseDecimal(String text) {
        String candidate = text.strip();
        if (GROUPED_NUMBER.matcher(candidate).matches()) {
            candidate = candidate.replace(",", "");
        }
        if (candidate.startsWith("+")) {
            candidate = candidate.substring(1);
        }
        if (candidate.isEmpty() || !Character.isDigit(candidate.charAt(candidate.length() - 1))) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(candidate));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    static Optional<Boolean> parseBoolean(String text) {
        String candidate = text.strip();
        if (candidate.equalsIgnoreCase("true")) {
            return Optional.of(Boolean.TRUE);
        }
        if (candidate.equalsIgnoreCase("false")) {
            return Optional.of(Boolean.FALSE);
        }
        return Optional.empty();
    }
}
