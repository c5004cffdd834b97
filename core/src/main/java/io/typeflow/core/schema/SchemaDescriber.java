package io.typeflow.core.schema;

import java.util.List;

/**
 * Deterministic textual rendering of schema definitions, consumed by prompting and documentation
 * collaborators. Classes come first, then enums, each in insertion order:
 *
 * <pre>
 * /// A registered user
 * class User {
 *   /// The user's full name
 *   name string @alias("username")
 *   age int?
 * }
 *
 * enum Status {
 *   ACTIVE @alias("active")
 *   INACTIVE
 * }
 * </pre>
 *
 * <p>Aliases are quoted, so a {@code "} or {@code \} inside an alias is preceded by a backslash:
 * alias {@code say "hi"} renders as {@code @alias("say \"hi\"")}. Descriptions are written
 * verbatim, one {@code ///} line per source line.
 */
final class SchemaDescriber {

    private static final String INDENT = "  ";

    private SchemaDescriber() {}

    static String describe(List<ClassDef> classes, List<EnumDef> enums) {
        StringBuilder out = new StringBuilder();
        for (ClassDef classDef : classes) {
            separate(out);
            appendDescription(out, "", classDef.metadata());
            out.append("class ").append(classDef.name());
            appendAlias(out, classDef.metadata());
            out.append(" {\n");
            for (PropertyDef property : classDef.properties()) {
                appendDescription(out, INDENT, property.metadata());
                out.append(INDENT)
                        .append(property.name())
                        .append(' ')
                        .append(property.type() != null ? property.type().toString() : "<unset>");
                appendAlias(out, property.metadata());
                out.append('\n');
            }
            out.append("}\n");
        }
        for (EnumDef enumDef : enums) {
            separate(out);
            appendDescription(out, "", enumDef.metadata());
            out.append("enum ").append(enumDef.name());
            appendAlias(out, enumDef.metadata());
            out.append(" {\n");
            for (EnumValueDef value : enumDef.values()) {
                appendDescription(out, INDENT, value.metadata());
                out.append(INDENT).append(value.name());
                appendAlias(out, value.metadata());
                out.append('\n');
            }
            out.append("}\n");
        }
        return out.toString();
    }

    private static void separate(StringBuilder out) {
        if (out.length() > 0) {
            out.append('\n');
        }
    }

    private static void appendDescription(StringBuilder out, String indent, Metadata metadata) {
        if (metadata.description() == null) {
            return;
        }
        for (String line : metadata.description().split("\\R", -1)) {
            out.append(indent).append("///");
            if (!line.isEmpty()) {
                out.append(' ').append(line);
            }
            out.append('\n');
        }
    }

    private static void appendAlias(StringBuilder out, Metadata metadata) {
        if (metadata.alias() != null) {
            out.append(" @alias(\"").append(escape(metadata.alias())).append("\")");
        }
    }

    private static String escape(String alias) {
        return alias.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
