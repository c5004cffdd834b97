package io.typeflow.core.schema;

import io.typeflow.core.error.TypeSyntaxException;
import io.typeflow.core.model.MediaKind;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for type expressions.
 *
 * <pre>
 * union   := postfix ('|' postfix)*
 * postfix := primary ('[]' | '?')*
 * primary := '(' union ')' | 'map' '&lt;' 'string' ',' union '&gt;' | literal | identifier
 * literal := '"' chars '"' | '-'? digits | 'true' | 'false'
 * </pre>
 *
 * <p>Inside a string literal, {@code \} escapes the next character.
 */
final class TypeExpressionParser {

    private final String expression;
    private int pos;

    TypeExpressionParser(String expression) {
        if (expression == null) {
            throw new NullPointerException("expression must not be null");
        }
        this.expression = expression;
    }

    TypeRef parse() {
        TypeRef result = parseUnion();
        skipWhitespace();
        if (pos < expression.length()) {
            throw error("Unexpected '" + expression.charAt(pos) + "'");
        }
        return result;
    }

    private TypeRef parseUnion() {
        List<TypeRef> alternatives = new ArrayList<>();
        alternatives.add(parsePostfix());
        while (consume('|')) {
            alternatives.add(parsePostfix());
        }
        return alternatives.size() == 1 ? alternatives.get(0) : new TypeRef.UnionOf(alternatives);
    }

    private TypeRef parsePostfix() {
        TypeRef type = parsePrimary();
        while (true) {
            if (consume('?')) {
                type = type.optional();
            } else if (consume('[')) {
                expect(']');
                type = new TypeRef.ListOf(type);
            } else {
                return type;
            }
        }
    }

    private TypeRef parsePrimary() {
        if (consume('(')) {
            TypeRef inner = parseUnion();
            expect(')');
            return inner;
        }
        skipWhitespace();
        if (pos < expression.length() && expression.charAt(pos) == '"') {
            return stringLiteral();
        }
        if (pos < expression.length() && (expression.charAt(pos) == '-' || Character.isDigit(expression.charAt(pos)))) {
            return integerLiteral();
        }
        int start = pos;
        String identifier = identifier();
        if (identifier.equals("map") && consume('<')) {
            String keyType = identifier();
            if (!keyType.equals("string")) {
                pos = start;
                throw error("Map keys must be 'string', got '" + keyType + "'");
            }
            expect(',');
            TypeRef value = parseUnion();
            expect('>');
            return new TypeRef.MapOf(value);
        }
        return switch (identifier) {
            case "string" -> TypeRef.string();
            case "int" -> TypeRef.integer();
            case "float" -> TypeRef.floating();
            case "bool" -> TypeRef.bool();
            case "true" -> TypeRef.literal(true);
            case "false" -> TypeRef.literal(false);
            default -> MediaKind.fromTypeName(identifier)
                    .filter(kind -> kind.typeName().equals(identifier))
                    .<TypeRef>map(TypeRef.Media::new)
                    .orElseGet(() -> new TypeRef.Named(identifier));
        };
    }

    private TypeRef stringLiteral() {
        int start = pos++;
        StringBuilder value = new StringBuilder();
        while (pos < expression.length() && expression.charAt(pos) != '"') {
            if (expression.charAt(pos) == '\\' && pos + 1 < expression.length()) {
                pos++;
            }
            value.append(expression.charAt(pos++));
        }
        if (pos >= expression.length()) {
            pos = start;
            throw error("Unterminated string literal");
        }
        pos++;
        return TypeRef.literal(value.toString());
    }

    private TypeRef integerLiteral() {
        int start = pos;
        if (expression.charAt(pos) == '-') {
            pos++;
        }
        while (pos < expression.length() && Character.isDigit(expression.charAt(pos))) {
            pos++;
        }
        try {
            return TypeRef.literal(Long.parseLong(expression.substring(start, pos)));
        } catch (NumberFormatException e) {
            pos = start;
            throw error("Not an integer literal");
        }
    }

    private String identifier() {
        skipWhitespace();
        int start = pos;
        while (pos < expression.length()) {
            char c = expression.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_') {
                pos++;
            } else {
                break;
            }
        }
        if (start == pos) {
            throw error(pos < expression.length() ? "Expected a type name" : "Unexpected end of expression");
        }
        if (Character.isDigit(expression.charAt(start))) {
            pos = start;
            throw error("Type names must not start with a digit");
        }
        return expression.substring(start, pos);
    }

    private boolean consume(char c) {
        skipWhitespace();
        if (pos < expression.length() && expression.charAt(pos) == c) {
            pos++;
            return true;
        }
        return false;
    }

    private void expect(char c) {
        if (!consume(c)) {
            throw error("Expected '" + c + "'");
        }
    }

    private void skipWhitespace() {
        while (pos < expression.length() && Character.isWhitespace(expression.charAt(pos))) {
            pos++;
        }
    }

    private TypeSyntaxException error(String message) {
        return new TypeSyntaxException(message, expression, pos);
    }
}
