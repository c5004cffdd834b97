package io.typeflow.core.error;

/** Thrown when a textual type expression such as {@code map<string, Item[]>?} cannot be parsed. */
public final class TypeSyntaxException extends SchemaException {

    private static final long serialVersionUID = 1L;

    private final String expression;
    private final int position;

    public TypeSyntaxException(String message, String expression, int position) {
        super(message + " at position " + position + " in '" + expression + "'", null);
        this.expression = expression;
        this.position = position;
    }

    public String expression() {
        return expression;
    }

    public int position() {
        return position;
    }
}
