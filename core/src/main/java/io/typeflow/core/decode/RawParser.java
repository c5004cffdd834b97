package io.typeflow.core.decode;

import io.typeflow.core.decode.RawValue.Entry;
import io.typeflow.core.decode.RawValue.RawArray;
import io.typeflow.core.decode.RawValue.RawObject;
import io.typeflow.core.decode.RawValue.RawString;
import io.typeflow.core.decode.RawValue.RawToken;
import java.util.ArrayList;
import java.util.List;

/**
 * Lenient, prefix-stable parser for JSON-like payloads. Tolerates leading prose, markdown code
 * fences, single-quoted strings, unquoted keys and values, missing or trailing commas and
 * comments. Parsing a longer payload never changes a node that was already complete in a shorter
 * prefix of it.
 *
 * <p>Not thread-safe; one instance parses one payload.
 */
final class RawParser {

    /** Where the value of interest starts in the payload. */
    enum Start {
        /** First {@code {}. */
        OBJECT,
        /** First {@code [}. */
        ARRAY,
        /** First {@code {} or {@code [}, falling back to {@link #SCALAR}. */
        ANY,
        /** The whole payload is one scalar. */
        SCALAR
    }

    private static final String FENCE = "```";

    private final String text;
    private final int end;
    private final boolean endOfInput;
    private final int maxDepth;
    private int pos;
    private boolean depthExceeded;

    private RawParser(String text, int start, int end, boolean endOfInput, int maxDepth) {
        this.text = text;
        this.pos = start;
        this.end = end;
        this.endOfInput = endOfInput;
        this.maxDepth = maxDepth;
    }

    /** Parse outcome. {@code value} is {@code null} when nothing relevant has arrived yet. */
    record Result(RawValue value, boolean depthExceeded) {}

    static Result parse(String payload, boolean endOfInput, Start start, int maxDepth) {
        int contentStart = 0;
        int contentEnd = payload.length();

        int fence = payload.indexOf(FENCE);
        int brace = firstStructural(payload, 0, payload.length(), start);
        if (fence >= 0 && (brace < 0 || fence < brace)) {
            int lineEnd = payload.indexOf('\n', fence + FENCE.length());
            if (lineEnd < 0) {
                // Fence header still arriving
                return new Result(null, false);
            }
            contentStart = lineEnd + 1;
            int closing = payload.indexOf(FENCE, contentStart);
            if (closing >= 0) {
                contentEnd = closing;
            }
        }
        boolean contentEnds = endOfInput || contentEnd < payload.length();

        if (start == Start.SCALAR) {
            return parseScalar(payload, contentStart, contentEnd, contentEnds, maxDepth);
        }
        int first = firstStructural(payload, contentStart, contentEnd, start);
        if (first < 0) {
            if (start == Start.ANY) {
                return parseScalar(payload, contentStart, contentEnd, contentEnds, maxDepth);
            }
            return new Result(null, false);
        }
        RawParser parser = new RawParser(payload, first, contentEnd, contentEnds, maxDepth);
        RawValue value = parser.parseValue(0);
        return new Result(value, parser.depthExceeded);
    }

    private static Result parseScalar(String payload, int start, int end, boolean endOfInput, int maxDepth) {
        int first = start;
        while (first < end && Character.isWhitespace(payload.charAt(first))) {
            first++;
        }
        if (first >= end) {
            return new Result(null, false);
        }
        char c = payload.charAt(first);
        if (c == '"' || c == '\'' || c == '{' || c == '[') {
            RawParser parser = new RawParser(payload, first, end, endOfInput, maxDepth);
            RawValue value = parser.parseValue(0);
            return new Result(value, parser.depthExceeded);
        }
        return new Result(new RawToken(payload.substring(first, end).strip(), endOfInput), false);
    }

    private static int firstStructural(String payload, int from, int to, Start start) {
        for (int i = from; i < to; i++) {
            char c = payload.charAt(i);
            if ((c == '{' && start != Start.ARRAY) || (c == '[' && start != Start.OBJECT)) {
                return i;
            }
        }
        return -1;
    }

    private RawValue parseValue(int depth) {
        skipTrivia();
        if (pos >= end) {
            return null;
        }
        char c = text.charAt(pos);
        if ((c == '{' || c == '[') && depth >= maxDepth) {
            depthExceeded = true;
            pos = end;
            return null;
        }
        return switch (c) {
            case '{' -> parseObject(depth + 1);
            case '[' -> parseArray(depth + 1);
            case '"', '\'' -> parseString(c);
            default -> parseToken();
        };
    }

    private RawObject parseObject(int depth) {
        pos++;
        List<Entry> entries = new ArrayList<>();
        while (true) {
            skipTrivia();
            if (pos >= end) {
                return new RawObject(entries, false);
            }
            char c = text.charAt(pos);
            if (c == '}' || c == ']') {
                pos++;
                return new RawObject(entries, true);
            }
            if (c == ',') {
                pos++;
                continue;
            }

            String key;
            if (c == '"' || c == '\'') {
                RawString quoted = parseString(c);
                if (!quoted.closed()) {
                    return new RawObject(entries, false);
                }
                key = quoted.text();
            } else {
                int keyStart = pos;
                while (pos < end && !isKeyTerminator(text.charAt(pos))) {
                    pos++;
                }
                if (pos >= end) {
                    return new RawObject(entries, false);
                }
                if (keyStart == pos) {
                    // Stray character such as '{' in key position
                    pos++;
                    continue;
                }
                key = text.substring(keyStart, pos);
            }

            skipTrivia();
            if (pos >= end) {
                return new RawObject(entries, false);
            }
            if (text.charAt(pos) != ':') {
                // Key without a colon: drop it
                continue;
            }
            pos++;
            skipTrivia();
            if (pos >= end) {
                entries.add(new Entry(key, null));
                return new RawObject(entries, false);
            }
            RawValue value = parseValue(depth);
            entries.add(new Entry(key, value));
            if (pos >= end && (value == null || !value.isComplete())) {
                return new RawObject(entries, false);
            }
        }
    }

    private RawArray parseArray(int depth) {
        pos++;
        List<RawValue> elements = new ArrayList<>();
        while (true) {
            skipTrivia();
            if (pos >= end) {
                return new RawArray(elements, false);
            }
            char c = text.charAt(pos);
            if (c == ']' || c == '}') {
                pos++;
                return new RawArray(elements, true);
            }
            if (c == ',') {
                pos++;
                continue;
            }
            int before = pos;
            RawValue value = parseValue(depth);
            if (value == null) {
                return new RawArray(elements, false);
            }
            elements.add(value);
            if (pos == before) {
                pos++;
            }
            if (pos >= end && !value.isComplete()) {
                return new RawArray(elements, false);
            }
        }
    }

    private RawString parseString(char quote) {
        pos++;
        StringBuilder out = new StringBuilder();
        while (pos < end) {
            char c = text.charAt(pos);
            if (c == quote) {
                pos++;
                return new RawString(out.toString(), true);
            }
            if (c != '\\') {
                out.append(c);
                pos++;
                continue;
            }
            if (pos + 1 >= end) {
                break;
            }
            char escaped = text.charAt(pos + 1);
            switch (escaped) {
                case 'n' -> out.append('\n');
                case 't' -> out.append('\t');
                case 'r' -> out.append('\r');
                case 'b' -> out.append('\b');
                case 'f' -> out.append('\f');
                case 'u' -> {
                    if (pos + 6 > end) {
                        pos = end;
                        return new RawString(out.toString(), false);
                    }
                    String hex = text.substring(pos + 2, pos + 6);
                    try {
                        out.append((char) Integer.parseInt(hex, 16));
                    } catch (NumberFormatException e) {
                        out.append("\\u").append(hex);
                    }
                    pos += 4;
                }
                default -> out.append(escaped);
            }
            pos += 2;
        }
        pos = end;
        return new RawString(out.toString(), false);
    }

    private RawToken parseToken() {
        int start = pos;
        while (pos < end && !isValueTerminator(text.charAt(pos)) && !atTrailingComment(start)) {
            pos++;
        }
        boolean complete = pos < end || endOfInput;
        return new RawToken(text.substring(start, pos).strip(), complete);
    }

    private void skipTrivia() {
        while (pos < end) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '/' && pos + 1 < end && text.charAt(pos + 1) == '/') {
                int newline = text.indexOf('\n', pos);
                pos = newline < 0 || newline > end ? end : newline + 1;
            } else if (c == '/' && pos + 1 < end && text.charAt(pos + 1) == '*') {
                int close = text.indexOf("*/", pos + 2);
                pos = close < 0 || close + 2 > end ? end : close + 2;
            } else {
                return;
            }
        }
    }

    /** {@code //} after whitespace ends a bare token; {@code http://x} stays one token. */
    private boolean atTrailingComment(int tokenStart) {
        return text.charAt(pos) == '/'
                && pos + 1 < end
                && text.charAt(pos + 1) == '/'
                && pos > tokenStart
                && Character.isWhitespace(text.charAt(pos - 1));
    }

    private static boolean isKeyTerminator(char c) {
        return c == ':' || c == ',' || c == '}' || c == ']' || c == '{' || c == '[' || Character.isWhitespace(c);
    }

    private static boolean isValueTerminator(char c) {
        return c == ',' || c == '}' || c == ']' || c == '\n';
    }
}
