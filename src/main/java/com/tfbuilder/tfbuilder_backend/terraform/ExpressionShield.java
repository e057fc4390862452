package com.tfbuilder.tfbuilder_backend.terraform;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Second encoding pass, run on interpolation-encoded text before it reaches
 * the HCL parser, so the parser only builds structure and never evaluates.
 * <ul>
 *   <li>Bare expressions and heredocs become quoted placeholder tokens; their
 *   values are kept aside in {@link Shielded#values()}.</li>
 *   <li>Quoted strings carrying interpolation markers, escapes or template
 *   directives become placeholders as well.</li>
 *   <li>Nested blocks become object attributes whose key carries a unique
 *   {@link #BLOCK_TOKEN} suffix, so repeated blocks stay distinct.</li>
 *   <li>Comments are dropped.</li>
 * </ul>
 * Top-level blocks, plain strings, lists and objects are left to the parser.
 */
public final class ExpressionShield {

    public static final String VALUE_TOKEN = InterpolationCodec.PREFIX + "V";
    public static final String BLOCK_TOKEN = InterpolationCodec.PREFIX + "B";
    private static final String TOKEN_END = "____";

    private static final List<String> TRAILING_OPERATORS =
            List.of("||", "&&", "==", "!=", "<=", ">=", "=>", "+", "-", "*", "/", "%", "<", ">", "?", ":", "!");
    private static final List<String> LEADING_OPERATORS =
            List.of("||", "&&", "==", "!=", "<=", ">=", "?", ":", "+", "*", "%", ".");

    private enum Context { ATTRIBUTE, COLLECTION }

    private final String src;
    private final StringBuilder out = new StringBuilder();
    private final List<Object> values = new ArrayList<>();
    private final List<String> addresses = new ArrayList<>();
    private int blockCounter;
    private int pos;

    private ExpressionShield(String src) {
        this.src = src;
    }

    /**
     * Shields an interpolation-encoded document.
     *
     * @throws TerraformSyntaxException when the document is malformed
     */
    public static Shielded shield(String encodedText) {
        ExpressionShield shield = new ExpressionShield(encodedText != null ? encodedText : "");
        shield.shieldBody(0);
        return new Shielded(shield.out.toString(), shield.values, shield.addresses);
    }

    /** Block name when {@code key} is a renamed nested block, otherwise null. */
    public static String blockName(String key) {
        int at = key.indexOf(BLOCK_TOKEN);
        return at > 0 ? key.substring(0, at) : null;
    }

    // ── Bodies ───────────────────────────────────────────────────────────────

    // depth 0 is the document, 1 a top-level block body, deeper levels are nested blocks
    private void shieldBody(int depth) {
        while (true) {
            skipSpace(true);
            if (eof()) {
                if (depth > 0) throw error("Unclosed block, expected '}'");
                return;
            }
            if (peek() == '}') {
                if (depth == 0) throw error("Unexpected '}'");
                pos++;
                out.append("}\n");
                return;
            }
            int itemStart = pos;
            String name = readIdentifier();
            if (name == null) throw error("Expected attribute or block");
            skipSpace(false);
            if (!eof() && peek() == '=' && peekAt(1) != '=') {
                pos++;
                out.append(name).append(" = ");
                shieldValue(Context.ATTRIBUTE);
                out.append('\n');
                expectItemEnd();
                continue;
            }
            List<String> labels = readLabels(name, itemStart);
            pos++; // {
            if (depth == 0) {
                openTopLevelBlock(name, labels);
                shieldBody(1);
            } else {
                out.append(name).append(BLOCK_TOKEN).append(blockCounter++).append(TOKEN_END).append(" = {\n");
                labels.forEach(label -> out.append('"').append(TerraformExpressions.escape(label)).append("\" = {\n"));
                shieldBody(depth + 1);
                labels.forEach(label -> out.append("}\n"));
            }
        }
    }

    private List<String> readLabels(String type, int blockStart) {
        List<String> labels = new ArrayList<>();
        while (!eof() && peek() != '{') {
            if (peek() == '"') {
                labels.add(readQuoted());
            } else {
                String label = readIdentifier();
                if (label == null) {
                    pos = blockStart;
                    throw error("Expected '=' or block body after '" + type + "'");
                }
                labels.add(label);
            }
            skipSpace(false);
        }
        if (eof()) throw error("Expected '{' to open block '" + type + "'");
        return labels;
    }

    private void openTopLevelBlock(String type, List<String> labels) {
        out.append(type);
        labels.forEach(label -> out.append(" \"").append(TerraformExpressions.escape(label)).append('"'));
        out.append(" {\n");
        if ("resource".equals(type) && labels.size() >= 2) {
            addresses.add(labels.get(0) + "." + labels.get(1));
        } else if (TerraformResource.MODULE_TYPE.equals(type) && !labels.isEmpty()) {
            addresses.add(TerraformResource.MODULE_TYPE + "." + labels.get(0));
        }
    }

    private void expectItemEnd() {
        skipSpace(false);
        if (eof()) return;
        char c = peek();
        if (c == '\n' || c == '}') return;
        throw error("Unexpected '" + c + "' after attribute value");
    }

    // ── Values ───────────────────────────────────────────────────────────────

    private void shieldValue(Context context) {
        skipSpace(false);
        if (eof()) throw error("Expected value");
        int start = pos;
        char c = peek();
        if (c == '"') {
            String literal = readQuoted();
            if (atValueEnd()) {
                emitString(src.substring(start, pos), literal);
                return;
            }
            pos = start;
        } else if (c == '<' && peekAt(1) == '<') {
            emitValue(readHeredoc());
            return;
        } else if ((c == '[' || c == '{') && !startsForExpression()) {
            int outMark = out.length();
            int valueMark = values.size();
            if (c == '[') shieldList();
            else shieldObject();
            if (atValueEnd()) return;
            // a collection followed by more expression, e.g. an index
            out.setLength(outMark);
            values.subList(valueMark, values.size()).clear();
            pos = start;
        }
        emitValue(new BareExpression(readBare(context)));
    }

    private void emitString(String source, String literal) {
        if (source.indexOf('\\') >= 0 || source.contains(InterpolationCodec.START)
                || source.contains("$${") || source.contains("%{")) {
            emitValue(literal);
        } else {
            out.append(source);
        }
    }

    private void emitValue(Object value) {
        out.append('"').append(VALUE_TOKEN).append(values.size()).append(TOKEN_END).append('"');
        values.add(value);
    }

    private boolean atValueEnd() {
        int save = pos;
        skipSpace(false);
        boolean end = eof() || "\n,]})".indexOf(peek()) >= 0;
        pos = save;
        return end;
    }

    private boolean startsForExpression() {
        int i = pos + 1;
        while (i < src.length() && Character.isWhitespace(src.charAt(i))) i++;
        return src.startsWith("for", i) && i + 3 < src.length() && Character.isWhitespace(src.charAt(i + 3));
    }

    private void shieldList() {
        pos++; // [
        out.append('[');
        boolean first = true;
        while (true) {
            skipSpace(true);
            if (eof()) throw error("Unclosed list, expected ']'");
            if (peek() == ']') {
                pos++;
                out.append(']');
                return;
            }
            if (!first) out.append(", ");
            first = false;
            shieldValue(Context.COLLECTION);
            skipSpace(true);
            if (eof()) throw error("Unclosed list, expected ']'");
            if (peek() == ',') {
                pos++;
            } else if (peek() != ']') {
                throw error("Expected ',' or ']' in list");
            }
        }
    }

    private void shieldObject() {
        pos++; // {
        out.append("{\n");
        while (true) {
            skipSpace(true);
            if (eof()) throw error("Unclosed object, expected '}'");
            if (peek() == '}') {
                pos++;
                out.append('}');
                return;
            }
            String key = peek() == '"' ? readQuoted() : readObjectKey();
            skipSpace(false);
            if (eof() || (peek() != '=' && peek() != ':') || peekAt(1) == '=') {
                throw error("Expected '=' or ':' after object key '" + key + "'");
            }
            pos++;
            out.append('"').append(TerraformExpressions.escape(key)).append("\" = ");
            shieldValue(Context.COLLECTION);
            out.append('\n');
            skipSpace(true);
            if (eof()) throw error("Unclosed object, expected '}'");
            if (peek() == ',') {
                pos++;
            } else if (peek() != '}' && !isIdentifierStart(peek()) && peek() != '"') {
                throw error("Expected ',' or '}' in object");
            }
        }
    }

    private String readObjectKey() {
        int start = pos;
        while (!eof() && !Character.isWhitespace(peek()) && peek() != '=' && peek() != ':') {
            pos++;
        }
        if (start == pos) throw error("Expected object key");
        return src.substring(start, pos);
    }

    /**
     * Reads an unquoted expression up to the end of the line or the enclosing
     * delimiter. A line ending in an operator, or followed by a line starting
     * with one, continues the expression; such line breaks become one space.
     */
    private String readBare(Context context) {
        StringBuilder text = new StringBuilder();
        int segmentStart = pos;
        int depth = 0;
        while (!eof()) {
            if (src.startsWith(InterpolationCodec.START, pos)) {
                skipMarker();
                continue;
            }
            char c = peek();
            if (c == '"') {
                readQuoted();
                continue;
            }
            if (c == '#' || (c == '/' && (peekAt(1) == '/' || peekAt(1) == '*'))) {
                if (depth == 0) break;
                skipComment();
                continue;
            }
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                if (depth == 0) break;
                depth--;
            } else if (c == '\n' && depth == 0) {
                String line = text + src.substring(segmentStart, pos);
                if (!continuesOnNextLine(line)) break;
                text.append(src.substring(segmentStart, pos).stripTrailing()).append(' ');
                while (!eof() && Character.isWhitespace(peek())) pos++;
                segmentStart = pos;
                continue;
            } else if (c == ',' && depth == 0 && context == Context.COLLECTION) {
                break;
            }
            pos++;
        }
        if (depth > 0) throw error("Unbalanced brackets in expression");
        text.append(src, segmentStart, pos);
        String expression = text.toString().trim();
        if (expression.isEmpty()) throw error("Expected value");
        return expression;
    }

    private boolean continuesOnNextLine(String sofar) {
        String trimmed = sofar.strip();
        if (trimmed.isEmpty()) return false;
        if (!trimmed.endsWith(".*")) {
            for (String op : TRAILING_OPERATORS) {
                if (trimmed.endsWith(op)) return true;
            }
        }
        int next = pos;
        while (next < src.length() && Character.isWhitespace(src.charAt(next))) next++;
        for (String op : LEADING_OPERATORS) {
            if (src.startsWith(op, next)) return true;
        }
        return false;
    }

    private String readHeredoc() {
        pos += 2; // <<
        boolean indented = !eof() && peek() == '-';
        if (indented) pos++;
        String marker = readIdentifier();
        if (marker == null) throw error("Expected heredoc delimiter");
        skipSpace(false);
        if (eof()) throw error("Unterminated heredoc, expected '" + marker + "'");
        if (peek() != '\n') throw error("Unexpected content after heredoc delimiter");
        pos++;
        List<String> lines = new ArrayList<>();
        while (true) {
            if (eof()) throw error("Unterminated heredoc, expected '" + marker + "'");
            int lineEnd = src.indexOf('\n', pos);
            if (lineEnd < 0) lineEnd = src.length();
            String line = src.substring(pos, lineEnd);
            String stripped = line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
            if (stripped.trim().equals(marker)) {
                pos += line.length();
                break;
            }
            lines.add(stripped);
            pos = Math.min(src.length(), lineEnd + 1);
        }
        if (indented) lines = stripCommonIndent(lines);
        StringBuilder body = new StringBuilder();
        lines.forEach(l -> body.append(l).append('\n'));
        return body.toString();
    }

    private static List<String> stripCommonIndent(List<String> lines) {
        int indent = Integer.MAX_VALUE;
        for (String line : lines) {
            if (line.isBlank()) continue;
            int n = 0;
            while (n < line.length() && (line.charAt(n) == ' ' || line.charAt(n) == '\t')) n++;
            indent = Math.min(indent, n);
        }
        if (indent == Integer.MAX_VALUE || indent == 0) return lines;
        List<String> result = new ArrayList<>(lines.size());
        for (String line : lines) {
            result.add(line.length() >= indent ? line.substring(indent) : line.stripLeading());
        }
        return result;
    }

    // ── Lexical helpers ──────────────────────────────────────────────────────

    /** Reads a double-quoted string and processes escapes; marker spans are copied verbatim. */
    private String readQuoted() {
        pos++; // opening quote
        StringBuilder literal = new StringBuilder();
        while (true) {
            if (eof() || peek() == '\n') throw error("Unterminated string");
            if (src.startsWith(InterpolationCodec.START, pos)) {
                int markerStart = pos;
                skipMarker();
                literal.append(src, markerStart, pos);
                continue;
            }
            char c = peek();
            if (c == '"') {
                pos++;
                return literal.toString();
            }
            if (c == '\\' && pos + 1 < src.length()) {
                char next = src.charAt(pos + 1);
                switch (next) {
                    case '"' -> literal.append('"');
                    case '\\' -> literal.append('\\');
                    case 'n' -> literal.append('\n');
                    case 't' -> literal.append('\t');
                    case 'r' -> literal.append('\r');
                    default -> literal.append('\\').append(next);
                }
                pos += 2;
                continue;
            }
            literal.append(c);
            pos++;
        }
    }

    private void skipMarker() {
        int end = InterpolationCodec.findMatchingEnd(src, pos + InterpolationCodec.START.length());
        if (end < 0) throw error("Unterminated interpolation");
        pos = end + InterpolationCodec.END.length();
    }

    private String readIdentifier() {
        if (eof() || !isIdentifierStart(peek())) return null;
        int start = pos;
        pos++;
        while (!eof() && isIdentifierPart(peek())) pos++;
        return src.substring(start, pos);
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }

    /** Skips blanks and comments; newlines too when {@code newlines} is set. */
    private void skipSpace(boolean newlines) {
        while (!eof()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || (newlines && c == '\n')) {
                pos++;
            } else if (c == '#' || (c == '/' && (peekAt(1) == '/' || peekAt(1) == '*'))) {
                skipComment();
            } else {
                break;
            }
        }
    }

    // Line comments stop before the newline.
    private void skipComment() {
        if (peek() == '/' && peekAt(1) == '*') {
            int end = src.indexOf("*/", pos + 2);
            if (end < 0) throw error("Unterminated block comment");
            pos = end + 2;
            return;
        }
        while (!eof() && peek() != '\n') pos++;
    }

    private boolean eof() {
        return pos >= src.length();
    }

    private char peek() {
        return src.charAt(pos);
    }

    private char peekAt(int offset) {
        int i = pos + offset;
        return i < src.length() ? src.charAt(i) : '\0';
    }

    private TerraformSyntaxException error(String message) {
        int line = 1;
        int column = 1;
        for (int i = 0; i < Math.min(pos, src.length()); i++) {
            if (src.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return new TerraformSyntaxException(message, line, column);
    }

    /**
     * A shielded document: the text for the HCL parser, the values its
     * placeholder tokens stand for, and resource/module addresses in document
     * order (repeated when a block is declared twice).
     */
    public record Shielded(String text, List<Object> values, List<String> addresses) {

        public Shielded {
            values = List.copyOf(values);
            addresses = List.copyOf(addresses);
        }

        /**
         * Replaces placeholder tokens in a parsed value with what they stand
         * for: a literal {@code String} or a {@link BareExpression}. Lists and
         * maps are resolved element by element.
         */
        public Object resolve(Object parsed) {
            if (parsed == null) return null;
            if (parsed instanceof String s) return valueOf(s);
            if (parsed instanceof List<?> list) {
                List<Object> resolved = new ArrayList<>(list.size());
                list.forEach(item -> resolved.add(resolve(item)));
                return resolved;
            }
            if (parsed instanceof Map<?, ?> map) {
                Map<String, Object> resolved = new LinkedHashMap<>();
                map.forEach((key, value) -> resolved.put(String.valueOf(key), resolve(value)));
                return resolved;
            }
            return new BareExpression(String.valueOf(parsed));
        }

        private Object valueOf(String text) {
            if (!text.startsWith(VALUE_TOKEN) || !text.endsWith(TOKEN_END)) return text;
            String index = text.substring(VALUE_TOKEN.length(), text.length() - TOKEN_END.length());
            if (index.isEmpty() || !index.chars().allMatch(Character::isDigit)) return text;
            int i = Integer.parseInt(index);
            return i < values.size() ? values.get(i) : text;
        }
    }
}
