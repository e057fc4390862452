package com.tfbuilder.tfbuilder_backend.terraform;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shape predicates and top-level text utilities shared by the parser, the
 * reference analyzer and the code generator.
 */
public final class TerraformExpressions {

    public static final String RESOURCE_PREFIX = "aws_";

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?([eE][+-]?\\d+)?");
    private static final Pattern TRAVERSAL = Pattern.compile(
            "[A-Za-z_][A-Za-z0-9_-]*(?:\\[[^\\]]*])?(?:\\.(?:[A-Za-z_*][A-Za-z0-9_-]*|\\d+)(?:\\[[^\\]]*])?)+");
    private static final Pattern FUNCTION_CALL = Pattern.compile("([A-Za-z_][A-Za-z0-9_:]*)\\((.*)\\)", Pattern.DOTALL);
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_-]*");

    /** Roots whose traversals are always references, whatever their length. */
    private static final Set<String> TRAVERSAL_ROOTS =
            Set.of("var", "local", "module", "data", "path", "count", "each", "self", "terraform");

    private TerraformExpressions() {}

    public static boolean isNumber(String value) {
        return value != null && NUMBER.matcher(value).matches();
    }

    public static boolean isBoolean(String value) {
        return "true".equals(value) || "false".equals(value);
    }

    public static boolean isIdentifier(String value) {
        return value != null && IDENTIFIER.matcher(value).matches();
    }

    /**
     * True for attribute references that are emitted unquoted: {@code var.x},
     * {@code local.x}, {@code module.m.out}, {@code data.t.n.attr} and
     * resource references {@code aws_type.name.attr} with at least three segments.
     */
    public static boolean isReference(String value) {
        if (value == null || !TRAVERSAL.matcher(value).matches()) return false;
        String root = rootOf(value);
        if (TRAVERSAL_ROOTS.contains(root)) return true;
        return root.startsWith(RESOURCE_PREFIX) && value.split("\\.").length >= 3;
    }

    /** Like {@link #isReference} but also accepts a bare resource address {@code aws_type.name}. */
    public static boolean isReferenceOrAddress(String value) {
        if (isReference(value)) return true;
        return value != null && TRAVERSAL.matcher(value).matches() && rootOf(value).startsWith(RESOURCE_PREFIX);
    }

    private static String rootOf(String traversal) {
        int end = 0;
        while (end < traversal.length() && traversal.charAt(end) != '.' && traversal.charAt(end) != '[') end++;
        return traversal.substring(0, end);
    }

    /** Whole value is a single call such as {@code jsonencode({...})}. */
    public static boolean isFunctionCall(String value) {
        if (value == null) return false;
        String encoded = InterpolationCodec.encode(value.trim());
        Matcher m = FUNCTION_CALL.matcher(encoded);
        if (!m.matches()) return false;
        int open = m.end(1);
        return findClosing(encoded, open) == encoded.length() - 1;
    }

    public static boolean isMapShaped(String value) {
        return value != null && value.startsWith("{") && value.endsWith("}");
    }

    public static boolean isListShaped(String value) {
        return value != null && value.startsWith("[") && value.endsWith("]");
    }

    public static boolean isQuoted(String value) {
        return value != null && value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"");
    }

    // ── Quoting ──────────────────────────────────────────────────────────────

    public static String escape(String literal) {
        StringBuilder out = new StringBuilder(literal.length() + 8);
        for (int i = 0; i < literal.length(); i++) {
            char c = literal.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '"' -> out.append("\\\"");
                case '\n' -> out.append("\\n");
                case '\t' -> out.append("\\t");
                case '\r' -> out.append("\\r");
                default -> out.append(c);
            }
        }
        return out.toString();
    }

    /**
     * Quotes a generation-ready value. Text outside {@code ${...}} spans is
     * escaped; interpolation bodies are emitted as written.
     */
    public static String quote(String value) {
        return "\"" + InterpolationCodec.decode(escapeEncoded(InterpolationCodec.encode(value))) + "\"";
    }

    /** Escapes the literal parts of encoded text, leaving marker spans intact. */
    public static String escapeEncoded(String encoded) {
        StringBuilder out = new StringBuilder();
        for (InterpolationCodec.Span span : InterpolationCodec.scanSpans(encoded)) {
            if (span.marked()) {
                out.append(InterpolationCodec.START).append(span.content()).append(InterpolationCodec.END);
            } else {
                out.append(escape(span.content()));
            }
        }
        return out.toString();
    }

    // ── Top-level scanning of encoded text ───────────────────────────────────

    /**
     * Splits encoded text on {@code separator} where it occurs outside quotes,
     * brackets and marker spans. Pieces are trimmed; blank pieces are dropped.
     */
    public static List<String> splitTopLevel(String encoded, char separator) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        int i = 0;
        while (i < encoded.length()) {
            int skipped = skipOpaque(encoded, i);
            if (skipped != i) {
                i = skipped;
                continue;
            }
            char c = encoded.charAt(i);
            if (c == '(' || c == '[' || c == '{') depth++;
            else if (c == ')' || c == ']' || c == '}') depth--;
            else if (c == separator && depth == 0) {
                addPart(parts, encoded.substring(start, i));
                start = i + 1;
            }
            i++;
        }
        addPart(parts, encoded.substring(start));
        return parts;
    }

    private static void addPart(List<String> parts, String part) {
        String trimmed = part.trim();
        if (!trimmed.isEmpty()) parts.add(trimmed);
    }

    /** Index of the first top-level {@code target} character, or -1. */
    public static int indexOfTopLevel(String encoded, char target) {
        int depth = 0;
        int i = 0;
        while (i < encoded.length()) {
            int skipped = skipOpaque(encoded, i);
            if (skipped != i) {
                i = skipped;
                continue;
            }
            char c = encoded.charAt(i);
            if (c == target && depth == 0) return i;
            if (c == '(' || c == '[' || c == '{') depth++;
            else if (c == ')' || c == ']' || c == '}') depth--;
            i++;
        }
        return -1;
    }

    /** Index of the bracket closing the one at {@code open}, or -1. */
    public static int findClosing(String encoded, int open) {
        int depth = 0;
        int i = open;
        while (i < encoded.length()) {
            int skipped = i == open ? i : skipOpaque(encoded, i);
            if (skipped != i) {
                i = skipped;
                continue;
            }
            char c = encoded.charAt(i);
            if (c == '(' || c == '[' || c == '{') depth++;
            else if (c == ')' || c == ']' || c == '}') {
                depth--;
                if (depth == 0) return i;
            }
            i++;
        }
        return -1;
    }

    // Quoted strings and marker spans are skipped as a unit.
    private static int skipOpaque(String encoded, int i) {
        if (encoded.startsWith(InterpolationCodec.START, i)) {
            int end = InterpolationCodec.findMatchingEnd(encoded, i + InterpolationCodec.START.length());
            return end < 0 ? encoded.length() : end + InterpolationCodec.END.length();
        }
        if (encoded.charAt(i) != '"') return i;
        int j = i + 1;
        while (j < encoded.length()) {
            if (encoded.startsWith(InterpolationCodec.START, j)) {
                int end = InterpolationCodec.findMatchingEnd(encoded, j + InterpolationCodec.START.length());
                if (end < 0) return encoded.length();
                j = end + InterpolationCodec.END.length();
                continue;
            }
            char c = encoded.charAt(j);
            if (c == '\\') {
                j += 2;
                continue;
            }
            if (c == '"') return j + 1;
            j++;
        }
        return encoded.length();
    }
}
