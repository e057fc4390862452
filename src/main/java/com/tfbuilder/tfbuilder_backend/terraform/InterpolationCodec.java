package com.tfbuilder.tfbuilder_backend.terraform;

import java.util.ArrayList;
import java.util.List;

/**
 * Reversible substitution of {@code ${...}} spans with sentinel markers, so a
 * generic block parser never sees interpolation braces as structure.
 * <p>
 * Every token starts with {@link #PREFIX}. A literal occurrence of the prefix
 * in the input is itself escaped, which makes {@code decode(encode(s)) == s}
 * hold for every string, including ones that already contain marker text.
 * An unbalanced {@code ${} and the escaped form {@code $${} are left alone.
 */
public final class InterpolationCodec {

    public static final String PREFIX = "____INTERP_";
    public static final String START = PREFIX + "S____";
    public static final String END = PREFIX + "E____";
    public static final String ESCAPED_PREFIX = PREFIX + "Q____";

    private static final int TOKEN_SUFFIX_LENGTH = START.length() - PREFIX.length();

    private InterpolationCodec() {}

    public static String encode(String text) {
        if (text == null || text.isEmpty()) return text;
        StringBuilder out = new StringBuilder(text.length() + 32);
        int i = 0;
        while (i < text.length()) {
            if (text.startsWith(PREFIX, i)) {
                out.append(ESCAPED_PREFIX);
                i += PREFIX.length();
                continue;
            }
            char c = text.charAt(i);
            if (c == '$' && text.startsWith("$${", i)) {
                out.append("$${");
                i += 3;
                continue;
            }
            if (c == '$' && text.startsWith("${", i)) {
                int close = findClosingBrace(text, i + 2);
                if (close > 0) {
                    out.append(START).append(encode(text.substring(i + 2, close))).append(END);
                    i = close + 1;
                    continue;
                }
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    public static String decode(String text) {
        if (text == null || text.indexOf(PREFIX) < 0) return text;
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            if (text.startsWith(PREFIX, i)) {
                String token = text.substring(i, Math.min(text.length(), i + PREFIX.length() + TOKEN_SUFFIX_LENGTH));
                if (token.equals(START)) {
                    out.append("${");
                    i += START.length();
                    continue;
                }
                if (token.equals(END)) {
                    out.append('}');
                    i += END.length();
                    continue;
                }
                if (token.equals(ESCAPED_PREFIX)) {
                    out.append(PREFIX);
                    i += ESCAPED_PREFIX.length();
                    continue;
                }
            }
            out.append(text.charAt(i));
            i++;
        }
        return out.toString();
    }

    public static boolean containsMarker(String text) {
        return text != null && text.contains(START);
    }

    /** Inner (still encoded) content of every top-level marked span, in order. */
    public static List<String> extractMarkedSpans(String text) {
        List<String> spans = new ArrayList<>();
        for (Span span : scanSpans(text)) {
            if (span.marked()) spans.add(span.content());
        }
        return spans;
    }

    /**
     * Splits encoded text into alternating literal and marked spans. Literal
     * spans are still encoded; marked spans carry their inner content.
     */
    public static List<Span> scanSpans(String text) {
        List<Span> spans = new ArrayList<>();
        if (text == null || text.isEmpty()) return spans;
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            if (text.startsWith(START, i)) {
                int end = findMatchingEnd(text, i + START.length());
                if (end >= 0) {
                    if (literal.length() > 0) {
                        spans.add(new Span(literal.toString(), false));
                        literal.setLength(0);
                    }
                    spans.add(new Span(text.substring(i + START.length(), end), true));
                    i = end + END.length();
                    continue;
                }
            }
            literal.append(text.charAt(i));
            i++;
        }
        if (literal.length() > 0) spans.add(new Span(literal.toString(), false));
        return spans;
    }

    /** Index of the END token that closes a START whose content begins at {@code from}, or -1. */
    public static int findMatchingEnd(String text, int from) {
        int depth = 1;
        int i = from;
        while (i < text.length()) {
            if (text.startsWith(START, i)) {
                depth++;
                i += START.length();
            } else if (text.startsWith(END, i)) {
                depth--;
                if (depth == 0) return i;
                i += END.length();
            } else {
                i++;
            }
        }
        return -1;
    }

    // Quoted strings inside an interpolation may contain braces.
    private static int findClosingBrace(String text, int from) {
        int depth = 1;
        boolean inQuote = false;
        int i = from;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (inQuote) {
                if (c == '\\') {
                    i += 2;
                    continue;
                }
                if (c == '"') inQuote = false;
            } else if (c == '"') {
                inQuote = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) return i;
            }
            i++;
        }
        return -1;
    }

    public record Span(String content, boolean marked) {}
}
