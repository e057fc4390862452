package com.tfbuilder.tfbuilder_backend.terraform;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Canonical stringification of parsed attribute values. Output is still
 * interpolation-encoded; callers decode at the node boundary.
 * <p>
 * Maps render as {@code {k = v, k2 = v2}}, lists as {@code [a, b]}; strings
 * inside collections are quoted, raw expressions are kept verbatim.
 */
public final class HclValueRenderer {

    private HclValueRenderer() {}

    /**
     * Renders a top-level attribute value, or returns null when the attribute
     * should be dropped ({@code null} literal).
     */
    public static String renderAttribute(Object value) {
        if (value == null) return null;
        if (value instanceof String s) return s;
        if (value instanceof BareExpression raw) return renderRaw(raw);
        return renderNested(value);
    }

    /** Top-level raw expressions that are not plain literals or references become interpolations. */
    private static String renderRaw(BareExpression raw) {
        if (raw.isNull()) return null;
        String text = raw.text();
        String decoded = InterpolationCodec.decode(text);
        if (TerraformExpressions.isNumber(text)
                || TerraformExpressions.isBoolean(text)
                || TerraformExpressions.isReference(decoded)
                || TerraformExpressions.isFunctionCall(decoded)) {
            return text;
        }
        return InterpolationCodec.START + text + InterpolationCodec.END;
    }

    public static String renderNested(Object value) {
        if (value == null) return "null";
        if (value instanceof String s) return "\"" + TerraformExpressions.escapeEncoded(s) + "\"";
        if (value instanceof BareExpression raw) return raw.text();
        if (value instanceof List<?> list) {
            return list.stream().map(HclValueRenderer::renderNested).collect(Collectors.joining(", ", "[", "]"));
        }
        if (value instanceof Map<?, ?> map) {
            return map.entrySet().stream()
                    .map(e -> renderKey(String.valueOf(e.getKey())) + " = " + renderNested(e.getValue()))
                    .collect(Collectors.joining(", ", "{", "}"));
        }
        return String.valueOf(value);
    }

    public static String renderKey(String key) {
        return TerraformExpressions.isIdentifier(key) ? key : "\"" + TerraformExpressions.escape(key) + "\"";
    }
}
