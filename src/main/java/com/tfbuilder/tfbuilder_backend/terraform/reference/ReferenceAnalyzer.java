package com.tfbuilder.tfbuilder_backend.terraform.reference;

import com.tfbuilder.tfbuilder_backend.terraform.InterpolationCodec;
import com.tfbuilder.tfbuilder_backend.terraform.TerraformExpressions;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits property values into literal text and classified references.
 * Stateless; every method is a pure function of its input.
 * <p>
 * Interpolation spans are classified in priority order: variable reference,
 * resource reference, function call (arguments analyzed recursively), opaque
 * expression.
 */
@Component
public class ReferenceAnalyzer {

    private static final String VARIABLE_PREFIX = "var.";

    private static final Pattern VARIABLE_NAME = Pattern.compile("var\\.([A-Za-z_][A-Za-z0-9_-]*).*", Pattern.DOTALL);
    private static final Pattern RESOURCE_REFERENCE = Pattern.compile(
            "([A-Za-z_][A-Za-z0-9_-]*)\\.([A-Za-z_][A-Za-z0-9_-]*)(?:\\[[^\\]]*])?(?:\\.([A-Za-z0-9_.*\\[\\]\"-]+))?");
    private static final Pattern FUNCTION_CALL = Pattern.compile("([A-Za-z_][A-Za-z0-9_]*)\\((.*)\\)", Pattern.DOTALL);

    /** First segments that look like {@code a.b} but are not resources. */
    private static final Set<String> NON_RESOURCE_ROOTS =
            Set.of("var", "data", "local", "path", "count", "each", "self", "terraform");

    /**
     * Analyzes an interpolation-encoded value. Marked spans become classified
     * segments; everything between them becomes {@link ExpressionSegment.Text}.
     */
    public List<ExpressionSegment> analyze(String encodedValue) {
        List<ExpressionSegment> segments = new ArrayList<>();
        if (encodedValue == null || encodedValue.isEmpty()) return segments;
        for (InterpolationCodec.Span span : InterpolationCodec.scanSpans(encodedValue)) {
            if (span.marked()) {
                String original = "${" + InterpolationCodec.decode(span.content()) + "}";
                segments.add(classify(span.content(), original, true));
            } else {
                segments.add(new ExpressionSegment.Text(InterpolationCodec.decode(span.content())));
            }
        }
        return segments;
    }

    /**
     * Analyzes a generation-ready property value. A value with no
     * interpolation that is itself a bare reference or call (as written by
     * dependency inference) yields a single non-interpolated segment.
     */
    public List<ExpressionSegment> analyzeProperty(String value) {
        if (value == null || value.isEmpty()) return List.of();
        String trimmed = value.trim();
        String encoded = InterpolationCodec.encode(trimmed);
        if (TerraformExpressions.isListShaped(trimmed)) {
            return analyzeArguments(encoded.substring(1, encoded.length() - 1));
        }
        if (TerraformExpressions.isMapShaped(trimmed)) {
            return analyzeMapValues(encoded.substring(1, encoded.length() - 1));
        }
        if (InterpolationCodec.containsMarker(encoded)) {
            return analyze(InterpolationCodec.encode(value));
        }
        if (isBareVariable(trimmed)
                || TerraformExpressions.isReferenceOrAddress(trimmed)
                || TerraformExpressions.isFunctionCall(trimmed)) {
            return List.of(classify(encoded, trimmed, false));
        }
        return List.of(new ExpressionSegment.Text(value));
    }

    /** Variable names referenced anywhere in the value, including call arguments. */
    public List<String> findVariableReferences(String value) {
        Set<String> names = new LinkedHashSet<>();
        collect(analyzeProperty(value), names, new LinkedHashSet<>());
        return new ArrayList<>(names);
    }

    /** Resource addresses referenced anywhere in the value, including call arguments. */
    public List<ResourceAddress> findResourceReferences(String value) {
        Set<ResourceAddress> addresses = new LinkedHashSet<>();
        collect(analyzeProperty(value), new LinkedHashSet<>(), addresses);
        return new ArrayList<>(addresses);
    }

    private void collect(List<ExpressionSegment> segments, Set<String> variables, Set<ResourceAddress> resources) {
        for (ExpressionSegment segment : segments) {
            if (segment instanceof ExpressionSegment.VariableReference v) {
                variables.add(v.name());
            } else if (segment instanceof ExpressionSegment.ResourceReference r) {
                resources.add(r.address());
            } else if (segment instanceof ExpressionSegment.FunctionCall f) {
                collect(f.argumentSegments(), variables, resources);
            }
        }
    }

    private ExpressionSegment classify(String encodedInner, String originalText, boolean interpolated) {
        String inner = InterpolationCodec.decode(encodedInner).trim();

        if (inner.startsWith(VARIABLE_PREFIX)) {
            Matcher m = VARIABLE_NAME.matcher(inner);
            String name = m.matches() ? m.group(1) : inner.substring(VARIABLE_PREFIX.length());
            return new ExpressionSegment.VariableReference(name, originalText, interpolated);
        }

        Matcher ref = RESOURCE_REFERENCE.matcher(inner);
        if (ref.matches() && !NON_RESOURCE_ROOTS.contains(ref.group(1))) {
            return new ExpressionSegment.ResourceReference(ref.group(1), ref.group(2), ref.group(3), originalText, interpolated);
        }

        String encodedTrimmed = encodedInner.trim();
        Matcher call = FUNCTION_CALL.matcher(encodedTrimmed);
        if (call.matches() && TerraformExpressions.findClosing(encodedTrimmed, call.end(1)) == encodedTrimmed.length() - 1) {
            return new ExpressionSegment.FunctionCall(
                    call.group(1),
                    InterpolationCodec.decode(call.group(2)),
                    analyzeArguments(call.group(2)),
                    originalText,
                    interpolated);
        }

        return new ExpressionSegment.Expression(inner, originalText, interpolated);
    }

    private List<ExpressionSegment> analyzeArguments(String encodedArguments) {
        List<ExpressionSegment> segments = new ArrayList<>();
        for (String argument : TerraformExpressions.splitTopLevel(encodedArguments, ',')) {
            String decoded = InterpolationCodec.decode(argument);
            if (TerraformExpressions.isMapShaped(argument)) {
                segments.addAll(analyzeMapValues(argument.substring(1, argument.length() - 1)));
            } else if (TerraformExpressions.isListShaped(argument)) {
                segments.addAll(analyzeArguments(argument.substring(1, argument.length() - 1)));
            } else if (InterpolationCodec.containsMarker(argument)) {
                segments.addAll(analyze(argument));
            } else if (TerraformExpressions.isQuoted(argument)
                    || TerraformExpressions.isNumber(argument)
                    || TerraformExpressions.isBoolean(argument)) {
                segments.add(new ExpressionSegment.Text(decoded));
            } else {
                segments.add(classify(argument, decoded, false));
            }
        }
        return segments;
    }

    // Entries are "key = value" or "key: value"; keys are never references.
    private List<ExpressionSegment> analyzeMapValues(String encodedEntries) {
        List<ExpressionSegment> segments = new ArrayList<>();
        List<String> entries = new ArrayList<>();
        TerraformExpressions.splitTopLevel(encodedEntries, ',')
                .forEach(piece -> entries.addAll(TerraformExpressions.splitTopLevel(piece, '\n')));
        for (String entry : entries) {
            int separator = TerraformExpressions.indexOfTopLevel(entry, '=');
            if (separator < 0) separator = TerraformExpressions.indexOfTopLevel(entry, ':');
            if (separator < 0) continue;
            String entryValue = entry.substring(separator + 1).trim();
            if (TerraformExpressions.isMapShaped(entryValue)) {
                segments.addAll(analyzeMapValues(entryValue.substring(1, entryValue.length() - 1)));
            } else if (TerraformExpressions.isListShaped(entryValue)) {
                segments.addAll(analyzeArguments(entryValue.substring(1, entryValue.length() - 1)));
            } else {
                segments.addAll(analyzeArguments(entryValue));
            }
        }
        return segments;
    }

    private static boolean isBareVariable(String value) {
        return value.startsWith(VARIABLE_PREFIX) && TerraformExpressions.isReference(value);
    }
}
