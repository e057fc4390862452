package com.tfbuilder.tfbuilder_backend.engine;

import com.tfbuilder.tfbuilder_backend.model.domain.Block;
import com.tfbuilder.tfbuilder_backend.model.domain.ResourceType;
import com.tfbuilder.tfbuilder_backend.model.domain.TerraformVariable;
import com.tfbuilder.tfbuilder_backend.model.schema.PropertyType;
import com.tfbuilder.tfbuilder_backend.model.schema.TerraformProperty;
import com.tfbuilder.tfbuilder_backend.schema.SchemaProvider;
import com.tfbuilder.tfbuilder_backend.terraform.InterpolationCodec;
import com.tfbuilder.tfbuilder_backend.terraform.TerraformExpressions;
import com.tfbuilder.tfbuilder_backend.terraform.TerraformNames;
import com.tfbuilder.tfbuilder_backend.terraform.TerraformResource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders blocks and variables as Terraform text.
 * <p>
 * Property values are formatted by the first matching rule: blank, variable
 * name, reference or call, policy document, tags map, list, depends_on,
 * interpolated string, then map/bool/number/string. Properties recorded as
 * nested blocks are re-emitted in block syntax. Each node is rendered on its
 * own; a failing node or property is replaced by a fallback and reported as
 * a warning.
 */
@Slf4j
@Component
public class TerraformCodeGenerator {

    static final String INDENT = "  ";
    static final String DEFAULT_REGION_VARIABLE = "aws_region";

    private static final List<String> POLICY_KEYS = List.of("policy", "assume_role_policy", "inline_policy", "document");
    private static final String POLICY_STATEMENT_KEY = "Statement";

    private final SchemaProvider schemaProvider;
    private final String awsRegion;

    public TerraformCodeGenerator(SchemaProvider schemaProvider,
                                  @Value("${app.terraform.aws-region:us-west-2}") String awsRegion) {
        this.schemaProvider = schemaProvider;
        this.awsRegion = awsRegion;
    }

    /**
     * @throws GenerationRefusedException when {@code blocks} is empty
     */
    public GeneratedTerraform generate(List<Block> blocks, List<TerraformVariable> variables) {
        if (blocks == null || blocks.isEmpty()) {
            throw new GenerationRefusedException("Nothing to generate: add at least one resource first");
        }
        List<String> warnings = new ArrayList<>();
        List<TerraformVariable> vars = variables != null ? variables : List.of();

        String main = blocks.stream()
                .map(block -> renderBlockSafely(block, vars, warnings))
                .collect(Collectors.joining("\n\n"));

        List<String> variableBlocks = new ArrayList<>();
        if (vars.stream().noneMatch(v -> v.name().equals(DEFAULT_REGION_VARIABLE))) {
            variableBlocks.add(generateVariableDeclaration(new TerraformVariable(
                    DEFAULT_REGION_VARIABLE, null, "The AWS region to deploy resources into", awsRegion, false)));
        }
        for (TerraformVariable variable : vars) {
            try {
                variableBlocks.add(generateVariableDeclaration(variable));
            } catch (RuntimeException e) {
                warnings.add("variable " + variable.name() + ": " + e.getMessage());
                log.warn("Failed to render variable {}: {}", variable.name(), e.getMessage());
                variableBlocks.add("# variable \"" + variable.name() + "\" could not be rendered");
            }
        }

        String outputs = blocks.stream()
                .map(this::generateOutput)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.joining("\n\n"));

        log.info("Generated Terraform for {} resources and {} variables", blocks.size(), vars.size());
        return new GeneratedTerraform(generateProviderConfig(), main, String.join("\n\n", variableBlocks), outputs, warnings);
    }

    String generateProviderConfig() {
        return "provider \"aws\" {\n" + INDENT + "region = var." + DEFAULT_REGION_VARIABLE + "\n}";
    }

    // ── Resources ────────────────────────────────────────────────────────────

    private String renderBlockSafely(Block block, List<TerraformVariable> variables, List<String> warnings) {
        try {
            return generateResourceDeclaration(block, variables, warnings);
        } catch (RuntimeException e) {
            String address = block.getTypeName() + "." + TerraformNames.formatResourceName(block.getContent());
            warnings.add(address + ": " + e.getMessage());
            log.warn("Failed to render {}: {}", address, e.getMessage());
            return "# " + address + " could not be rendered";
        }
    }

    String generateResourceDeclaration(Block block, List<TerraformVariable> variables, List<String> warnings) {
        String name = TerraformNames.formatResourceName(block.getContent());
        if (name.isEmpty()) {
            throw new IllegalArgumentException("block " + block.getId() + " has no usable name");
        }
        Set<String> jsonProperties = schemaProvider.getPropertiesForBlock(block).stream()
                .filter(p -> p.type() == PropertyType.JSON)
                .map(TerraformProperty::name)
                .collect(Collectors.toSet());

        StringBuilder body = new StringBuilder();
        for (Map.Entry<String, String> property : block.getProperties().entrySet()) {
            String key = property.getKey();
            String value = property.getValue();
            if (value == null || value.isEmpty()) continue;
            body.append(renderProperty(block, key, value, variables, jsonProperties, warnings)).append('\n');
        }

        String header = TerraformResource.MODULE_TYPE.equals(block.getTypeName())
                ? "module \"" + name + "\" {\n"
                : "resource \"" + block.getTypeName() + "\" \"" + name + "\" {\n";
        return header + body + "}";
    }

    private String renderProperty(Block block, String key, String value, List<TerraformVariable> variables,
                                  Set<String> jsonProperties, List<String> warnings) {
        try {
            if (block.isNestedBlock(key) && isBlockShaped(value)) {
                return renderNestedBlock(key, InterpolationCodec.encode(value.trim()), key, block.getNestedBlocks(), INDENT);
            }
            return INDENT + key + " = " + formatPropertyValue(key, value, variables, jsonProperties.contains(key));
        } catch (RuntimeException e) {
            warnings.add(block.getId() + "." + key + ": " + e.getMessage());
            log.warn("Failed to format property {} of {}: {}", key, block.getId(), e.getMessage());
            return INDENT + key + " = " + TerraformExpressions.quote(value);
        }
    }

    private static boolean isBlockShaped(String value) {
        String trimmed = value.trim();
        if (TerraformExpressions.isMapShaped(trimmed)) return true;
        if (!TerraformExpressions.isListShaped(trimmed)) return false;
        String encoded = InterpolationCodec.encode(trimmed);
        List<String> elements = TerraformExpressions.splitTopLevel(encoded.substring(1, encoded.length() - 1), ',');
        return !elements.isEmpty() && elements.stream().allMatch(TerraformExpressions::isMapShaped);
    }

    /** Emits {@code name { ... }} from a canonical map, or one block per element of a list of maps. */
    private String renderNestedBlock(String name, String encoded, String path, Set<String> nestedPaths, String indent) {
        if (TerraformExpressions.isListShaped(encoded)) {
            return TerraformExpressions.splitTopLevel(encoded.substring(1, encoded.length() - 1), ',').stream()
                    .map(element -> renderNestedBlock(name, element, path, nestedPaths, indent))
                    .collect(Collectors.joining("\n"));
        }
        StringBuilder out = new StringBuilder(indent).append(name).append(" {\n");
        for (String entry : TerraformExpressions.splitTopLevel(encoded.substring(1, encoded.length() - 1), ',')) {
            int eq = TerraformExpressions.indexOfTopLevel(entry, '=');
            if (eq < 0) {
                throw new IllegalArgumentException("malformed entry in block " + path + ": " + InterpolationCodec.decode(entry));
            }
            String key = unquoteKey(entry.substring(0, eq).trim());
            String value = entry.substring(eq + 1).trim();
            String childPath = path + "." + key;
            if (nestedPaths.contains(childPath) && isBlockShaped(InterpolationCodec.decode(value))) {
                out.append(renderNestedBlock(key, value, childPath, nestedPaths, indent + INDENT)).append('\n');
            } else {
                out.append(indent).append(INDENT).append(key).append(" = ").append(InterpolationCodec.decode(value)).append('\n');
            }
        }
        return out.append(indent).append('}').toString();
    }

    private static String unquoteKey(String key) {
        return TerraformExpressions.isQuoted(key) ? key.substring(1, key.length() - 1) : key;
    }

    // ── Value formatting ─────────────────────────────────────────────────────

    String formatPropertyValue(String key, String value, List<TerraformVariable> variables, boolean jsonTyped) {
        if (value.isBlank()) {
            return "\"\"";
        }
        if (isVariableName(value, variables)) {
            return "var." + value;
        }
        if (TerraformExpressions.isReference(value) || TerraformExpressions.isFunctionCall(value)) {
            return value;
        }
        if (isPolicyDocument(key, value, jsonTyped)) {
            return "jsonencode(" + value.trim() + ")";
        }
        if (key.equals("tags") && value.contains("=") && TerraformExpressions.isMapShaped(value.trim())) {
            return formatTags(value.trim(), variables);
        }
        if (TerraformExpressions.isListShaped(value)) {
            return formatListValue(value, variables);
        }
        if (key.equals(DependencyInferenceEngine.DEPENDS_ON)) {
            return value;
        }
        if (value.contains("${")) {
            return TerraformExpressions.quote(value);
        }
        if (TerraformExpressions.isMapShaped(value)) return value;
        if (TerraformExpressions.isBoolean(value)) return value;
        if (TerraformExpressions.isNumber(value)) return value;
        return TerraformExpressions.quote(value);
    }

    private static boolean isVariableName(String value, List<TerraformVariable> variables) {
        return variables.stream().anyMatch(v -> v.name().equals(value));
    }

    private static boolean isPolicyDocument(String key, String value, boolean jsonTyped) {
        if (!TerraformExpressions.isMapShaped(value.trim())) return false;
        if (jsonTyped) return true;
        if (key.equals("tags")) return false;
        String lowerKey = key.toLowerCase(Locale.ROOT);
        return POLICY_KEYS.stream().anyMatch(lowerKey::contains) || hasTopLevelKey(value.trim(), POLICY_STATEMENT_KEY);
    }

    /** True when the map literal has {@code key} among its own entries, quoted or not. */
    private static boolean hasTopLevelKey(String mapValue, String key) {
        String encoded = InterpolationCodec.encode(mapValue);
        for (String piece : TerraformExpressions.splitTopLevel(encoded.substring(1, encoded.length() - 1), ',')) {
            for (String entry : TerraformExpressions.splitTopLevel(piece, '\n')) {
                int eq = TerraformExpressions.indexOfTopLevel(entry, '=');
                if (eq < 0) eq = TerraformExpressions.indexOfTopLevel(entry, ':');
                if (eq < 0) continue;
                String entryKey = entry.substring(0, eq).trim();
                if (TerraformExpressions.isQuoted(entryKey)) {
                    entryKey = entryKey.substring(1, entryKey.length() - 1);
                }
                if (entryKey.equals(key)) return true;
            }
        }
        return false;
    }

    /** {@code {a = "x", b = "y"}} → one entry per line, values re-classified. */
    private String formatTags(String value, List<TerraformVariable> variables) {
        String encoded = InterpolationCodec.encode(value);
        List<String> pairs = new ArrayList<>();
        for (String piece : TerraformExpressions.splitTopLevel(encoded.substring(1, encoded.length() - 1), ',')) {
            for (String entry : TerraformExpressions.splitTopLevel(piece, '\n')) {
                int eq = TerraformExpressions.indexOfTopLevel(entry, '=');
                if (eq < 0) {
                    eq = TerraformExpressions.indexOfTopLevel(entry, ':');
                }
                if (eq < 0) {
                    pairs.add(InterpolationCodec.decode(entry));
                    continue;
                }
                String tagKey = InterpolationCodec.decode(entry.substring(0, eq).trim());
                String tagValue = entry.substring(eq + 1).trim();
                pairs.add(tagKey + " = " + formatElement(tagValue, variables));
            }
        }
        if (pairs.isEmpty()) return "{}";
        String inner = INDENT + INDENT;
        return "{\n" + inner + String.join(",\n" + inner, pairs) + "\n" + INDENT + "}";
    }

    private String formatListValue(String value, List<TerraformVariable> variables) {
        String encoded = InterpolationCodec.encode(value);
        List<String> items = TerraformExpressions.splitTopLevel(encoded.substring(1, encoded.length() - 1), ',');
        if (items.isEmpty()) return "[]";
        return items.stream()
                .map(item -> formatElement(item, variables))
                .collect(Collectors.joining(", ", "[", "]"));
    }

    /** Classifies one encoded list element or map value. */
    private String formatElement(String encodedItem, List<TerraformVariable> variables) {
        String item = InterpolationCodec.decode(encodedItem);
        if (item.isEmpty()) return "\"\"";
        if (isVariableName(item, variables)) return "var." + item;
        if (TerraformExpressions.isQuoted(encodedItem)) return item;
        if (item.startsWith("{") || item.startsWith("[")) return item;
        if (TerraformExpressions.isReferenceOrAddress(item) || TerraformExpressions.isFunctionCall(item)) return item;
        if (TerraformExpressions.isBoolean(item) || TerraformExpressions.isNumber(item) || item.equals("null")) return item;
        return TerraformExpressions.quote(item);
    }

    // ── Variables ────────────────────────────────────────────────────────────

    String generateVariableDeclaration(TerraformVariable variable) {
        StringBuilder out = new StringBuilder()
                .append("variable \"").append(variable.name()).append("\" {\n")
                .append(INDENT).append("description = ").append(TerraformExpressions.quote(variable.description())).append('\n')
                .append(INDENT).append("type        = ").append(variable.type().getTerraformType()).append('\n');
        if (variable.defaultValue() != null) {
            out.append(INDENT).append("default     = ").append(formatVariableDefault(variable)).append('\n');
        }
        if (variable.sensitive()) {
            out.append(INDENT).append("sensitive   = true\n");
        }
        return out.append('}').toString();
    }

    private static String formatVariableDefault(TerraformVariable variable) {
        String value = variable.defaultValue();
        return switch (variable.type()) {
            case STRING -> TerraformExpressions.quote(value);
            case NUMBER, BOOL -> value.isBlank() ? "null" : value;
            case LIST -> TerraformExpressions.isListShaped(value.trim()) ? value.trim() : "[" + value + "]";
            case MAP -> TerraformExpressions.isMapShaped(value.trim()) ? value.trim() : "{ " + value + " }";
        };
    }

    // ── Outputs ──────────────────────────────────────────────────────────────

    String generateOutput(Block block) {
        String name = TerraformNames.formatResourceName(block.getContent());
        if (name.isEmpty()) return "";
        String address = block.getTypeName() + "." + name;
        ResourceType type = block.getResourceType();
        return switch (type) {
            case LB, ELB -> output(name + "_dns_name", "DNS name of the load balancer " + name, address + ".dns_name");
            case EC2_INSTANCE -> output(name + "_public_ip", "Public IP address of the EC2 instance " + name, address + ".public_ip");
            case RDS_INSTANCE -> output(name + "_endpoint", "Endpoint of the RDS instance " + name, address + ".endpoint");
            case LAMBDA_FUNCTION -> output(name + "_function_name", "Name of the Lambda function " + name, address + ".function_name");
            case API_GATEWAY_REST_API -> output(name + "_invoke_url", "Invoke URL for the API Gateway " + name, address + ".execution_arn");
            default -> "";
        };
    }

    private static String output(String outputName, String description, String value) {
        return "output \"" + outputName + "\" {\n"
                + INDENT + "description = " + TerraformExpressions.quote(description) + "\n"
                + INDENT + "value       = " + value + "\n"
                + "}";
    }
}
