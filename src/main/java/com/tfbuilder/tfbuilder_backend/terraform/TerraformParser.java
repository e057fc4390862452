package com.tfbuilder.tfbuilder_backend.terraform;

import com.tfbuilder.tfbuilder_backend.model.domain.Block;
import com.tfbuilder.tfbuilder_backend.model.domain.ResourceType;
import com.tfbuilder.tfbuilder_backend.model.domain.TerraformVariable;
import com.tfbuilder.tfbuilder_backend.model.domain.VariableType;
import com.tfbuilder.tfbuilder_backend.schema.SchemaProvider;
import com.bertramlabs.plugins.hcl4j.HCLParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns Terraform documents into resource and variable records, and resource
 * records into canvas blocks.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TerraformParser {

    private final ResourceTypeCategorizer categorizer;
    private final SchemaProvider schemaProvider;

    /**
     * Parses one document. A malformed document yields an empty result that
     * carries the cause; nothing is thrown.
     */
    public ParseResult parse(String content) {
        if (content == null || content.isBlank()) {
            return new ParseResult(List.of(), List.of(), null);
        }
        try {
            ExpressionShield.Shielded document = ExpressionShield.shield(InterpolationCodec.encode(content));
            Map<String, Object> tree = new HCLParser().parse(new StringReader(document.text()));
            List<TerraformResource> resources = parseResources(tree, document);
            List<TerraformVariable> variables = parseVariables(tree, document);
            log.debug("Parsed document: {} resources, {} variables", resources.size(), variables.size());
            return new ParseResult(resources, variables, null);
        } catch (TerraformSyntaxException e) {
            log.warn("Failed to parse Terraform document: {}", e.getMessage());
            return ParseResult.failed(e.getMessage());
        } catch (Exception e) {
            log.warn("Failed to parse Terraform document", e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return ParseResult.failed(message);
        }
    }

    /**
     * Parses several documents as one configuration. Failed documents are
     * skipped and their errors joined; duplicate addresses across documents
     * follow the same last-write-wins rule as within one document.
     */
    public ParseResult parseAll(List<String> documents) {
        Map<String, TerraformResource> resources = new LinkedHashMap<>();
        Map<String, TerraformVariable> variables = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();
        int index = 0;
        for (String document : documents) {
            index++;
            ParseResult result = parse(document);
            if (result.hasError()) {
                errors.add("document " + index + ": " + result.error());
                continue;
            }
            result.resources().forEach(r -> putResource(resources, r));
            result.variables().forEach(v -> variables.putIfAbsent(v.name(), v));
        }
        String error = errors.isEmpty() ? null : String.join("; ", errors);
        return new ParseResult(new ArrayList<>(resources.values()), new ArrayList<>(variables.values()), error);
    }

    // ── Resources ────────────────────────────────────────────────────────────

    private List<TerraformResource> parseResources(Map<String, Object> tree, ExpressionShield.Shielded document) {
        Map<String, TerraformResource> found = new LinkedHashMap<>();
        blocksOf(tree.get("resource")).forEach((type, instances) ->
                blocksOf(instances).forEach((name, body) ->
                        found.put(type + "." + name, toResource(type, name, lastBody(body), document))));
        blocksOf(tree.get(TerraformResource.MODULE_TYPE)).forEach((name, body) ->
                found.put(TerraformResource.MODULE_TYPE + "." + name,
                        toResource(TerraformResource.MODULE_TYPE, name, lastBody(body), document)));
        if (tree.containsKey("data")) {
            log.debug("Ignoring data blocks {}", blocksOf(tree.get("data")).keySet());
        }

        // Document order of first occurrence; a repeated address keeps its first slot.
        List<TerraformResource> ordered = new ArrayList<>(found.size());
        Set<String> seen = new HashSet<>();
        for (String address : document.addresses()) {
            if (!seen.add(address)) {
                log.warn("Duplicate resource {}: later definition replaces the earlier one", address);
                continue;
            }
            TerraformResource resource = found.remove(address);
            if (resource != null) ordered.add(resource);
        }
        ordered.addAll(found.values());
        return ordered;
    }

    /** Labelled blocks by label. Same-label entries from a list are combined into a list. */
    private static Map<String, Object> blocksOf(Object value) {
        Map<String, Object> blocks = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> map) {
            map.forEach((key, body) -> blocks.put(String.valueOf(key), body));
        } else if (value instanceof List<?> list) {
            for (Object item : list) {
                blocksOf(item).forEach((key, body) -> blocks.merge(key, body, (a, b) -> List.of(a, b)));
            }
        }
        return blocks;
    }

    // Last write wins for a repeated block.
    private static Map<?, ?> lastBody(Object body) {
        if (body instanceof Map<?, ?> map) return map;
        if (body instanceof List<?> list && !list.isEmpty()) return lastBody(list.get(list.size() - 1));
        return Map.of();
    }

    private static Map<?, ?> firstBody(Object body) {
        if (body instanceof Map<?, ?> map) return map;
        if (body instanceof List<?> list && !list.isEmpty()) return firstBody(list.get(0));
        return Map.of();
    }

    // Last write wins; the replaced entry keeps the first occurrence's position.
    private static void putResource(Map<String, TerraformResource> resources, TerraformResource resource) {
        if (resources.put(resource.address(), resource) != null) {
            log.warn("Duplicate resource {}: later definition replaces the earlier one", resource.address());
        }
    }

    private TerraformResource toResource(String type, String name, Map<?, ?> body, ExpressionShield.Shielded document) {
        Set<String> nestedBlocks = new LinkedHashSet<>();
        Map<String, Object> properties = flatten(body, "", nestedBlocks, document);
        return new TerraformResource(type, name, properties, nestedBlocks);
    }

    /**
     * Flattens a block body into an ordered map. Nested blocks become map
     * values (a list of maps when repeated) and their paths are recorded.
     */
    private Map<String, Object> flatten(Map<?, ?> body, String pathPrefix, Set<String> nestedBlocks,
                                        ExpressionShield.Shielded document) {
        Map<String, Object> values = new LinkedHashMap<>();
        body.forEach((rawKey, value) -> {
            String key = String.valueOf(rawKey);
            String blockName = ExpressionShield.blockName(key);
            if (blockName == null) {
                values.put(key, document.resolve(value));
                return;
            }
            String path = pathPrefix + blockName;
            nestedBlocks.add(path);
            Map<String, Object> nestedValues = flatten(firstBody(value), path + ".", nestedBlocks, document);
            Object existing = values.get(blockName);
            if (existing instanceof List<?> list) {
                List<Object> repeated = new ArrayList<>(list);
                repeated.add(nestedValues);
                values.put(blockName, repeated);
            } else if (existing instanceof Map<?, ?>) {
                values.put(blockName, new ArrayList<>(List.of(existing, nestedValues)));
            } else {
                values.put(blockName, nestedValues);
            }
        });
        return values;
    }

    // ── Variables ────────────────────────────────────────────────────────────

    private List<TerraformVariable> parseVariables(Map<String, Object> tree, ExpressionShield.Shielded document) {
        List<TerraformVariable> variables = new ArrayList<>();
        blocksOf(tree.get("variable")).forEach((name, body) -> {
            if (name.isBlank()) {
                log.warn("Skipping variable block with a blank name");
                return;
            }
            variables.add(toVariable(name, firstBody(body), document));
        });
        return variables;
    }

    private TerraformVariable toVariable(String name, Map<?, ?> body, ExpressionShield.Shielded document) {
        Map<String, Object> values = new LinkedHashMap<>();
        body.forEach((key, value) -> values.put(String.valueOf(key), document.resolve(value)));

        Object typeValue = values.get("type");
        VariableType type = typeValue != null
                ? VariableType.fromDeclaration(InterpolationCodec.decode(String.valueOf(typeValue)))
                : VariableType.STRING;
        String description = values.get("description") instanceof String s ? InterpolationCodec.decode(s) : "";
        Object defaultValue = values.get("default");
        String renderedDefault = defaultValue == null || (defaultValue instanceof BareExpression raw && raw.isNull())
                ? null
                : InterpolationCodec.decode(defaultValue instanceof String s ? s : HclValueRenderer.renderNested(defaultValue));
        boolean sensitive = "true".equals(String.valueOf(values.get("sensitive")));
        return new TerraformVariable(name, type, description, renderedDefault, sensitive);
    }

    // ── Nodes ────────────────────────────────────────────────────────────────

    /**
     * Builds one block per resource. Ids are {@code type_name}, the display
     * content is the resource name, and property values are stringified and
     * restored to generation-ready text.
     */
    public List<Block> convertToNodes(List<TerraformResource> resources) {
        List<Block> blocks = new ArrayList<>(resources.size());
        for (TerraformResource resource : resources) {
            Map<String, String> properties = new LinkedHashMap<>();
            resource.properties().forEach((key, value) -> {
                String rendered = HclValueRenderer.renderAttribute(value);
                if (rendered != null) {
                    properties.put(key, InterpolationCodec.decode(rendered));
                }
            });
            ResourceType resourceType = ResourceType.fromResourceName(resource.type());
            blocks.add(Block.builder()
                    .id(resource.type() + "_" + resource.name())
                    .type(categorizer.determineBlockType(resource.type()))
                    .content(resource.name())
                    .resourceType(resourceType)
                    .typeName(resource.type())
                    .description(schemaProvider.getResourceDescription(resource.type()))
                    .properties(properties)
                    .nestedBlocks(resource.nestedBlocks())
                    .build());
        }
        return blocks;
    }
}
