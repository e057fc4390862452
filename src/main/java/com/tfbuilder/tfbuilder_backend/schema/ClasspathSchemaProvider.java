package com.tfbuilder.tfbuilder_backend.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tfbuilder.tfbuilder_backend.model.schema.PropertyType;
import com.tfbuilder.tfbuilder_backend.model.schema.TerraformProperty;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Loads a {@code terraform providers schema -json} document for the AWS
 * provider. The location accepts any Spring resource prefix
 * ({@code classpath:}, {@code file:}).
 * <p>
 * Attributes that are computed-only are not user-settable and are skipped.
 * A non-standard {@code "default"} field on an attribute is read as the
 * property default.
 */
@Slf4j
@Component
public class ClasspathSchemaProvider implements SchemaProvider {

    private static final String AWS_PROVIDER = "registry.terraform.io/hashicorp/aws";

    private static final List<Pattern> POLICY_NAME_PATTERNS = List.of(
            Pattern.compile("_policy$"),
            Pattern.compile("policy$"),
            Pattern.compile("policy_"),
            Pattern.compile("_document$"),
            Pattern.compile("document$"),
            Pattern.compile("^assume_role_"),
            Pattern.compile("^trust_")
    );

    private static final List<String> POLICY_DESCRIPTION_KEYWORDS = List.of(
            "policy document", "json", "iam policy", "policy statement", "trust relationship"
    );

    private final ObjectMapper objectMapper;
    private final String location;

    private volatile boolean initialized;
    private Map<String, List<TerraformProperty>> properties = Map.of();
    private Map<String, String> descriptions = Map.of();

    public ClasspathSchemaProvider(ObjectMapper objectMapper,
                                   @Value("${app.schema.location:classpath:schema/aws-provider-schema.json}") String location) {
        this.objectMapper = objectMapper;
        this.location = location;
    }

    @Override
    @PostConstruct
    public synchronized void initialize() {
        if (initialized) return;
        Resource resource = new DefaultResourceLoader().getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Provider schema not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            JsonNode resourceSchemas = objectMapper.readTree(in)
                    .path("provider_schemas")
                    .path(AWS_PROVIDER)
                    .path("resource_schemas");

            Map<String, List<TerraformProperty>> loadedProperties = new HashMap<>();
            Map<String, String> loadedDescriptions = new HashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = resourceSchemas.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                JsonNode block = entry.getValue().path("block");
                loadedProperties.put(entry.getKey(), Collections.unmodifiableList(extractProperties(block)));
                String description = block.path("description").asText("");
                if (!description.isBlank()) loadedDescriptions.put(entry.getKey(), description);
            }
            this.properties = Map.copyOf(loadedProperties);
            this.descriptions = Map.copyOf(loadedDescriptions);
            this.initialized = true;
            log.info("Loaded provider schema from {} ({} resource types)", location, loadedProperties.size());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read provider schema " + location, e);
        }
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    @Override
    public List<TerraformProperty> getProperties(String typeName) {
        requireInitialized();
        return properties.getOrDefault(typeName, List.of());
    }

    @Override
    public String getResourceDescription(String typeName) {
        requireInitialized();
        return descriptions.getOrDefault(typeName, NO_DESCRIPTION);
    }

    @Override
    public int getResourceCount() {
        requireInitialized();
        return properties.size();
    }

    private void requireInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Schema provider queried before initialize()");
        }
    }

    private List<TerraformProperty> extractProperties(JsonNode block) {
        List<TerraformProperty> result = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> attributes = block.path("attributes").fields();
        while (attributes.hasNext()) {
            Map.Entry<String, JsonNode> entry = attributes.next();
            JsonNode details = entry.getValue();
            if (isComputedOnly(details)) continue;
            result.add(toProperty(entry.getKey(), details));
        }

        Iterator<Map.Entry<String, JsonNode>> blockTypes = block.path("block_types").fields();
        while (blockTypes.hasNext()) {
            Map.Entry<String, JsonNode> entry = blockTypes.next();
            String blockName = entry.getKey();
            JsonNode nested = entry.getValue();
            result.add(TerraformProperty.builder()
                    .name(blockName)
                    .type(PropertyType.BLOCK)
                    .required(nested.path("min_items").asInt(0) > 0)
                    .description(nested.path("block").path("description").asText(""))
                    .build());
            if (blockName.contains("policy") || blockName.contains("document")) {
                addNestedPolicyFields(blockName, nested.path("block"), result);
            }
        }
        return result;
    }

    // Policy fields of policy-ish nested blocks are exposed as "block.field" JSON properties.
    private void addNestedPolicyFields(String blockName, JsonNode block, List<TerraformProperty> result) {
        Iterator<Map.Entry<String, JsonNode>> fields = block.path("attributes").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String fieldName = field.getKey();
            String description = field.getValue().path("description").asText("");
            if (fieldName.equals("policy") || fieldName.equals("document") || isPolicyField(fieldName, description)) {
                result.add(TerraformProperty.builder()
                        .name(blockName + "." + fieldName)
                        .type(PropertyType.JSON)
                        .required(field.getValue().path("required").asBoolean(false))
                        .deprecated(field.getValue().path("deprecated").asBoolean(false))
                        .description(description)
                        .build());
            }
        }
    }

    private TerraformProperty toProperty(String name, JsonNode details) {
        String description = details.path("description").asText("");
        JsonNode defaultNode = details.get("default");
        return TerraformProperty.builder()
                .name(name)
                .type(propertyType(name, description, details.path("type")))
                .defaultValue(defaultNode != null && !defaultNode.isNull() ? defaultNode.asText() : null)
                .required(details.path("required").asBoolean(false))
                .deprecated(details.path("deprecated").asBoolean(false))
                .description(description)
                .build();
    }

    private static boolean isComputedOnly(JsonNode details) {
        return details.path("computed").asBoolean(false)
                && !details.path("optional").asBoolean(false)
                && !details.path("required").asBoolean(false);
    }

    private static PropertyType propertyType(String name, String description, JsonNode type) {
        if (type.isTextual()) {
            return switch (type.asText()) {
                case "string" -> isPolicyField(name, description) ? PropertyType.JSON : PropertyType.STRING;
                case "number" -> PropertyType.NUMBER;
                case "bool" -> PropertyType.BOOLEAN;
                default -> PropertyType.STRING;
            };
        }
        if (type.isArray() && type.size() > 0) {
            return switch (type.get(0).asText()) {
                case "map", "object" -> PropertyType.MAP;
                case "set" -> PropertyType.SET;
                case "list" -> PropertyType.ARRAY;
                default -> PropertyType.STRING;
            };
        }
        return PropertyType.STRING;
    }

    static boolean isPolicyField(String name, String description) {
        String lowerName = name.toLowerCase(Locale.ROOT);
        if (POLICY_NAME_PATTERNS.stream().anyMatch(p -> p.matcher(lowerName).find())) return true;
        String lowerDescription = description.toLowerCase(Locale.ROOT);
        return POLICY_DESCRIPTION_KEYWORDS.stream().anyMatch(lowerDescription::contains);
    }
}
