package com.tfbuilder.tfbuilder_backend.engine;

import com.tfbuilder.tfbuilder_backend.graph.GraphSnapshot;
import com.tfbuilder.tfbuilder_backend.model.domain.Block;
import com.tfbuilder.tfbuilder_backend.model.domain.Connection;
import com.tfbuilder.tfbuilder_backend.model.domain.ResourceType;
import com.tfbuilder.tfbuilder_backend.model.schema.PropertyType;
import com.tfbuilder.tfbuilder_backend.model.schema.TerraformProperty;
import com.tfbuilder.tfbuilder_backend.schema.SchemaProvider;
import com.tfbuilder.tfbuilder_backend.terraform.InterpolationCodec;
import com.tfbuilder.tfbuilder_backend.terraform.TerraformExpressions;
import com.tfbuilder.tfbuilder_backend.terraform.TerraformNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns connections into Terraform references.
 * <p>
 * For each edge the target's schema properties are searched for one that
 * can hold a reference to the source ({@code vpc_id} for a VPC, {@code role}
 * for an IAM role, {@code <kind>_id}/{@code <kind>_arn} otherwise). A match
 * receives {@code <type>.<name>.<attribute>}; without one the source address
 * is appended to {@code depends_on}. An edge is never dropped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DependencyInferenceEngine {

    public static final String DEPENDS_ON = "depends_on";

    private static final Map<ResourceType, List<String>> SPECIAL_PATTERNS = new EnumMap<>(ResourceType.class);

    static {
        SPECIAL_PATTERNS.put(ResourceType.VPC, List.of("vpc_id"));
        SPECIAL_PATTERNS.put(ResourceType.SUBNET, List.of("subnet_id", "subnet_ids"));
        SPECIAL_PATTERNS.put(ResourceType.SECURITY_GROUP, List.of("security_group_id", "security_group_ids", "vpc_security_group_ids"));
        SPECIAL_PATTERNS.put(ResourceType.IAM_ROLE, List.of("role", "role_arn", "iam_role_arn"));
        SPECIAL_PATTERNS.put(ResourceType.S3_BUCKET, List.of("bucket", "s3_bucket", "bucket_name"));
        SPECIAL_PATTERNS.put(ResourceType.LAMBDA_FUNCTION, List.of("function_name", "lambda_function_name", "function_arn"));
        SPECIAL_PATTERNS.put(ResourceType.API_GATEWAY_REST_API, List.of("rest_api_id", "api_id"));
        SPECIAL_PATTERNS.put(ResourceType.DYNAMODB_TABLE, List.of("table_name", "dynamodb_table_name"));
    }

    private final SchemaProvider schemaProvider;

    /** Returns a new snapshot with references applied; the input is not modified. */
    public GraphSnapshot infer(GraphSnapshot snapshot) {
        GraphSnapshot working = GraphSnapshot.of(snapshot.blocks(), snapshot.connections(), snapshot.variables());
        for (Connection connection : working.connections()) {
            try {
                apply(connection.getSourceBlock(), connection.getTargetBlock());
            } catch (RuntimeException e) {
                log.warn("Could not infer reference for connection {}: {}", connection.getId(), e.getMessage());
            }
        }
        return working;
    }

    void apply(Block source, Block target) {
        String sourceRef = sourceReference(source);
        Optional<TerraformProperty> match = findReferenceProperty(schemaProvider.getPropertiesForBlock(target), source);

        if (match.isPresent()) {
            TerraformProperty property = match.get();
            String expression = sourceRef + "." + determineSourceAttribute(property.name());
            if (property.type() == PropertyType.ARRAY || property.type() == PropertyType.SET) {
                target.setProperty(property.name(), appendToList(target.getProperty(property.name()), expression));
            } else {
                target.setProperty(property.name(), expression);
            }
            log.debug("Connection {} -> {} resolved through {}", source.getId(), target.getId(), property.name());
        } else {
            target.setProperty(DEPENDS_ON, appendToList(target.getProperty(DEPENDS_ON), sourceRef));
            log.debug("Connection {} -> {} recorded in depends_on", source.getId(), target.getId());
        }
    }

    public static String sourceReference(Block source) {
        return source.getTypeName() + "." + TerraformNames.formatResourceName(source.getContent());
    }

    Optional<TerraformProperty> findReferenceProperty(List<TerraformProperty> properties, Block source) {
        String kind = kindName(source);
        String compact = kind.replace("_", "");
        List<String> patterns = new ArrayList<>(List.of(kind + "_id", compact + "id", kind + "_arn", compact + "arn"));
        patterns.addAll(SPECIAL_PATTERNS.getOrDefault(source.getResourceType(), List.of()));

        Optional<TerraformProperty> direct = properties.stream()
                .filter(p -> p.type() != PropertyType.BLOCK)
                .filter(p -> {
                    String name = p.name().toLowerCase(Locale.ROOT);
                    return patterns.stream().anyMatch(pattern -> name.equals(pattern) || name.endsWith("_" + pattern));
                })
                .findFirst();
        if (direct.isPresent()) return direct;

        return properties.stream()
                .filter(p -> p.type() != PropertyType.BLOCK)
                .filter(p -> {
                    String name = p.name().toLowerCase(Locale.ROOT);
                    return name.contains(kind) || name.contains(compact);
                })
                .findFirst();
    }

    // Catalog kinds use the enum name; uncatalogued types fall back to the type name without its prefix.
    private static String kindName(Block source) {
        if (source.getResourceType() != ResourceType.UNKNOWN) {
            return source.getResourceType().name().toLowerCase(Locale.ROOT);
        }
        String typeName = source.getTypeName().toLowerCase(Locale.ROOT);
        return typeName.startsWith(TerraformExpressions.RESOURCE_PREFIX)
                ? typeName.substring(TerraformExpressions.RESOURCE_PREFIX.length())
                : typeName;
    }

    static String determineSourceAttribute(String propertyName) {
        String name = propertyName.toLowerCase(Locale.ROOT);
        if (name.endsWith("_arn") || name.endsWith("arn")) return "arn";
        if (name.endsWith("_name") || name.endsWith("name")) return "name";
        if (name.equals("bucket") || name.equals("s3_bucket")) return "bucket";
        if (name.equals("role")) return "arn";
        return "id";
    }

    /** Appends {@code entry} to a {@code [a, b]} list value unless already present. */
    static String appendToList(String current, String entry) {
        List<String> entries = new ArrayList<>();
        if (current != null && !current.isBlank()) {
            String encoded = InterpolationCodec.encode(current.trim());
            String inner = TerraformExpressions.isListShaped(encoded) ? encoded.substring(1, encoded.length() - 1) : encoded;
            TerraformExpressions.splitTopLevel(inner, ',').forEach(e -> entries.add(InterpolationCodec.decode(e)));
        }
        if (!entries.contains(entry)) entries.add(entry);
        return "[" + String.join(", ", entries) + "]";
    }
}
