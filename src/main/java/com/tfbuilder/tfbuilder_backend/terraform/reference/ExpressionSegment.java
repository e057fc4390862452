package com.tfbuilder.tfbuilder_backend.terraform.reference;

import java.util.List;

/**
 * One piece of an analyzed property value. {@code originalText} is the exact
 * source text of the piece, so concatenating the segments of a value gives
 * the value back. {@code interpolated} is set for pieces that came from a
 * {@code ${...}} span.
 */
public interface ExpressionSegment {

    String originalText();

    boolean interpolated();

    record Text(String originalText) implements ExpressionSegment {
        @Override
        public boolean interpolated() {
            return false;
        }
    }

    record VariableReference(String name, String originalText, boolean interpolated) implements ExpressionSegment {}

    /** {@code type.name} or {@code type.name.attribute}; attribute is null when absent. */
    record ResourceReference(String resourceType,
                             String resourceName,
                             String attribute,
                             String originalText,
                             boolean interpolated) implements ExpressionSegment {

        public ResourceAddress address() {
            return new ResourceAddress(resourceType, resourceName);
        }
    }

    /** A call; each argument is analyzed on its own, in order. */
    record FunctionCall(String functionName,
                        String arguments,
                        List<ExpressionSegment> argumentSegments,
                        String originalText,
                        boolean interpolated) implements ExpressionSegment {

        public FunctionCall {
            argumentSegments = List.copyOf(argumentSegments);
        }
    }

    /** Anything else: operators, conditionals, locals, splats. */
    record Expression(String expression, String originalText, boolean interpolated) implements ExpressionSegment {}
}
