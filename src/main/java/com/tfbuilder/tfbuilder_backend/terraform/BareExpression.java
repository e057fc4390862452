package com.tfbuilder.tfbuilder_backend.terraform;

/** Unquoted attribute value kept as written: literals, references, calls, operators. */
public record BareExpression(String text) {

    public boolean isNull() {
        return "null".equals(text);
    }

    @Override
    public String toString() {
        return text;
    }
}
