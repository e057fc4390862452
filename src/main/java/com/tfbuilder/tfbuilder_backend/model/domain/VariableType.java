package com.tfbuilder.tfbuilder_backend.model.domain;

import java.util.Locale;

public enum VariableType {
    STRING("string"),
    NUMBER("number"),
    BOOL("bool"),
    LIST("list(string)"),
    MAP("map(string)");

    private final String terraformType;

    VariableType(String terraformType) {
        this.terraformType = terraformType;
    }

    /** Type expression emitted in a variable block. */
    public String getTerraformType() {
        return terraformType;
    }

    /**
     * Resolves a declared type such as {@code string}, {@code Number} or
     * {@code list(string)}. Only the token before any parenthesis counts;
     * anything unrecognized is STRING.
     */
    public static VariableType fromDeclaration(String declaration) {
        if (declaration == null) return STRING;
        String token = declaration.trim();
        int paren = token.indexOf('(');
        if (paren >= 0) token = token.substring(0, paren);
        return switch (token.trim().toLowerCase(Locale.ROOT)) {
            case "number" -> NUMBER;
            case "bool" -> BOOL;
            case "list" -> LIST;
            case "map" -> MAP;
            default -> STRING;
        };
    }
}
