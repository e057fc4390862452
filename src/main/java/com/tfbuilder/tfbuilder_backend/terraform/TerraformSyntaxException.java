package com.tfbuilder.tfbuilder_backend.terraform;

/** Malformed document; line and column refer to the interpolation-encoded text. */
public class TerraformSyntaxException extends RuntimeException {

    private final int line;
    private final int column;

    public TerraformSyntaxException(String message, int line, int column) {
        super(message + " at line " + line + ", column " + column);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
