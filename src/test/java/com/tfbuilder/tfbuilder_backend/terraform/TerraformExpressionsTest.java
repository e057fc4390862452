package com.tfbuilder.tfbuilder_backend.terraform;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TerraformExpressionsTest {

    @Test
    void references() {
        assertThat(TerraformExpressions.isReference("var.region")).isTrue();
        assertThat(TerraformExpressions.isReference("aws_vpc.main.id")).isTrue();
        assertThat(TerraformExpressions.isReference("module.net.vpc_id")).isTrue();
        assertThat(TerraformExpressions.isReference("aws_vpc.main")).isFalse();
        assertThat(TerraformExpressions.isReferenceOrAddress("aws_vpc.main")).isTrue();
        assertThat(TerraformExpressions.isReference("example.com")).isFalse();
        assertThat(TerraformExpressions.isReference("var.n + 1")).isFalse();
    }

    @Test
    void functionCallMustSpanWholeValue() {
        assertThat(TerraformExpressions.isFunctionCall("jsonencode({a = \"(\"})")).isTrue();
        assertThat(TerraformExpressions.isFunctionCall("max(1, 2) + min(3, 4)")).isFalse();
        assertThat(TerraformExpressions.isFunctionCall("not a call")).isFalse();
    }

    @Test
    void numbersRejectNonFiniteText() {
        assertThat(TerraformExpressions.isNumber("42")).isTrue();
        assertThat(TerraformExpressions.isNumber("-1.5e3")).isTrue();
        assertThat(TerraformExpressions.isNumber("NaN")).isFalse();
        assertThat(TerraformExpressions.isNumber("Infinity")).isFalse();
    }

    @Test
    void quoteEscapesLiteralPartsOnly() {
        assertThat(TerraformExpressions.quote("say \"hi\"")).isEqualTo("\"say \\\"hi\\\"\"");
        assertThat(TerraformExpressions.quote("${lookup(var.m, \"k\")}-x")).isEqualTo("\"${lookup(var.m, \"k\")}-x\"");
        assertThat(TerraformExpressions.quote("line\nbreak")).isEqualTo("\"line\\nbreak\"");
    }

    @Test
    void splitTopLevelIgnoresNestedAndQuotedSeparators() {
        String encoded = InterpolationCodec.encode("a, \"b,c\", [d, e], f(g, h), ${x(1, 2)}");

        assertThat(TerraformExpressions.splitTopLevel(encoded, ',')).hasSize(5);
    }

    @Test
    void resourceNamesAreFormatted() {
        assertThat(TerraformNames.formatResourceName("Main VPC")).isEqualTo("main_vpc");
        assertThat(TerraformNames.formatResourceName("public-subnet")).isEqualTo("public_subnet");
        assertThat(TerraformNames.formatResourceName("  --weird__Name!! ")).isEqualTo("weird_name");
    }
}
