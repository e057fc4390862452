package com.tfbuilder.tfbuilder_backend.terraform;

import java.util.Locale;

public final class TerraformNames {

    private TerraformNames() {}

    /** "Main VPC" → "main_vpc". Used for resource labels, references and output names. */
    public static String formatResourceName(String content) {
        if (content == null) return "";
        String name = content.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9_]", "_")
                .replaceAll("_+", "_");
        int start = 0;
        int end = name.length();
        while (start < end && name.charAt(start) == '_') start++;
        while (end > start && name.charAt(end - 1) == '_') end--;
        return name.substring(start, end);
    }
}
