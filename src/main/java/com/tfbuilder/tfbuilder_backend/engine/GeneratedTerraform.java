package com.tfbuilder.tfbuilder_backend.engine;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** The four generated artifacts plus any per-node rendering warnings. */
public record GeneratedTerraform(
    String provider,
    String main,
    String variables,
    String outputs,
    List<String> warnings
) {
    public static final String PROVIDER_FILE = "provider.tf";
    public static final String MAIN_FILE = "main.tf";
    public static final String VARIABLES_FILE = "variables.tf";
    public static final String OUTPUTS_FILE = "outputs.tf";

    public GeneratedTerraform {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    /** File name to content, in a fixed order. */
    public Map<String, String> files() {
        Map<String, String> files = new LinkedHashMap<>();
        files.put(PROVIDER_FILE, provider);
        files.put(MAIN_FILE, main);
        files.put(VARIABLES_FILE, variables);
        files.put(OUTPUTS_FILE, outputs);
        return files;
    }
}
