package com.tfbuilder.tfbuilder_backend.model.domain;

import java.util.Arrays;

/** Closed set of composite icons, each mapped to a static asset. */
public enum IconTag {
    CATEGORY("icons/category.svg"),
    API("icons/api.svg"),
    CLOUD("icons/cloud.svg"),
    CODE("icons/code.svg"),
    STORAGE("icons/storage.svg");

    private final String asset;

    IconTag(String asset) {
        this.asset = asset;
    }

    public String getAsset() {
        return asset;
    }

    /** Case-insensitive lookup; unknown tags fall back to CATEGORY. */
    public static IconTag fromTag(String tag) {
        if (tag == null || tag.isBlank()) return CATEGORY;
        return Arrays.stream(values())
                .filter(t -> t.name().equalsIgnoreCase(tag.trim()))
                .findFirst()
                .orElse(CATEGORY);
    }
}
