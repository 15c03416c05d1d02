package com.clipfeed.sampler.savedfilter;

import java.util.Locale;

public enum SavedFilterMode {
    SCENES,
    SCENE_MARKERS;

    public static SavedFilterMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
