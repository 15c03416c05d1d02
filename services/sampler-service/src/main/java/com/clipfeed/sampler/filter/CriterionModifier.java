package com.clipfeed.sampler.filter;

import java.util.Locale;

public enum CriterionModifier {
    INCLUDES,
    INCLUDES_ALL,
    EXCLUDES,
    EQUALS,
    NOT_EQUALS,
    IS_NULL,
    NOT_NULL;

    public boolean requiresIds() {
        return this != IS_NULL && this != NOT_NULL;
    }

    public static CriterionModifier fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return CriterionModifier.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
