package com.scorebot.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Factor families a metric rolls up into.
 * SENTIMENT is scored and stored, but never contributes to the composite.
 */
public enum Category {
    MOMENTUM("momentum", true),
    VALUE("value", true),
    QUALITY("quality", true),
    GROWTH("growth", true),
    STABILITY("stability", true),
    POSITIONING("positioning", true),
    SENTIMENT("sentiment", false);

    private static final Set<Category> COMPOSITE = EnumSet.of(
            MOMENTUM, VALUE, QUALITY, GROWTH, STABILITY, POSITIONING
    );

    private final String label;
    private final boolean compositeEligible;

    Category(String label, boolean compositeEligible) {
        this.label = label;
        this.compositeEligible = compositeEligible;
    }

    public String label() {
        return label;
    }

    public boolean compositeEligible() {
        return compositeEligible;
    }

    public static Set<Category> compositeCategories() {
        return EnumSet.copyOf(COMPOSITE);
    }

    public static Category fromLabel(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        String target = raw.trim().toLowerCase(Locale.ROOT);
        for (Category category : values()) {
            if (category.label.equals(target)) {
                return category;
            }
        }
        return null;
    }
}
