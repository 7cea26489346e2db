package com.svarx.learning;

import java.util.Locale;
import java.util.Optional;

/**
 * How the user reacted to a suggestion, with the feedback weight each reaction carries.
 */
public enum InteractionType {
    SELECTED("selected", 1.0),
    THUMBS_UP("thumbs_up", 0.7),
    THUMBS_DOWN("thumbs_down", -0.5);

    private final String wireName;
    private final double weight;

    InteractionType(String wireName, double weight) {
        this.wireName = wireName;
        this.weight = weight;
    }

    public String wireName() {
        return wireName;
    }

    public double weight() {
        return weight;
    }

    public static Optional<InteractionType> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (InteractionType type : values()) {
            if (type.wireName.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
