package com.phillippitts.aura.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Urgency category parsed from the report trailer line.
 */
public enum TriageLevel {
    ROUTINE("Routine"),
    PRIORITY("Priority"),
    URGENT("Urgent"),
    UNDETERMINED("Undetermined");

    private final String label;

    TriageLevel(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Case-insensitive lookup by label. {@code UNDETERMINED} is not a parseable value.
     */
    public static Optional<TriageLevel> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (TriageLevel level : values()) {
            if (level != UNDETERMINED && level.label.toLowerCase(Locale.ROOT).equals(v)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return label;
    }
}
