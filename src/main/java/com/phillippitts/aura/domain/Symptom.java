package com.phillippitts.aura.domain;

import java.util.List;
import java.util.Objects;

/**
 * A single extracted symptom with its free-text qualifiers (severity, appearance, duration).
 *
 * @param name       symptom name as reported, e.g. "rash"
 * @param qualifiers descriptors attached to the symptom, in extraction order (never null)
 */
public record Symptom(String name, List<String> qualifiers) {

    public Symptom {
        Objects.requireNonNull(name, "name");
        qualifiers = qualifiers == null ? List.of() : List.copyOf(qualifiers);
    }

    public static Symptom of(String name, String... qualifiers) {
        return new Symptom(name, List.of(qualifiers));
    }
}
