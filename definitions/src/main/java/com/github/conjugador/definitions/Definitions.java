package com.github.conjugador.definitions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Verb descriptions keyed by infinitive, along with the infinitives that got none.
 */
public final class Definitions {
    private final Map<String, String> descriptions;
    private final List<String> defined;
    private final List<String> undefined;

    Definitions(Map<String, String> descriptions, List<String> infinitives) {
        this.descriptions = Collections.unmodifiableMap(new LinkedHashMap<>(descriptions));
        this.defined = infinitives.stream().filter(descriptions::containsKey).toList();
        this.undefined = infinitives.stream().filter(inf -> !descriptions.containsKey(inf)).toList();
    }

    /**
     * Descriptions in the order their keys were first met in the dump.
     */
    public Map<String, String> getDescriptions() {
        return descriptions;
    }

    public Optional<String> getDescription(String infinitive) {
        return Optional.ofNullable(descriptions.get(Objects.requireNonNull(infinitive)));
    }

    /**
     * Infinitives with a description, in infinitive list order.
     */
    public List<String> getDefinedInfinitives() {
        return defined;
    }

    /**
     * Infinitives without a description, in infinitive list order.
     */
    public List<String> getUndefinedInfinitives() {
        return undefined;
    }

    public int size() {
        return descriptions.size();
    }

    @Override
    public String toString() {
        return String.format("[definitions=%d,without=%d]", descriptions.size(), undefined.size());
    }
}
