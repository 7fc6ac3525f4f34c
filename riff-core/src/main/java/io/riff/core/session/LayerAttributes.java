package io.riff.core.session;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record LayerAttributes(
    String notes,
    String pattern,
    String dur,
    Double amp,
    Integer oct,
    Map<String, Object> effects
) {
    public LayerAttributes {
        effects = effects == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(effects));
    }

    public static LayerAttributes empty() {
        return new LayerAttributes(null, null, null, null, null, Map.of());
    }

    public LayerAttributes merge(Double newAmp, Integer newOct, Map<String, Object> newEffects) {
        Map<String, Object> mergedEffects = new LinkedHashMap<>(effects);
        if (newEffects != null) {
            mergedEffects.putAll(newEffects);
        }
        return new LayerAttributes(
            notes,
            pattern,
            dur,
            newAmp == null ? amp : newAmp,
            newOct == null ? oct : newOct,
            mergedEffects
        );
    }
}
