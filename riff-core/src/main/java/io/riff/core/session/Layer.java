package io.riff.core.session;

import java.time.Instant;
import java.util.Objects;

public record Layer(
    String name,
    String synth,
    String code,
    String description,
    LayerState state,
    Instant createdAt,
    Instant modifiedAt,
    LayerAttributes attributes
) {
    public Layer {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        synth = synth == null ? "" : synth;
        code = code == null ? "" : code;
        description = description == null ? "" : description;
        state = state == null ? LayerState.ACTIVE : state;
        modifiedAt = modifiedAt == null ? createdAt : modifiedAt;
        attributes = attributes == null ? LayerAttributes.empty() : attributes;
    }
}
