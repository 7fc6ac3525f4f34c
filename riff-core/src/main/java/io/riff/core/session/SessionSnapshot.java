package io.riff.core.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionSnapshot(
    String sessionId,
    Instant createdAt,
    int tempo,
    MusicScale scale,
    PitchClass root,
    List<Layer> layers,
    List<ConversationTurn> turns,
    List<ExecutionRecord> executions
) {
    public SessionSnapshot {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        createdAt = createdAt == null ? Instant.EPOCH : createdAt;
        tempo = tempo <= 0 ? Session.DEFAULT_TEMPO : tempo;
        scale = scale == null ? MusicScale.MAJOR : scale;
        root = root == null ? PitchClass.C : root;
        layers = layers == null ? List.of() : List.copyOf(layers);
        turns = turns == null ? List.of() : List.copyOf(turns);
        executions = executions == null ? List.of() : List.copyOf(executions);
    }
}
