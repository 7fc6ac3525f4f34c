package io.riff.core.session;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Music state of one conversation: global parameters, the layers currently in effect,
 * every finalized turn and every piece of code that was executed. Owned by a single
 * turn engine; not thread-safe.
 */
public final class Session {
    public static final int DEFAULT_TEMPO = 120;

    private static final DateTimeFormatter ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final String id;
    private final Instant createdAt;
    private final Clock clock;
    private final Map<String, Layer> layers = new LinkedHashMap<>();
    private final List<ConversationTurn> history = new ArrayList<>();
    private final List<ExecutionRecord> executions = new ArrayList<>();
    private int tempo = DEFAULT_TEMPO;
    private MusicScale scale = MusicScale.MAJOR;
    private PitchClass root = PitchClass.C;

    public Session(String id, Instant createdAt, Clock clock) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public static Session create(Clock clock) {
        Instant now = clock.instant();
        String id = LocalDateTime.ofInstant(now, clock.getZone()).format(ID_FORMAT);
        return new Session(id, now, clock);
    }

    public String id() {
        return id;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public int tempo() {
        return tempo;
    }

    public MusicScale scale() {
        return scale;
    }

    public PitchClass root() {
        return root;
    }

    public void setTempo(int bpm) {
        this.tempo = bpm;
    }

    public void setScale(MusicScale scale) {
        this.scale = Objects.requireNonNull(scale, "scale must not be null");
    }

    public void setRoot(PitchClass root) {
        this.root = Objects.requireNonNull(root, "root must not be null");
    }

    public Layer upsertLayer(String name, String synth, String code, String description, LayerAttributes attributes) {
        if (!PlayerRole.isPlayer(name)) {
            throw new IllegalArgumentException("Not a player name: " + name);
        }
        Instant now = clock.instant();
        Layer previous = layers.get(name);
        Instant created = previous == null ? now : previous.createdAt();
        Layer layer = new Layer(name, synth, code, description, LayerState.ACTIVE, created, now, attributes);
        layers.put(name, layer);
        return layer;
    }

    /**
     * Merges new amplitude, octave and effects into an existing layer and replaces its code.
     * Returns empty when no layer has that name.
     */
    public Optional<Layer> updateLayer(String name, Double amp, Integer oct, Map<String, Object> effects, String code) {
        Layer current = layers.get(name);
        if (current == null) {
            return Optional.empty();
        }
        Layer updated = new Layer(
            current.name(),
            current.synth(),
            code == null ? current.code() : code,
            current.description(),
            current.state(),
            current.createdAt(),
            clock.instant(),
            current.attributes().merge(amp, oct, effects)
        );
        layers.put(name, updated);
        return Optional.of(updated);
    }

    public boolean removeLayer(String name) {
        return layers.remove(name) != null;
    }

    public void clearAll() {
        layers.clear();
    }

    public Optional<Layer> layer(String name) {
        return Optional.ofNullable(layers.get(name));
    }

    public List<Layer> layers() {
        return List.copyOf(layers.values());
    }

    public boolean hasLayer(String name) {
        return layers.containsKey(name);
    }

    /**
     * First name of {@code role} with no layer, or the role's first name when every slot is taken.
     */
    public String nextAvailableName(PlayerRole role) {
        for (String name : role.names()) {
            if (!layers.containsKey(name)) {
                return name;
            }
        }
        return role.firstName();
    }

    public void appendHistory(ConversationTurn turn) {
        history.add(Objects.requireNonNull(turn, "turn must not be null"));
    }

    public List<ConversationTurn> history() {
        return Collections.unmodifiableList(history);
    }

    public ExecutionRecord recordExecution(String code, boolean success, String output) {
        ExecutionRecord record = new ExecutionRecord(clock.instant(), code, success, output);
        executions.add(record);
        return record;
    }

    public List<ExecutionRecord> executions() {
        return Collections.unmodifiableList(executions);
    }

    public String describe() {
        StringBuilder out = new StringBuilder("## Current Music Session State\n\n");
        out.append("Tempo: ").append(tempo).append(" BPM\n");
        out.append("Scale: ").append(scale.runtimeName()).append('\n');
        out.append("Root: ").append(root.symbol()).append("\n\n");
        if (layers.isEmpty()) {
            out.append("No active layers (silence)");
            return out.toString();
        }
        out.append("Active layers:");
        for (Layer layer : layers.values()) {
            out.append("\n- ").append(layer.name()).append(" (").append(layer.synth()).append("): ")
                .append(layer.description());
            LayerAttributes attributes = layer.attributes();
            if (attributes.notes() != null) {
                out.append(" | notes: ").append(attributes.notes());
            }
            if (attributes.pattern() != null) {
                out.append(" | pattern: '").append(attributes.pattern()).append('\'');
            }
            if (attributes.amp() != null) {
                out.append(" | amp: ").append(attributes.amp());
            }
        }
        return out.toString();
    }

    public String renderProgram() {
        StringBuilder out = new StringBuilder();
        out.append("# Session: ").append(id).append('\n');
        out.append("# Generated: ").append(clock.instant()).append("\n\n");
        out.append("Clock.bpm = ").append(tempo).append('\n');
        out.append("Scale.default = Scale.").append(scale.runtimeName()).append('\n');
        out.append("Root.default = \"").append(root.symbol()).append("\"\n");
        for (Layer layer : layers.values()) {
            out.append("\n# ").append(layer.description()).append('\n');
            out.append(layer.code()).append('\n');
        }
        return out.toString();
    }

    public SessionSnapshot snapshot() {
        return new SessionSnapshot(id, createdAt, tempo, scale, root, layers(), history, executions);
    }

    public static Session restore(SessionSnapshot snapshot, Clock clock) {
        Session session = new Session(snapshot.sessionId(), snapshot.createdAt(), clock);
        session.tempo = snapshot.tempo();
        session.scale = snapshot.scale();
        session.root = snapshot.root();
        for (Layer layer : snapshot.layers()) {
            session.layers.put(layer.name(), layer);
        }
        session.history.addAll(snapshot.turns());
        session.executions.addAll(snapshot.executions());
        return session;
    }
}
