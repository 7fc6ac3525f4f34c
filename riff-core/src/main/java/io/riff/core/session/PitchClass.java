package io.riff.core.session;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;

public enum PitchClass {
    C("C"),
    C_SHARP("C#"),
    D("D"),
    D_SHARP("D#"),
    E("E"),
    F("F"),
    F_SHARP("F#"),
    G("G"),
    G_SHARP("G#"),
    A("A"),
    A_SHARP("A#"),
    B("B"),
    D_FLAT("Db"),
    E_FLAT("Eb"),
    G_FLAT("Gb"),
    A_FLAT("Ab"),
    B_FLAT("Bb");

    private final String symbol;

    PitchClass(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String symbol() {
        return symbol;
    }

    public static Optional<PitchClass> fromSymbol(String value) {
        for (PitchClass pitch : values()) {
            if (pitch.symbol.equals(value)) {
                return Optional.of(pitch);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static PitchClass fromJson(String value) {
        return fromSymbol(value)
            .orElseThrow(() -> new IllegalArgumentException("Unknown root: " + value));
    }
}
