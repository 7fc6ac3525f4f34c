package io.riff.core.session;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;

public enum MusicScale {
    MAJOR("major"),
    MINOR("minor"),
    DORIAN("dorian"),
    PHRYGIAN("phrygian"),
    LYDIAN("lydian"),
    MIXOLYDIAN("mixolydian"),
    LOCRIAN("locrian"),
    PENTATONIC("pentatonic"),
    MINOR_PENTATONIC("minorPentatonic"),
    BLUES("blues"),
    HARMONIC_MINOR("harmonicMinor"),
    MELODIC_MINOR("melodicMinor"),
    WHOLE("whole"),
    CHROMATIC("chromatic"),
    EGYPTIAN("egyptian"),
    JAPANESE("japanese"),
    CHINESE("chinese");

    private final String runtimeName;

    MusicScale(String runtimeName) {
        this.runtimeName = runtimeName;
    }

    @JsonValue
    public String runtimeName() {
        return runtimeName;
    }

    public static Optional<MusicScale> fromRuntimeName(String value) {
        for (MusicScale scale : values()) {
            if (scale.runtimeName.equals(value)) {
                return Optional.of(scale);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static MusicScale fromJson(String value) {
        return fromRuntimeName(value)
            .orElseThrow(() -> new IllegalArgumentException("Unknown scale: " + value));
    }
}
