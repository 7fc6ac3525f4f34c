package io.riff.core.call.impl;

import io.riff.core.call.CallArguments;
import io.riff.core.call.CallKind;
import io.riff.core.call.CodeBuildException;
import io.riff.core.call.FoxDotCodeBuilder;
import io.riff.core.call.SessionCall;
import io.riff.core.session.LayerAttributes;
import io.riff.core.session.PlayerRole;
import io.riff.core.session.Session;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class PlayDrumsCall implements SessionCall {

    @Override
    public CallKind kind() {
        return CallKind.PLAY_DRUMS;
    }

    @Override
    public String description() {
        return "Play a drum pattern from sample characters: 'x' kick, 'o' snare, '-' hi-hat, '*' clap. "
            + "[] subdivides, () alternates, {} picks at random.";
    }

    @Override
    public Map<String, Object> schema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("player", CallSchemas.oneOf("Drum player name", PlayerRole.PERCUSSIVE.names()));
        properties.put("pattern", CallSchemas.string("Drum pattern, e.g. 'x-o-x-o-' or 'x--o--x-o-'"));
        properties.put("dur", CallSchemas.string("Duration pattern, e.g. '1', '0.5', '[1, 0.5]'"));
        properties.put("amp", CallSchemas.number("Amplitude (0.0 to 1.0)"));
        properties.put("description", CallSchemas.string("Human-readable description of this drum pattern"));
        properties.put("effects", CallSchemas.effects("Optional effects", Map.of(
            "room", CallSchemas.number("Reverb amount"),
            "sample", CallSchemas.integer("Sample variation number"),
            "rate", CallSchemas.number("Playback rate"),
            "pan", CallSchemas.number("Stereo pan"),
            "lpf", CallSchemas.integer("Low-pass filter frequency"),
            "coarse", CallSchemas.integer("Bit crush amount")
        )));
        return CallSchemas.object(properties, List.of("player", "pattern", "description"));
    }

    @Override
    public void validate(CallArguments arguments, Session session) throws CodeBuildException {
        String player = arguments.requireString("player");
        if (PlayerRole.of(player).filter(role -> role == PlayerRole.PERCUSSIVE).isEmpty()) {
            throw new CodeBuildException("Player " + player + " is not a drum player; use d1-d9");
        }
        arguments.requireString("description");
    }

    @Override
    public Set<String> mutate(Session session, CallArguments arguments, String code) throws CodeBuildException {
        String player = arguments.requireString("player");
        LayerAttributes attributes = new LayerAttributes(
            null,
            arguments.requireString("pattern"),
            arguments.optionalString("dur").orElse(FoxDotCodeBuilder.DEFAULT_DRUM_DUR),
            arguments.optionalDouble("amp").orElse(FoxDotCodeBuilder.DEFAULT_DRUM_AMP),
            null,
            arguments.effects("effects")
        );
        session.upsertLayer(player, FoxDotCodeBuilder.PERCUSSION_SYNTH, code, arguments.requireString("description"), attributes);
        return Set.of(player);
    }
}
