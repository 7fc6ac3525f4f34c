package io.riff.core.call.impl;

import io.riff.core.call.CallArguments;
import io.riff.core.call.CallKind;
import io.riff.core.call.CodeBuildException;
import io.riff.core.call.FoxDotCodeBuilder;
import io.riff.core.call.SessionCall;
import io.riff.core.session.LayerAttributes;
import io.riff.core.session.PlayerRole;
import io.riff.core.session.Session;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class PlaySynthCall implements SessionCall {
    private static final List<PlayerRole> ROLES = List.of(PlayerRole.MELODIC, PlayerRole.BASS, PlayerRole.PAD);

    @Override
    public CallKind kind() {
        return CallKind.PLAY_SYNTH;
    }

    @Override
    public String description() {
        return "Play a melodic synthesizer on a player (p1-p9 melody, b1-b4 bass, pad1-pad3 pads). "
            + "Use for melodies, basslines, chord progressions and leads.";
    }

    @Override
    public Map<String, Object> schema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("player", CallSchemas.oneOf("Player name", playerNames()));
        properties.put("synth", CallSchemas.string("Synth name (pluck, bass, keys, piano, pads, blip, saw, ...)"));
        properties.put("notes", CallSchemas.string("Pitch sequence as a list, e.g. '[0, 2, 4, 7]' or '[(0,2,4), 1, 2]' for chords"));
        properties.put("dur", CallSchemas.string("Duration pattern, e.g. '1', '[1, 0.5, 0.5]', '1/4'"));
        properties.put("amp", CallSchemas.number("Amplitude (0.0 to 1.0)"));
        properties.put("oct", CallSchemas.integer("Octave (3-7, default 5)"));
        properties.put("description", CallSchemas.string("Human-readable description of this layer"));
        properties.put("effects", CallSchemas.effects("Optional effects like room, lpf, hpf, vib, slide, chop, pan", Map.of(
            "room", CallSchemas.number("Reverb amount (0-1)"),
            "lpf", CallSchemas.integer("Low-pass filter frequency"),
            "hpf", CallSchemas.integer("High-pass filter frequency"),
            "vib", CallSchemas.number("Vibrato depth"),
            "slide", CallSchemas.number("Pitch slide amount"),
            "chop", CallSchemas.integer("Chop into pieces"),
            "pan", CallSchemas.number("Stereo pan (-1 to 1)")
        )));
        return CallSchemas.object(properties, List.of("player", "synth", "notes", "description"));
    }

    @Override
    public void validate(CallArguments arguments, Session session) throws CodeBuildException {
        String player = arguments.requireString("player");
        if (!PlayerRole.of(player).map(ROLES::contains).orElse(false)) {
            throw new CodeBuildException("Player " + player + " cannot play a synth; use one of " + playerNames());
        }
        arguments.requireString("description");
    }

    @Override
    public Set<String> mutate(Session session, CallArguments arguments, String code) throws CodeBuildException {
        String player = arguments.requireString("player");
        LayerAttributes attributes = new LayerAttributes(
            arguments.requirePitchSequence("notes"),
            null,
            arguments.optionalString("dur").orElse(FoxDotCodeBuilder.DEFAULT_SYNTH_DUR),
            arguments.optionalDouble("amp").orElse(FoxDotCodeBuilder.DEFAULT_SYNTH_AMP),
            arguments.optionalInteger("oct").orElse(FoxDotCodeBuilder.DEFAULT_SYNTH_OCT),
            arguments.effects("effects")
        );
        session.upsertLayer(player, arguments.requireString("synth"), code, arguments.requireString("description"), attributes);
        return Set.of(player);
    }

    private static List<String> playerNames() {
        List<String> names = new ArrayList<>();
        ROLES.forEach(role -> names.addAll(role.names()));
        return names;
    }
}
