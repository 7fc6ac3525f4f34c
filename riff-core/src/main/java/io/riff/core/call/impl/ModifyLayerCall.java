package io.riff.core.call.impl;

import io.riff.core.call.CallArguments;
import io.riff.core.call.CallKind;
import io.riff.core.call.CodeBuildException;
import io.riff.core.call.SessionCall;
import io.riff.core.session.Session;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class ModifyLayerCall implements SessionCall {

    @Override
    public CallKind kind() {
        return CallKind.MODIFY_LAYER;
    }

    @Override
    public String description() {
        return "Change an existing layer's amplitude, octave or effects without changing its core pattern.";
    }

    @Override
    public Map<String, Object> schema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("player", CallSchemas.string("Player name to modify"));
        properties.put("amp", CallSchemas.number("New amplitude"));
        properties.put("oct", CallSchemas.integer("New octave"));
        properties.put("effects", CallSchemas.effects("Effects to add or change", Map.of(
            "room", CallSchemas.number("Reverb amount"),
            "lpf", CallSchemas.integer("Low-pass filter frequency"),
            "hpf", CallSchemas.integer("High-pass filter frequency"),
            "vib", CallSchemas.number("Vibrato depth"),
            "pan", CallSchemas.number("Stereo pan"),
            "chop", CallSchemas.integer("Chop into pieces")
        )));
        return CallSchemas.object(properties, List.of("player"));
    }

    @Override
    public Set<String> mutate(Session session, CallArguments arguments, String code) throws CodeBuildException {
        String player = arguments.requireString("player");
        boolean updated = session.updateLayer(
            player,
            arguments.optionalDouble("amp").orElse(null),
            arguments.optionalInteger("oct").orElse(null),
            arguments.effects("effects"),
            code
        ).isPresent();
        return updated ? Set.of(player) : Set.of();
    }
}
