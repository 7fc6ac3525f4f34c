package io.riff.core.call.impl;

import io.riff.core.call.CallArguments;
import io.riff.core.call.CallKind;
import io.riff.core.call.CodeBuildException;
import io.riff.core.call.SessionCall;
import io.riff.core.session.Session;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class SetTempoCall implements SessionCall {
    public static final int MIN_BPM = 40;
    public static final int MAX_BPM = 200;

    @Override
    public CallKind kind() {
        return CallKind.SET_TEMPO;
    }

    @Override
    public String description() {
        return "Set the tempo in beats per minute. Typical ranges: ambient 60-90, hip-hop 85-115, "
            + "house 120-130, techno 125-150, drum & bass 160-180.";
    }

    @Override
    public Map<String, Object> schema() {
        return CallSchemas.object(
            Map.of("bpm", CallSchemas.integer("Tempo in beats per minute (" + MIN_BPM + "-" + MAX_BPM + ")")),
            List.of("bpm")
        );
    }

    @Override
    public void validate(CallArguments arguments, Session session) throws CodeBuildException {
        int bpm = arguments.requireInteger("bpm");
        if (bpm < MIN_BPM || bpm > MAX_BPM) {
            throw new CodeBuildException("Tempo must be between " + MIN_BPM + " and " + MAX_BPM + " BPM, got " + bpm);
        }
    }

    @Override
    public Set<String> mutate(Session session, CallArguments arguments, String code) throws CodeBuildException {
        session.setTempo(arguments.requireInteger("bpm"));
        return Set.of();
    }
}
