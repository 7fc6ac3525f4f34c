package io.riff.core.call.impl;

import io.riff.core.call.CallArguments;
import io.riff.core.call.CallKind;
import io.riff.core.call.CodeBuildException;
import io.riff.core.call.SessionCall;
import io.riff.core.session.MusicScale;
import io.riff.core.session.Session;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class SetScaleCall implements SessionCall {

    @Override
    public CallKind kind() {
        return CallKind.SET_SCALE;
    }

    @Override
    public String description() {
        return "Set the musical scale for all players.";
    }

    @Override
    public Map<String, Object> schema() {
        List<String> scales = Arrays.stream(MusicScale.values()).map(MusicScale::runtimeName).toList();
        return CallSchemas.object(Map.of("scale", CallSchemas.oneOf("Scale name", scales)), List.of("scale"));
    }

    @Override
    public void validate(CallArguments arguments, Session session) throws CodeBuildException {
        parse(arguments);
    }

    @Override
    public Set<String> mutate(Session session, CallArguments arguments, String code) throws CodeBuildException {
        session.setScale(parse(arguments));
        return Set.of();
    }

    private MusicScale parse(CallArguments arguments) throws CodeBuildException {
        String value = arguments.requireString("scale");
        return MusicScale.fromRuntimeName(value)
            .orElseThrow(() -> new CodeBuildException("Unknown scale: " + value));
    }
}
