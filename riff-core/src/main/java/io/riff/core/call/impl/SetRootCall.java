package io.riff.core.call.impl;

import io.riff.core.call.CallArguments;
import io.riff.core.call.CallKind;
import io.riff.core.call.CodeBuildException;
import io.riff.core.call.SessionCall;
import io.riff.core.session.PitchClass;
import io.riff.core.session.Session;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class SetRootCall implements SessionCall {

    @Override
    public CallKind kind() {
        return CallKind.SET_ROOT;
    }

    @Override
    public String description() {
        return "Set the root note (key) for all players.";
    }

    @Override
    public Map<String, Object> schema() {
        List<String> roots = Arrays.stream(PitchClass.values()).map(PitchClass::symbol).toList();
        return CallSchemas.object(Map.of("root", CallSchemas.oneOf("Root note name", roots)), List.of("root"));
    }

    @Override
    public void validate(CallArguments arguments, Session session) throws CodeBuildException {
        parse(arguments);
    }

    @Override
    public Set<String> mutate(Session session, CallArguments arguments, String code) throws CodeBuildException {
        session.setRoot(parse(arguments));
        return Set.of();
    }

    private PitchClass parse(CallArguments arguments) throws CodeBuildException {
        String value = arguments.requireString("root");
        return PitchClass.fromSymbol(value)
            .orElseThrow(() -> new CodeBuildException("Unknown root note: " + value));
    }
}
