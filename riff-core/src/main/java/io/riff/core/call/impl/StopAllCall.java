package io.riff.core.call.impl;

import io.riff.core.call.CallArguments;
import io.riff.core.call.CallKind;
import io.riff.core.call.SessionCall;
import io.riff.core.session.Layer;
import io.riff.core.session.Session;
import java.util.LinkedHashSet;
import java.util.Set;

public final class StopAllCall implements SessionCall {

    @Override
    public CallKind kind() {
        return CallKind.STOP_ALL;
    }

    @Override
    public String description() {
        return "Stop all music and clear every player. Use when the user wants silence or a fresh start.";
    }

    @Override
    public Set<String> mutate(Session session, CallArguments arguments, String code) {
        Set<String> stopped = new LinkedHashSet<>();
        for (Layer layer : session.layers()) {
            stopped.add(layer.name());
        }
        session.clearAll();
        return stopped;
    }
}
