package io.riff.core.call.impl;

import io.riff.core.call.CallArguments;
import io.riff.core.call.CallKind;
import io.riff.core.call.SessionCall;
import io.riff.core.session.Session;
import java.util.Set;

public final class GetSessionStateCall implements SessionCall {

    @Override
    public CallKind kind() {
        return CallKind.GET_SESSION_STATE;
    }

    @Override
    public String description() {
        return "Get the current state of the music session: tempo, scale, root and every active layer.";
    }

    @Override
    public Set<String> mutate(Session session, CallArguments arguments, String code) {
        return Set.of();
    }

    @Override
    public boolean producesCode() {
        return false;
    }
}
