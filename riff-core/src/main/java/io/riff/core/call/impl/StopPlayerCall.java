package io.riff.core.call.impl;

import io.riff.core.call.CallArguments;
import io.riff.core.call.CallKind;
import io.riff.core.call.CodeBuildException;
import io.riff.core.call.SessionCall;
import io.riff.core.session.PlayerRole;
import io.riff.core.session.Session;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class StopPlayerCall implements SessionCall {

    @Override
    public CallKind kind() {
        return CallKind.STOP_PLAYER;
    }

    @Override
    public String description() {
        return "Stop a specific player.";
    }

    @Override
    public Map<String, Object> schema() {
        return CallSchemas.object(
            Map.of("player", CallSchemas.string("Player name to stop (p1-p9, d1-d9, b1-b4, pad1-pad3)")),
            List.of("player")
        );
    }

    @Override
    public void validate(CallArguments arguments, Session session) throws CodeBuildException {
        String player = arguments.requireString("player");
        if (!PlayerRole.isPlayer(player)) {
            throw new CodeBuildException("Unknown player: " + player);
        }
    }

    @Override
    public Set<String> mutate(Session session, CallArguments arguments, String code) throws CodeBuildException {
        String player = arguments.requireString("player");
        session.removeLayer(player);
        return Set.of(player);
    }
}
