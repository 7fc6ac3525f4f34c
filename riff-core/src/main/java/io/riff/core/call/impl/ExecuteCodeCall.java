package io.riff.core.call.impl;

import io.riff.core.call.CallArguments;
import io.riff.core.call.CallKind;
import io.riff.core.call.CodeBuildException;
import io.riff.core.call.SessionCall;
import io.riff.core.session.Session;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class ExecuteCodeCall implements SessionCall {

    @Override
    public CallKind kind() {
        return CallKind.EXECUTE_CODE;
    }

    @Override
    public String description() {
        return "Execute raw FoxDot code for patterns or features the other calls do not cover.";
    }

    @Override
    public Map<String, Object> schema() {
        return CallSchemas.object(
            Map.of(
                "code", CallSchemas.string("Raw FoxDot Python code to execute"),
                "description", CallSchemas.string("What the code does")
            ),
            List.of("code", "description")
        );
    }

    @Override
    public void validate(CallArguments arguments, Session session) throws CodeBuildException {
        arguments.requireString("code");
    }

    @Override
    public Set<String> mutate(Session session, CallArguments arguments, String code) {
        return Set.of();
    }
}
