package io.riff.core.call;

import io.riff.core.sandbox.ExecutionResult;
import io.riff.core.sandbox.ExecutionSandbox;
import io.riff.core.session.Session;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves one call against a session: catalog lookup, argument checks, code building,
 * session mutation and, when enabled, sandbox execution. Never throws for per-call failures.
 */
public final class CallDispatcher {
    private static final Logger LOG = LoggerFactory.getLogger(CallDispatcher.class);

    private final CallRegistry registry;
    private final CodeBuilder codeBuilder;
    private final ExecutionSandbox sandbox;
    private final boolean autoExecute;

    public CallDispatcher(CallRegistry registry, CodeBuilder codeBuilder, ExecutionSandbox sandbox, boolean autoExecute) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.codeBuilder = Objects.requireNonNull(codeBuilder, "codeBuilder must not be null");
        this.sandbox = Objects.requireNonNull(sandbox, "sandbox must not be null");
        this.autoExecute = autoExecute;
    }

    public CallRegistry registry() {
        return registry;
    }

    public CallResult dispatch(String name, Map<String, Object> rawArguments, Session session) {
        Optional<SessionCall> found = registry.find(name);
        if (found.isEmpty()) {
            LOG.debug("Model requested unknown call {}", name);
            return CallResult.failed(CallFailure.UNKNOWN_CALL, "Unknown call: " + name);
        }
        SessionCall call = found.get();
        if (!call.producesCode()) {
            return CallResult.sessionState(session.describe());
        }

        CallArguments arguments = new CallArguments(rawArguments);
        String code;
        Set<String> affected = new LinkedHashSet<>();
        try {
            call.validate(arguments, session);
            code = codeBuilder.build(call.kind(), arguments, session);
            affected.addAll(call.mutate(session, arguments, code));
        } catch (CodeBuildException e) {
            LOG.debug("Rejected {} {}: {}", name, arguments, e.getMessage());
            return CallResult.failed(CallFailure.INVALID_ARGUMENTS, e.getMessage());
        }

        if (!autoExecute) {
            return CallResult.codeGenerated(code, new ArrayList<>(affected));
        }

        ExecutionResult execution;
        try {
            execution = sandbox.execute(code, description(arguments));
        } catch (RuntimeException e) {
            LOG.warn("Sandbox {} threw while executing {}", sandbox.name(), name, e);
            session.recordExecution(code, false, "");
            return CallResult.sandboxFailed(code, "", String.valueOf(e.getMessage()), new ArrayList<>(affected));
        }
        session.recordExecution(code, execution.success(), execution.output());
        affected.addAll(execution.affectedPlayers());
        if (!execution.success()) {
            LOG.warn("Sandbox {} rejected {}: {}", sandbox.name(), name, execution.error());
            return CallResult.sandboxFailed(code, execution.output(), execution.error(), new ArrayList<>(affected));
        }
        return CallResult.success(code, execution.output(), new ArrayList<>(affected));
    }

    private String description(CallArguments arguments) {
        Object value = arguments.asMap().get("description");
        return value instanceof String text && !text.isBlank() ? text : null;
    }
}
