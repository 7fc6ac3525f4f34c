package io.riff.core.agent;

import io.riff.core.call.CallDispatcher;
import io.riff.core.call.CallRecord;
import io.riff.core.call.CallRegistry;
import io.riff.core.call.CallResult;
import io.riff.core.call.CodeBuilder;
import io.riff.core.call.FoxDotCodeBuilder;
import io.riff.core.context.ContextManager;
import io.riff.core.event.TurnEvent;
import io.riff.core.event.TurnEventType;
import io.riff.core.event.TurnListener;
import io.riff.core.model.ChatMessage;
import io.riff.core.model.ToolCall;
import io.riff.core.model.ToolResult;
import io.riff.core.observability.ObservabilityService;
import io.riff.core.provider.Delta;
import io.riff.core.provider.DeltaStream;
import io.riff.core.provider.GenerationRequest;
import io.riff.core.provider.LlmProvider;
import io.riff.core.sandbox.ExecutionResult;
import io.riff.core.sandbox.ExecutionSandbox;
import io.riff.core.session.ConversationTurn;
import io.riff.core.session.Session;
import io.riff.core.session.SessionSnapshot;
import io.riff.core.session.TurnRole;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one conversation: streams a generation for each user message, classifies its deltas
 * into events, resolves calls against the session and issues continuation passes until the
 * model stops calling. Turns never interleave.
 */
public final class TurnEngine implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(TurnEngine.class);

    private final LlmProvider provider;
    private final TurnSettings settings;
    private final CallRegistry registry;
    private final CallDispatcher dispatcher;
    private final ExecutionSandbox sandbox;
    private final ContextManager contextManager;
    private final ObservabilityService observability;
    private final Clock clock;
    private final OutboundConversation outbound = new OutboundConversation();

    private Session session;
    private volatile TurnState state = TurnState.IDLE;
    private int callSequence;

    public TurnEngine(LlmProvider provider, TurnSettings settings, ExecutionSandbox sandbox, ContextManager contextManager) {
        this(
            provider,
            settings,
            CallRegistry.defaultCatalog(),
            new FoxDotCodeBuilder(),
            sandbox,
            contextManager,
            null,
            Clock.systemDefaultZone()
        );
    }

    public TurnEngine(
        LlmProvider provider,
        TurnSettings settings,
        CallRegistry registry,
        CodeBuilder codeBuilder,
        ExecutionSandbox sandbox,
        ContextManager contextManager,
        ObservabilityService observability,
        Clock clock
    ) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.sandbox = Objects.requireNonNull(sandbox, "sandbox must not be null");
        this.contextManager = Objects.requireNonNull(contextManager, "contextManager must not be null");
        this.observability = observability;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.dispatcher = new CallDispatcher(registry, codeBuilder, sandbox, settings.autoExecute());
        this.session = Session.create(clock);
    }

    public TurnResult send(String message, TurnListener listener) {
        return send(message, listener, new CancellationSignal());
    }

    public synchronized TurnResult send(String message, TurnListener listener, CancellationSignal signal) {
        Objects.requireNonNull(message, "message must not be null");
        TurnListener sink = listener == null ? TurnListener.NONE : listener;
        CancellationSignal cancellation = signal == null ? new CancellationSignal() : signal;
        Instant startedAt = clock.instant();

        consolidateIfNeeded();

        int mark = outbound.mark();
        outbound.beginExchange(message);
        audit("turn_started", attributes("message_chars", message.length()));
        state = TurnState.STREAMING;

        TurnRun run = new TurnRun(sink, cancellation);
        try {
            run.execute();
        } catch (TurnCancelledException e) {
            LOG.debug("Turn cancelled in session {}", session.id());
            outbound.rollback(mark);
            state = TurnState.IDLE;
            audit("turn_cancelled", attributes("calls", run.calls.size()));
            return TurnResult.cancelled();
        } catch (IOException | TurnAbortedException | RuntimeException e) {
            String error = describe(e);
            LOG.warn("Turn aborted in session {}: {}", session.id(), error);
            outbound.rollback(mark);
            state = TurnState.ERROR;
            audit("turn_failed", attributes("error", error, "calls", run.calls.size()));
            emitSafely(sink, TurnEventType.ERROR, payload("message", error));
            return TurnResult.failed(error);
        }

        String response = run.response.toString();
        String reasoning = run.reasoning.toString();
        ConversationTurn userTurn = new ConversationTurn(
            TurnRole.USER, message, null, List.of(), contextManager.estimate(message), startedAt
        );
        ConversationTurn agentTurn = new ConversationTurn(
            TurnRole.AGENT, response, reasoning, run.calls, contextManager.estimate(response + reasoning), clock.instant()
        );
        contextManager.recordTurn(agentTurn);
        session.appendHistory(userTurn);
        session.appendHistory(agentTurn);

        state = TurnState.DONE;
        audit("turn_completed", attributes(
            "calls", run.calls.size(),
            "response_chars", response.length(),
            "duration_ms", Duration.between(startedAt, clock.instant()).toMillis(),
            "context_size_estimate", contextManager.totalSize(),
            "size_estimate_approximate", true
        ));
        emit(sink, TurnEventType.DONE, payload(
            "response", response,
            "reasoning", reasoning,
            "calls", run.calls.stream().map(this::callPayload).toList()
        ));
        return TurnResult.completed(response, reasoning, run.calls);
    }

    public TurnState state() {
        return state;
    }

    public synchronized Session session() {
        return session;
    }

    public ContextManager contextManager() {
        return contextManager;
    }

    public TurnSettings settings() {
        return settings;
    }

    public synchronized String currentCode() {
        return session.renderProgram();
    }

    /**
     * Silences the runtime directly, outside any turn, and empties the session's layers.
     */
    public synchronized ExecutionResult stopAll() {
        ExecutionResult result = sandbox.execute("Clock.clear()", "Stop all music");
        session.recordExecution(result.code(), result.success(), result.output());
        session.clearAll();
        return result;
    }

    public synchronized void clearContext() {
        contextManager.clear();
        outbound.clear();
    }

    public synchronized SessionSnapshot snapshot() {
        return session.snapshot();
    }

    /**
     * Replaces the session and rebuilds the context window from the snapshot's turns.
     * The rolling summary is not restored; it is derived again when the window fills up.
     */
    public synchronized void restore(SessionSnapshot snapshot) {
        session = Session.restore(snapshot, clock);
        contextManager.clear();
        outbound.clear();
        for (ConversationTurn turn : snapshot.turns()) {
            if (turn.role() == TurnRole.USER) {
                outbound.beginExchange(turn.content());
                continue;
            }
            contextManager.recordTurn(turn);
            if (outbound.exchanges() > 0 && !turn.content().isBlank()) {
                outbound.append(ChatMessage.assistant(turn.content()));
            }
        }
        outbound.retainLastExchanges(exchangesToKeep());
        state = TurnState.IDLE;
    }

    @Override
    public void close() {
        sandbox.close();
    }

    List<ChatMessage> outboundMessages() {
        return outbound.messages();
    }

    private void consolidateIfNeeded() {
        if (!contextManager.needsConsolidation()) {
            return;
        }
        Optional<String> request = contextManager.buildConsolidationRequest();
        if (request.isEmpty()) {
            return;
        }
        try {
            String summary = provider.complete(settings.model(), List.of(ChatMessage.user(request.get())));
            if (contextManager.applyConsolidation(summary)) {
                outbound.retainLastExchanges(exchangesToKeep());
                LOG.debug("Consolidated context for session {} to ~{} tokens", session.id(), contextManager.totalSize());
                audit("context_consolidated", attributes(
                    "turns_kept", contextManager.turns().size(),
                    "context_size_estimate", contextManager.totalSize(),
                    "size_estimate_approximate", true
                ));
            } else {
                LOG.warn("Consolidation for session {} returned an empty summary; keeping full context", session.id());
                audit("consolidation_failed", attributes("error", "empty summary"));
            }
        } catch (IOException | RuntimeException e) {
            LOG.warn("Consolidation for session {} failed, continuing without it: {}", session.id(), describe(e));
            audit("consolidation_failed", attributes("error", describe(e)));
        }
    }

    private int exchangesToKeep() {
        return contextManager.settings().keepRecentTurns();
    }

    private List<ChatMessage> generationMessages() {
        StringBuilder system = new StringBuilder(settings.systemPrompt());
        system.append("\n\n").append(session.describe());
        String context = contextManager.renderContextForPrompt();
        if (!context.isBlank()) {
            system.append("\n\n").append(context);
        }
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system(system.toString()));
        messages.addAll(outbound.messages());
        return messages;
    }

    private Map<String, Object> callPayload(CallRecord record) {
        return payload(
            "id", record.id(),
            "name", record.name(),
            "arguments", record.arguments(),
            "result", record.result().toMap()
        );
    }

    private void emit(TurnListener sink, TurnEventType type, Map<String, Object> payload) {
        sink.onEvent(new TurnEvent(type, clock.instant(), payload));
    }

    private void emitSafely(TurnListener sink, TurnEventType type, Map<String, Object> payload) {
        try {
            emit(sink, type, payload);
        } catch (RuntimeException e) {
            LOG.warn("Listener failed while handling {}", type, e);
        }
    }

    private void audit(String type, Map<String, Object> attributes) {
        if (observability == null) {
            return;
        }
        Map<String, Object> withSession = new LinkedHashMap<>();
        withSession.put("session_id", session.id());
        withSession.putAll(attributes);
        observability.recordQuietly(type, withSession);
    }

    private static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return map;
    }

    private static Map<String, Object> attributes(Object... keyValues) {
        return payload(keyValues);
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            return e.getClass().getSimpleName();
        }
        return message;
    }

    /**
     * Per-turn accumulators and the delta classification state machine.
     */
    private final class TurnRun {
        private final TurnListener sink;
        private final CancellationSignal cancellation;
        private final StringBuilder reasoning = new StringBuilder();
        private final StringBuilder response = new StringBuilder();
        private final List<CallRecord> calls = new ArrayList<>();
        private boolean reasoningOpen;

        private TurnRun(TurnListener sink, CancellationSignal cancellation) {
            this.sink = sink;
            this.cancellation = cancellation;
        }

        private void execute() throws IOException, TurnAbortedException, TurnCancelledException {
            for (int depth = 0; ; depth++) {
                state = depth == 0 ? TurnState.STREAMING : TurnState.CONTINUING;
                Pass pass = streamPass();
                if (pass.calls.isEmpty()) {
                    if (!pass.narration.isEmpty()) {
                        outbound.append(ChatMessage.assistant(pass.narration.toString()));
                    }
                    return;
                }

                List<ToolCall> issued = new ArrayList<>();
                List<ToolResult> results = new ArrayList<>();
                for (CallRecord record : pass.calls) {
                    issued.add(new ToolCall(record.id(), record.name(), record.arguments()));
                    results.add(new ToolResult(record.id(), record.name(), record.result().toMap()));
                }
                outbound.append(ChatMessage.assistantWithToolCalls(pass.narration.toString(), issued, results));
                outbound.append(ChatMessage.toolResults(results));

                if (depth >= settings.maxContinuationDepth()) {
                    throw new TurnAbortedException("continuation depth exceeded (" + settings.maxContinuationDepth() + ")");
                }
            }
        }

        private Pass streamPass() throws IOException, TurnCancelledException {
            Pass pass = new Pass();
            GenerationRequest request = new GenerationRequest(
                settings.model(),
                generationMessages(),
                registry.declarations(),
                settings.temperature(),
                settings.includeReasoning()
            );
            try (DeltaStream stream = provider.stream(request)) {
                while (true) {
                    checkCancelled();
                    Delta delta = stream.next();
                    if (delta == null) {
                        break;
                    }
                    checkCancelled();
                    switch (delta.kind()) {
                        case REASONING -> onReasoning(delta.text());
                        case NARRATION -> onNarration(pass, delta.text());
                        case CALL -> onCall(pass, delta.call());
                    }
                }
            }
            closeReasoning();
            if (pass.narrationStarted) {
                emit(sink, TurnEventType.NARRATION_ENDED, payload("narration", pass.narration.toString()));
            }
            return pass;
        }

        private void onReasoning(String text) {
            if (!reasoningOpen) {
                reasoningOpen = true;
                state = TurnState.THINKING;
                emit(sink, TurnEventType.REASONING_STARTED, payload());
            }
            reasoning.append(text);
            emit(sink, TurnEventType.REASONING_CHUNK, payload("text", text));
        }

        private void onNarration(Pass pass, String text) {
            closeReasoning();
            if (!pass.narrationStarted) {
                pass.narrationStarted = true;
                emit(sink, TurnEventType.NARRATION_STARTED, payload());
            }
            state = TurnState.RESPONDING;
            pass.narration.append(text);
            response.append(text);
            emit(sink, TurnEventType.NARRATION_CHUNK, payload("text", text));
        }

        private void onCall(Pass pass, ToolCall call) throws TurnCancelledException {
            closeReasoning();
            state = TurnState.DISPATCHING;
            String id = call.id().isBlank() ? "call_" + (++callSequence) : call.id();
            emit(sink, TurnEventType.CALL_STARTED, payload("id", id, "name", call.name()));
            emit(sink, TurnEventType.CALL_REQUESTED, payload("id", id, "name", call.name(), "arguments", call.arguments()));
            checkCancelled();

            CallResult result = dispatcher.dispatch(call.name(), call.arguments(), session);
            CallRecord record = new CallRecord(id, call.name(), call.arguments(), result);
            pass.calls.add(record);
            calls.add(record);
            LOG.debug("Resolved {} -> {}", call.name(), result.status());
            audit(result.succeeded() ? "call_succeeded" : "call_failed", attributes(
                "call", call.name(),
                "status", result.status().wireName(),
                "failure", result.failure().name(),
                "affected_layers", result.affectedLayers()
            ));

            emit(sink, TurnEventType.CALL_RESOLVED, payload("id", id, "name", call.name(), "result", result.toMap()));
            emit(sink, TurnEventType.CALL_ENDED, payload("id", id, "name", call.name()));
        }

        private void closeReasoning() {
            if (!reasoningOpen) {
                return;
            }
            reasoningOpen = false;
            emit(sink, TurnEventType.REASONING_ENDED, payload("reasoning", reasoning.toString()));
        }

        private void checkCancelled() throws TurnCancelledException {
            if (cancellation.isCancelled()) {
                throw new TurnCancelledException();
            }
        }
    }

    private static final class Pass {
        private final StringBuilder narration = new StringBuilder();
        private final List<CallRecord> calls = new ArrayList<>();
        private boolean narrationStarted;
    }

    private static final class TurnCancelledException extends Exception {
        private TurnCancelledException() {
            super("turn cancelled");
        }
    }

    private static final class TurnAbortedException extends Exception {
        private TurnAbortedException(String message) {
            super(message);
        }
    }
}
