package io.riff.core.call;

import static org.assertj.core.api.Assertions.assertThat;

import io.riff.core.sandbox.DryRunSandbox;
import io.riff.core.sandbox.ExecutionResult;
import io.riff.core.sandbox.ExecutionSandbox;
import io.riff.core.session.ExecutionRecord;
import io.riff.core.session.Layer;
import io.riff.core.session.Session;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.Test;

class CallDispatcherTest {

    private final Session session = Session.create(Clock.systemUTC());

    @Test
    void shouldApplyTempoDrumsAndStopAllInOrder() {
        DryRunSandbox sandbox = new DryRunSandbox();
        CallDispatcher dispatcher = dispatcher(sandbox, true);

        CallResult tempo = dispatcher.dispatch("set_tempo", Map.of("bpm", 140), session);
        CallResult drums = dispatcher.dispatch("play_drums", Map.of(
            "player", "d1",
            "pattern", "x-o-",
            "description", "basic beat"
        ), session);

        assertThat(tempo.status()).isEqualTo(CallStatus.SUCCESS);
        assertThat(tempo.code()).isEqualTo("Clock.bpm = 140");
        assertThat(drums.affectedLayers()).containsExactly("d1");
        assertThat(session.tempo()).isEqualTo(140);
        assertThat(session.layer("d1")).get().extracting(Layer::description).isEqualTo("basic beat");

        CallResult stop = dispatcher.dispatch("stop_all", Map.of(), session);

        assertThat(stop.status()).isEqualTo(CallStatus.SUCCESS);
        assertThat(stop.affectedLayers()).containsExactly("d1");
        assertThat(session.layers()).isEmpty();
        assertThat(session.tempo()).isEqualTo(140);
        assertThat(sandbox.executed()).containsExactly(
            "Clock.bpm = 140",
            "d1 >> play(\"x-o-\", dur=0.5, amp=0.8)",
            "Clock.clear()"
        );
        assertThat(session.executions()).extracting(ExecutionRecord::success).containsOnly(true);
    }

    @Test
    void shouldReportUnknownCallWithoutTouchingSession() {
        DryRunSandbox sandbox = new DryRunSandbox();

        CallResult result = dispatcher(sandbox, true).dispatch("play_kazoo", Map.of("player", "p1"), session);

        assertThat(result.status()).isEqualTo(CallStatus.ERROR);
        assertThat(result.failure()).isEqualTo(CallFailure.UNKNOWN_CALL);
        assertThat(result.toMap()).containsEntry("status", "error").containsEntry("error", "Unknown call: play_kazoo");
        assertThat(sandbox.executed()).isEmpty();
        assertThat(session.executions()).isEmpty();
    }

    @Test
    void shouldRejectModifyOfAbsentLayer() {
        CallResult result = dispatcher(new DryRunSandbox(), true)
            .dispatch("modify_layer", Map.of("player", "p1", "amp", 0.5), session);

        assertThat(result.failure()).isEqualTo(CallFailure.INVALID_ARGUMENTS);
        assertThat(result.error()).isEqualTo("Player p1 not found");
        assertThat(result.code()).isNull();
        assertThat(session.layers()).isEmpty();
    }

    @Test
    void shouldRejectOutOfRangeTempoAndWrongPlayerRole() {
        CallDispatcher dispatcher = dispatcher(new DryRunSandbox(), true);

        CallResult tempo = dispatcher.dispatch("set_tempo", Map.of("bpm", 400), session);
        CallResult drumsOnSynth = dispatcher.dispatch("play_synth", Map.of(
            "player", "d1", "synth", "pluck", "notes", "[0]", "description", "x"
        ), session);

        assertThat(tempo.failure()).isEqualTo(CallFailure.INVALID_ARGUMENTS);
        assertThat(session.tempo()).isEqualTo(120);
        assertThat(drumsOnSynth.failure()).isEqualTo(CallFailure.INVALID_ARGUMENTS);
        assertThat(session.layers()).isEmpty();
    }

    @Test
    void shouldOnlyGenerateCodeWhenAutoExecuteIsOff() {
        DryRunSandbox sandbox = new DryRunSandbox();

        CallResult result = dispatcher(sandbox, false).dispatch("set_scale", Map.of("scale", "dorian"), session);

        assertThat(result.status()).isEqualTo(CallStatus.CODE_GENERATED);
        assertThat(result.toMap())
            .containsEntry("status", "code_generated")
            .containsEntry("code", "Scale.default = Scale.dorian")
            .containsEntry("message", "Code generated but not executed");
        assertThat(sandbox.executed()).isEmpty();
        assertThat(session.scale().runtimeName()).isEqualTo("dorian");
    }

    @Test
    void shouldKeepLayerWhenSandboxRejectsCode() {
        ExecutionSandbox failing = new StubSandbox(code -> ExecutionResult.failure(code, "SyntaxError", List.of("p1")));

        CallResult result = dispatcher(failing, true).dispatch("play_synth", Map.of(
            "player", "p1", "synth", "pluck", "notes", "[0, 2]", "description", "lead"
        ), session);

        assertThat(result.status()).isEqualTo(CallStatus.ERROR);
        assertThat(result.failure()).isEqualTo(CallFailure.SANDBOX);
        assertThat(result.error()).isEqualTo("SyntaxError");
        assertThat(result.code()).startsWith("p1 >> pluck(");
        assertThat(session.hasLayer("p1")).isTrue();
        assertThat(session.executions()).extracting(ExecutionRecord::success).containsExactly(false);
    }

    @Test
    void shouldCaptureSandboxExceptions() {
        ExecutionSandbox throwing = new StubSandbox(code -> {
            throw new IllegalStateException("runtime gone");
        });

        CallResult result = dispatcher(throwing, true).dispatch("set_root", Map.of("root", "Eb"), session);

        assertThat(result.failure()).isEqualTo(CallFailure.SANDBOX);
        assertThat(result.error()).isEqualTo("runtime gone");
        assertThat(session.root().symbol()).isEqualTo("Eb");
    }

    @Test
    void shouldAnswerStateQueriesWithoutCodeOrSandbox() {
        DryRunSandbox sandbox = new DryRunSandbox();

        CallResult result = dispatcher(sandbox, true).dispatch("get_session_state", Map.of(), session);

        assertThat(result.status()).isEqualTo(CallStatus.SUCCESS);
        assertThat(result.state()).contains("## Current Music Session State");
        assertThat(result.toMap()).containsOnlyKeys("status", "state");
        assertThat(sandbox.executed()).isEmpty();
    }

    private static CallDispatcher dispatcher(ExecutionSandbox sandbox, boolean autoExecute) {
        return new CallDispatcher(CallRegistry.defaultCatalog(), new FoxDotCodeBuilder(), sandbox, autoExecute);
    }

    private record StubSandbox(Function<String, ExecutionResult> behaviour) implements ExecutionSandbox {
        @Override
        public String name() {
            return "stub";
        }

        @Override
        public void start() {
        }

        @Override
        public ExecutionResult execute(String code, String description) {
            return behaviour.apply(code);
        }

        @Override
        public void close() {
        }
    }
}
