package io.riff.core.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SessionTest {

    @Test
    void shouldDeriveIdFromCreationTime() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC);

        Session session = Session.create(clock);

        assertThat(session.id()).isEqualTo("20260301_101530");
        assertThat(session.tempo()).isEqualTo(120);
        assertThat(session.scale()).isEqualTo(MusicScale.MAJOR);
        assertThat(session.root()).isEqualTo(PitchClass.C);
        assertThat(session.layers()).isEmpty();
    }

    @Test
    void shouldPreserveCreatedAtWhenLayerIsReplaced() {
        SteppingClock clock = new SteppingClock(Instant.parse("2026-03-01T10:00:00Z"));
        Session session = Session.create(clock);

        Layer first = session.upsertLayer("p1", "pluck", "p1 >> pluck([0])", "lead", LayerAttributes.empty());
        clock.advance(Duration.ofMinutes(2));
        Layer second = session.upsertLayer("p1", "keys", "p1 >> keys([0])", "keys lead", LayerAttributes.empty());

        assertThat(second.createdAt()).isEqualTo(first.createdAt());
        assertThat(second.modifiedAt()).isAfter(first.modifiedAt());
        assertThat(session.layers()).hasSize(1);
        assertThat(session.layer("p1")).get().extracting(Layer::synth).isEqualTo("keys");
    }

    @Test
    void shouldRejectNamesOutsidePlayerNamespace() {
        Session session = Session.create(Clock.systemUTC());

        assertThatThrownBy(() -> session.upsertLayer("x1", "pluck", "x1 >> pluck([0])", "bad", null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("x1");
        assertThatThrownBy(() -> session.upsertLayer("p10", "pluck", "", "bad", null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldMergeAttributesOnUpdate() {
        Session session = Session.create(Clock.systemUTC());
        session.upsertLayer("b1", "bass", "b1 >> bass([0])", "bass", new LayerAttributes(
            "[0]", null, "1", 0.7, 4, Map.of("room", 0.3)
        ));

        Layer updated = session.updateLayer("b1", 0.5, null, Map.of("lpf", 800), "b1 >> bass([0], amp=0.5)")
            .orElseThrow();

        assertThat(updated.attributes().amp()).isEqualTo(0.5);
        assertThat(updated.attributes().oct()).isEqualTo(4);
        assertThat(updated.attributes().effects()).containsEntry("room", 0.3).containsEntry("lpf", 800);
        assertThat(updated.code()).isEqualTo("b1 >> bass([0], amp=0.5)");
        assertThat(session.updateLayer("p2", 0.5, null, null, null)).isEmpty();
    }

    @Test
    void shouldPickFirstFreeNameForRole() {
        Session session = Session.create(Clock.systemUTC());
        session.upsertLayer("d1", "play", "", "kick", null);
        session.upsertLayer("d2", "play", "", "hats", null);

        assertThat(session.nextAvailableName(PlayerRole.PERCUSSIVE)).isEqualTo("d3");
        assertThat(session.nextAvailableName(PlayerRole.PAD)).isEqualTo("pad1");
    }

    @Test
    void shouldFallBackToFirstNameWhenRoleIsFull() {
        Session session = Session.create(Clock.systemUTC());
        for (String name : PlayerRole.BASS.names()) {
            session.upsertLayer(name, "bass", "", "bass", null);
        }

        assertThat(session.nextAvailableName(PlayerRole.BASS)).isEqualTo("b1");
    }

    @Test
    void shouldRemoveLayerOnlyOnce() {
        Session session = Session.create(Clock.systemUTC());
        session.upsertLayer("d1", "play", "d1 >> play(\"x-o-\")", "kick", null);
        session.upsertLayer("p1", "pluck", "p1 >> pluck([0])", "lead", null);

        assertThat(session.removeLayer("d1")).isTrue();
        List<Layer> afterFirst = session.layers();

        assertThat(session.removeLayer("d1")).isFalse();
        assertThat(session.layers()).isEqualTo(afterFirst);
        assertThat(session.layers()).extracting(Layer::name).containsExactly("p1");
    }

    @Test
    void shouldDescribeSilenceAndActiveLayers() {
        Session session = Session.create(Clock.systemUTC());
        assertThat(session.describe())
            .contains("Tempo: 120 BPM")
            .contains("Scale: major")
            .contains("Root: C")
            .contains("No active layers (silence)");

        session.setTempo(140);
        session.setScale(MusicScale.MINOR_PENTATONIC);
        session.upsertLayer("d1", "play", "d1 >> play(\"x-o-\")", "four on the floor", new LayerAttributes(
            null, "x-o-", "0.5", 0.8, null, Map.of()
        ));

        assertThat(session.describe())
            .contains("Tempo: 140 BPM")
            .contains("Scale: minorPentatonic")
            .contains("- d1 (play): four on the floor | pattern: 'x-o-' | amp: 0.8");
    }

    @Test
    void shouldRenderFullProgramInLayerOrder() {
        Session session = Session.create(Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC));
        session.setRoot(PitchClass.D);
        session.upsertLayer("d1", "play", "d1 >> play(\"x-o-\")", "drums", null);
        session.upsertLayer("p1", "pluck", "p1 >> pluck([0, 2])", "lead", null);

        String program = session.renderProgram();

        assertThat(program).startsWith("# Session: 20260301_101530\n");
        assertThat(program).contains("Clock.bpm = 120\nScale.default = Scale.major\nRoot.default = \"D\"\n");
        assertThat(program.indexOf("d1 >> play")).isLessThan(program.indexOf("p1 >> pluck"));
    }

    @Test
    void shouldRestoreFromSnapshot() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC);
        Session session = Session.create(clock);
        session.setTempo(95);
        session.upsertLayer("pad1", "pads", "pad1 >> pads([0])", "wash", null);
        session.appendHistory(new ConversationTurn(TurnRole.USER, "slow it down", null, List.of(), 3, clock.instant()));
        session.recordExecution("Clock.bpm = 95", true, "");

        Session restored = Session.restore(session.snapshot(), clock);

        assertThat(restored.id()).isEqualTo(session.id());
        assertThat(restored.tempo()).isEqualTo(95);
        assertThat(restored.layers()).extracting(Layer::name).containsExactly("pad1");
        assertThat(restored.history()).hasSize(1);
        assertThat(restored.executions()).extracting(ExecutionRecord::code).containsExactly("Clock.bpm = 95");
    }

    static final class SteppingClock extends Clock {
        private Instant now;

        SteppingClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
