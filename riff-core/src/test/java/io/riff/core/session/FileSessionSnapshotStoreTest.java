package io.riff.core.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSessionSnapshotStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldRoundTripSnapshotThroughJsonFile() throws Exception {
        FileSessionSnapshotStore store = new FileSessionSnapshotStore(tempDir.resolve("sessions"));
        SessionSnapshot snapshot = SessionSnapshotFixtures.sample("2026-03-01T10:15:30Z");

        store.save(snapshot);
        SessionSnapshot loaded = store.load(snapshot.sessionId()).orElseThrow();

        assertThat(Files.exists(tempDir.resolve("sessions/20260301_101530.json"))).isTrue();
        assertThat(loaded.tempo()).isEqualTo(140);
        assertThat(loaded.scale()).isEqualTo(MusicScale.MINOR);
        assertThat(loaded.root()).isEqualTo(PitchClass.F_SHARP);
        assertThat(loaded.layers()).hasSize(1);
        assertThat(loaded.layers().get(0).attributes().pattern()).isEqualTo("x-o-");
        assertThat(loaded.turns()).hasSize(2);
        assertThat(loaded.turns().get(1).calls().get(0).result().affectedLayers()).containsExactly("d1");
        assertThat(loaded.turns().get(0).reasoning()).isNull();
        assertThat(loaded.executions()).hasSize(1);
    }

    @Test
    void shouldListSavedSessionsAndReturnEmptyForUnknownId() throws Exception {
        FileSessionSnapshotStore store = new FileSessionSnapshotStore(tempDir.resolve("sessions"));
        assertThat(store.list()).isEmpty();

        store.save(SessionSnapshotFixtures.sample("2026-03-02T08:00:00Z"));
        store.save(SessionSnapshotFixtures.sample("2026-03-01T08:00:00Z"));

        assertThat(store.list()).containsExactly("20260301_080000", "20260302_080000");
        assertThat(store.load("20990101_000000")).isEmpty();
    }

    @Test
    void shouldRejectIdsThatEscapeTheDirectory() {
        FileSessionSnapshotStore store = new FileSessionSnapshotStore(tempDir.resolve("sessions"));

        assertThatThrownBy(() -> store.load("../secrets"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
