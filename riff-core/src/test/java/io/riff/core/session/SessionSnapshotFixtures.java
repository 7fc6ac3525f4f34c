package io.riff.core.session;

import io.riff.core.call.CallRecord;
import io.riff.core.call.CallResult;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

final class SessionSnapshotFixtures {

    private SessionSnapshotFixtures() {
    }

    static SessionSnapshot sample(String startedAt) {
        Clock clock = Clock.fixed(Instant.parse(startedAt), ZoneOffset.UTC);
        Session session = Session.create(clock);
        session.setTempo(140);
        session.setScale(MusicScale.MINOR);
        session.setRoot(PitchClass.F_SHARP);
        session.upsertLayer("d1", "play", "d1 >> play(\"x-o-\", dur=0.5, amp=0.8)", "driving kick", new LayerAttributes(
            null, "x-o-", "0.5", 0.8, null, Map.of("room", 0.2)
        ));
        CallRecord call = new CallRecord(
            "call_1",
            "play_drums",
            Map.of("player", "d1", "pattern", "x-o-"),
            CallResult.success("d1 >> play(\"x-o-\", dur=0.5, amp=0.8)", "", List.of("d1"))
        );
        session.appendHistory(new ConversationTurn(TurnRole.USER, "give me drums", null, List.of(), 3, clock.instant()));
        session.appendHistory(new ConversationTurn(TurnRole.AGENT, "Drums are in.", "kick first", List.of(call), 5, clock.instant()));
        session.recordExecution("d1 >> play(\"x-o-\", dur=0.5, amp=0.8)", true, "");
        return session.snapshot();
    }
}
