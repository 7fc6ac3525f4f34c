package io.riff.cli;

import io.riff.core.agent.TurnEngine;
import io.riff.core.config.model.RiffConfig;
import io.riff.core.session.SessionSnapshot;
import io.riff.core.session.SessionSnapshotStore;
import java.io.IOException;

final class SessionBinding implements AutoCloseable {
    private final TurnEngine engine;
    private final SessionSnapshotStore store;

    private SessionBinding(TurnEngine engine, SessionSnapshotStore store) {
        this.engine = engine;
        this.store = store;
    }

    static SessionBinding open(CliContext context, RiffConfig config, String provider, String model, String sessionId)
        throws Exception {
        SessionSnapshotStore store = context.snapshotStoreFactory().open(config);
        TurnEngine engine = context.engineFactory().create(config, provider, model);
        if (sessionId != null && !sessionId.isBlank()) {
            SessionSnapshot snapshot = store.load(sessionId).orElse(null);
            if (snapshot == null) {
                engine.close();
                throw new IllegalArgumentException("Unknown session: " + sessionId);
            }
            engine.restore(snapshot);
        }
        return new SessionBinding(engine, store);
    }

    TurnEngine engine() {
        return engine;
    }

    SessionSnapshotStore store() {
        return store;
    }

    String save() throws IOException {
        SessionSnapshot snapshot = engine.snapshot();
        store.save(snapshot);
        return snapshot.sessionId();
    }

    @Override
    public void close() {
        engine.close();
    }
}
