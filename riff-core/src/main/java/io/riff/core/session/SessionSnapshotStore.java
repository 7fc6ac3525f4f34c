package io.riff.core.session;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface SessionSnapshotStore {
    void save(SessionSnapshot snapshot) throws IOException;

    Optional<SessionSnapshot> load(String sessionId) throws IOException;

    List<String> list() throws IOException;
}
