package io.riff.cli;

import io.riff.core.config.model.RiffConfig;
import io.riff.core.session.SessionSnapshotStore;
import java.io.IOException;

@FunctionalInterface
public interface SnapshotStoreFactory {
    SessionSnapshotStore open(RiffConfig config) throws IOException;
}
