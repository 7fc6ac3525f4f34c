package io.riff.core.provider;

import java.io.IOException;

public interface DeltaStream extends AutoCloseable {

    Delta next() throws IOException;

    @Override
    void close();
}
