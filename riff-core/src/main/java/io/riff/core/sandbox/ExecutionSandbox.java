package io.riff.core.sandbox;

import java.io.IOException;

public interface ExecutionSandbox extends AutoCloseable {
    String name();

    void start() throws IOException;

    ExecutionResult execute(String code, String description);

    @Override
    void close();
}
