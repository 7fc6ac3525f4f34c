package io.riff.core.provider;

import java.io.IOException;

public class StreamException extends IOException {

    public StreamException(String message) {
        super(message);
    }

    public StreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
