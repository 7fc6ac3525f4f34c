package io.riff.core.provider;

import java.io.IOException;
import okio.BufferedSource;

final class SseReader {
    private final BufferedSource source;

    SseReader(BufferedSource source) {
        this.source = source;
    }

    String nextData() throws IOException {
        StringBuilder data = null;
        while (!source.exhausted()) {
            String line = source.readUtf8Line();
            if (line == null) {
                break;
            }
            if (line.isBlank()) {
                if (data != null) {
                    return data.toString();
                }
                continue;
            }
            if (!line.startsWith("data:")) {
                continue;
            }
            String payload = line.substring(5).trim();
            if (data == null) {
                data = new StringBuilder(payload);
            } else {
                data.append('\n').append(payload);
            }
        }
        return data == null ? null : data.toString();
    }
}
