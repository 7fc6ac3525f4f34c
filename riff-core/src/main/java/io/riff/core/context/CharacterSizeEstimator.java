package io.riff.core.context;

public final class CharacterSizeEstimator implements SizeEstimator {
    private static final int CHARS_PER_TOKEN = 4;

    @Override
    public int estimate(String text) {
        return text == null ? 0 : text.length() / CHARS_PER_TOKEN;
    }
}
