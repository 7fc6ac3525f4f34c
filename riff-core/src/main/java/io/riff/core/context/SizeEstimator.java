package io.riff.core.context;

@FunctionalInterface
public interface SizeEstimator {
    int estimate(String text);
}
