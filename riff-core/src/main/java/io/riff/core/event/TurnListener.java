package io.riff.core.event;

@FunctionalInterface
public interface TurnListener {
    TurnListener NONE = event -> {
    };

    void onEvent(TurnEvent event);
}
