package io.riff.core.session;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

public enum PlayerRole {
    MELODIC("p", 9),
    PERCUSSIVE("d", 9),
    BASS("b", 4),
    PAD("pad", 3);

    private final List<String> names;

    PlayerRole(String prefix, int count) {
        List<String> generated = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            generated.add(prefix + i);
        }
        this.names = Collections.unmodifiableList(generated);
    }

    public List<String> names() {
        return names;
    }

    public String firstName() {
        return names.get(0);
    }

    public static Optional<PlayerRole> of(String playerName) {
        if (playerName == null) {
            return Optional.empty();
        }
        for (PlayerRole role : values()) {
            if (role.names.contains(playerName)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    public static boolean isPlayer(String playerName) {
        return of(playerName).isPresent();
    }
}
