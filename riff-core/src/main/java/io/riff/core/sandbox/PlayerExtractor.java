package io.riff.core.sandbox;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class PlayerExtractor {
    private static final Pattern ASSIGNMENT = Pattern.compile("([a-zA-Z]\\w*)\\s*>>");
    private static final Pattern STOP = Pattern.compile("([a-zA-Z]\\w*)\\.stop\\(\\)");

    private PlayerExtractor() {
    }

    public static List<String> extract(String code) {
        if (code == null || code.isBlank()) {
            return List.of();
        }
        Set<String> players = new LinkedHashSet<>();
        collect(ASSIGNMENT.matcher(code), players);
        collect(STOP.matcher(code), players);
        return new ArrayList<>(players);
    }

    private static void collect(Matcher matcher, Set<String> players) {
        while (matcher.find()) {
            players.add(matcher.group(1));
        }
    }
}
