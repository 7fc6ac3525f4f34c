package io.riff.core.context;

import io.riff.core.session.ConversationTurn;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded conversation window: verbatim recent turns plus at most one rolling summary of
 * everything older. Sizes come from a {@link SizeEstimator} and are approximate.
 */
public final class ContextManager {
    private static final int MAX_TURN_CHARS_IN_REQUEST = 500;

    private final ContextSettings settings;
    private final SizeEstimator estimator;
    private final List<ConversationTurn> turns = new ArrayList<>();
    private String summary;
    private int totalSize;

    public ContextManager(ContextSettings settings, SizeEstimator estimator) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.estimator = Objects.requireNonNull(estimator, "estimator must not be null");
    }

    public ContextManager() {
        this(ContextSettings.defaults(), new CharacterSizeEstimator());
    }

    public ContextSettings settings() {
        return settings;
    }

    public int estimate(String text) {
        return estimator.estimate(text);
    }

    public void recordTurn(ConversationTurn turn) {
        turns.add(Objects.requireNonNull(turn, "turn must not be null"));
        totalSize += turn.sizeEstimate();
    }

    public boolean needsConsolidation() {
        return totalSize > settings.maxSize() * settings.consolidationThreshold();
    }

    /**
     * Summarization prompt covering every turn older than the last K, or empty when there is
     * nothing older to summarize.
     */
    public Optional<String> buildConsolidationRequest() {
        int keep = settings.keepRecentTurns();
        if (turns.size() <= keep) {
            return Optional.empty();
        }
        List<String> lines = new ArrayList<>();
        for (ConversationTurn turn : turns.subList(0, turns.size() - keep)) {
            lines.add(roleLabel(turn) + ": " + truncate(turn.content()));
            if (!turn.calls().isEmpty()) {
                lines.add("  [Calls: " + String.join(", ", turn.callNames()) + "]");
            }
        }
        return Optional.of("""
            Summarize the following conversation history into a concise summary that preserves:
            1. Key musical decisions made (tempo, scale, instruments)
            2. User preferences discovered
            3. Current state of the composition
            4. Any important context for future requests

            Conversation:
            %s

            Provide a brief summary (2-3 paragraphs max):""".formatted(String.join("\n", lines)));
    }

    /**
     * Replaces the summary and keeps only the last K turns. A blank summary changes nothing.
     *
     * @return whether the window was consolidated
     */
    public boolean applyConsolidation(String summaryText) {
        if (summaryText == null || summaryText.isBlank()) {
            return false;
        }
        int keep = settings.keepRecentTurns();
        if (turns.size() > keep) {
            List<ConversationTurn> recent = new ArrayList<>(turns.subList(turns.size() - keep, turns.size()));
            turns.clear();
            turns.addAll(recent);
        }
        summary = summaryText;
        totalSize = turns.stream().mapToInt(ConversationTurn::sizeEstimate).sum() + estimator.estimate(summaryText);
        return true;
    }

    public String renderContextForPrompt() {
        StringBuilder out = new StringBuilder();
        if (summary != null) {
            out.append("## Previous Conversation Summary\n").append(summary).append("\n\n");
        }
        if (!turns.isEmpty()) {
            out.append("## Recent Conversation");
            int keep = settings.keepRecentTurns();
            for (ConversationTurn turn : turns.subList(Math.max(0, turns.size() - keep), turns.size())) {
                out.append('\n').append(roleLabel(turn)).append(": ").append(turn.content());
                if (!turn.calls().isEmpty()) {
                    out.append("\n  [Calls: ").append(String.join(", ", turn.callNames())).append(']');
                }
            }
        }
        return out.toString().stripTrailing();
    }

    public void clear() {
        turns.clear();
        summary = null;
        totalSize = 0;
    }

    public List<ConversationTurn> turns() {
        return Collections.unmodifiableList(turns);
    }

    public Optional<String> summary() {
        return Optional.ofNullable(summary);
    }

    public int totalSize() {
        return totalSize;
    }

    private String roleLabel(ConversationTurn turn) {
        String name = turn.role().name().toLowerCase(Locale.ROOT);
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    private String truncate(String content) {
        if (content.length() <= MAX_TURN_CHARS_IN_REQUEST) {
            return content;
        }
        return content.substring(0, MAX_TURN_CHARS_IN_REQUEST) + "...";
    }
}
