package io.riff.core.agent;

import io.riff.core.model.ChatMessage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

final class OutboundConversation {
    private final List<ChatMessage> messages = new ArrayList<>();
    private final List<Integer> exchangeStarts = new ArrayList<>();

    int mark() {
        return messages.size();
    }

    void beginExchange(String userMessage) {
        exchangeStarts.add(messages.size());
        messages.add(ChatMessage.user(userMessage));
    }

    void append(ChatMessage message) {
        messages.add(message);
    }

    void rollback(int mark) {
        while (messages.size() > mark) {
            messages.remove(messages.size() - 1);
        }
        exchangeStarts.removeIf(start -> start >= mark);
    }

    void retainLastExchanges(int count) {
        if (exchangeStarts.size() <= count) {
            return;
        }
        int cut = count <= 0 ? messages.size() : exchangeStarts.get(exchangeStarts.size() - count);
        messages.subList(0, cut).clear();
        List<Integer> shifted = new ArrayList<>();
        for (int start : exchangeStarts) {
            if (start >= cut) {
                shifted.add(start - cut);
            }
        }
        exchangeStarts.clear();
        exchangeStarts.addAll(shifted);
    }

    void clear() {
        messages.clear();
        exchangeStarts.clear();
    }

    int exchanges() {
        return exchangeStarts.size();
    }

    List<ChatMessage> messages() {
        return Collections.unmodifiableList(messages);
    }
}
