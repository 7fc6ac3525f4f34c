package io.riff.core.call;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CallRegistryTest {

    @Test
    void shouldRegisterEveryCallKindInDefaultCatalog() {
        CallRegistry registry = CallRegistry.defaultCatalog();

        List<String> expected = Arrays.stream(CallKind.values()).map(CallKind::wireName).toList();
        assertThat(registry.all()).extracting(SessionCall::name).containsExactlyElementsOf(expected);
        for (CallKind kind : CallKind.values()) {
            assertThat(registry.find(kind.wireName())).get().extracting(SessionCall::kind).isEqualTo(kind);
        }
        assertThat(registry.find("play_kazoo")).isEmpty();
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldDeclareCallsInFunctionShape() {
        List<Map<String, Object>> declarations = CallRegistry.defaultCatalog().declarations();

        assertThat(declarations).hasSize(CallKind.values().length);
        Map<String, Object> first = declarations.get(0);
        assertThat(first).containsEntry("type", "function");
        Map<String, Object> function = (Map<String, Object>) first.get("function");
        assertThat(function).containsEntry("name", "play_synth").containsKeys("description", "parameters");
        Map<String, Object> parameters = (Map<String, Object>) function.get("parameters");
        assertThat((List<String>) parameters.get("required")).contains("player", "synth", "notes");
    }
}
