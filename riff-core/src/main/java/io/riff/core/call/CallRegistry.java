package io.riff.core.call;

import io.riff.core.call.impl.ExecuteCodeCall;
import io.riff.core.call.impl.GetSessionStateCall;
import io.riff.core.call.impl.ModifyLayerCall;
import io.riff.core.call.impl.PlayDrumsCall;
import io.riff.core.call.impl.PlaySynthCall;
import io.riff.core.call.impl.SetRootCall;
import io.riff.core.call.impl.SetScaleCall;
import io.riff.core.call.impl.SetTempoCall;
import io.riff.core.call.impl.StopAllCall;
import io.riff.core.call.impl.StopPlayerCall;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class CallRegistry {
    private final Map<String, SessionCall> calls = new LinkedHashMap<>();

    public static CallRegistry defaultCatalog() {
        CallRegistry registry = new CallRegistry();
        registry.register(new PlaySynthCall());
        registry.register(new PlayDrumsCall());
        registry.register(new SetTempoCall());
        registry.register(new SetScaleCall());
        registry.register(new SetRootCall());
        registry.register(new StopPlayerCall());
        registry.register(new StopAllCall());
        registry.register(new ModifyLayerCall());
        registry.register(new ExecuteCodeCall());
        registry.register(new GetSessionStateCall());
        return registry;
    }

    public void register(SessionCall call) {
        calls.put(call.name(), call);
    }

    public Optional<SessionCall> find(String name) {
        return Optional.ofNullable(calls.get(name));
    }

    public Collection<SessionCall> all() {
        return Collections.unmodifiableCollection(calls.values());
    }

    public List<Map<String, Object>> declarations() {
        List<Map<String, Object>> declarations = new ArrayList<>();
        for (SessionCall call : calls.values()) {
            Map<String, Object> function = new LinkedHashMap<>();
            function.put("name", call.name());
            function.put("description", call.description());
            function.put("parameters", call.schema());
            declarations.add(Map.of("type", "function", "function", function));
        }
        return declarations;
    }
}
