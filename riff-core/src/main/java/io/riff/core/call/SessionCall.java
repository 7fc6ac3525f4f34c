package io.riff.core.call;

import io.riff.core.session.Session;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One entry of the call catalog: declaration sent to the model, argument checks and the
 * session mutation applied once code has been built.
 */
public interface SessionCall {
    CallKind kind();

    default String name() {
        return kind().wireName();
    }

    String description();

    default Map<String, Object> schema() {
        return Map.of("type", "object", "properties", Map.of(), "required", List.of());
    }

    default void validate(CallArguments arguments, Session session) throws CodeBuildException {
    }

    /**
     * Applies the call to the session and returns the names of the layers it touched.
     */
    Set<String> mutate(Session session, CallArguments arguments, String code) throws CodeBuildException;

    default boolean producesCode() {
        return true;
    }
}
