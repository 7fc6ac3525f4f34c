package io.riff.core.call;

import io.riff.core.session.Session;

public interface CodeBuilder {
    String build(CallKind kind, CallArguments arguments, Session session) throws CodeBuildException;
}
