package io.riff.core.sandbox;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class DryRunSandbox implements ExecutionSandbox {
    private static final Logger LOG = LoggerFactory.getLogger(DryRunSandbox.class);

    private final List<String> executed = Collections.synchronizedList(new ArrayList<>());

    @Override
    public String name() {
        return "dry_run";
    }

    @Override
    public void start() {
        LOG.debug("Dry-run sandbox started; code will not reach a music runtime");
    }

    @Override
    public ExecutionResult execute(String code, String description) {
        executed.add(code);
        LOG.debug("Dry run of {}", code);
        return new ExecutionResult(true, code, "", "", PlayerExtractor.extract(code), Duration.ZERO, List.of());
    }

    public List<String> executed() {
        return List.copyOf(executed);
    }

    @Override
    public void close() {
        executed.clear();
    }
}
