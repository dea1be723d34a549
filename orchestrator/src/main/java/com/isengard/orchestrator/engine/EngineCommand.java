package com.isengard.orchestrator.engine;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * A fully resolved engine invocation: argv, working directory, extra environment.
 */
public record EngineCommand(List<String> argv, Path workingDirectory, Map<String, String> environment) {

    public EngineCommand {
        if (argv == null || argv.isEmpty()) {
            throw new IllegalArgumentException("Engine command must not be empty");
        }
        argv        = List.copyOf(argv);
        environment = Map.copyOf(environment);
    }

    public String executable() {
        return argv.get(0);
    }
}
