package com.isengard.orchestrator.engine;

import com.isengard.orchestrator.model.JobKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Every {@link EngineAdapter} bean, indexed by the job kind it runs.
 */
@Component
public class EngineRegistry {

    private static final Logger log = LoggerFactory.getLogger(EngineRegistry.class);

    private final Map<JobKind, EngineAdapter> engines = new EnumMap<>(JobKind.class);

    public EngineRegistry(List<EngineAdapter> adapters) {
        for (EngineAdapter adapter : adapters) {
            EngineAdapter previous = engines.put(adapter.kind(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Two engines registered for " + adapter.kind()
                        + ": " + previous.backend() + " and " + adapter.backend());
            }
            log.info("Registered engine '{}' for {} jobs", adapter.backend(), adapter.kind());
        }
    }

    public EngineAdapter forKind(JobKind kind) {
        EngineAdapter adapter = engines.get(kind);
        if (adapter == null) {
            throw new IllegalStateException("No engine registered for " + kind);
        }
        return adapter;
    }
}
