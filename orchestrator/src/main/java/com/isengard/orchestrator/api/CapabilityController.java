package com.isengard.orchestrator.api;

import com.isengard.orchestrator.validation.CapabilityCatalog;
import com.isengard.orchestrator.validation.EngineCapabilities;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * GET /capabilities: the parameter schema each job kind accepts. Clients
 * build their forms from this; submission is validated against the same data.
 */
@RestController
public class CapabilityController {

    private final CapabilityCatalog catalog;

    public CapabilityController(CapabilityCatalog catalog) {
        this.catalog = catalog;
    }

    @GetMapping("/capabilities")
    public Map<String, EngineCapabilities> capabilities() {
        Map<String, EngineCapabilities> out = new TreeMap<>();
        catalog.all().forEach((kind, caps) -> out.put(kind.name().toLowerCase(Locale.ROOT), caps));
        return out;
    }
}
