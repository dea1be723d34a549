package com.isengard.orchestrator.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.isengard.orchestrator.config.OrchestratorProperties;
import com.isengard.orchestrator.model.ArtifactDraft;
import com.isengard.orchestrator.model.ArtifactKind;
import com.isengard.orchestrator.model.Job;
import com.isengard.orchestrator.model.JobKind;
import com.isengard.orchestrator.storage.JobArena;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Image generation through the ComfyUI client. Complete when the output
 * directory holds at least {@code count} images.
 */
@Component
public class GenerationEngine extends TemplatedEngine {

    private final OrchestratorProperties props;

    public GenerationEngine(ObjectMapper objectMapper, OrchestratorProperties props) {
        super(objectMapper);
        this.props = props;
    }

    @Override public JobKind kind()         { return JobKind.GENERATION; }
    @Override public String  backend()      { return "comfyui"; }
    @Override public String  runningStage() { return "generating"; }

    @Override
    protected String commandTemplate() {
        return props.getEngines().getGenerationCommand();
    }

    @Override
    protected Map<String, Object> engineSettings(Job job, JobArena arena) {
        return Map.of("filename_prefix", "img-" + job.getId().toString().substring(0, 8));
    }

    @Override
    public ArtifactCheck collectArtifacts(Job job, JobArena arena) throws IOException {
        int expected = job.getConfig().intValue("count", 1);
        List<ArtifactDraft> images = filesWithExtension(arena, arena.outputDir(),
                IMAGE_EXTENSIONS, ArtifactKind.IMAGE);
        if (images.size() < expected) {
            return ArtifactCheck.incomplete(images,
                    "expected " + expected + " image(s), found " + images.size());
        }
        return ArtifactCheck.complete(images);
    }
}
