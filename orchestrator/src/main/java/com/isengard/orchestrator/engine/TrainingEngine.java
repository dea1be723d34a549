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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * LoRA training through ai-toolkit. A run is complete when at least one
 * {@code .safetensors} file is in the output directory.
 */
@Component
public class TrainingEngine extends TemplatedEngine {

    private final OrchestratorProperties props;

    public TrainingEngine(ObjectMapper objectMapper, OrchestratorProperties props) {
        super(objectMapper);
        this.props = props;
    }

    @Override public JobKind kind()         { return JobKind.TRAINING; }
    @Override public String  backend()      { return "ai-toolkit"; }
    @Override public String  runningStage() { return "training"; }

    @Override
    protected String commandTemplate() {
        return props.getEngines().getTrainingCommand();
    }

    @Override
    protected Map<String, Object> engineSettings(Job job, JobArena arena) {
        String name = job.getConfig().stringValue("character_id", "lora-" + job.getId());
        return Map.of(
                "model_name", name,
                "save_path", arena.outputDir().resolve(name + ".safetensors").toString());
    }

    @Override
    public ArtifactCheck collectArtifacts(Job job, JobArena arena) throws IOException {
        List<ArtifactDraft> models = filesWithExtension(arena, arena.outputDir(),
                Set.of("safetensors"), ArtifactKind.MODEL);
        List<ArtifactDraft> found = new ArrayList<>(models);
        found.addAll(filesWithExtension(arena, arena.samplesDir(), IMAGE_EXTENSIONS, ArtifactKind.SAMPLE));
        if (models.isEmpty()) {
            return ArtifactCheck.incomplete(found, "no .safetensors model in " + arena.outputDir());
        }
        return ArtifactCheck.complete(found);
    }
}
