package com.isengard.orchestrator.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.isengard.orchestrator.model.ArtifactDraft;
import com.isengard.orchestrator.model.ArtifactKind;
import com.isengard.orchestrator.model.Job;
import com.isengard.orchestrator.storage.JobArena;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Shared launch logic for engines started from a command template with a
 * JSON config file.
 */
abstract class TemplatedEngine implements EngineAdapter {

    static final Set<String> IMAGE_EXTENSIONS = Set.of("png", "jpg", "jpeg", "webp");

    private final ObjectMapper objectMapper;

    protected TemplatedEngine(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    protected abstract String commandTemplate();

    /** Engine-specific keys merged into config.json next to the job's own config. */
    protected abstract Map<String, Object> engineSettings(Job job, JobArena arena);

    @Override
    public EngineCommand prepare(Job job, JobArena.Lease lease) throws IOException {
        JobArena arena = lease.arena();

        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("job_id", job.getId().toString());
        doc.put("kind", job.getKind().name().toLowerCase(Locale.ROOT));
        doc.put("output_dir", arena.outputDir().toString());
        doc.put("samples_dir", arena.samplesDir().toString());
        doc.putAll(engineSettings(job, arena));
        doc.put("config", job.getConfig().asMap());
        lease.writeConfig(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(doc));

        List<String> argv = CommandTemplate.render(commandTemplate(), Map.of(
                "config", arena.configFile().toString(),
                "output", arena.outputDir().toString(),
                "job",    job.getId().toString()));
        return new EngineCommand(argv, arena.root(), Map.of(
                "ISENGARD_JOB_ID", job.getId().toString(),
                "ISENGARD_OUTPUT_DIR", arena.outputDir().toString()));
    }

    protected static List<ArtifactDraft> filesWithExtension(JobArena arena, Path dir,
                                                           Set<String> extensions,
                                                           ArtifactKind kind) throws IOException {
        List<ArtifactDraft> drafts = new ArrayList<>();
        for (Path file : arena.listFiles(dir)) {
            String name = file.getFileName().toString();
            int dot = name.lastIndexOf('.');
            if (dot < 0) continue;
            if (extensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT))) {
                drafts.add(new ArtifactDraft(name, file.toString(), kind, null));
            }
        }
        return drafts;
    }
}
