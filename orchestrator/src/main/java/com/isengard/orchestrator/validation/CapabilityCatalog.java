package com.isengard.orchestrator.validation;

import com.isengard.orchestrator.model.JobKind;
import com.isengard.orchestrator.validation.ParameterSpec.Type;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Parameter schemas for the training (ai-toolkit) and generation (ComfyUI)
 * backends. Submission is validated against this before a job is stored.
 */
@Component
public class CapabilityCatalog {

    private final Map<JobKind, EngineCapabilities> byKind = new EnumMap<>(JobKind.class);

    public CapabilityCatalog() {
        byKind.put(JobKind.TRAINING, new EngineCapabilities("ai-toolkit", List.of(
                ParameterSpec.oneOf("method", List.of("lora"), "lora"),
                ParameterSpec.oneOf("preset", List.of("quick", "balanced", "quality", "custom"), "balanced"),
                ParameterSpec.intRange("steps", 100, 10_000, 1000),
                ParameterSpec.floatRange("learning_rate", 1e-6, 1e-2, 1e-4),
                ParameterSpec.intRange("batch_size", 1, 8, 1),
                ParameterSpec.oneOf("resolution", List.of(512, 768, 1024), 1024),
                ParameterSpec.intRange("lora_rank", 4, 128, 16),
                ParameterSpec.oneOf("optimizer", List.of("adamw8bit", "adamw", "prodigy", "adafactor"), "adamw8bit"),
                ParameterSpec.intRange("save_every", 50, 5_000, 250),
                ParameterSpec.intRange("sample_every", 50, 5_000, 250),
                ParameterSpec.text("character_id", 200, false),
                ParameterSpec.text("trigger_word", 100, false),
                ParameterSpec.unwired("noise_offset", Type.FLOAT, "Not exposed by the ai-toolkit integration"),
                ParameterSpec.unwired("caption_dropout", Type.FLOAT, "Captioning is not part of this pipeline")
        )));

        byKind.put(JobKind.GENERATION, new EngineCapabilities("comfyui", List.of(
                ParameterSpec.text("prompt", 2000, true),
                ParameterSpec.text("negative_prompt", 1000, false),
                ParameterSpec.intRange("width", 512, 2048, 1024),
                ParameterSpec.intRange("height", 512, 2048, 1024),
                ParameterSpec.intRange("steps", 1, 100, 30),
                ParameterSpec.floatRange("guidance_scale", 1.0, 20.0, 7.5),
                ParameterSpec.intRange("seed", 0, Integer.MAX_VALUE, null),
                ParameterSpec.text("lora_id", 200, false),
                ParameterSpec.floatRange("lora_strength", 0.0, 1.5, 0.8),
                ParameterSpec.intRange("count", 1, 8, 1),
                ParameterSpec.unwired("use_controlnet", Type.BOOL, "ControlNet workflow not installed"),
                ParameterSpec.unwired("use_ipadapter", Type.BOOL, "IP-Adapter workflow not installed"),
                ParameterSpec.unwired("use_facedetailer", Type.BOOL, "FaceDetailer workflow not installed"),
                ParameterSpec.unwired("use_upscale", Type.BOOL, "Upscale models not downloaded")
        )));
    }

    public EngineCapabilities forKind(JobKind kind) {
        return byKind.get(kind);
    }

    public Map<JobKind, EngineCapabilities> all() {
        return Map.copyOf(byKind);
    }
}
