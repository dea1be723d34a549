package com.isengard.orchestrator.validation;

import com.isengard.orchestrator.model.JobConfig;
import com.isengard.orchestrator.model.JobKind;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class ConfigValidatorTest {

    private final ConfigValidator validator = new ConfigValidator(new CapabilityCatalog());

    // -------------------------------------------------------------------------
    // training
    // -------------------------------------------------------------------------

    @Test
    void training_emptyConfig_takesDefaults() {
        JobConfig config = validator.validate(JobKind.TRAINING, Map.of());

        assertThat(config.intValue("steps", 0)).isEqualTo(1000);
        assertThat(config.get("preset")).isEqualTo("balanced");
        assertThat(config.get("optimizer")).isEqualTo("adamw8bit");
        assertThat(config.has("noise_offset")).isFalse();
    }

    @Test
    void training_submittedValuesOverrideDefaults() {
        JobConfig config = validator.validate(JobKind.TRAINING, Map.of("steps", 2500, "resolution", 768));

        assertThat(config.intValue("steps", 0)).isEqualTo(2500);
        assertThat(config.intValue("resolution", 0)).isEqualTo(768);
    }

    @Test
    void training_unknownKey_passesThrough() {
        JobConfig config = validator.validate(JobKind.TRAINING, Map.of("dataset_tag", "v2"));

        assertThat(config.get("dataset_tag")).isEqualTo("v2");
    }

    @Test
    void training_outOfRangeValues_allReported() {
        ValidationException ex = catchThrowableOfType(
                () -> validator.validate(JobKind.TRAINING, Map.of("steps", 50, "learning_rate", 0.5, "lora_rank", 3)),
                ValidationException.class);

        assertThat(ex.getViolations())
                .extracting(ValidationException.Violation::field)
                .containsExactlyInAnyOrder("steps", "learning_rate", "lora_rank");
    }

    @Test
    void training_fractionalInteger_rejected() {
        assertThatThrownBy(() -> validator.validate(JobKind.TRAINING, Map.of("steps", 1000.5)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("integer");
    }

    @Test
    void training_enumOutsideOptions_rejected() {
        ValidationException ex = catchThrowableOfType(
                () -> validator.validate(JobKind.TRAINING, Map.of("optimizer", "sgd")),
                ValidationException.class);

        assertThat(ex.getViolations()).singleElement()
                .satisfies(v -> assertThat(v.message()).contains("sgd").contains("adamw8bit"));
    }

    @Test
    void training_unwiredParameter_rejectedWithReason() {
        ValidationException ex = catchThrowableOfType(
                () -> validator.validate(JobKind.TRAINING, Map.of("noise_offset", 0.1)),
                ValidationException.class);

        assertThat(ex.getViolations()).singleElement()
                .satisfies(v -> assertThat(v.message()).contains("not supported by ai-toolkit"));
    }

    // -------------------------------------------------------------------------
    // generation
    // -------------------------------------------------------------------------

    @Test
    void generation_missingPrompt_rejected() {
        ValidationException ex = catchThrowableOfType(
                () -> validator.validate(JobKind.GENERATION, Map.of("width", 1024)),
                ValidationException.class);

        assertThat(ex.getViolations()).extracting(ValidationException.Violation::field).containsExactly("prompt");
    }

    @Test
    void generation_unwiredToggleFalse_accepted() {
        Map<String, Object> submitted = new HashMap<>();
        submitted.put("prompt", "portrait of a knight");
        submitted.put("use_upscale", false);

        JobConfig config = validator.validate(JobKind.GENERATION, submitted);

        assertThat(config.intValue("count", 0)).isEqualTo(1);
        assertThat(config.doubleValue("guidance_scale", 0)).isEqualTo(7.5);
        assertThat(config.has("seed")).isFalse();
    }

    @Test
    void generation_unwiredToggleTrue_rejected() {
        assertThatThrownBy(() -> validator.validate(JobKind.GENERATION,
                Map.of("prompt", "a castle", "use_controlnet", true)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void missingKind_rejected() {
        ValidationException ex = catchThrowableOfType(
                () -> validator.validate(null, Map.of()), ValidationException.class);

        assertThat(ex.getViolations()).extracting(ValidationException.Violation::field).containsExactly("kind");
    }
}
