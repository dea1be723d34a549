package com.isengard.orchestrator.progress;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OutputLineParserTest {

    private final OutputLineParser parser = new OutputLineParser(new ObjectMapper());

    @Test
    void jsonLine_isStructured() {
        EngineLine line = parser.parse("{\"step\": 500, \"total_steps\": 1000, \"loss\": 0.12, \"lr\": 0.0001}");

        assertThat(line.kind()).isEqualTo(EngineLine.Kind.STRUCTURED);
        assertThat(line.step()).isEqualTo(500);
        assertThat(line.totalSteps()).isEqualTo(1000);
        assertThat(line.loss()).isEqualTo(0.12);
        assertThat(line.learningRate()).isEqualTo(0.0001);
    }

    @Test
    void jsonLine_withGpuAndSample_carriesBoth() {
        EngineLine line = parser.parse("{\"step\": 250, \"sample_path\": \"/data/s/250.png\","
                + " \"gpu\": {\"utilization_pct\": 97.5, \"memory_used_gb\": 20.1}}");

        assertThat(line.samplePath()).isEqualTo("/data/s/250.png");
        assertThat(line.hasArtifact()).isTrue();
        assertThat(line.gpu().utilizationPct()).isEqualTo(97.5);
        assertThat(line.gpu().memoryUsedGb()).isEqualTo(20.1);
    }

    @Test
    void stepLogLine_isLogDerived() {
        EngineLine line = parser.parse("Step 37/200");

        assertThat(line.kind()).isEqualTo(EngineLine.Kind.LOG_STEP);
        assertThat(line.step()).isEqualTo(37);
        assertThat(line.totalSteps()).isEqualTo(200);
    }

    @Test
    void tqdmBar_isLogDerivedWithLoss() {
        EngineLine line = parser.parse(
                "flux_lora:  37%|###7  | 370/1000 [01:23<02:10, 4.5it/s, lr: 1e-04 loss: 4.1e-01]");

        assertThat(line.kind()).isEqualTo(EngineLine.Kind.LOG_STEP);
        assertThat(line.step()).isEqualTo(370);
        assertThat(line.totalSteps()).isEqualTo(1000);
        assertThat(line.loss()).isEqualTo(0.41);
    }

    @Test
    void stepBeyondTotal_isText() {
        assertThat(parser.parse("Step 300/200").kind()).isEqualTo(EngineLine.Kind.TEXT);
    }

    @Test
    void malformedJson_fallsBackToText() {
        EngineLine line = parser.parse("{\"step\": 5,");

        assertThat(line.kind()).isEqualTo(EngineLine.Kind.TEXT);
        assertThat(line.raw()).isEqualTo("{\"step\": 5,");
    }

    @Test
    void plainText_isText() {
        assertThat(parser.parse("Loading model weights...").kind()).isEqualTo(EngineLine.Kind.TEXT);
        assertThat(parser.parse(null).kind()).isEqualTo(EngineLine.Kind.TEXT);
    }
}
