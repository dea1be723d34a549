package com.isengard.orchestrator.engine;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandTemplateTest {

    @Test
    void render_substitutesTokensPerArgument() {
        assertThat(CommandTemplate.render("python  run.py {config} --out={output}",
                Map.of("config", "/data/jobs/a/config.json", "output", "/data/jobs/a/output")))
                .containsExactly("python", "run.py", "/data/jobs/a/config.json", "--out=/data/jobs/a/output");
    }

    @Test
    void render_pathWithSpaces_staysOneArgument() {
        assertThat(CommandTemplate.render("engine {config}", Map.of("config", "/My Files/config.json")))
                .containsExactly("engine", "/My Files/config.json");
    }

    @Test
    void render_blankTemplate_rejected() {
        assertThatThrownBy(() -> CommandTemplate.render("  ", Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
