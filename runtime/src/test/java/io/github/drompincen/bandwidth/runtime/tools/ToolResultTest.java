package io.github.drompincen.bandwidth.runtime.tools;

import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ToolResultTest {

    @Test
    void successHasNoWarningsByDefault() {
        ToolResult result = ToolResult.success(new TextNode("plan"));

        assertThat(result.success()).isTrue();
        assertThat(result.output().asText()).isEqualTo("plan");
        assertThat(result.error()).isNull();
        assertThat(result.hasWarnings()).isFalse();
    }

    @Test
    void successKeepsACopyOfWarnings() {
        List<String> warnings = new ArrayList<>(List.of("No resources supplied; all 2 tasks overflow"));

        ToolResult result = ToolResult.success(new TextNode("plan"), warnings);
        warnings.clear();

        assertThat(result.hasWarnings()).isTrue();
        assertThat(result.warnings()).containsExactly("No resources supplied; all 2 tasks overflow");
    }

    @Test
    void failureCarriesOnlyTheError() {
        ToolResult result = ToolResult.failure("'tasks' must be an array");

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("'tasks' must be an array");
        assertThat(result.output()).isNull();
        assertThat(result.warnings()).isEmpty();
    }
}
