package io.lingualearn.core.execution;

import static org.assertj.core.api.Assertions.assertThat;

import io.lingualearn.core.catalog.AgentDescriptor;
import io.lingualearn.core.catalog.WorkflowDescriptor;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class StepPlannerTest {

    private final StepPlanner planner = new StepPlanner();

    private final WorkflowDescriptor workflow = new WorkflowDescriptor(
        "Lesson",
        "",
        List.of(
            agent("Transcribe", "{{audio}}"),
            agent("Capture", "{{photo}}"),
            agent("Translate", "{{transcript}}"),
            agent("Summarize", "{{translation}}", "{{notes}}")
        ),
        Map.of(
            "Transcribe", List.of("transcript"),
            "Capture", List.of("notes"),
            "Translate", List.of("translation")
        ),
        Set.of(),
        ""
    );

    @Test
    void shouldKeepDeclaredOrderWhenSequential() {
        assertThat(planner.plan(workflow, 1))
            .containsExactly(List.of(0), List.of(1), List.of(2), List.of(3));
    }

    @Test
    void shouldGroupIndependentStepsIntoLevels() {
        assertThat(planner.plan(workflow, 4))
            .containsExactly(List.of(0, 1), List.of(2), List.of(3));
    }

    private static AgentDescriptor agent(String name, String... arguments) {
        return new AgentDescriptor(name, "", "/bin/true", Path.of("."), Map.of(), List.of(arguments), Set.of(), "");
    }
}
