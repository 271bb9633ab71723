package io.lingualearn.core.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class WorkflowDescriptorTest {

    private final AgentDescriptor transcriber = agent("Transcriber", "{{audio}}");
    private final AgentDescriptor translator = agent("Translator", "{{transcript}}", "{{targetLanguage}}");

    @Test
    void shouldExposeProducersAndInvocationInputs() {
        WorkflowDescriptor workflow = new WorkflowDescriptor(
            "Lecture", "", List.of(transcriber, translator), Map.of("Transcriber", List.of("transcript")), Set.of(), ""
        );

        assertThat(workflow.producerOf("transcript")).isZero();
        assertThat(workflow.producerOf("audio")).isEqualTo(-1);
        assertThat(workflow.invocationInputs()).containsExactly("audio", "targetLanguage");
        assertThat(workflow.kind()).isEqualTo(EntryKind.WORKFLOW);
    }

    @Test
    void shouldRejectConsumerBeforeProducer() {
        assertThatThrownBy(() -> new WorkflowDescriptor(
            "Backwards", "", List.of(translator, transcriber), Map.of("Transcriber", List.of("transcript")), Set.of(), ""
        ))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("before it is produced");
    }

    @Test
    void shouldRejectMappingFromUnknownStep() {
        assertThatThrownBy(() -> new WorkflowDescriptor(
            "Orphan", "", List.of(transcriber), Map.of("Ghost", List.of("transcript")), Set.of(), ""
        ))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("'Ghost' is not a step");
    }

    @Test
    void shouldRejectEmptyWorkflow() {
        assertThatThrownBy(() -> new WorkflowDescriptor("Empty", "", List.of(), Map.of(), Set.of(), ""))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void ofAgentShouldWrapSingleStep() {
        WorkflowDescriptor single = WorkflowDescriptor.ofAgent(transcriber);

        assertThat(single.name()).isEqualTo("Transcriber");
        assertThat(single.steps()).containsExactly(transcriber);
    }

    @Test
    void descriptiveTextShouldCombineNameDescriptionKeywordsAndCategory() {
        AgentDescriptor agent = new AgentDescriptor(
            "Speech Translator", "Translates speech", "/bin/true", Path.of("."), Map.of(), List.of(),
            Set.of("speech"), "Language"
        );

        assertThat(agent.descriptiveText())
            .isEqualTo("Speech Translator. Translates speech. Keywords: speech. Category: Language");
    }

    private static AgentDescriptor agent(String name, String... arguments) {
        return new AgentDescriptor(name, "", "/bin/true", Path.of("."), Map.of(), List.of(arguments), Set.of(), "");
    }
}
