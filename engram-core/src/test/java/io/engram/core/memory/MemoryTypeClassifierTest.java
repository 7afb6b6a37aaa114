package io.engram.core.memory;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class MemoryTypeClassifierTest {

    private final MemoryTypeClassifier classifier = new MemoryTypeClassifier();

    @Test
    void shouldClassifyByContentKeywords() {
        assertThat(classifier.classify("User prefers dark mode", List.of())).isEqualTo(MemoryType.PREFERENCES);
        assertThat(classifier.classify("We chose Kafka for the event bus", List.of())).isEqualTo(MemoryType.DECISIONS);
        assertThat(classifier.classify("Yesterday the deploy pipeline broke", List.of())).isEqualTo(MemoryType.EXPERIENCES);
        assertThat(classifier.classify("How to rotate the API keys", List.of())).isEqualTo(MemoryType.SKILLS);
    }

    @Test
    void shouldClassifyContextFromTags() {
        assertThat(classifier.classify("Engram stores agent memories", List.of("Project"))).isEqualTo(MemoryType.CONTEXT);
    }

    @Test
    void shouldApplyRulesInPriorityOrder() {
        assertThat(classifier.classify("I prefer the strategy we decided on", List.of()))
            .isEqualTo(MemoryType.PREFERENCES);
    }

    @Test
    void shouldFallBackToFacts() {
        assertThat(classifier.classify("Water boils at 100 degrees Celsius", List.of())).isEqualTo(MemoryType.FACTS);
        assertThat(classifier.classify(null, null)).isEqualTo(MemoryType.FACTS);
    }
}
