package io.engram.core.consolidation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class ConsolidationResponseParserTest {

    private final ConsolidationResponseParser parser = new ConsolidationResponseParser();

    @Test
    void shouldParseDecisionsOrderedById() throws Exception {
        List<BatchDecision> decisions = parser.parse("""
            [
              {"id": 2, "decision": "forget", "reason": "noise"},
              {"id": 1, "decision": "IMPORTANT", "reason": "key learning"},
              {"id": 3, "decision": "context"}
            ]
            """, 3);

        assertThat(decisions).extracting(BatchDecision::ordinal).containsExactly(1, 2, 3);
        assertThat(decisions).extracting(BatchDecision::category)
            .containsExactly(ReviewCategory.IMPORTANT, ReviewCategory.FORGET, ReviewCategory.CONTEXT);
        assertThat(decisions.get(0).reason()).isEqualTo("key learning");
        assertThat(decisions.get(2).reason()).isEmpty();
    }

    @Test
    void shouldRejectNonArrayOrProse() {
        assertThatThrownBy(() -> parser.parse("", 1)).isInstanceOf(AdvisorException.class);
        assertThatThrownBy(() -> parser.parse("Sure! Here are my decisions.", 1)).isInstanceOf(AdvisorException.class);
        assertThatThrownBy(() -> parser.parse("{\"id\": 1, \"decision\": \"forget\"}", 1))
            .isInstanceOf(AdvisorException.class)
            .hasMessageContaining("array");
    }

    @Test
    void shouldRejectWrongDecisionCount() {
        assertThatThrownBy(() -> parser.parse("[{\"id\": 1, \"decision\": \"forget\"}]", 2))
            .isInstanceOf(AdvisorException.class)
            .hasMessageContaining("1 decisions for a batch of 2");
    }

    @Test
    void shouldRejectBadIds() {
        assertThatThrownBy(() -> parser.parse("[{\"id\": 3, \"decision\": \"forget\"}, {\"id\": 1, \"decision\": \"forget\"}]", 2))
            .isInstanceOf(AdvisorException.class)
            .hasMessageContaining("outside");
        assertThatThrownBy(() -> parser.parse("[{\"id\": 1, \"decision\": \"forget\"}, {\"id\": 1, \"decision\": \"archive\"}]", 2))
            .isInstanceOf(AdvisorException.class)
            .hasMessageContaining("more than once");
        assertThatThrownBy(() -> parser.parse("[{\"id\": \"1\", \"decision\": \"forget\"}]", 1))
            .isInstanceOf(AdvisorException.class);
        assertThatThrownBy(() -> parser.parse("[{\"id\": 1.5, \"decision\": \"forget\"}]", 1))
            .isInstanceOf(AdvisorException.class);
    }

    @Test
    void shouldRejectUnknownOrMissingDecision() {
        assertThatThrownBy(() -> parser.parse("[{\"id\": 1, \"decision\": \"keep\"}]", 1))
            .isInstanceOf(AdvisorException.class)
            .hasMessageContaining("keep");
        assertThatThrownBy(() -> parser.parse("[{\"id\": 1}]", 1)).isInstanceOf(AdvisorException.class);
        assertThatThrownBy(() -> parser.parse("[{\"id\": 1, \"decision\": \"forget\", \"reason\": 5}]", 1))
            .isInstanceOf(AdvisorException.class);
        assertThatThrownBy(() -> parser.parse("[\"forget\"]", 1)).isInstanceOf(AdvisorException.class);
    }
}
