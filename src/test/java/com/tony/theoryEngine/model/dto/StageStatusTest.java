package com.tony.theoryEngine.model.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tony.theoryEngine.model.engine.ReasonCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StageStatusTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("completed() ne renvoie un résultat que pour une étape complète")
    void completedOnlyForComplete() {
        StageStatus<String> complete = StageStatus.complete("ok");
        StageStatus<String> notRun = StageStatus.notRun(ReasonCode.NOT_REQUESTED, "analyze only");
        StageStatus<String> unavailable = StageStatus.unavailable(ReasonCode.TOO_FEW_BETS, "3 bets");

        assertThat(complete.completed()).contains("ok");
        assertThat(complete.isComplete()).isTrue();
        assertThat(notRun.completed()).isEmpty();
        assertThat(unavailable.completed()).isEmpty();
        assertThat(unavailable.isComplete()).isFalse();
    }

    @Test
    @DisplayName("JSON : discriminant status et code de raison, sans champ technique")
    void serializesTaggedVariants() throws Exception {
        JsonNode unavailable = mapper.valueToTree(StageStatus.unavailable(ReasonCode.NO_SLICES, "no window"));
        JsonNode complete = mapper.valueToTree(StageStatus.complete(12));

        assertThat(unavailable.get("status").asText()).isEqualTo("unavailable");
        assertThat(unavailable.get("reasonCode").asText()).isEqualTo("no_slices");
        assertThat(complete.get("status").asText()).isEqualTo("complete");
        assertThat(complete.get("result").asInt()).isEqualTo(12);
        assertThat(complete.has("complete")).isFalse();
        assertThat(complete.has("completed")).isFalse();
    }
}
