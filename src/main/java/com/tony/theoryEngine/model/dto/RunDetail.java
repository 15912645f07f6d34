package com.tony.theoryEngine.model.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunDetail {
    private RunSummary summary;
    private JsonNode request;
    private JsonNode result;
}
