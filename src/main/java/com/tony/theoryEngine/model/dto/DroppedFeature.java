package com.tony.theoryEngine.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DroppedFeature {
    private String feature;
    private String reason;
    // Feature conservée pour near_collinear / duplicate_vector
    private String duplicateOf;
    private Double value;
}
