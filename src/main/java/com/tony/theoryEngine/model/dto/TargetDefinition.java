package com.tony.theoryEngine.model.dto;

import com.tony.theoryEngine.model.engine.MarketType;
import com.tony.theoryEngine.model.engine.MetricType;
import com.tony.theoryEngine.model.engine.OddsAssumption;
import com.tony.theoryEngine.model.engine.TargetClass;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Les valeurs par défaut passent par {@link com.tony.theoryEngine.service.TargetDefinitions}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TargetDefinition {

    @NotNull(message = "targetClass est requis")
    private TargetClass targetClass;

    @NotBlank(message = "targetName est requis")
    private String targetName;

    @NotNull(message = "metricType est requis")
    private MetricType metricType;

    private MarketType marketType;
    private String side;

    @Builder.Default
    private OddsAssumption oddsAssumption = OddsAssumption.USE_CLOSING;

    @Builder.Default
    private boolean oddsRequired = true;

    public boolean isMarket() {
        return targetClass == TargetClass.MARKET;
    }

    public boolean isStat() {
        return targetClass == TargetClass.STAT;
    }

    public boolean isBinary() {
        return metricType == MetricType.BINARY;
    }
}
