package com.tony.theoryEngine.service;

import com.tony.theoryEngine.model.dto.CleaningOptions;
import com.tony.theoryEngine.model.dto.ExposureControls;
import com.tony.theoryEngine.model.dto.FilterBundle;
import com.tony.theoryEngine.model.dto.TargetDefinition;
import com.tony.theoryEngine.model.dto.TriggerDefinition;
import com.tony.theoryEngine.model.dto.WalkforwardWindow;
import com.tony.theoryEngine.model.engine.AnalysisContext;
import com.tony.theoryEngine.model.engine.FeatureDefinition;
import com.tony.theoryEngine.service.LeagueCatalogService.LeagueProfile;

import java.util.List;

/**
 * Requête validée et complétée par les valeurs par défaut. Plus aucun champ n'est nul.
 */
public record ResolvedTheory(
        LeagueProfile league,
        FilterBundle filters,
        List<FeatureDefinition> features,
        TargetDefinition target,
        TriggerDefinition trigger,
        ExposureControls exposure,
        CleaningOptions cleaning,
        AnalysisContext context,
        WalkforwardWindow window
) {
}
