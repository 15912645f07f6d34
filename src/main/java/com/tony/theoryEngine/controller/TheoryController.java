package com.tony.theoryEngine.controller;

import com.tony.theoryEngine.model.dto.AnalysisRequest;
import com.tony.theoryEngine.model.dto.AnalysisResponse;
import com.tony.theoryEngine.model.dto.FeatureGenerationRequest;
import com.tony.theoryEngine.model.dto.FeatureGenerationResponse;
import com.tony.theoryEngine.model.dto.ModelBuildRequest;
import com.tony.theoryEngine.model.dto.ModelBuildResponse;
import com.tony.theoryEngine.model.dto.WalkforwardRequest;
import com.tony.theoryEngine.model.dto.WalkforwardResponse;
import com.tony.theoryEngine.service.TheoryAnalysisOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/theories")
@RequiredArgsConstructor
public class TheoryController {

    private final TheoryAnalysisOrchestrator orchestrator;

    @PostMapping("/features")
    public ResponseEntity<FeatureGenerationResponse> generateFeatures(@Valid @RequestBody FeatureGenerationRequest request) {
        return ResponseEntity.ok(orchestrator.generateFeatures(request));
    }

    @PostMapping("/analyze")
    public ResponseEntity<AnalysisResponse> analyze(@Valid @RequestBody AnalysisRequest request) {
        return ResponseEntity.ok(orchestrator.analyze(request));
    }

    @PostMapping("/model")
    public ResponseEntity<ModelBuildResponse> buildModel(@Valid @RequestBody ModelBuildRequest request) {
        return ResponseEntity.ok(orchestrator.buildModel(request));
    }

    @PostMapping("/walkforward")
    public ResponseEntity<WalkforwardResponse> runWalkforward(@Valid @RequestBody WalkforwardRequest request) {
        return ResponseEntity.ok(orchestrator.runWalkforward(request));
    }
}
