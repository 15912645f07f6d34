package com.tony.theoryEngine.controller;

import com.tony.theoryEngine.model.dto.RunDetail;
import com.tony.theoryEngine.model.dto.RunSummary;
import com.tony.theoryEngine.service.RunSnapshotService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/runs")
@RequiredArgsConstructor
public class TheoryRunController {

    private final RunSnapshotService runStore;

    @GetMapping
    public ResponseEntity<List<RunSummary>> listRuns() {
        return ResponseEntity.ok(runStore.listRuns());
    }

    @GetMapping("/{runId}")
    public ResponseEntity<RunDetail> getRun(@PathVariable String runId) {
        return ResponseEntity.ok(runStore.getRun(runId));
    }
}
