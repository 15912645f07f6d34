package com.tony.theoryEngine.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.tony.theoryEngine.exception.RunNotFoundException;
import com.tony.theoryEngine.model.TheoryRun;
import com.tony.theoryEngine.model.dto.RunDetail;
import com.tony.theoryEngine.model.dto.RunSummary;
import com.tony.theoryEngine.model.engine.RunType;
import com.tony.theoryEngine.repository.TheoryRunRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDateTime;
import java.util.HexFormat;
import java.util.List;

/**
 * Snapshots de runs adressés par le contenu. Un run déjà stocké n'est jamais réécrit.
 */
@Slf4j
@Service
public class RunSnapshotService {

    private static final int RUN_ID_HASH_CHARS = 16;

    private final TheoryRunRepository runRepository;
    private final ObjectMapper canonicalMapper;

    public RunSnapshotService(TheoryRunRepository runRepository, ObjectMapper objectMapper) {
        this.runRepository = runRepository;
        // Clés triées : deux payloads égaux donnent le même JSON, donc le même hash
        this.canonicalMapper = objectMapper.copy()
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * Hash SHA-256 (hex) du JSON canonique du payload.
     */
    public String hash(Object payload) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonicalJson(payload).getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 indisponible", e);
        }
    }

    public static String runId(RunType type, String hash) {
        return type.getCode() + "-" + hash.substring(0, RUN_ID_HASH_CHARS);
    }

    public String canonicalJson(Object payload) {
        try {
            return canonicalMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Sérialisation du payload impossible", e);
        }
    }

    /**
     * Écrit le run s'il n'existe pas encore. À appeler uniquement une fois le pipeline terminé.
     */
    public void commit(String runId, String hash, RunType type, String leagueCode, String targetName,
                       Integer sampleSize, Object request, Object result) {
        if (runRepository.existsById(runId)) {
            log.debug("Run {} déjà stocké, aucune réécriture", runId);
            return;
        }
        TheoryRun run = new TheoryRun();
        run.setRunId(runId);
        run.setSnapshotHash(hash);
        run.setRunType(type.getCode());
        run.setLeagueCode(leagueCode);
        run.setTargetName(targetName);
        run.setSampleSize(sampleSize);
        run.setCreatedAt(LocalDateTime.now());
        run.setRequestJson(canonicalJson(request));
        run.setResultJson(canonicalJson(result));
        try {
            runRepository.saveAndFlush(run);
            log.info("💾 Run {} enregistré ({}, n={})", runId, leagueCode, sampleSize);
        } catch (DataIntegrityViolationException e) {
            // Insertion concurrente du même contenu : le run existe déjà
            log.info("Run {} inséré en parallèle, conservé tel quel ({})", runId, e.getMostSpecificCause().getMessage());
        }
    }

    public List<RunSummary> listRuns() {
        return runRepository.findAllByOrderByCreatedAtDesc().stream()
                .map(RunSnapshotService::toSummary)
                .toList();
    }

    public RunDetail getRun(String runId) {
        TheoryRun run = runRepository.findById(runId)
                .orElseThrow(() -> new RunNotFoundException(runId));
        try {
            JsonNode request = canonicalMapper.readTree(run.getRequestJson());
            JsonNode result = canonicalMapper.readTree(run.getResultJson());
            return RunDetail.builder()
                    .summary(toSummary(run))
                    .request(request)
                    .result(result)
                    .build();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Snapshot illisible pour le run " + runId, e);
        }
    }

    private static RunSummary toSummary(TheoryRun run) {
        return RunSummary.builder()
                .runId(run.getRunId())
                .snapshotHash(run.getSnapshotHash())
                .runType(run.getRunType())
                .leagueCode(run.getLeagueCode())
                .targetName(run.getTargetName())
                .sampleSize(run.getSampleSize())
                .createdAt(run.getCreatedAt())
                .build();
    }
}
