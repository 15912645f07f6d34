package com.tony.theoryEngine.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Snapshot écrit une seule fois, indexé par le hash du contenu de la requête.
 */
@Entity
@Getter @Setter @NoArgsConstructor
@Table(name = "theory_runs", indexes = {
        @Index(name = "idx_theory_runs_created", columnList = "created_at")
})
public class TheoryRun {
    @Id
    @Column(length = 64)
    private String runId;

    @Column(nullable = false, length = 64)
    private String snapshotHash;

    @Column(nullable = false, length = 20)
    private String runType;

    private String leagueCode;
    private String targetName;
    private Integer sampleSize;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(columnDefinition = "TEXT", nullable = false, updatable = false)
    private String requestJson;

    @Column(columnDefinition = "TEXT", nullable = false, updatable = false)
    private String resultJson;
}
