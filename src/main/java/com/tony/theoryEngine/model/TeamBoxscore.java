package com.tony.theoryEngine.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.util.Map;

@Entity
@Getter @Setter @NoArgsConstructor
@Table(name = "sports_team_boxscores", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"game_id", "team_id"})
})
public class TeamBoxscore {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "game_id", nullable = false)
    private Long gameId;

    @Column(name = "team_id", nullable = false)
    private Long teamId;

    private Boolean isHome;

    // Clés libres par ligue (points, rebounds, fg_pct...), valeurs numériques ou texte brut
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private Map<String, Object> stats;
}
