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
@Table(name = "sports_player_boxscores", indexes = {
        @Index(name = "idx_player_boxscores_game", columnList = "game_id")
})
public class PlayerBoxscore {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "game_id", nullable = false)
    private Long gameId;

    @Column(name = "team_id")
    private Long teamId;

    @Column(nullable = false)
    private String playerName;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private Map<String, Object> stats;
}
