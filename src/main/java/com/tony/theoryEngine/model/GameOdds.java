package com.tony.theoryEngine.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

@Entity
@Getter @Setter @NoArgsConstructor
@Table(name = "sports_game_odds", indexes = {
        @Index(name = "idx_game_odds_game_closing", columnList = "game_id, is_closing_line")
})
public class GameOdds {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "game_id", nullable = false)
    private Long gameId;

    private String book;

    @Column(nullable = false)
    private String marketType; // spread, total, moneyline

    private String side; // home, away, over, under

    private Double line;   // null pour le moneyline
    private Double price;  // cote américaine (-110, +150...)

    @Column(name = "is_closing_line")
    private Boolean closingLine;

    private LocalDateTime observedAt;
}
