package com.tony.theoryEngine.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "sports_leagues")
@Data
@NoArgsConstructor
public class League {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false, length = 20)
    private String code; // Ex: "NBA", "NCAAB"

    @Column(nullable = false)
    private String name;

    private String level; // "pro" ou "college"

    public League(String code, String name, String level) {
        this.code = code;
        this.name = name;
        this.level = level;
    }
}
