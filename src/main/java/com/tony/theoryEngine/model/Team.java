package com.tony.theoryEngine.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Getter @Setter @NoArgsConstructor
@Table(name = "sports_teams", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"league_id", "name"})
})
public class Team {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "league_id", nullable = false)
    private League league;

    @Column(nullable = false)
    private String name;

    private String shortName;
    private String abbreviation;
    private String city;

    public Team(League league, String name, String abbreviation) {
        this.league = league;
        this.name = name;
        this.abbreviation = abbreviation;
    }

    // HashCode compatible JPA (évite les bugs quand l'ID change après save)
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Team)) return false;
        return id != null && id.equals(((Team) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
