package com.conflictdata.model;

import jakarta.persistence.*;
import java.time.LocalDateTime;

/**
 * Cached average severity score for one country.
 *
 * <p>Rows are inserted once per country by the risk score read path and are
 * never updated. The unique constraint on {@code country} is what resolves two
 * requests computing the same aggregate at the same time.
 */
@Entity
@Table(name = "risk_cache",
    uniqueConstraints = @UniqueConstraint(name = "ux_risk_country", columnNames = "country"))
public class RiskAggregate {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String country;

    @Column(name = "avg_score", nullable = false)
    private Double avgScore;

    @Column(name = "computed_at", nullable = false)
    private LocalDateTime computedAt;

    protected RiskAggregate() {
    }

    public RiskAggregate(String country, double avgScore, LocalDateTime computedAt) {
        this.country = country;
        this.avgScore = avgScore;
        this.computedAt = computedAt;
    }

    public Long getId() { return id; }
    public String getCountry() { return country; }
    public Double getAvgScore() { return avgScore; }
    public LocalDateTime getComputedAt() { return computedAt; }
}
