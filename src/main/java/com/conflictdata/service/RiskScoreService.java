package com.conflictdata.service;

import com.conflictdata.exception.AggregateConflictException;
import com.conflictdata.exception.ResourceNotFoundException;
import com.conflictdata.model.RiskAggregate;
import com.conflictdata.repository.ConflictRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Serves the average severity score per country.
 *
 * <p>The first request for a country computes the mean of its record scores and
 * stores it; every later request returns the stored row unchanged. Stored rows are
 * not refreshed when records for the country change afterwards. Whether admin
 * deletes and imports evict them is decided by {@link RiskAggregateInvalidator}.
 *
 * <p>Two first requests racing for the same country both compute; the unique
 * constraint on {@code risk_cache.country} lets one insert through and the other
 * re-reads that row. {@link #getAggregate} must not run inside a transaction: the
 * losing insert would mark it rollback-only.
 */
@Service
public class RiskScoreService {

    private static final Logger log = LoggerFactory.getLogger(RiskScoreService.class);

    private final ConflictRecordRepository conflictRecordRepository;
    private final RiskAggregateStore aggregateStore;
    private final Clock clock;

    public RiskScoreService(ConflictRecordRepository conflictRecordRepository,
                            RiskAggregateStore aggregateStore,
                            Clock clock) {
        this.conflictRecordRepository = conflictRecordRepository;
        this.aggregateStore = aggregateStore;
        this.clock = clock;
    }

    public RiskAggregate getAggregate(String country) {
        if (!conflictRecordRepository.existsByCountry(country)) {
            throw new ResourceNotFoundException("No conflict data found for country: " + country);
        }

        Optional<RiskAggregate> cached = aggregateStore.get(country);
        if (cached.isPresent()) {
            log.debug("Risk score cache hit for {}", country);
            return cached.get();
        }

        List<Double> scores = conflictRecordRepository.findScoresByCountry(country);
        double avgScore = averageScore(scores);
        // risk_cache.computed_at holds microseconds; match it so the returned row equals a re-read
        LocalDateTime computedAt = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);

        try {
            RiskAggregate saved = aggregateStore.put(country, avgScore, computedAt);
            log.info("Computed risk score for {} from {} regions: {}", country, scores.size(), avgScore);
            return saved;
        } catch (AggregateConflictException e) {
            log.warn("Risk score for {} was stored by a concurrent request, returning stored value", country);
            return aggregateStore.get(country)
                .orElseThrow(() -> new IllegalStateException(
                    "Risk score for " + country + " missing after insert conflict", e));
        }
    }

    /**
     * Arithmetic mean in double precision. An empty list yields 0.0.
     */
    public static double averageScore(List<Double> scores) {
        if (scores == null || scores.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (Double score : scores) {
            sum += score;
        }
        return sum / scores.size();
    }
}
