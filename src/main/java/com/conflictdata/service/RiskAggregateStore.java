package com.conflictdata.service;

import com.conflictdata.exception.AggregateConflictException;
import com.conflictdata.model.RiskAggregate;
import com.conflictdata.repository.RiskAggregateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Durable country to {@link RiskAggregate} store backed by the {@code risk_cache} table.
 *
 * <p>There is no update operation: a country's row is inserted once. {@link #evict}
 * exists only for the optional invalidation policy and is never called by the read path.
 */
@Component
public class RiskAggregateStore {

    private static final Logger log = LoggerFactory.getLogger(RiskAggregateStore.class);

    private final RiskAggregateRepository repository;

    public RiskAggregateStore(RiskAggregateRepository repository) {
        this.repository = repository;
    }

    public Optional<RiskAggregate> get(String country) {
        return repository.findByCountry(country);
    }

    /**
     * Inserts the aggregate in its own transaction so a uniqueness failure never
     * poisons a caller's transaction.
     *
     * @throws AggregateConflictException if a row for the country already exists
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public RiskAggregate put(String country, double avgScore, LocalDateTime computedAt) {
        try {
            return repository.saveAndFlush(new RiskAggregate(country, avgScore, computedAt));
        } catch (DataIntegrityViolationException e) {
            throw new AggregateConflictException(country, e);
        }
    }

    @Transactional
    public boolean evict(String country) {
        long removed = repository.deleteByCountry(country);
        if (removed > 0) {
            log.info("Evicted cached risk score for {}", country);
        }
        return removed > 0;
    }
}
