package com.conflictdata.repository;

import com.conflictdata.model.RiskAggregate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface RiskAggregateRepository extends JpaRepository<RiskAggregate, Long> {

    Optional<RiskAggregate> findByCountry(String country);

    long countByCountry(String country);

    long deleteByCountry(String country);
}
