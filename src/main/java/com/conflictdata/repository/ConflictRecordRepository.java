package com.conflictdata.repository;

import com.conflictdata.model.ConflictRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Event store for per-region conflict rows. The risk score read path only
 * uses {@link #existsByCountry} and {@link #findScoresByCountry}.
 */
@Repository
public interface ConflictRecordRepository extends JpaRepository<ConflictRecord, Long> {

    boolean existsByCountry(String country);

    @Query("SELECT c.score FROM ConflictRecord c WHERE c.country = :country")
    List<Double> findScoresByCountry(@Param("country") String country);

    List<ConflictRecord> findByCountryInOrderByCountryAscRegionAsc(Collection<String> countries);

    Optional<ConflictRecord> findByCountryAndRegion(String country, String region);

    // admin1 names are not unique across countries; the lowest id wins
    Optional<ConflictRecord> findFirstByRegionOrderByIdAsc(String region);

    boolean existsByRegion(String region);
}
