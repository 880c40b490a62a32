package com.conflictdata.integration;

import com.conflictdata.exception.ResourceNotFoundException;
import com.conflictdata.importer.ConflictCsvImporter;
import com.conflictdata.importer.ImportSummary;
import com.conflictdata.model.ConflictRecord;
import com.conflictdata.model.RiskAggregate;
import com.conflictdata.repository.ConflictRecordRepository;
import com.conflictdata.repository.FeedbackRepository;
import com.conflictdata.repository.RiskAggregateRepository;
import com.conflictdata.repository.UserRepository;
import com.conflictdata.service.ConflictDataService;
import com.conflictdata.service.RiskScoreService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@Tag("integration")
public class RiskScoreCacheIntegrationTest {

    @Autowired
    private RiskScoreService riskScoreService;

    @Autowired
    private ConflictDataService conflictDataService;

    @Autowired
    private ConflictCsvImporter importer;

    @Autowired
    private ConflictRecordRepository conflictRecordRepository;

    @Autowired
    private RiskAggregateRepository riskAggregateRepository;

    @Autowired
    private FeedbackRepository feedbackRepository;

    @Autowired
    private UserRepository userRepository;

    @BeforeEach
    void setUp() {
        feedbackRepository.deleteAll();
        riskAggregateRepository.deleteAll();
        conflictRecordRepository.deleteAll();
        userRepository.deleteAll();

        conflictRecordRepository.save(new ConflictRecord("Kenya", "Nairobi", 4_397_073, 12, 7.0));
        conflictRecordRepository.save(new ConflictRecord("Kenya", "Mombasa", 1_208_333, 5, 4.0));
        conflictRecordRepository.save(new ConflictRecord("Kenya", "Kisumu", 1_155_574, 3, 3.0));
    }

    @Test
    void test_first_read_computes_mean() {
        RiskAggregate aggregate = riskScoreService.getAggregate("Kenya");

        assertEquals("Kenya", aggregate.getCountry());
        assertEquals(14.0 / 3.0, aggregate.getAvgScore(), 1e-9);
        assertNotNull(aggregate.getComputedAt());
        assertEquals(1, riskAggregateRepository.countByCountry("Kenya"));
    }

    @Test
    void test_repeat_reads_return_identical_aggregate() {
        RiskAggregate first = riskScoreService.getAggregate("Kenya");
        RiskAggregate second = riskScoreService.getAggregate("Kenya");

        assertEquals(first.getAvgScore(), second.getAvgScore());
        assertEquals(first.getComputedAt(), second.getComputedAt());
        assertEquals(1, riskAggregateRepository.countByCountry("Kenya"));
    }

    @Test
    void test_unknown_country_not_found_and_not_cached() {
        assertThrows(ResourceNotFoundException.class, () -> riskScoreService.getAggregate("Atlantis"));
        assertEquals(0, riskAggregateRepository.countByCountry("Atlantis"));
    }

    @Test
    void test_new_record_does_not_change_cached_score() {
        RiskAggregate before = riskScoreService.getAggregate("Kenya");

        conflictRecordRepository.save(new ConflictRecord("Kenya", "Nakuru", 2_162_202, 8, 10.0));
        RiskAggregate after = riskScoreService.getAggregate("Kenya");

        assertEquals(before.getAvgScore(), after.getAvgScore());
        assertEquals(before.getComputedAt(), after.getComputedAt());
    }

    @Test
    void test_edited_record_does_not_change_cached_score() {
        RiskAggregate before = riskScoreService.getAggregate("Kenya");

        ImportSummary summary = importer.importLines(List.of(
            "country,admin1,population,events,score",
            "Kenya,Nairobi,4397073,12,10"));
        RiskAggregate after = riskScoreService.getAggregate("Kenya");

        assertEquals(new ImportSummary(0, 1, 0), summary);
        assertEquals(10.0, conflictRecordRepository.findByCountryAndRegion("Kenya", "Nairobi")
            .orElseThrow().getScore());
        assertEquals(before.getAvgScore(), after.getAvgScore());
        assertEquals(before.getComputedAt(), after.getComputedAt());
        assertEquals(1, riskAggregateRepository.countByCountry("Kenya"));
    }

    @Test
    void test_delete_keeps_cached_score_by_default() {
        RiskAggregate before = riskScoreService.getAggregate("Kenya");

        conflictDataService.deleteRecord("Kenya", "Nairobi");
        RiskAggregate after = riskScoreService.getAggregate("Kenya");

        assertEquals(before.getAvgScore(), after.getAvgScore());
        assertEquals(before.getComputedAt(), after.getComputedAt());
    }

    @Test
    void test_removing_cached_row_forces_recompute() {
        riskScoreService.getAggregate("Kenya");
        conflictRecordRepository.save(new ConflictRecord("Kenya", "Nakuru", 2_162_202, 8, 10.0));

        riskAggregateRepository.deleteAll();
        RiskAggregate recomputed = riskScoreService.getAggregate("Kenya");

        assertEquals(6.0, recomputed.getAvgScore(), 1e-9);
    }
}
