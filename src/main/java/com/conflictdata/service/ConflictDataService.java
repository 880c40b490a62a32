package com.conflictdata.service;

import com.conflictdata.exception.InvalidRequestException;
import com.conflictdata.exception.ResourceNotFoundException;
import com.conflictdata.model.ConflictRecord;
import com.conflictdata.repository.ConflictRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
public class ConflictDataService {

    private static final Logger log = LoggerFactory.getLogger(ConflictDataService.class);

    @Autowired
    private ConflictRecordRepository conflictRecordRepository;

    @Autowired
    private RiskAggregateInvalidator riskAggregateInvalidator;

    @Value("${conflictdata.pagination.default-per-page:20}")
    private int defaultPerPage;

    @Value("${conflictdata.pagination.max-per-page:100}")
    private int maxPerPage;

    public int getDefaultPerPage() {
        return defaultPerPage;
    }

    /**
     * One page of records ordered by country then admin1. {@code page} is 1-based.
     */
    @Transactional(readOnly = true)
    public Page<ConflictRecord> listRecords(int page, int perPage) {
        if (page < 1 || perPage < 1 || perPage > maxPerPage) {
            throw new InvalidRequestException("Invalid pagination parameters provided from URL");
        }
        // pages past the addressable offset are empty rather than an error
        if ((long) (page - 1) * perPage > Integer.MAX_VALUE) {
            return new PageImpl<>(List.of(), Pageable.unpaged(), conflictRecordRepository.count());
        }
        return conflictRecordRepository.findAll(
            PageRequest.of(page - 1, perPage, Sort.by("country", "region")));
    }

    /**
     * Splits a comma separated country list, trimming whitespace and dropping blanks.
     */
    public static List<String> parseCountries(String countries) {
        if (countries == null) {
            return List.of();
        }
        return Arrays.stream(countries.split(","))
            .map(String::trim)
            .filter(c -> !c.isEmpty())
            .collect(Collectors.toList());
    }

    /**
     * Records grouped by country, keyed in request order. Countries without data map
     * to an empty list as long as at least one requested country has data.
     */
    @Transactional(readOnly = true)
    public Map<String, List<ConflictRecord>> findByCountries(List<String> countries) {
        if (countries.isEmpty()) {
            throw new InvalidRequestException("No valid country names provided in URL");
        }
        List<ConflictRecord> rows = conflictRecordRepository.findByCountryInOrderByCountryAscRegionAsc(countries);
        if (rows.isEmpty()) {
            throw new ResourceNotFoundException("No conflict data found for provided countries");
        }

        Map<String, List<ConflictRecord>> byCountry = new LinkedHashMap<>();
        for (String country : countries) {
            byCountry.putIfAbsent(country, new ArrayList<>());
        }
        for (ConflictRecord row : rows) {
            byCountry.get(row.getCountry()).add(row);
        }
        return byCountry;
    }

    /**
     * Deletes the record for a country/admin1 pair together with its feedback.
     *
     * @return number of records deleted
     */
    @Transactional
    public int deleteRecord(String country, String region) {
        ConflictRecord record = conflictRecordRepository.findByCountryAndRegion(country, region)
            .orElseThrow(() -> new ResourceNotFoundException(
                "No records found for " + country + "/" + region));

        int feedbackCount = record.getFeedback().size();
        conflictRecordRepository.delete(record);
        conflictRecordRepository.flush();
        log.info("Deleted conflict record {} ({}/{}) with {} feedback entries",
            record.getId(), country, region, feedbackCount);

        riskAggregateInvalidator.recordsChanged(List.of(country));
        return 1;
    }
}
