package com.conflictdata.controller;

import com.conflictdata.model.ConflictRecord;
import com.conflictdata.model.Feedback;
import com.conflictdata.model.RiskAggregate;
import com.conflictdata.security.AuthenticatedUser;
import com.conflictdata.service.ConflictDataService;
import com.conflictdata.service.FeedbackService;
import com.conflictdata.service.RiskScoreService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/conflictdata")
public class ConflictDataController {

    private static final Logger log = LoggerFactory.getLogger(ConflictDataController.class);

    @Autowired
    private ConflictDataService conflictDataService;

    @Autowired
    private RiskScoreService riskScoreService;

    @Autowired
    private FeedbackService feedbackService;

    @GetMapping
    public ResponseEntity<Map<String, Object>> listRecords(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(name = "per_page", required = false) Integer perPage) {
        int size = perPage != null ? perPage : conflictDataService.getDefaultPerPage();
        Page<ConflictRecord> result = conflictDataService.listRecords(page, size);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("page", page);
        body.put("per_page", size);
        body.put("total", result.getTotalElements());
        body.put("data", result.getContent().stream().map(this::toRecordMap).collect(Collectors.toList()));
        return ResponseEntity.ok(body);
    }

    /**
     * One country returns a single object, a comma separated list returns an array
     * in request order.
     */
    @GetMapping("/{countries}")
    public ResponseEntity<Object> getCountries(@PathVariable String countries) {
        List<String> requested = ConflictDataService.parseCountries(countries);
        Map<String, List<ConflictRecord>> byCountry = conflictDataService.findByCountries(requested);

        if (requested.size() == 1) {
            String country = requested.get(0);
            return ResponseEntity.ok(toCountryMap(country, byCountry.get(country)));
        }
        List<Map<String, Object>> body = requested.stream()
            .map(country -> toCountryMap(country, byCountry.get(country)))
            .collect(Collectors.toList());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{country}/riskscore")
    public ResponseEntity<Map<String, Object>> getRiskScore(@PathVariable String country) {
        RiskAggregate aggregate = riskScoreService.getAggregate(country);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("country", aggregate.getCountry());
        body.put("avg_score", aggregate.getAvgScore());
        body.put("computed_at", aggregate.getComputedAt());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/{admin1}/userfeedback")
    public ResponseEntity<Map<String, Object>> postFeedback(
            @PathVariable("admin1") String region,
            @AuthenticationPrincipal AuthenticatedUser principal,
            @Valid @RequestBody FeedbackRequest request) {
        Feedback saved = feedbackService.submit(principal.userId(), region, request.text());
        return ResponseEntity.status(HttpStatus.CREATED).body(toFeedbackMap(saved));
    }

    @GetMapping("/{admin1}/userfeedback")
    public ResponseEntity<List<Map<String, Object>>> listFeedback(@PathVariable("admin1") String region) {
        List<Map<String, Object>> body = feedbackService.listForRegion(region).stream()
            .map(this::toFeedbackMap)
            .collect(Collectors.toList());
        return ResponseEntity.ok(body);
    }

    @DeleteMapping
    public ResponseEntity<Map<String, Object>> deleteRecord(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @Valid @RequestBody DeleteRequest request) {
        int deleted = conflictDataService.deleteRecord(request.country(), request.admin1());
        log.info("Admin {} deleted {}/{}", principal.username(), request.country(), request.admin1());
        return ResponseEntity.ok(Map.of("deleted", deleted));
    }

    private Map<String, Object> toCountryMap(String country, List<ConflictRecord> records) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("country", country);
        map.put("admin1_entries", records == null ? List.of()
            : records.stream().map(this::toRecordMap).collect(Collectors.toList()));
        return map;
    }

    // population is nullable, so Map.of cannot be used here
    private Map<String, Object> toRecordMap(ConflictRecord record) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", record.getId());
        map.put("country", record.getCountry());
        map.put("admin1", record.getRegion());
        map.put("population", record.getPopulation());
        map.put("events", record.getEvents());
        map.put("score", record.getScore());
        map.put("created_at", record.getCreatedAt());
        map.put("updated_at", record.getUpdatedAt());
        return map;
    }

    private Map<String, Object> toFeedbackMap(Feedback feedback) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", feedback.getId());
        map.put("user_id", feedback.getAuthor().getId());
        map.put("country", feedback.getCountry());
        map.put("admin1", feedback.getRegion());
        map.put("text", feedback.getText());
        map.put("created_at", feedback.getCreatedAt());
        return map;
    }

    public record FeedbackRequest(@NotNull String text) {
    }

    public record DeleteRequest(@NotBlank String country, @NotBlank String admin1) {
    }
}
