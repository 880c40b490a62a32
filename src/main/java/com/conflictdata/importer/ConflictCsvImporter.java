package com.conflictdata.importer;

import com.conflictdata.model.ConflictRecord;
import com.conflictdata.repository.ConflictRecordRepository;
import com.conflictdata.service.RiskAggregateInvalidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Upserts conflict records from a CSV file with the header columns
 * {@code country, admin1, population, events, score}. Extra columns are ignored.
 *
 * <p>Rows are matched on (country, admin1): existing records are updated in place,
 * new ones inserted. Rows with blank keys or unparseable numbers are skipped.
 * The whole file is written in a single transaction, so re-running the import is safe.
 */
@Service
public class ConflictCsvImporter {

    private static final Logger log = LoggerFactory.getLogger(ConflictCsvImporter.class);

    static final List<String> REQUIRED_COLUMNS = List.of("country", "admin1", "population", "events", "score");

    @Autowired
    private ConflictRecordRepository conflictRecordRepository;

    @Autowired
    private RiskAggregateInvalidator riskAggregateInvalidator;

    @Transactional
    public ImportSummary importFile(Path csvPath) {
        if (!Files.isRegularFile(csvPath)) {
            throw new CsvImportException("File not found: " + csvPath);
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(csvPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CsvImportException("Could not read " + csvPath, e);
        }
        return importLines(lines);
    }

    @Transactional
    public ImportSummary importLines(List<String> lines) {
        if (lines.isEmpty()) {
            throw new CsvImportException("Missing required columns: " + REQUIRED_COLUMNS);
        }
        Map<String, Integer> columns = headerIndex(lines.get(0));
        if (!columns.keySet().containsAll(REQUIRED_COLUMNS)) {
            throw new CsvImportException("Missing required columns: " + REQUIRED_COLUMNS);
        }

        int imported = 0;
        int updated = 0;
        int skipped = 0;
        Set<String> touchedCountries = new LinkedHashSet<>();

        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) continue;

            String[] cols = parseCsvLine(line);
            String country = safeGet(cols, columns.get("country"));
            String region = safeGet(cols, columns.get("admin1"));
            if (country.isEmpty() || region.isEmpty()) {
                skipped++;
                continue;
            }

            Integer population;
            int events;
            double score;
            try {
                String rawPopulation = safeGet(cols, columns.get("population"));
                population = rawPopulation.isEmpty() ? null : Integer.valueOf(rawPopulation);
                events = Integer.parseInt(safeGet(cols, columns.get("events")));
                score = Double.parseDouble(safeGet(cols, columns.get("score")));
            } catch (NumberFormatException e) {
                log.debug("Skipping line {}: {}", i + 1, e.getMessage());
                skipped++;
                continue;
            }

            ConflictRecord existing = conflictRecordRepository.findByCountryAndRegion(country, region).orElse(null);
            if (existing != null) {
                existing.setPopulation(population);
                existing.setEvents(events);
                existing.setScore(score);
                conflictRecordRepository.save(existing);
                updated++;
            } else {
                conflictRecordRepository.save(new ConflictRecord(country, region, population, events, score));
                imported++;
            }
            touchedCountries.add(country);
        }

        riskAggregateInvalidator.recordsChanged(touchedCountries);

        ImportSummary summary = new ImportSummary(imported, updated, skipped);
        log.info("Imported {} new records, updated {} existing records ({} skipped)",
            summary.imported(), summary.updated(), summary.skipped());
        return summary;
    }

    private Map<String, Integer> headerIndex(String headerLine) {
        // drop a UTF-8 byte order mark left by spreadsheet exports
        String header = headerLine.startsWith("\uFEFF") ? headerLine.substring(1) : headerLine;
        String[] names = parseCsvLine(header);
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < names.length; i++) {
            index.putIfAbsent(names[i].trim().toLowerCase(), i);
        }
        return index;
    }

    static String[] parseCsvLine(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                if (inQuotes && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                } else {
                    inQuotes = !inQuotes;
                }
            } else if (c == ',' && !inQuotes) {
                fields.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString().trim());
        return fields.toArray(new String[0]);
    }

    private static String safeGet(String[] cols, int idx) {
        if (idx >= cols.length) return "";
        return cols[idx] == null ? "" : cols[idx].trim();
    }
}
