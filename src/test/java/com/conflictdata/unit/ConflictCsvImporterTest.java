package com.conflictdata.unit;

import com.conflictdata.importer.ConflictCsvImporter;
import com.conflictdata.importer.CsvImportException;
import com.conflictdata.importer.ImportSummary;
import com.conflictdata.model.ConflictRecord;
import com.conflictdata.repository.ConflictRecordRepository;
import com.conflictdata.service.RiskAggregateInvalidator;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@Tag("unit")
public class ConflictCsvImporterTest {

    @Mock
    private ConflictRecordRepository conflictRecordRepository;

    @Mock
    private RiskAggregateInvalidator riskAggregateInvalidator;

    @InjectMocks
    private ConflictCsvImporter importer;

    @Test
    void test_new_rows_inserted_and_existing_rows_updated() {
        ConflictRecord existing = new ConflictRecord("Kenya", "Nairobi", 100, 1, 1.0);
        when(conflictRecordRepository.findByCountryAndRegion("Kenya", "Nairobi")).thenReturn(Optional.of(existing));
        when(conflictRecordRepository.findByCountryAndRegion("Kenya", "Mombasa")).thenReturn(Optional.empty());

        ImportSummary summary = importer.importLines(List.of(
            "country,admin1,population,events,score",
            "Kenya,Nairobi,5000,12,7.5",
            "Kenya,Mombasa,,3,2.0"));

        assertEquals(new ImportSummary(1, 1, 0), summary);
        assertEquals(5000, existing.getPopulation());
        assertEquals(12, existing.getEvents());
        assertEquals(7.5, existing.getScore());

        ArgumentCaptor<ConflictRecord> saved = ArgumentCaptor.forClass(ConflictRecord.class);
        verify(conflictRecordRepository, times(2)).save(saved.capture());
        ConflictRecord inserted = saved.getAllValues().get(1);
        assertEquals("Mombasa", inserted.getRegion());
        assertNull(inserted.getPopulation());
    }

    @SuppressWarnings("unchecked")
    @Test
    void test_invalidator_receives_touched_countries() {
        when(conflictRecordRepository.findByCountryAndRegion(anyString(), anyString())).thenReturn(Optional.empty());

        importer.importLines(List.of(
            "country,admin1,population,events,score",
            "Kenya,Nairobi,1,1,1.0",
            "Uganda,Kampala,1,1,1.0",
            "Kenya,Mombasa,1,1,1.0"));

        ArgumentCaptor<Collection<String>> countries = ArgumentCaptor.forClass(Collection.class);
        verify(riskAggregateInvalidator).recordsChanged(countries.capture());
        assertEquals(List.of("Kenya", "Uganda"), List.copyOf(countries.getValue()));
    }

    @Test
    void test_bad_rows_skipped() {
        when(conflictRecordRepository.findByCountryAndRegion(anyString(), anyString())).thenReturn(Optional.empty());

        ImportSummary summary = importer.importLines(List.of(
            "country,admin1,population,events,score",
            ",Nairobi,1,1,1.0",
            "Kenya,,1,1,1.0",
            "Kenya,Nairobi,1,many,1.0",
            "",
            "Kenya,Nairobi,1,2,3.0"));

        assertEquals(new ImportSummary(1, 0, 3), summary);
    }

    @Test
    void test_header_with_bom_and_extra_columns_accepted() {
        when(conflictRecordRepository.findByCountryAndRegion("Kenya", "Nairobi")).thenReturn(Optional.empty());

        ImportSummary summary = importer.importLines(List.of(
            "\uFEFFiso,Country,admin1,population,events,score",
            "KEN,Kenya,Nairobi,1,2,3.0"));

        assertEquals(1, summary.imported());
    }

    @Test
    void test_quoted_fields_keep_commas() {
        when(conflictRecordRepository.findByCountryAndRegion("Congo, Democratic Republic", "North \"Kivu\""))
            .thenReturn(Optional.empty());

        ImportSummary summary = importer.importLines(List.of(
            "country,admin1,population,events,score",
            "\"Congo, Democratic Republic\",\"North \"\"Kivu\"\"\",10,20,8.25"));

        assertEquals(1, summary.imported());
    }

    @Test
    void test_missing_columns_rejected() {
        assertThrows(CsvImportException.class, () -> importer.importLines(List.of("country,admin1,score")));
        assertThrows(CsvImportException.class, () -> importer.importLines(List.of()));
        verifyNoInteractions(conflictRecordRepository);
    }

    @Test
    void test_missing_file_rejected(@TempDir Path dir) {
        assertThrows(CsvImportException.class, () -> importer.importFile(dir.resolve("absent.csv")));
    }
}
